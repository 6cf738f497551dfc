package dev.lyceum.search;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.lyceum.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the whole retrieval pipeline against pgvector with real embeddings and no relevance judge
 * configured, so ranking falls back to similarity plus metadata boosts.
 */
class RetrievalPipelineIT extends BaseIntegrationTest {

    @Autowired
    private RetrievalPipeline retrievalPipeline;

    @Autowired
    private EmbeddingModel embeddingModel;

    @Autowired
    private VectorRetriever vectorRetriever;

    private void store(String text, String sourceId, int offset, int season, String types,
            String contentType) {
        Metadata metadata = Metadata.from("source_id", sourceId)
                .put("source_label", "Season " + season + " - " + sourceId)
                .put("chunk_offset", offset)
                .put("season", season)
                .put("types_discussed", types)
                .put("content_type", contentType);
        embeddingStore.add(embeddingModel.embed(text).content(), TextSegment.from(text, metadata));
    }

    @Test
    void relationshipQuestionRanksMatchingLectureFirstWithoutJudge() {
        store("INTJ and ENFP are a golden pair; their compatibility rests on shared intuition.",
                "s21e04", 0, 21, "INTJ, ENFP", "relationship");
        store("Extraverted sensing in ESTPs shows up as fast reactions to the environment.",
                "s05e02", 3, 5, "ESTP", "function");
        store("The octagram describes how a type develops its functions over a lifetime.",
                "s12e01", 1, 12, "", "octagram");

        RankedPassages ranked =
                retrievalPipeline.retrieve("How are INTJ and ENFP socially compatible?");

        assertThat(ranked.judged()).isFalse();
        assertThat(ranked.queryVariants()).hasSizeGreaterThan(1);
        assertThat(ranked.passages()).hasSize(3);
        assertThat(ranked.passages()).extracting(Candidate::passageId).doesNotHaveDuplicates();
        assertThat(ranked.passages()).allSatisfy(c -> {
            assertThat(c.relevanceScore()).isNull();
            assertThat(c.hybridScore()).isEqualTo(c.boostedScore());
        });

        Candidate first = ranked.passages().get(0);
        assertThat(first.sourceId()).isEqualTo("s21e04");
        assertThat(first.passageId()).isEqualTo("s21e04#0");
        assertThat(first.boostedScore()).isGreaterThan(first.similarityScore());
        assertThat(ranked.confidence().reasoning()).endsWith("found");
    }

    @Test
    void emptyStoreYieldsEmptyRankingWithLowConfidence() {
        RankedPassages ranked = retrievalPipeline.retrieve("What is the INTJ demon function?");

        assertThat(ranked.passages()).isEmpty();
        assertThat(ranked.confidence().level()).isEqualTo(ConfidenceLevel.LOW);
        assertThat(ranked.confidence().reasoning()).isEqualTo("No relevant sources found");
    }

    @Test
    void metadataFilterKeepsOnlyPassagesOfNamedTypeAndSeason() {
        store("INTJ and ENFP are a golden pair.", "s21e04", 0, 21, "INTJ, ENFP", "relationship");
        store("INTJ leadership in the workplace.", "s09e01", 2, 9, "INTJ", "career");
        store("ESTP and ISFJ as a pedagogue pair.", "s21e07", 5, 21, "ESTP, ISFJ", "relationship");

        List<RetrievedPassage> hits = vectorRetriever.search(
                "INTJ relationships", 10, new RetrievalFilter(List.of("INTJ"), 21));

        assertThat(hits).extracting(RetrievedPassage::sourceId).containsExactly("s21e04");
    }
}
