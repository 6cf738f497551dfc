package dev.lyceum;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.lyceum.conversation.ChatMessage;
import dev.lyceum.conversation.ChatMessageRepository;
import dev.lyceum.conversation.CitationRecord;
import dev.lyceum.conversation.CitationSource;
import dev.lyceum.conversation.MessageRole;
import dev.lyceum.search.Confidence;
import dev.lyceum.search.ConfidenceLevel;
import dev.lyceum.search.RetrievedPassage;
import dev.lyceum.search.VectorRetriever;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=none by verifying the JPA entity and the LangChain4j metadata layout
 * against the Flyway schema.
 * Catches entity ↔ migration drift at test time rather than runtime.
 */
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Autowired
    private ChatMessageRepository chatMessageRepository;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private EmbeddingModel embeddingModel;

    @Autowired
    private VectorRetriever vectorRetriever;

    @Test
    @Transactional
    void chatMessageRoundtripsWithJsonCitations() {
        UUID conversationId = UUID.randomUUID();
        Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        CitationRecord citations = new CitationRecord(
                List.of(new CitationSource("Season 21 - Episode 4", 0.842)),
                new Confidence(ConfidenceLevel.HIGH, 0.81, "⭐⭐⭐⭐", "3 relevant sources found"));
        ChatMessage message = new ChatMessage(
                conversationId, MessageRole.ASSISTANT, "INTJs lead with Ni.", createdAt);
        message.setCitations(citations);
        message.setFollowUpQuestion("How does Ni develop?");
        message.setInputTokens(1200);
        message.setOutputTokens(150);

        ChatMessage saved = chatMessageRepository.saveAndFlush(message);
        entityManager.clear();
        ChatMessage found = chatMessageRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getConversationId()).isEqualTo(conversationId);
        assertThat(found.getRole()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(found.getContent()).isEqualTo("INTJs lead with Ni.");
        assertThat(found.getCitations()).isEqualTo(citations);
        assertThat(found.getFollowUpQuestion()).isEqualTo("How does Ni develop?");
        assertThat(found.getInputTokens()).isEqualTo(1200);
        assertThat(found.getOutputTokens()).isEqualTo(150);
        assertThat(found.getCreatedAt()).isEqualTo(createdAt);
    }

    @Test
    void lectureChunkMetadataReadableAfterLangchain4jInsert() {
        // Insert via LangChain4j (the ingestion write path, includes embedding)
        String text = "INTJ and ENFP form a golden pair in social settings.";
        Metadata metadata = Metadata.from("source_id", "s21e04")
                .put("source_label", "Season 21 - Episode 4")
                .put("chunk_offset", 7)
                .put("season", 21)
                .put("types_discussed", "INTJ, ENFP")
                .put("functions_covered", "Ni, Fe")
                .put("content_type", "relationship");
        Embedding embedding = embeddingModel.embed(text).content();
        embeddingStore.add(embedding, TextSegment.from(text, metadata));

        List<RetrievedPassage> hits = vectorRetriever.search("golden pair INTJ ENFP", 5);

        assertThat(hits).hasSize(1);
        RetrievedPassage hit = hits.get(0);
        assertThat(hit.text()).isEqualTo(text);
        assertThat(hit.sourceId()).isEqualTo("s21e04");
        assertThat(hit.sourceLabel()).isEqualTo("Season 21 - Episode 4");
        assertThat(hit.offset()).isEqualTo(7);
        assertThat(hit.metadata().season()).isEqualTo(21);
        assertThat(hit.metadata().types()).containsExactlyInAnyOrder("INTJ", "ENFP");
        assertThat(hit.metadata().functions()).containsExactlyInAnyOrder("Ni", "Fe");
        assertThat(hit.metadata().contentType()).isEqualTo("relationship");
        assertThat(hit.similarityScore()).isBetween(0.0, 1.0);
    }
}
