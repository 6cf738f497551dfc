package dev.lyceum.answer;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.lyceum.conversation.CitationRetentionManager;
import dev.lyceum.conversation.CitationSource;
import dev.lyceum.conversation.RetentionProperties;
import dev.lyceum.fixture.CandidateBuilder;
import dev.lyceum.fixture.InMemoryConversationStore;
import dev.lyceum.fixture.RecordingAnswerSink;
import dev.lyceum.search.CandidateMerger;
import dev.lyceum.search.ConfidenceLevel;
import dev.lyceum.search.ConfidenceScorer;
import dev.lyceum.search.JudgeResponseParser;
import dev.lyceum.search.MetadataReranker;
import dev.lyceum.search.QueryAnalyzer;
import dev.lyceum.search.QueryExpander;
import dev.lyceum.search.RankingProperties;
import dev.lyceum.search.RelevanceJudge;
import dev.lyceum.search.RelevanceReranker;
import dev.lyceum.search.RetrievalPipeline;
import dev.lyceum.search.RetrievedPassage;
import dev.lyceum.search.VectorRetriever;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs whole questions through the real ranking and answering components, with the vector store,
 * relevance judge and text generator replaced by deterministic stand-ins.
 */
class AnswerScenarioTest {

  private static final String QUESTION = "How are INTJ and ENFP socially compatible?";
  private static final UUID CONVERSATION = UUID.fromString("7d3e1c2b-8a9f-4e6d-b5c4-a3b2c1d0e9f8");

  private static final List<RetrievedPassage> LECTURE_HITS =
      List.of(
          new CandidateBuilder()
              .source("s08e02", 4)
              .label("Season 8 - Episode 2")
              .text("Ni users look for patterns over time.")
              .season(8)
              .similarity(0.74)
              .passage(),
          new CandidateBuilder()
              .source("s21e04", 12)
              .label("Season 21 - Episode 4")
              .text("INTJ and ENFP are a classic compatible pairing in social settings.")
              .season(21)
              .types("INTJ", "ENFP")
              .contentType("relationship")
              .similarity(0.71)
              .passage(),
          new CandidateBuilder()
              .source("s08e09", 0)
              .label("Season 8 - Episode 9")
              .text("Housekeeping notes before the stream starts.")
              .season(8)
              .similarity(0.40)
              .passage());

  private final List<String> judgedQuestions = new ArrayList<>();

  private final JudgeResponseParser parser = new JudgeResponseParser(new ObjectMapper());

  InMemoryConversationStore store;
  AnswerStreamer answerStreamer;

  @BeforeEach
  void setUp() {
    store = new InMemoryConversationStore();
    answerStreamer =
        answerStreamer(
            (question, passages) -> {
              judgedQuestions.add(question);
              StringBuilder reply = new StringBuilder("```json\n[");
              for (int i = 0; i < passages.size(); i++) {
                reply
                    .append(i == 0 ? "" : ", ")
                    .append(passages.get(i).contains("compatib") ? 9 : 3);
              }
              return parser.parse(reply.append("]\n```").toString());
            });
  }

  private AnswerStreamer answerStreamer(RelevanceJudge judge) {
    RankingProperties ranking = new RankingProperties();
    Executor direct = Runnable::run;
    VectorRetriever retriever = (query, topK) -> LECTURE_HITS;

    RetrievalPipeline pipeline =
        new RetrievalPipeline(
            new QueryExpander(ranking),
            new QueryAnalyzer(),
            retriever,
            new CandidateMerger(),
            new MetadataReranker(ranking),
            new RelevanceReranker(Optional.of(judge), direct, ranking),
            new ConfidenceScorer(ranking),
            ranking,
            direct);

    TextGenerator generator =
        (request, onChunk) -> {
          String reply =
              "INTJ and ENFP pair well socially [Source 1].\n"
                  + "[[FOLLOW-UP]] How do INTJ and ENFP handle conflict?";
          for (int i = 0; i < reply.length(); i += 7) {
            onChunk.accept(reply.substring(i, Math.min(reply.length(), i + 7)));
          }
          return CompletableFuture.completedFuture(new GeneratedAnswer(reply, null, null));
        };

    CitationRetentionManager retention =
        new CitationRetentionManager(store, new RetentionProperties());
    return new AnswerStreamer(
        pipeline,
        new GroundingPromptBuilder(),
        Optional.of(generator),
        store,
        retention,
        new AnswerProperties());
  }

  @Test
  void compatibilityQuestionIsAnsweredFromTheRelationshipLecture() {
    RecordingAnswerSink sink = new RecordingAnswerSink();

    AnswerState state = answerStreamer.stream(CONVERSATION, QUESTION, sink);

    assertThat(state).isEqualTo(AnswerState.DONE);
    assertThat(judgedQuestions).containsExactly(QUESTION);
    assertThat(sink.events().get(0)).isEqualTo(AnswerEvent.searching());
    assertThat(sink.streamedText()).isEqualTo("INTJ and ENFP pair well socially [Source 1].\n");

    AnswerEvent done = sink.last();
    assertThat(done.followUp()).isEqualTo("How do INTJ and ENFP handle conflict?");
    assertThat(done.citations().sources())
        .extracting(CitationSource::label)
        .containsExactly("Season 21 - Episode 4", "Season 8 - Episode 2", "Season 8 - Episode 9");
    assertThat(done.citations().sources().get(0).score()).isEqualTo(0.94);
    assertThat(done.citations().confidence().level()).isEqualTo(ConfidenceLevel.MEDIUM);
    assertThat(done.citations().confidence().reasoning()).isEqualTo("1 relevant source found");
  }

  @Test
  void onlyTheLastSixAnswersKeepCitations() {
    for (int i = 0; i < 8; i++) {
      assertThat(answerStreamer.stream(CONVERSATION, QUESTION, new RecordingAnswerSink()))
          .isEqualTo(AnswerState.DONE);
      assertThat(store.retainedCitations(CONVERSATION)).isEqualTo(Math.min(i + 1, 6));
    }

    assertThat(store.messages(CONVERSATION)).hasSize(16);
    assertThat(store.messages(CONVERSATION).get(1).getCitations()).isNull();
    assertThat(store.messages(CONVERSATION).get(1).getFollowUpQuestion()).isNull();
    assertThat(store.messages(CONVERSATION).get(15).getCitations()).isNotNull();
  }

  @Test
  void malformedJudgeReplyStillProducesAnAnswerRankedByMetadata() {
    RecordingAnswerSink sink = new RecordingAnswerSink();
    AnswerStreamer degraded =
        answerStreamer(
            (question, passages) -> {
              judgedQuestions.add(question);
              return parser.parse("sure! [7, x]");
            });

    AnswerState state = degraded.stream(CONVERSATION, QUESTION, sink);

    assertThat(state).isEqualTo(AnswerState.DONE);
    assertThat(judgedQuestions).containsExactly(QUESTION);
    assertThat(sink.streamedText()).isNotBlank();

    AnswerEvent done = sink.last();
    assertThat(done.answer()).isEqualTo("INTJ and ENFP pair well socially [Source 1].");
    // hybrid equals the boosted score: 0.71 + 0.24 types + 0.06 season + 0.10 relationship, clamped
    assertThat(done.citations().sources())
        .extracting(source -> source.label() + "=" + source.score())
        .containsExactly(
            "Season 21 - Episode 4=1.0", "Season 8 - Episode 2=0.74", "Season 8 - Episode 9=0.4");
    assertThat(done.citations().confidence().level()).isEqualTo(ConfidenceLevel.MEDIUM);
    assertThat(done.citations().confidence().reasoning()).isEqualTo("2 relevant sources found");
    assertThat(store.retainedCitations(CONVERSATION)).isEqualTo(1);
  }
}
