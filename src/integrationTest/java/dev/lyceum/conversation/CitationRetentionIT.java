package dev.lyceum.conversation;

import dev.lyceum.BaseIntegrationTest;
import dev.lyceum.search.Confidence;
import dev.lyceum.search.ConfidenceLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises citation retention against the real schema: after every stored answer only the six
 * most recent answers of the conversation carry citations, and other conversations are untouched.
 */
class CitationRetentionIT extends BaseIntegrationTest {

    @Autowired
    private CitationRetentionManager retentionManager;

    @Autowired
    private ChatMessageRepository chatMessageRepository;

    @Autowired
    private ConversationStore conversationStore;

    @BeforeEach
    void cleanMessages() {
        chatMessageRepository.deleteAll();
    }

    private static AnsweredTurn turn(UUID conversationId, int n) {
        CitationRecord citations = new CitationRecord(
                List.of(new CitationSource("Lecture " + n, 0.8)),
                new Confidence(ConfidenceLevel.HIGH, 0.8, "⭐⭐⭐⭐", "1 relevant source found"));
        return new AnsweredTurn(conversationId, "Question " + n, "Answer " + n, citations,
                "Follow-up " + n, 100, 20);
    }

    @Test
    void onlyTheSixMostRecentAnswersKeepCitations() {
        UUID conversationId = UUID.randomUUID();

        for (int i = 1; i <= 10; i++) {
            retentionManager.recordAnswer(turn(conversationId, i));

            assertThat(chatMessageRepository.countRetainedCitations(conversationId))
                    .isEqualTo(Math.min(i, 6));
        }

        List<ChatMessage> messages = conversationStore.messages(conversationId);
        assertThat(messages).hasSize(20);
        List<ChatMessage> answers = messages.stream()
                .filter(m -> m.getRole() == MessageRole.ASSISTANT)
                .toList();
        assertThat(answers.subList(0, 4))
                .allSatisfy(m -> {
                    assertThat(m.getCitations()).isNull();
                    assertThat(m.getFollowUpQuestion()).isNull();
                    assertThat(m.getContent()).startsWith("Answer ");
                });
        assertThat(answers.subList(4, 10))
                .extracting(m -> m.getCitations().sources().get(0).label())
                .containsExactly("Lecture 5", "Lecture 6", "Lecture 7", "Lecture 8", "Lecture 9",
                        "Lecture 10");
        assertThat(answers.get(9).getFollowUpQuestion()).isEqualTo("Follow-up 10");
    }

    @Test
    void pruneIsIdempotent() {
        UUID conversationId = UUID.randomUUID();
        for (int i = 1; i <= 8; i++) {
            conversationStore.appendTurn(turn(conversationId, i));
        }

        assertThat(retentionManager.enforce(conversationId)).isEqualTo(2);
        assertThat(retentionManager.enforce(conversationId)).isZero();
        assertThat(chatMessageRepository.countRetainedCitations(conversationId)).isEqualTo(6);
    }

    @Test
    void pruningOneConversationLeavesOthersAlone() {
        UUID busy = UUID.randomUUID();
        UUID quiet = UUID.randomUUID();
        for (int i = 1; i <= 3; i++) {
            retentionManager.recordAnswer(turn(quiet, i));
        }
        for (int i = 1; i <= 9; i++) {
            retentionManager.recordAnswer(turn(busy, i));
        }

        assertThat(chatMessageRepository.countRetainedCitations(busy)).isEqualTo(6);
        assertThat(chatMessageRepository.countRetainedCitations(quiet)).isEqualTo(3);
    }
}
