package dev.lyceum.mcp;

import dev.lyceum.conversation.ChatMessage;
import dev.lyceum.conversation.CitationRecord;
import dev.lyceum.conversation.CitationSource;
import dev.lyceum.conversation.ConversationStore;
import dev.lyceum.conversation.MessageRole;
import dev.lyceum.fixture.CandidateBuilder;
import dev.lyceum.fixture.ChatMessageBuilder;
import dev.lyceum.search.Candidate;
import dev.lyceum.search.Confidence;
import dev.lyceum.search.ConfidenceLevel;
import dev.lyceum.search.RankedPassages;
import dev.lyceum.search.RetrievalPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

    private static final UUID CONVERSATION = UUID.fromString("11111111-2222-3333-4444-555555555555");

    @Mock
    RetrievalPipeline retrievalPipeline;

    @Mock
    ConversationStore conversationStore;

    @Mock
    TokenBudgetTruncator truncator;

    @Captor
    ArgumentCaptor<RankedPassages> rankedCaptor;

    McpToolService mcpToolService;

    @BeforeEach
    void setUp() {
        mcpToolService = new McpToolService(retrievalPipeline, conversationStore, truncator);
    }

    private static RankedPassages rankedWith(int count) {
        List<Candidate> passages = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            passages.add(new CandidateBuilder().id("p" + i).hybrid(0.9 - i * 0.01).build());
        }
        return new RankedPassages("q", List.of("q"), passages,
                new Confidence(ConfidenceLevel.MEDIUM, 0.6, "⭐⭐⭐", "4 relevant sources found"), true);
    }

    // --- search_lectures ---

    @Test
    void searchLecturesReturnsTruncatedRanking() {
        given(retrievalPipeline.retrieve("What is Ti?")).willReturn(rankedWith(4));
        given(truncator.truncate(any())).willReturn("formatted passages");

        String result = mcpToolService.searchLectures("What is Ti?", null);

        assertThat(result).isEqualTo("formatted passages");
        verify(truncator).truncate(rankedCaptor.capture());
        assertThat(rankedCaptor.getValue().passages()).hasSize(4);
        assertThat(rankedCaptor.getValue().confidence().level()).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Test
    void searchLecturesLimitsToMaxResults() {
        given(retrievalPipeline.retrieve("What is Ti?")).willReturn(rankedWith(10));
        given(truncator.truncate(any())).willReturn("formatted");

        mcpToolService.searchLectures("What is Ti?", 3);

        verify(truncator).truncate(rankedCaptor.capture());
        assertThat(rankedCaptor.getValue().passages())
                .extracting(Candidate::passageId)
                .containsExactly("p0", "p1", "p2");
    }

    @Test
    void searchLecturesClampsOversizedMaxResults() {
        given(retrievalPipeline.retrieve("What is Ti?")).willReturn(rankedWith(12));
        given(truncator.truncate(any())).willReturn("formatted");

        mcpToolService.searchLectures("What is Ti?", 500);

        verify(truncator).truncate(rankedCaptor.capture());
        assertThat(rankedCaptor.getValue().passages()).hasSize(12);
    }

    @Test
    void searchLecturesRejectsBlankQuestion() {
        String result = mcpToolService.searchLectures("  ", null);

        assertThat(result).isEqualTo("Error: Question must not be empty. Provide a question string.");
        verifyNoInteractions(retrievalPipeline);
    }

    @Test
    void searchLecturesReportsNoResults() {
        given(retrievalPipeline.retrieve("Unknown topic")).willReturn(rankedWith(0));

        String result = mcpToolService.searchLectures("Unknown topic", null);

        assertThat(result).isEqualTo("No lecture passages found for question: Unknown topic");
        verify(truncator, never()).truncate(any());
    }

    @Test
    void searchLecturesReturnsErrorStringOnFailure() {
        given(retrievalPipeline.retrieve(anyString())).willThrow(new RuntimeException("pool exhausted"));

        String result = mcpToolService.searchLectures("What is Ti?", null);

        assertThat(result).isEqualTo("Error searching lectures: pool exhausted");
    }

    // --- conversation_citations ---

    @Test
    void conversationCitationsListsRetainedAnswersOnly() {
        CitationRecord citations = new CitationRecord(
                List.of(new CitationSource("Season 21 - Episode 4", 0.842),
                        new CitationSource("Season 19 - Episode 2", 0.61)),
                new Confidence(ConfidenceLevel.HIGH, 0.81, "⭐⭐⭐⭐", "2 relevant sources found"));
        ChatMessage pruned = new ChatMessageBuilder().id(2L).conversationId(CONVERSATION)
                .role(MessageRole.ASSISTANT).content("old answer").build();
        ChatMessage retained = new ChatMessageBuilder().id(4L).conversationId(CONVERSATION)
                .role(MessageRole.ASSISTANT).content("new answer").citations(citations)
                .followUpQuestion("How does Ni develop?")
                .createdAt(Instant.parse("2026-01-15T10:05:00Z")).build();
        ChatMessage question = new ChatMessageBuilder().id(3L).conversationId(CONVERSATION).build();
        given(conversationStore.messages(CONVERSATION)).willReturn(List.of(pruned, question, retained));

        String result = mcpToolService.conversationCitations(CONVERSATION.toString());

        assertThat(result).startsWith("- Answer 4 (2026-01-15T10:05:00Z): confidence high 0.81, 2 relevant sources found");
        assertThat(result).contains("    * Season 21 - Episode 4 (0.842)");
        assertThat(result).contains("    * Season 19 - Episode 2 (0.610)");
        assertThat(result).contains("    follow-up: How does Ni develop?");
        assertThat(result).doesNotContain("Answer 2");
    }

    @Test
    void conversationCitationsReportsNothingRetained() {
        given(conversationStore.messages(CONVERSATION)).willReturn(List.of());

        String result = mcpToolService.conversationCitations(CONVERSATION.toString());

        assertThat(result).isEqualTo("No retained citations for conversation " + CONVERSATION);
    }

    @Test
    void conversationCitationsRejectsInvalidId() {
        String result = mcpToolService.conversationCitations("not-a-uuid");

        assertThat(result).isEqualTo("Error: Invalid conversation ID format: not-a-uuid");
        verifyNoInteractions(conversationStore);
    }

    @Test
    void conversationCitationsRejectsBlankId() {
        assertThat(mcpToolService.conversationCitations(" "))
                .isEqualTo("Error: Conversation ID must not be empty.");
    }

    @Test
    void conversationCitationsReturnsErrorStringOnStorageFailure() {
        given(conversationStore.messages(any())).willThrow(new IllegalStateException("db down"));

        String result = mcpToolService.conversationCitations(CONVERSATION.toString());

        assertThat(result).isEqualTo("Error reading citations: db down");
    }
}
