package dev.lyceum.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import dev.lyceum.conversation.MessageRole;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class StreamingChatTextGeneratorTest {

  @Mock StreamingChatModel model;

  StreamingChatTextGenerator generator;

  final List<String> chunks = new ArrayList<>();
  final AtomicReference<StreamingChatResponseHandler> handler = new AtomicReference<>();

  private static final GenerationRequest REQUEST =
      new GenerationRequest(
          "system",
          List.of(
              new PriorMessage(MessageRole.USER, "earlier question"),
              new PriorMessage(MessageRole.ASSISTANT, "earlier answer")),
          "question");

  @BeforeEach
  void setUp() {
    generator = new StreamingChatTextGenerator(model);
  }

  private void captureHandler() {
    doAnswer(
            invocation -> {
              handler.set(invocation.getArgument(1));
              return null;
            })
        .when(model)
        .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
  }

  private static ChatResponse response(String text, TokenUsage usage) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).tokenUsage(usage).build();
  }

  @Test
  void relaysPartialsAndReportsTokenUsage() {
    captureHandler();
    CompletableFuture<GeneratedAnswer> result = generator.generate(REQUEST, chunks::add);

    handler.get().onPartialResponse("Hel");
    handler.get().onPartialResponse("lo");
    handler.get().onCompleteResponse(response("Hello", new TokenUsage(120, 7)));

    assertThat(chunks).containsExactly("Hel", "lo");
    GeneratedAnswer answer = result.join();
    assertThat(answer.text()).isEqualTo("Hello");
    assertThat(answer.inputTokens()).isEqualTo(120);
    assertThat(answer.outputTokens()).isEqualTo(7);
  }

  @Test
  void wholeReplyInFinalResponseIsRelayedOnce() {
    captureHandler();
    CompletableFuture<GeneratedAnswer> result = generator.generate(REQUEST, chunks::add);

    handler.get().onCompleteResponse(response("Whole answer", null));

    assertThat(chunks).containsExactly("Whole answer");
    assertThat(result.join().text()).isEqualTo("Whole answer");
    assertThat(result.join().inputTokens()).isNull();
  }

  @Test
  void errorCompletesExceptionally() {
    captureHandler();
    CompletableFuture<GeneratedAnswer> result = generator.generate(REQUEST, chunks::add);

    handler.get().onError(new IllegalStateException("rate limited"));

    assertThat(result).isCompletedExceptionally();
  }

  @Test
  void partialsAfterCancellationAreDropped() {
    captureHandler();
    CompletableFuture<GeneratedAnswer> result = generator.generate(REQUEST, chunks::add);

    handler.get().onPartialResponse("kept");
    result.cancel(true);
    handler.get().onPartialResponse("dropped");

    assertThat(chunks).containsExactly("kept");
  }

  @Test
  void synchronousFailureIsReportedThroughFuture() {
    doThrow(new IllegalArgumentException("bad request"))
        .when(model)
        .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

    CompletableFuture<GeneratedAnswer> result = generator.generate(REQUEST, chunks::add);

    assertThat(result).isCompletedExceptionally();
  }

  @Test
  void messagesAreSystemThenHistoryThenQuestion() {
    List<ChatMessage> messages = StreamingChatTextGenerator.toMessages(REQUEST);

    assertThat(messages)
        .containsExactly(
            SystemMessage.from("system"),
            UserMessage.from("earlier question"),
            AiMessage.from("earlier answer"),
            UserMessage.from("question"));
  }
}
