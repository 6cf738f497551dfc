package dev.lyceum.answer;

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
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TextGenerator} backed by a LangChain4j {@link StreamingChatModel}.
 *
 * <p>Partial responses are forwarded as chunks until the returned future is completed or
 * cancelled; after that, late partials from the model are dropped.
 */
public class StreamingChatTextGenerator implements TextGenerator {

  private static final Logger log = LoggerFactory.getLogger(StreamingChatTextGenerator.class);

  private final StreamingChatModel model;

  public StreamingChatTextGenerator(StreamingChatModel model) {
    this.model = model;
  }

  @Override
  public CompletableFuture<GeneratedAnswer> generate(
      GenerationRequest request, Consumer<String> onChunk) {
    CompletableFuture<GeneratedAnswer> result = new CompletableFuture<>();
    StringBuilder text = new StringBuilder();

    StreamingChatResponseHandler handler =
        new StreamingChatResponseHandler() {
          @Override
          public void onPartialResponse(String partialResponse) {
            if (result.isDone() || partialResponse == null || partialResponse.isEmpty()) {
              return;
            }
            text.append(partialResponse);
            onChunk.accept(partialResponse);
          }

          @Override
          public void onCompleteResponse(ChatResponse response) {
            TokenUsage usage = response.tokenUsage();
            if (text.length() == 0 && !result.isDone()) {
              // some providers deliver the whole reply only in the final response
              String whole = aiText(response);
              if (!whole.isEmpty()) {
                text.append(whole);
                onChunk.accept(whole);
              }
            }
            String full = text.toString();
            result.complete(
                new GeneratedAnswer(
                    full,
                    usage == null ? null : usage.inputTokenCount(),
                    usage == null ? null : usage.outputTokenCount()));
          }

          @Override
          public void onError(Throwable error) {
            log.debug("Streaming generation failed", error);
            result.completeExceptionally(error);
          }
        };

    try {
      model.chat(ChatRequest.builder().messages(toMessages(request)).build(), handler);
    } catch (RuntimeException e) {
      result.completeExceptionally(e);
    }
    return result;
  }

  static List<ChatMessage> toMessages(GenerationRequest request) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(request.systemPrompt()));
    for (PriorMessage prior : request.history()) {
      if (prior.role() == MessageRole.USER) {
        messages.add(UserMessage.from(prior.content()));
      } else {
        messages.add(AiMessage.from(prior.content()));
      }
    }
    messages.add(UserMessage.from(request.question()));
    return messages;
  }

  private static String aiText(ChatResponse response) {
    if (response.aiMessage() == null || response.aiMessage().text() == null) {
      return "";
    }
    return response.aiMessage().text();
  }
}
