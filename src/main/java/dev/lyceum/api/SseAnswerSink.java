package dev.lyceum.api;

import dev.lyceum.answer.AnswerEvent;
import dev.lyceum.answer.AnswerSink;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * {@link AnswerSink} writing events to a Spring MVC {@link SseEmitter} as JSON {@code data:} lines.
 *
 * <p>The sink closes on the first failed write, on emitter timeout or error, and on completion.
 * Close callbacks run on whichever thread observes the close.
 */
class SseAnswerSink implements AnswerSink {

  private static final Logger log = LoggerFactory.getLogger(SseAnswerSink.class);

  private final SseEmitter emitter;
  private final AtomicBoolean open = new AtomicBoolean(true);
  private final List<Runnable> closeCallbacks = new CopyOnWriteArrayList<>();

  SseAnswerSink(SseEmitter emitter) {
    this.emitter = emitter;
    emitter.onTimeout(this::close);
    emitter.onError(error -> close());
    emitter.onCompletion(this::close);
  }

  @Override
  public boolean send(AnswerEvent event) {
    if (!open.get()) {
      return false;
    }
    try {
      emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
      return true;
    } catch (IOException | IllegalStateException e) {
      log.debug("Answer stream closed by client: {}", e.getMessage());
      close();
      return false;
    }
  }

  @Override
  public boolean isOpen() {
    return open.get();
  }

  @Override
  public void complete() {
    if (open.compareAndSet(true, false)) {
      emitter.complete();
      runCloseCallbacks();
    }
  }

  @Override
  public void onClose(Runnable callback) {
    closeCallbacks.add(callback);
    if (!open.get()) {
      runCloseCallbacks();
    }
  }

  private void close() {
    if (open.compareAndSet(true, false)) {
      runCloseCallbacks();
    }
  }

  private void runCloseCallbacks() {
    for (Runnable callback : closeCallbacks) {
      // remove() succeeds for exactly one caller, so each callback runs once
      if (closeCallbacks.remove(callback)) {
        callback.run();
      }
    }
  }
}
