package dev.lyceum.answer;

/** Destination of an answer stream, typically one HTTP client connection. */
public interface AnswerSink {

  /**
   * Delivers one event.
   *
   * @return false if the caller has gone away and the event was not delivered
   */
  boolean send(AnswerEvent event);

  /** False once the caller has disconnected or the stream was completed. */
  boolean isOpen();

  /** Ends the stream after the terminal event. */
  void complete();

  /**
   * Registers a callback run once when the sink closes, whether the caller left or the stream was
   * completed. Runs the callback at once if the sink is already closed.
   */
  void onClose(Runnable callback);
}
