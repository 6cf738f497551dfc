package dev.lyceum.answer;

/**
 * Lifecycle of one streamed answer: {@code IDLE -> SEARCHING -> GENERATING -> DONE}, with {@code
 * ERROR} reachable from every non-terminal state.
 */
public enum AnswerState {
  IDLE,
  SEARCHING,
  GENERATING,
  DONE,
  ERROR;

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }

  /**
   * Returns {@code next} if the transition is allowed.
   *
   * @throws IllegalStateException on a transition the lifecycle does not permit
   */
  public AnswerState transitionTo(AnswerState next) {
    boolean allowed;
    if (isTerminal()) {
      allowed = false;
    } else if (next == ERROR) {
      allowed = true;
    } else {
      // declaration order is the happy path
      allowed = next.ordinal() == ordinal() + 1;
    }
    if (!allowed) {
      throw new IllegalStateException("Illegal answer transition " + this + " -> " + next);
    }
    return next;
  }
}
