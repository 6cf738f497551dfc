package dev.lyceum.answer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FollowUpFilterTest {

  private final FollowUpFilter filter = new FollowUpFilter();

  @Test
  void textWithoutMarkerPassesThrough() {
    assertThat(filter.accept("Hello ")).isEqualTo("Hello ");
    assertThat(filter.accept("world")).isEqualTo("world");

    FollowUpFilter.Outcome outcome = filter.finish();

    assertThat(outcome.tail()).isEmpty();
    assertThat(outcome.answer()).isEqualTo("Hello world");
    assertThat(outcome.followUp()).isEmpty();
  }

  @Test
  void markerInOneChunkWithholdsTrailer() {
    String visible = filter.accept("Answer.\n[[FOLLOW-UP]] What about ENFP?");

    FollowUpFilter.Outcome outcome = filter.finish();

    assertThat(visible).isEqualTo("Answer.\n");
    assertThat(outcome.answer()).isEqualTo("Answer.");
    assertThat(outcome.followUp()).contains("What about ENFP?");
  }

  @Test
  void markerSplitAcrossChunksNeverLeaks() {
    String first = filter.accept("Answer [[FOL");
    String second = filter.accept("LOW-UP]] Next");
    String third = filter.accept(" question?");

    FollowUpFilter.Outcome outcome = filter.finish();

    assertThat(first).isEqualTo("Answer ");
    assertThat(second).isEmpty();
    assertThat(third).isEmpty();
    assertThat(outcome.tail()).isEmpty();
    assertThat(outcome.answer()).isEqualTo("Answer");
    assertThat(outcome.followUp()).contains("Next question?");
  }

  @Test
  void heldBackTextIsReleasedWhenMarkerDoesNotFollow() {
    assertThat(filter.accept("see [")).isEqualTo("see ");
    assertThat(filter.accept("x] here")).isEqualTo("[x] here");
  }

  @Test
  void danglingMarkerPrefixIsReleasedAtFinish() {
    assertThat(filter.accept("text [[FOLLOW")).isEqualTo("text ");

    FollowUpFilter.Outcome outcome = filter.finish();

    assertThat(outcome.tail()).isEqualTo("[[FOLLOW");
    assertThat(outcome.answer()).isEqualTo("text [[FOLLOW");
    assertThat(outcome.followUp()).isEmpty();
  }

  @Test
  void multiLineTrailerIsDropped() {
    filter.accept("Answer\n[[FOLLOW-UP]] First line\nSecond line");

    FollowUpFilter.Outcome outcome = filter.finish();

    assertThat(outcome.answer()).isEqualTo("Answer");
    assertThat(outcome.followUp()).isEmpty();
  }

  @Test
  void invalidTrailersAreRejected() {
    assertThat(FollowUpFilter.parseTrailer("   ")).isEmpty();
    assertThat(FollowUpFilter.parseTrailer("x".repeat(FollowUpFilter.MAX_FOLLOW_UP_LENGTH + 1)))
        .isEmpty();
    assertThat(FollowUpFilter.parseTrailer("What about [[FOLLOW-UP]] twice?")).isEmpty();
    assertThat(FollowUpFilter.parseTrailer("a\rb")).isEmpty();
  }

  @Test
  void validTrailerIsTrimmed() {
    assertThat(FollowUpFilter.parseTrailer("  How does Ne develop?  \n"))
        .contains("How does Ne develop?");
    assertThat(FollowUpFilter.parseTrailer("x".repeat(FollowUpFilter.MAX_FOLLOW_UP_LENGTH)))
        .isPresent();
  }
}
