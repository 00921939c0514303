package com.mk.fx.qa.process.sync.sink;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.process.sync.events.SampleEvent;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SampleSinkTest {

  private static SampleEvent sample(long second) {
    return new SampleEvent(10, 20, 30, 1_000 * second, Instant.ofEpochSecond(second));
  }

  @Test
  void emptyUntilFirstSample() {
    var sink = new SampleSink(5);

    assertThat(sink.latest()).isEmpty();
    assertThat(sink.history()).isEmpty();
  }

  @Test
  void retainsMostRecentHistory() {
    var sink = new SampleSink(3);
    for (long s = 1; s <= 5; s++) {
      sink.accept(sample(s));
    }

    assertThat(sink.history()).extracting(SampleEvent::networkBytes).containsExactly(3_000L, 4_000L, 5_000L);
    assertThat(sink.latest()).contains(sample(5));
  }
}
