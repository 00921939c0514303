package com.mk.fx.qa.process.sync.sink;

import com.mk.fx.qa.process.sync.events.SampleEvent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/** Keeps the most recent system samples for the observer's charts. */
public class SampleSink {

  private final int historySize;
  private final Deque<SampleEvent> samples = new ArrayDeque<>();

  public SampleSink(int historySize) {
    if (historySize < 1) {
      throw new IllegalArgumentException("historySize must be positive but was " + historySize);
    }
    this.historySize = historySize;
  }

  public void accept(SampleEvent sample) {
    synchronized (samples) {
      samples.addLast(sample);
      while (samples.size() > historySize) {
        samples.pollFirst();
      }
    }
  }

  /** Retained samples, oldest first. */
  public List<SampleEvent> history() {
    synchronized (samples) {
      return List.copyOf(samples);
    }
  }

  public Optional<SampleEvent> latest() {
    synchronized (samples) {
      return Optional.ofNullable(samples.peekLast());
    }
  }
}
