package com.mk.fx.qa.process.sync.model;

import java.util.concurrent.TimeUnit;
import java.util.random.RandomGenerator;

/** Kinds of simulated work a worker performs per step. */
public enum WorkType {
  CPU("cpu") {
    @Override
    public void perform() {
      long sum = 0;
      for (int i = 0; i < WORK_SIZE; i++) {
        sum += (long) i * i;
      }
      sink = sum;
    }
  },
  MEMORY("memory") {
    @Override
    public void perform() {
      int[] block = new int[WORK_SIZE];
      block[WORK_SIZE - 1] = 1;
      sink = block.length;
    }
  },
  IO("io") {
    @Override
    public void perform() throws InterruptedException {
      TimeUnit.MILLISECONDS.sleep(IO_WAIT_MILLIS);
    }
  };

  static final int WORK_SIZE = 100_000;
  static final long IO_WAIT_MILLIS = 10L;

  // keeps the JIT from discarding CPU and memory work
  @SuppressWarnings("unused")
  private static volatile long sink;

  private final String label;

  WorkType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public abstract void perform() throws InterruptedException;

  /** Picks a work type uniformly at random. */
  public static WorkType random(RandomGenerator random) {
    WorkType[] all = values();
    return all[random.nextInt(all.length)];
  }
}
