package com.mk.fx.qa.process.sync.coordination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.process.sync.events.LogEvent;
import com.mk.fx.qa.process.sync.events.ProgressEvent;
import com.mk.fx.qa.process.sync.events.StatusEvent;
import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.WorkerState;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class EventChannelTest {

  @Test
  void drainReturnsEventsInPublishOrder() {
    var channel = new EventChannel<Integer>("numbers");
    channel.publish(1);
    channel.publish(2);
    channel.publish(3);

    List<Integer> drained = new ArrayList<>();
    assertThat(channel.drain(drained::add)).isEqualTo(3);
    assertThat(drained).containsExactly(1, 2, 3);
    assertThat(channel.isEmpty()).isTrue();
  }

  @Test
  void drainOnEmptyChannelDoesNotBlock() {
    var channel = new EventChannel<String>("empty");
    assertThat(channel.drain(event -> {})).isZero();
  }

  @Test
  void rejectsNullEvents() {
    var channel = new EventChannel<String>("strings");
    assertThatThrownBy(() -> channel.publish(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void keepsPerProducerOrderUnderConcurrentPublishing() throws Exception {
    var channel = new EventChannel<ProgressEvent>("progress");
    int producers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(producers);
    var start = new CountDownLatch(1);
    for (int id = 0; id < producers; id++) {
      int worker = id;
      pool.submit(
          () -> {
            start.await();
            for (int p = 1; p <= 100; p++) {
              channel.publish(new ProgressEvent(worker, p));
            }
            return null;
          });
    }
    start.countDown();
    pool.shutdown();
    assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

    Map<Integer, Integer> last = new HashMap<>();
    channel.drain(
        event -> {
          int previous = last.getOrDefault(event.workerId(), 0);
          assertThat(event.progress()).isEqualTo(previous + 1);
          last.put(event.workerId(), event.progress());
        });
    assertThat(last).hasSize(producers).allSatisfy((id, p) -> assertThat(p).isEqualTo(100));
  }

  @Test
  void closeAllEmptiesEveryChannel() {
    var channels = new EventChannels();
    channels.publishStatus(StatusEvent.of(0, WorkerState.RUNNING, PriorityLevel.NORMAL));
    channels.publishProgress(new ProgressEvent(0, 1));
    channels.publishLog(LogEvent.now("Worker 0 started"));

    assertThat(channels.isEmpty()).isFalse();
    assertThat(channels.closeAll()).isEqualTo(3);
    assertThat(channels.isEmpty()).isTrue();
  }

  @Test
  void closedChannelDropsLatePublishes() {
    var channels = new EventChannels();
    channels.closeAll();

    channels.publishStatus(StatusEvent.of(1, WorkerState.RUNNING, PriorityLevel.LOW));
    channels.publishProgress(new ProgressEvent(1, 7));
    channels.publishLog(LogEvent.now("Worker 1 performing cpu work"));

    assertThat(channels.isEmpty()).isTrue();
    assertThat(channels.progress().isClosed()).isTrue();
  }

  @Test
  void closeRacingPublishersLeavesChannelEmpty() throws Exception {
    var channel = new EventChannel<Integer>("race");
    ExecutorService pool = Executors.newFixedThreadPool(4);
    var start = new CountDownLatch(1);
    for (int p = 0; p < 4; p++) {
      pool.submit(
          () -> {
            start.await();
            for (int i = 0; i < 10_000; i++) {
              channel.publish(i);
            }
            return null;
          });
    }
    start.countDown();
    channel.close();
    pool.shutdown();
    assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

    assertThat(channel.isEmpty()).isTrue();
  }
}
