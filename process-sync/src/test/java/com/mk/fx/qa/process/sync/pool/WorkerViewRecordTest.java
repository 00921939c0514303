package com.mk.fx.qa.process.sync.pool;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.process.sync.events.StatusEvent;
import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.SpeedSetting;
import com.mk.fx.qa.process.sync.model.WorkerState;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class WorkerViewRecordTest {

  private final WorkerViewRecord record =
      new WorkerViewRecord(3, SpeedSetting.X2, PriorityLevel.HIGH);

  private static StatusEvent status(WorkerState state) {
    return StatusEvent.of(3, state, PriorityLevel.HIGH);
  }

  @Test
  void startsFresh() {
    var view = record.toView();
    assertThat(view.id()).isEqualTo(3);
    assertThat(view.state()).isEqualTo(WorkerState.STARTING);
    assertThat(view.progress()).isZero();
    assertThat(view.duration()).isNull();
  }

  @Test
  void holdsProgressBelowHundredUntilCompleted() {
    record.applyStatus(status(WorkerState.RUNNING));

    record.applyProgress(100);
    assertThat(record.getProgress()).isEqualTo(99);

    record.applyStatus(StatusEvent.completed(3, PriorityLevel.HIGH, Duration.ofMillis(1500)));
    assertThat(record.toView().progress()).isEqualTo(100);
    assertThat(record.toView().duration()).isEqualTo(Duration.ofMillis(1500));
  }

  @Test
  void progressNeverDecreases() {
    record.applyStatus(status(WorkerState.RUNNING));
    assertThat(record.applyProgress(40)).isTrue();
    assertThat(record.applyProgress(20)).isFalse();
    assertThat(record.getProgress()).isEqualTo(40);
  }

  @Test
  void ignoresIllegalAndRepeatedTransitions() {
    assertThat(record.applyStatus(status(WorkerState.PAUSED))).isFalse();
    assertThat(record.applyStatus(status(WorkerState.RUNNING))).isTrue();
    assertThat(record.applyStatus(status(WorkerState.RUNNING))).isFalse();
    assertThat(record.getState()).isEqualTo(WorkerState.RUNNING);
  }

  @Test
  void acceptsOnlyOneTerminalTransition() {
    record.applyStatus(status(WorkerState.RUNNING));
    assertThat(record.terminateUnlessFinished()).isTrue();

    assertThat(record.applyStatus(StatusEvent.completed(3, PriorityLevel.HIGH, Duration.ofSeconds(1))))
        .isFalse();
    assertThat(record.terminateUnlessFinished()).isFalse();
    assertThat(record.getState()).isEqualTo(WorkerState.TERMINATED);
    assertThat(record.getTerminalTransitions()).isEqualTo(1);
  }

  @Test
  void completedIsKeptOnStop() {
    record.applyStatus(status(WorkerState.RUNNING));
    record.applyStatus(StatusEvent.completed(3, PriorityLevel.HIGH, Duration.ofSeconds(2)));

    assertThat(record.terminateUnlessFinished()).isFalse();
    assertThat(record.getState()).isEqualTo(WorkerState.COMPLETED);
    assertThat(record.applyProgress(50)).isFalse();
    assertThat(record.getProgress()).isEqualTo(100);
  }
}
