package com.mk.fx.qa.process.sync.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class WorkerStateTest {

  @Test
  void onlyCompletedAndTerminatedAreTerminal() {
    assertThat(WorkerState.COMPLETED.isTerminal()).isTrue();
    assertThat(WorkerState.TERMINATED.isTerminal()).isTrue();
    assertThat(WorkerState.STARTING.isTerminal()).isFalse();
    assertThat(WorkerState.RUNNING.isTerminal()).isFalse();
    assertThat(WorkerState.PAUSED.isTerminal()).isFalse();
  }

  @Test
  void runningAndPausedAlternate() {
    assertThat(WorkerState.RUNNING.canTransitionTo(WorkerState.PAUSED)).isTrue();
    assertThat(WorkerState.PAUSED.canTransitionTo(WorkerState.RUNNING)).isTrue();
  }

  @Test
  void onlyRunningMayComplete() {
    assertThat(WorkerState.RUNNING.canTransitionTo(WorkerState.COMPLETED)).isTrue();
    assertThat(WorkerState.STARTING.canTransitionTo(WorkerState.COMPLETED)).isFalse();
    assertThat(WorkerState.PAUSED.canTransitionTo(WorkerState.COMPLETED)).isFalse();
  }

  @Test
  void startingCannotPause() {
    assertThat(WorkerState.STARTING.canTransitionTo(WorkerState.PAUSED)).isFalse();
  }

  @ParameterizedTest
  @EnumSource(
      value = WorkerState.class,
      names = {"STARTING", "RUNNING", "PAUSED"})
  void everyLiveStateMayTerminate(WorkerState state) {
    assertThat(state.canTransitionTo(WorkerState.TERMINATED)).isTrue();
  }

  @ParameterizedTest
  @EnumSource(
      value = WorkerState.class,
      names = {"COMPLETED", "TERMINATED"})
  void terminalStatesAcceptNothing(WorkerState terminal) {
    for (WorkerState next : WorkerState.values()) {
      assertThat(terminal.canTransitionTo(next)).as("%s -> %s", terminal, next).isFalse();
    }
  }

  @Test
  void fromValueIgnoresCase() {
    assertThat(WorkerState.fromValue("paused")).isEqualTo(WorkerState.PAUSED);
    assertThatThrownBy(() -> WorkerState.fromValue("sleeping"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("sleeping");
  }
}
