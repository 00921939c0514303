package com.mk.fx.qa.process.sync.pool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drives {@link PoolController#reconcileTick()} on Spring's scheduler thread. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconcileScheduler {

  private final PoolController poolController;

  @Scheduled(fixedDelayString = "${process.pool.reconcile-interval-ms:200}")
  public void tick() {
    try {
      poolController.reconcileTick();
    } catch (RuntimeException ex) {
      log.error("Reconcile tick failed: {}", ex.getMessage(), ex);
    }
  }
}
