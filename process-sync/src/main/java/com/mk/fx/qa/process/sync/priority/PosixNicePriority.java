package com.mk.fx.qa.process.sync.priority;

import com.mk.fx.qa.process.sync.model.PriorityLevel;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Linux variant: renices the calling thread's native task to the level's niceness (LOW 19, NORMAL
 * 10, HIGH 0) and sets the matching Java thread priority.
 *
 * <p>Lowering niceness below the current value needs {@code CAP_SYS_NICE}; without it {@code
 * renice} fails and the request is reported unsupported.
 */
@Slf4j
public final class PosixNicePriority implements PrioritySetter {

  static final Path THREAD_SELF = Path.of("/proc/thread-self");
  private static final Duration RENICE_TIMEOUT = Duration.ofSeconds(2);

  private final Path threadSelf;

  public PosixNicePriority() {
    this(THREAD_SELF);
  }

  PosixNicePriority(Path threadSelf) {
    this.threadSelf = threadSelf;
  }

  @Override
  public void apply(PriorityLevel level) throws PriorityUnsupportedException {
    Thread.currentThread().setPriority(level.threadPriority());
    long tid = nativeThreadId(level);
    renice(level, tid);
    log.debug("Thread {} (tid {}) reniced to {}", Thread.currentThread().getName(), tid, level);
  }

  @Override
  public String name() {
    return "posix-nice";
  }

  /** Resolves {@code /proc/thread-self}, a link of the form {@code <pid>/task/<tid>}. */
  long nativeThreadId(PriorityLevel level) throws PriorityUnsupportedException {
    try {
      Path target = Files.readSymbolicLink(threadSelf);
      return Long.parseLong(target.getFileName().toString());
    } catch (IOException | UnsupportedOperationException | NumberFormatException ex) {
      throw new PriorityUnsupportedException(
          level, "Cannot resolve native thread id from " + threadSelf + ": " + ex.getMessage(), ex);
    }
  }

  private void renice(PriorityLevel level, long tid) throws PriorityUnsupportedException {
    List<String> command =
        List.of("renice", "-n", String.valueOf(level.niceness()), "-p", String.valueOf(tid));
    try {
      Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
      if (!process.waitFor(RENICE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new PriorityUnsupportedException(level, "renice timed out after " + RENICE_TIMEOUT);
      }
      if (process.exitValue() != 0) {
        throw new PriorityUnsupportedException(
            level, "renice exited with " + process.exitValue() + ": " + readOutput(process));
      }
    } catch (IOException ex) {
      throw new PriorityUnsupportedException(level, "renice unavailable: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new PriorityUnsupportedException(level, "Interrupted while applying priority", ex);
    }
  }

  private static String readOutput(Process process) throws IOException {
    try (InputStream in = process.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
    }
  }
}
