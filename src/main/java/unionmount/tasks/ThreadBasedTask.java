package unionmount.tasks;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import unionmount.Utils;

/**
 * Runs one {@link TaskLogic} on its own daemon thread until it finishes, fails, or is stopped.
 */
class ThreadBasedTask {

  private static int nextThread = 0;
  private static final Logger log = LoggerFactory.getLogger(ThreadBasedTask.class);
  private final AtomicBoolean shutdown = new AtomicBoolean(false);
  private final CountDownLatch isStarted = new CountDownLatch(1);
  private final CountDownLatch isShutdown = new CountDownLatch(1);
  private final Thread thread;
  private final TaskLogic task;
  private final TaskListener listener;

  private static synchronized int nextThreadId() {
    return nextThread++;
  }

  ThreadBasedTask(TaskLogic task, TaskListener listener) {
    this.task = task;
    this.listener = listener;
    thread = new ThreadFactoryBuilder().setDaemon(true).setNameFormat(nextThreadId() + "-" + task.getName() + "-%s").build().newThread(() -> run());
  }

  void start() {
    thread.start();
    Utils.resetIfInterrupted(() -> isStarted.await());
  }

  void stop() {
    if (shutdown.compareAndSet(false, true)) {
      Utils.resetIfInterrupted(() -> isStarted.await());
      thread.interrupt();
      task.onInterrupt();
      // a task asked to stop itself (e.g. from its own failure callback) can't wait on itself
      if (Thread.currentThread() != thread) {
        Utils.resetIfInterrupted(() -> isShutdown.await());
      }
    }
  }

  private void run() {
    try {
      isStarted.countDown();
      try {
        task.onStart();
        while (!shouldStop()) {
          Duration wait = task.runOneLoop();
          if (wait != null) {
            if (wait.isNegative()) {
              break;
            }
            Thread.sleep(wait.toMillis());
          }
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        // shutting down
      } catch (Throwable t) {
        // Errors included, so the listener sees every failure
        if (shouldStop()) {
          // closing a blocked resource from onInterrupt can surface as an exception
          log.debug("Exception while stopping " + task.getName(), t);
        } else {
          log.error("Error returned from runOneLoop", t);
          callTaskFailureCallback();
          callListener(() -> listener.onFailure(task, t));
        }
      } finally {
        callTaskStop();
      }
    } finally {
      callListener(() -> listener.onExit(task));
      isShutdown.countDown();
    }
  }

  private void callTaskStop() {
    try {
      task.onStop();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      // shutting down
    } catch (Exception e) {
      log.error("task.onStop() call failed", e);
    }
  }

  private void callTaskFailureCallback() {
    try {
      task.onFailure();
    } catch (Exception e2) {
      log.error("task.onFailure() call failed", e2);
    }
  }

  private void callListener(Runnable r) {
    if (listener != null) {
      try {
        r.run();
      } catch (Exception e) {
        log.error("Task listener call failed", e);
      }
    }
  }

  private boolean shouldStop() {
    return shutdown.get() || Thread.currentThread().isInterrupted();
  }

}
