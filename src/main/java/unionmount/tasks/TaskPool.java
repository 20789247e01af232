package unionmount.tasks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A pool of tasks whose lifetime is related: as soon as one task exits, whether it
 * failed or just finished, all of the tasks are shut down.
 *
 * The first failure is kept so that whoever is waiting in {@link #awaitTermination()}
 * can rethrow it.
 */
public class TaskPool {

  private static final Logger log = LoggerFactory.getLogger(TaskPool.class);
  private final TaskFactory factory;
  private final List<TaskLogic> tasks = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shutdown = new AtomicBoolean(false);
  private final AtomicReference<Throwable> failure = new AtomicReference<>();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final TaskListener listener = new TaskListener() {
    @Override
    public void onFailure(TaskLogic logic, Throwable cause) {
      failure.compareAndSet(null, cause);
    }

    @Override
    public void onExit(TaskLogic logic) {
      // only tasks that exit on their own take the rest of the pool down with them
      if (tasks.remove(logic)) {
        log.debug("{} exited, stopping pool", logic.getName());
        stopAllTasks();
      }
    }
  };

  public TaskPool(TaskFactory factory) {
    this.factory = factory;
  }

  public synchronized TaskHandle runTask(TaskLogic logic) {
    if (shutdown.get()) {
      throw new IllegalStateException("Pool is shutdown");
    }
    tasks.add(logic);
    return factory.runTask(logic, listener);
  }

  public void stopTask(TaskLogic logic) {
    tasks.remove(logic);
    factory.stopTask(logic);
  }

  /** Asynchronously stops every task; safe to call repeatedly and from a task's own thread. */
  public synchronized void stopAllTasks() {
    if (shutdown.compareAndSet(false, true)) {
      factory.runTask(new StopTasksInPool());
    }
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  /** Blocks until {@link #stopAllTasks()} has been triggered and every task has stopped. */
  public void awaitTermination() throws InterruptedException {
    terminated.await();
  }

  /** @return the first exception (or error) a task in this pool failed with, if any */
  public Optional<Throwable> getFailure() {
    return Optional.ofNullable(failure.get());
  }

  private class StopTasksInPool implements TaskLogic {
    @Override
    public Duration runOneLoop() {
      try {
        new ArrayList<>(tasks).forEach(t -> {
          try {
            stopTask(t);
          } catch (Exception e) {
            log.error("Error stopping " + t.getName(), e);
          }
        });
        log.debug("All tasks in pool stopped");
      } finally {
        terminated.countDown();
      }
      return Duration.ofMillis(-1);
    }
  }

}
