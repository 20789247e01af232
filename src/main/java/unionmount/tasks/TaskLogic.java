package unionmount.tasks;

import java.time.Duration;

import org.apache.commons.lang3.StringUtils;

/**
 * A unit of work that loops on a dedicated thread, e.g. pumping a watch service or draining a queue.
 */
public interface TaskLogic {

  /**
   * Run one iteration, and return how long the task wants to sleep.
   *
   * A {@code null} duration loops again immediately, a negative one ends the task.
   */
  Duration runOneLoop() throws Exception;

  /** Called on the task thread, before we start calling {@link #runOneLoop()} in a loop. */
  default void onStart() throws Exception {
  }

  /** Called on the task thread when {@link #runOneLoop()} threw. */
  default void onFailure() throws InterruptedException {
  }

  /** Called on the task thread, after we've interrupted/stopped calling {@link #runOneLoop()}. */
  default void onStop() throws InterruptedException {
  }

  /**
   * Called off the task thread, when we're trying to interrupt the task.
   *
   * Only tasks blocked in something that ignores {@code Thread.interrupt}, e.g.
   * a {@code WatchService.take}, need this.
   */
  default void onInterrupt() {
  }

  default String getName() {
    String name = getClass().getSimpleName();
    // lambdas don't have simple names
    if (name.equals("")) {
      name = StringUtils.substringAfterLast(getClass().getName(), ".");
    }
    return name;
  }
}
