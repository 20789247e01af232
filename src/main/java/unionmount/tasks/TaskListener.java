package unionmount.tasks;

/**
 * Observes the end of a task's life, from the task's own thread.
 */
public interface TaskListener {

  /** The task's loop threw {@code cause}; {@link #onExit(TaskLogic)} follows. */
  default void onFailure(TaskLogic logic, Throwable cause) {
  }

  /** The task's thread is about to terminate, whether it failed, finished or was stopped. */
  default void onExit(TaskLogic logic) {
  }

}
