package unionmount.tasks;

/**
 * An abstraction for running tasks on dedicated threads, e.g. watch pumps and queue consumers.
 *
 * Instead of creating, running, and shutting threads directly, code can just ask for tasks
 * to be ran/stopped.
 *
 * Each task gets its own thread, so it can block (on a watch service, on a rendezvous
 * queue) without starving anyone else, and tasks talk to each other only through
 * thread-safe queues.
 */
public interface TaskFactory {

  default TaskHandle runTask(TaskLogic logic) {
    return runTask(logic, null);
  }

  /** @param listener notified from the task thread when it fails/exits, may be null */
  TaskHandle runTask(TaskLogic logic, TaskListener listener);

  void stopTask(TaskLogic logic);

  default TaskPool newTaskPool() {
    return new TaskPool(this);
  }

}
