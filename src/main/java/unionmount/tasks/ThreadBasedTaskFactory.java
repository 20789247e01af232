package unionmount.tasks;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each task on a dedicated thread.
 */
public class ThreadBasedTaskFactory implements TaskFactory {

  private final ConcurrentHashMap<TaskLogic, ThreadBasedTask> tasks = new ConcurrentHashMap<>();

  @Override
  public TaskHandle runTask(TaskLogic logic, TaskListener listener) {
    ThreadBasedTask task = new ThreadBasedTask(logic, new TaskListener() {
      @Override
      public void onFailure(TaskLogic l, Throwable cause) {
        if (listener != null) {
          listener.onFailure(l, cause);
        }
      }

      @Override
      public void onExit(TaskLogic l) {
        // the task is already stopping, we just need to drop our entry to avoid leaking it
        tasks.remove(l);
        if (listener != null) {
          listener.onExit(l);
        }
      }
    });
    tasks.put(logic, task);
    task.start();
    return () -> stopTask(logic);
  }

  // Not synchronized: while we block on task.stop, the stopping task may ask us
  // to stop another task from its own thread.
  @Override
  public void stopTask(TaskLogic logic) {
    ThreadBasedTask task = tasks.remove(logic);
    if (task != null) {
      task.stop();
    }
  }

}
