package unionmount.tasks;

/** Stops a running task and waits for its thread to finish. */
@FunctionalInterface
public interface TaskHandle {

  void stop();

}
