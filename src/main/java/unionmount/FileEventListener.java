package unionmount;

/** Receives native file events, on the watcher's thread. */
@FunctionalInterface
public interface FileEventListener {

  /** May block, e.g. until the consumer is ready for the event. */
  void onEvent(FileEvent event) throws InterruptedException;

}
