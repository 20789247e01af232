package unionmount;

import java.io.IOException;
import java.nio.file.Path;

import unionmount.tasks.TaskLogic;

/**
 * Watches one directory tree, and passes its {@link FileEvent}s to a {@link FileEventListener}
 * while running as a task.
 */
public interface FileWatcher extends TaskLogic {

  /**
   * Sets up watches on the whole tree under {@link #getRoot()}, so that no changes are
   * missed between now and the task starting.
   *
   * This is performed on-thread and so this method blocks until complete.
   */
  void startWatching() throws IOException;

  /** @return the canonical root being watched */
  Path getRoot();

}
