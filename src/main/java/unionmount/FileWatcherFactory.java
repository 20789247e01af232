package unionmount;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Provides a factory for creating file watchers, given we need to know the root directory
 * (and who to notify) when we instantiate each watcher.
 */
@FunctionalInterface
public interface FileWatcherFactory {

  FileWatcher newWatcher(Path canonicalRoot, FileEventListener listener) throws IOException;

  /** @return the default factory, which uses the JDK's {@link java.nio.file.WatchService} */
  static FileWatcherFactory newFactory() {
    return (root, listener) -> new WatchServiceFileWatcher(root.getFileSystem().newWatchService(), root, listener);
  }

}
