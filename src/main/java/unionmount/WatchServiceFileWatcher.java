package unionmount;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursively watches a directory with the JDK {@link WatchService} and passes
 * {@link FileEvent}s with absolute paths to a listener.
 *
 * Directories are registered by their real path, so files under a symlinked directory that
 * points outside of the root get absolute paths outside of the root, which the
 * {@link WatcherBridge} keeps absolute.
 *
 * The observed behavior of renames is that if you have:
 *
 * - dir1/dir2/foo.txt
 *
 * And rename dir1 to dirA, a WatchEvent is fired with DELETE dir1, CREATE dirA, and nothing
 * about dir2 or foo.txt (they are silently moved). So on a create of a directory we walk it,
 * register it, and fire ADDED for every file inside, while a deleted directory gets its watches
 * (and the ones of its children) cancelled.
 *
 * Deleting dir1 instead fires DELETE for foo.txt, dir2, and then dir1.
 */
public class WatchServiceFileWatcher implements FileWatcher {

  private static final Logger log = LoggerFactory.getLogger(WatchServiceFileWatcher.class);
  // two maps instead of a BiMap, as WatchService reuses keys on renames
  private final Map<WatchKey, Path> keyToPath = new ConcurrentHashMap<>();
  private final Map<Path, WatchKey> pathToKey = new ConcurrentHashMap<>();
  private final Path rootDirectory;
  private final WatchService watchService;
  private final FileEventListener listener;

  public WatchServiceFileWatcher(WatchService watchService, Path rootDirectory, FileEventListener listener) {
    this.watchService = watchService;
    this.rootDirectory = rootDirectory;
    this.listener = listener;
  }

  @Override
  public Path getRoot() {
    return rootDirectory;
  }

  @Override
  public void startWatching() throws IOException {
    watchTree(rootDirectory, null);
  }

  @Override
  public Duration runOneLoop() throws IOException, InterruptedException {
    try {
      WatchKey watchKey = watchService.take();
      // We can't use watchKey.watchable() because it might be stale when the directory
      // renames, see https://bugs.openjdk.java.net/browse/JDK-7057783
      Path parentDir = keyToPath.get(watchKey);
      for (WatchEvent<?> watchEvent : watchKey.pollEvents()) {
        WatchEvent.Kind<?> eventKind = watchEvent.kind();
        if (log.isTraceEnabled()) {
          log.trace("WatchEvent {} {}", eventKind, watchEvent.context());
        }
        if (eventKind == OVERFLOW) {
          throw new IOException("Watcher overflow for " + rootDirectory);
        }
        if (parentDir == null) {
          // an event that was queued before we cancelled the key
          log.debug("Missing parentDir for {}: {}", watchKey.watchable(), watchEvent.context());
          continue;
        }
        Path child = parentDir.resolve((Path) watchEvent.context());
        if (eventKind == ENTRY_CREATE) {
          onCreatedPath(child);
        } else if (eventKind == ENTRY_MODIFY) {
          onModifiedPath(child);
        } else if (eventKind == ENTRY_DELETE) {
          onRemovedPath(child);
        }
      }
      // so far reset() returning false ("not valid") only happens after we've deleted a
      // directory, and we already cancel our watches for that in onRemovedPath
      watchKey.reset();
    } catch (ClosedWatchServiceException e) {
      // shutting down
      return Duration.ofMillis(-1);
    }
    return null;
  }

  @Override
  public void onInterrupt() {
    closeWatchService();
  }

  @Override
  public void onStop() {
    log.info("Stopping change monitor for {}", rootDirectory);
    closeWatchService();
  }

  private void onCreatedPath(Path path) throws IOException, InterruptedException {
    try {
      if (Files.isDirectory(path)) {
        List<Path> files = new ArrayList<>();
        watchTree(path, files);
        for (Path file : files) {
          fire(FileEvent.Kind.ADDED, file);
        }
      } else if (Files.exists(path)) {
        fire(FileEvent.Kind.ADDED, path);
      } else {
        // created and then removed before we could look at it, or a dangling symlink
        fire(FileEvent.Kind.UNKNOWN, path);
      }
    } catch (NoSuchFileException e) {
      fire(FileEvent.Kind.UNKNOWN, path);
    }
  }

  private void onModifiedPath(Path path) throws InterruptedException {
    // directories get modify events whenever their children change, which we've already seen
    if (!Files.isDirectory(path)) {
      fire(FileEvent.Kind.MODIFIED, path);
    }
  }

  private void onRemovedPath(Path path) throws InterruptedException {
    fire(FileEvent.Kind.REMOVED, path);
    // in case this was a deleted directory, we'll want to start watching it again if it's re-created
    for (Map.Entry<Path, WatchKey> e : new ArrayList<>(pathToKey.entrySet())) {
      if (e.getKey().startsWith(path)) {
        unwatchDirectory(e.getValue(), e.getKey());
      }
    }
  }

  /** Registers every directory under {@code directory}, collecting its files if {@code files} is not null. */
  private void watchTree(Path directory, List<Path> files) throws IOException {
    Files.walkFileTree(directory, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
        watchDirectory(dir.toRealPath());
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        if (files != null && attrs.isRegularFile()) {
          files.add(file.getParent().toRealPath().resolve(file.getFileName()));
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
        if (exc instanceof NoSuchFileException || exc instanceof FileSystemLoopException) {
          // deleted while walking, or a symlink cycle
          log.debug("Skipping {}: {}", file, exc.toString());
          return FileVisitResult.CONTINUE;
        }
        throw exc;
      }
    });
  }

  private void watchDirectory(Path directory) throws IOException {
    if (pathToKey.containsKey(directory)) {
      return;
    }
    WatchKey key = directory.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
    if (log.isTraceEnabled()) {
      log.trace("Putting " + key + " = " + directory);
    }
    keyToPath.put(key, directory);
    pathToKey.put(directory, key);
  }

  private void unwatchDirectory(WatchKey key, Path directory) {
    if (log.isTraceEnabled()) {
      log.trace("Removing " + key + " = " + directory);
    }
    pathToKey.remove(directory);
    keyToPath.remove(key);
    key.cancel();
  }

  private void fire(FileEvent.Kind kind, Path path) throws InterruptedException {
    listener.onEvent(new FileEvent(kind, path));
  }

  private void closeWatchService() {
    try {
      watchService.close();
    } catch (IOException e) {
      log.warn("Exception when shutting down the watch service", e);
    }
  }

}
