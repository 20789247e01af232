package unionmount;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates one {@link FileWatcher} per source, and funnels all of their events, tagged with
 * the source and made relative to its root, into a single queue.
 *
 * The queue is expected to be a rendezvous (e.g. a {@link java.util.concurrent.SynchronousQueue}),
 * so a watcher blocks until the consumer has taken its previous event, which keeps events
 * across all sources in one strict order.
 */
public class WatcherBridge<S> {

  private static final Logger log = LoggerFactory.getLogger(WatcherBridge.class);
  private final FileWatcherFactory watcherFactory;
  private final BlockingQueue<SourceEvent<S>> queue;

  public WatcherBridge(FileWatcherFactory watcherFactory, BlockingQueue<SourceEvent<S>> queue) {
    this.watcherFactory = watcherFactory;
    this.queue = queue;
  }

  /**
   * Sets up watches on every source root, which are not pumped until the returned watchers
   * are ran as tasks.
   *
   * @param roots canonical roots by source
   */
  public List<FileWatcher> startWatching(Map<S, Path> roots) throws IOException {
    List<FileWatcher> watchers = new ArrayList<>();
    try {
      for (Map.Entry<S, Path> e : roots.entrySet()) {
        watchers.add(startWatching(e.getKey(), e.getValue()));
      }
    } catch (IOException | RuntimeException e) {
      close(watchers);
      throw e;
    }
    return watchers;
  }

  /** Releases watchers that were set up but will never be ran as tasks. */
  public static void close(List<FileWatcher> watchers) {
    for (FileWatcher w : watchers) {
      try {
        w.onStop();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (RuntimeException e) {
        log.warn("Error closing watcher for " + w.getRoot(), e);
      }
    }
  }

  private FileWatcher startWatching(S source, Path root) throws IOException {
    log.info("Monitoring {} for changes", root);
    FileWatcher watcher = watcherFactory.newWatcher(root, event -> {
      log.debug("{}: {}", source, event);
      // the watcher registers real paths, so relativize against the canonical root
      String path = Utils.toLogicalPath(root, event.getPath());
      queue.put(new SourceEvent<>(source, path, event.toAction()));
    });
    watcher.startWatching();
    return watcher;
  }

}
