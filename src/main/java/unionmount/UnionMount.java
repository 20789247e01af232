package unionmount;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.SynchronousQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import unionmount.tasks.TaskFactory;
import unionmount.tasks.TaskPool;

/**
 * Mounts several directory trees ("sources") on top of each other, and reports their
 * changes keyed by logical (root-relative) path.
 *
 * {@link #run(ChangeHandler)} first delivers one batch with every matching file of every
 * source, and then one batch per accepted file event, until {@link #stop()} is called or
 * something fails:
 *
 * - one watcher task per source puts events on a rendezvous queue,
 * - one consumer task takes them off, and feeds them through the {@link ChangeAggregator}.
 *
 * All of these tasks run in one {@link TaskPool}, so the first one to exit takes the others
 * down with it.
 */
public class UnionMount<S, T> {

  private static final Logger log = LoggerFactory.getLogger(UnionMount.class);
  private final TaskFactory taskFactory;
  private final MountConfig<S, T> config;
  private final DirectoryLister lister;
  private final FileWatcherFactory watcherFactory;
  private final Object lock = new Object();
  private TaskPool pool;
  private boolean stopped;

  public UnionMount(TaskFactory taskFactory, MountConfig<S, T> config, DirectoryLister lister, FileWatcherFactory watcherFactory) {
    this.taskFactory = taskFactory;
    this.config = config;
    this.lister = lister;
    this.watcherFactory = watcherFactory;
  }

  /**
   * Blocks until the mount is stopped.
   *
   * @throws IOException if a root can't be resolved, listed, or watched
   * @throws UnionMountException if a watcher or the handler failed after startup
   */
  public void run(ChangeHandler<S, T> handler) throws IOException, InterruptedException {
    Map<S, Path> roots = canonicalRoots();
    BlockingQueue<SourceEvent<S>> queue = new SynchronousQueue<>();
    // watch before listing, so that changes made during the initial scan still show up later
    List<FileWatcher> watchers = new WatcherBridge<S>(watcherFactory, queue).startWatching(roots);
    OverlayTable<S> overlay = new OverlayTable<>();
    try {
      Change<S, T> initial = initialScan(roots, overlay);
      log.debug("Initial scan found {} files", overlay.size());
      handler.onChange(initial);
    } catch (IOException | InterruptedException | RuntimeException e) {
      WatcherBridge.close(watchers);
      throw e;
    } catch (Exception e) {
      WatcherBridge.close(watchers);
      throw new UnionMountException("Handler failed on the initial batch", e);
    }

    TaskPool p;
    synchronized (lock) {
      if (stopped) {
        WatcherBridge.close(watchers);
        return;
      }
      p = taskFactory.newTaskPool();
      pool = p;
      p.runTask(new MountConsumer<>(queue, config, overlay, handler));
      watchers.forEach(p::runTask);
    }

    try {
      p.awaitTermination();
    } catch (InterruptedException e) {
      p.stopAllTasks();
      throw e;
    }
    Optional<Throwable> failure = p.getFailure();
    if (failure.isPresent()) {
      throw new UnionMountException("Mount of " + roots.values() + " failed", failure.get());
    }
    log.info("Mount of {} stopped", roots.values());
  }

  /** Stops the watchers and the consumer; {@link #run(ChangeHandler)} then returns. */
  public void stop() {
    synchronized (lock) {
      stopped = true;
      if (pool != null) {
        pool.stopAllTasks();
      }
    }
  }

  private Map<S, Path> canonicalRoots() throws IOException {
    Map<S, Path> roots = new LinkedHashMap<>();
    for (Map.Entry<S, Path> e : config.getSources().entrySet()) {
      // watch events come back with real paths, so relativize against the real root
      roots.put(e.getKey(), e.getValue().toRealPath());
    }
    return roots;
  }

  private Change<S, T> initialScan(Map<S, Path> roots, OverlayTable<S> overlay) throws IOException {
    Change<S, T> change = new Change<>();
    for (Map.Entry<S, Path> e : roots.entrySet()) {
      S source = e.getKey();
      Path root = e.getValue();
      for (String path : lister.list(root, config.getPatterns(), config.getIgnore())) {
        Optional<T> tag = config.getPatterns().resolveTag(path);
        if (tag.isPresent()) {
          ChangeAggregator.apply(overlay, change, source, tag.get(), path, FileAction.refresh(RefreshAction.EXISTING, root.resolve(path)));
        }
      }
    }
    return change;
  }

}
