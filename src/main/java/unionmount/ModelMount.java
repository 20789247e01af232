package unionmount;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

import unionmount.tasks.TaskFactory;

/**
 * A {@link ChangeHandler} that keeps a {@link ModelStore} up to date.
 *
 * The first batch (the initial scan) initializes the store with {@code set}, applied to the
 * initial model, and every later batch goes through {@code modify}. Exceptions thrown by the
 * transformer are logged and ignored, i.e. that batch leaves the model as it was, and the
 * mount keeps running.
 *
 * Note the first call consumes the {@code set} even if the transformer failed, in which case
 * the store is set to the unchanged initial model.
 */
public class ModelMount<S, T, M> implements ChangeHandler<S, T> {

  enum State {
    AWAITING_INITIAL_SET, INITIALIZED
  }

  private static final Logger log = LoggerFactory.getLogger(ModelMount.class);
  private final ModelStore<M> store;
  private final M model0;
  private final ChangeTransformer<S, T, M> transformer;
  private final Object lock = new Object();
  private State state = State.AWAITING_INITIAL_SET;

  /**
   * @param store the store to drive; it should not be set already, as its value is overwritten by the first batch
   * @param model0 the initial value of the model, onto which the first batch is applied
   */
  public ModelMount(ModelStore<M> store, M model0, ChangeTransformer<S, T, M> transformer) {
    this.store = store;
    this.model0 = model0;
    this.transformer = transformer;
  }

  /** Mounts {@code config}'s sources onto {@code store}, blocking until the mount stops. */
  public static <S, T, M> void mount(
    TaskFactory taskFactory,
    MountConfig<S, T> config,
    ModelStore<M> store,
    M model0,
    ChangeTransformer<S, T, M> transformer) throws IOException, InterruptedException {
    UnionMount<S, T> mount = new UnionMount<>(taskFactory, config, new NativeDirectoryLister(), FileWatcherFactory.newFactory());
    mount.run(new ModelMount<>(store, model0, transformer));
  }

  /**
   * Mounts a single directory onto {@code store}, with a per-file {@code updater}.
   *
   * The updates of one batch are applied in batch order, i.e. by tag and then by path.
   */
  public static <T, M> void mountSingle(
    TaskFactory taskFactory,
    Path folder,
    TagPatterns<T> patterns,
    PathRules ignore,
    ModelStore<M> store,
    M model0,
    FileUpdater<T, M> updater) throws IOException, InterruptedException {
    MountConfig<Path, T> config = new MountConfig<>(Collections.singletonMap(folder, folder), patterns, ignore, false, new ArrayList<>());
    UnionMount<Path, T> mount = new UnionMount<>(taskFactory, config, new NativeDirectoryLister(), FileWatcherFactory.newFactory());
    mount.run(forSingleSource(store, model0, updater));
  }

  /** @return a handler for a mount whose only source is the directory itself */
  public static <T, M> ModelMount<Path, T, M> forSingleSource(ModelStore<M> store, M model0, FileUpdater<T, M> updater) {
    return new ModelMount<>(store, model0, change -> {
      List<UnaryOperator<M>> updates = new ArrayList<>();
      for (T tag : change.tags()) {
        for (Map.Entry<String, FileAction<Set<OverlayFile<Path>>>> e : change.get(tag).entrySet()) {
          FileAction<Path> action = e.getValue().map(files -> {
            OverlayFile<Path> file = files.iterator().next();
            return file.resolve(file.getSource());
          });
          updates.add(updater.update(tag, e.getKey(), action));
        }
      }
      return chain(updates);
    });
  }

  @Override
  public void onChange(Change<S, T> change) {
    UnaryOperator<M> update = interceptExceptions(UnaryOperator.identity(), change);
    synchronized (lock) {
      try {
        if (state == State.AWAITING_INITIAL_SET) {
          store.set(update.apply(model0));
        } else {
          store.modify(update);
        }
      } finally {
        state = State.INITIALIZED;
      }
    }
  }

  @VisibleForTesting
  State getState() {
    synchronized (lock) {
      return state;
    }
  }

  // Log and ignore exceptions; Errors propagate and fail the mount
  private UnaryOperator<M> interceptExceptions(UnaryOperator<M> fallback, Change<S, T> change) {
    Attempt<UnaryOperator<M>> attempt = Attempt.of(() -> transformer.handle(change));
    attempt.getFailure().ifPresent(e -> log.error("User exception: " + e, e));
    return attempt.getOrElse(fallback);
  }

  /** @return a function applying {@code updates} left to right */
  static <M> UnaryOperator<M> chain(List<UnaryOperator<M>> updates) {
    List<UnaryOperator<M>> copy = new ArrayList<>(updates);
    return m -> {
      M result = m;
      for (UnaryOperator<M> u : copy) {
        result = u.apply(result);
      }
      return result;
    };
  }

}
