package unionmount;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import unionmount.tasks.TaskLogic;

/**
 * Takes events off the watchers' queue one at a time and turns each accepted one into a
 * one-entry {@link Change} for the handler.
 *
 * There's no coalescing or debouncing, so batches are delivered in exactly the order the
 * events were queued. The {@link OverlayTable} is only ever touched from this task's thread.
 */
class MountConsumer<S, T> implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(MountConsumer.class);
  private final BlockingQueue<SourceEvent<S>> queue;
  private final MountConfig<S, T> config;
  private final OverlayTable<S> overlay;
  private final ChangeHandler<S, T> handler;

  MountConsumer(BlockingQueue<SourceEvent<S>> queue, MountConfig<S, T> config, OverlayTable<S> overlay, ChangeHandler<S, T> handler) {
    this.queue = queue;
    this.config = config;
    this.overlay = overlay;
    this.handler = handler;
  }

  @Override
  public Duration runOneLoop() throws Exception {
    SourceEvent<S> event = queue.take();
    String path = event.getPath();
    if (config.getIgnore().isIgnored(path)) {
      log.trace("Ignoring {}", event);
      return null;
    }
    Optional<T> tag = config.getPatterns().resolveTag(path);
    if (!tag.isPresent()) {
      log.trace("No pattern matches {}", event);
      return null;
    }
    Change<S, T> change = new Change<>();
    ChangeAggregator.apply(overlay, change, event.getSource(), tag.get(), path, event.getAction());
    if (config.shouldDebug(path)) {
      log.info("Change for {}: {}", event, change);
    }
    handler.onChange(change);
    return null;
  }

}
