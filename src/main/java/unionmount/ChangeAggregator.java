package unionmount;

import java.util.Set;

/**
 * Folds one (source, tag, path, action) event into the {@link OverlayTable} and the batch
 * being built.
 */
public final class ChangeAggregator {

  private ChangeAggregator() {
  }

  /**
   * Registers the event in {@code overlay} and then records the path's resulting state in
   * {@code batch}, overwriting any earlier entry for the same path.
   *
   * We don't track per-source actions, so when a delete leaves the path alive via other
   * sources it is reported as {@link RefreshAction#EXISTING}; any other refresh re-uses the
   * triggering action for all of the overlay files.
   */
  public static <S, T> void apply(OverlayTable<S> overlay, Change<S, T> batch, S source, T tag, String path, FileAction<?> action) {
    if (action.isDelete()) {
      overlay.remove(path, source);
    } else {
      overlay.add(path, source);
    }
    FileAction<Set<OverlayFile<S>>> result = overlay
      .lookup(path)
      .map(files -> FileAction.refresh(action.getRefreshAction().orElse(RefreshAction.EXISTING), files))
      .orElse(FileAction.delete());
    batch.put(tag, path, result);
  }

}
