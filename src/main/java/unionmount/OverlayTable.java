package unionmount;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Tracks, for every logical path, which sources currently provide it.
 *
 * A path whose last source goes away is removed entirely, so a path is present iff at
 * least one source provides it.
 *
 * This class is not thread safe as it's assumed to be fed from a single thread, e.g. the
 * initial scan and then the {@link MountConsumer}.
 */
public class OverlayTable<S> {

  private final Map<String, Set<S>> sources = new HashMap<>();

  public void add(String path, S source) {
    sources.computeIfAbsent(path, k -> new LinkedHashSet<>()).add(source);
  }

  public void remove(String path, S source) {
    Set<S> set = sources.get(path);
    if (set != null) {
      set.remove(source);
      if (set.isEmpty()) {
        sources.remove(path);
      }
    }
  }

  /** @return a snapshot of the sources providing {@code path}, in the order they were added, or empty */
  public Optional<Set<OverlayFile<S>>> lookup(String path) {
    Set<S> set = sources.get(path);
    if (set == null) {
      return Optional.empty();
    }
    ImmutableSet.Builder<OverlayFile<S>> b = ImmutableSet.builder();
    set.forEach(s -> b.add(new OverlayFile<>(s, path)));
    return Optional.of(b.build());
  }

  public Set<S> sourcesOf(String path) {
    Set<S> set = sources.get(path);
    return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
  }

  public Set<String> paths() {
    return Collections.unmodifiableSet(sources.keySet());
  }

  public int size() {
    return sources.size();
  }

  public boolean isEmpty() {
    return sources.isEmpty();
  }

  @Override
  public String toString() {
    return sources.toString();
  }

}
