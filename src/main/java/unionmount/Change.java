package unionmount;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One batch of changes, grouped by tag and then by logical path.
 *
 * Each refresh carries every source's copy of that path ({@link OverlayFile}s), and it is
 * up to the handler to union their contents. A delete means no source has the path anymore.
 *
 * Entries keep their insertion order, i.e. the order the aggregator saw them.
 */
public class Change<S, T> {

  private final Map<T, Map<String, FileAction<Set<OverlayFile<S>>>>> byTag = new LinkedHashMap<>();

  /** Adds or overwrites the entry for {@code path} under {@code tag}. */
  public void put(T tag, String path, FileAction<Set<OverlayFile<S>>> action) {
    byTag.computeIfAbsent(tag, k -> new LinkedHashMap<>()).put(path, action);
  }

  /** @return the entries for {@code tag}, possibly empty */
  public Map<String, FileAction<Set<OverlayFile<S>>>> get(T tag) {
    Map<String, FileAction<Set<OverlayFile<S>>>> files = byTag.get(tag);
    return files == null ? Collections.emptyMap() : Collections.unmodifiableMap(files);
  }

  public Set<T> tags() {
    return Collections.unmodifiableSet(byTag.keySet());
  }

  /** Visits every (tag, path, action) entry, in batch order. */
  public void forEach(EntryVisitor<S, T> visitor) {
    byTag.forEach((tag, files) -> files.forEach((path, action) -> visitor.visit(tag, path, action)));
  }

  /** @return the number of (tag, path) entries */
  public int size() {
    return byTag.values().stream().mapToInt(Map::size).sum();
  }

  public boolean isEmpty() {
    return byTag.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Change && byTag.equals(((Change<?, ?>) other).byTag);
  }

  @Override
  public int hashCode() {
    return byTag.hashCode();
  }

  @Override
  public String toString() {
    return byTag.toString();
  }

  @FunctionalInterface
  public interface EntryVisitor<S, T> {
    void visit(T tag, String path, FileAction<Set<OverlayFile<S>>> action);
  }

}
