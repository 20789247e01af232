package unionmount;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/** A parameter object for the sources and patterns of a mount. */
public class MountConfig<S, T> {

  private final Map<S, Path> sources;
  private final TagPatterns<T> patterns;
  private final PathRules ignore;
  private final boolean debugAll;
  private final List<String> debugPrefixes;

  public static <S, T> MountConfig<S, T> forTesting(Map<S, Path> sources, TagPatterns<T> patterns) {
    return new MountConfig<>(sources, patterns, new PathRules(), false, new ArrayList<>());
  }

  /**
   * @param sources the roots to union, in order
   * @param patterns which files to include, and their tags
   * @param ignore which files to skip, even if they match {@code patterns}
   */
  public MountConfig(Map<S, Path> sources, TagPatterns<T> patterns, PathRules ignore, boolean debugAll, List<String> debugPrefixes) {
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("At least one source is required");
    }
    this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    this.patterns = patterns;
    this.ignore = ignore;
    this.debugAll = debugAll;
    this.debugPrefixes = ImmutableList.copyOf(debugPrefixes);
  }

  public Map<S, Path> getSources() {
    return sources;
  }

  public TagPatterns<T> getPatterns() {
    return patterns;
  }

  public PathRules getIgnore() {
    return ignore;
  }

  public boolean shouldDebug(String path) {
    if (debugAll) {
      return true;
    }
    return debugPrefixes.stream().anyMatch(prefix -> path.startsWith(prefix));
  }

}
