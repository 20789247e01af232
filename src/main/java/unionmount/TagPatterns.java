package unionmount;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.jooq.lambda.Seq;

/**
 * An ordered list of (tag, pattern) pairs, which decides which tag a file belongs to.
 *
 * Patterns are evaluated in the order they were added and the first match wins, so more
 * specific patterns should come first, e.g. {@code (Doc, "*.md")} before {@code (Any, "*")}.
 *
 * Like {@link PathRules}, absolute paths are matched against the {@code **}{@code /}-widened
 * patterns. This means we might match files the user did not originally intend, which is
 * the trade off of following symlinks.
 *
 * Add all patterns before mounting; instances are then only read.
 */
public class TagPatterns<T> {

  private final List<TagPattern<T>> patterns = new ArrayList<>();

  public static <T> TagPatterns<T> of(T tag, String pattern) {
    return new TagPatterns<T>().add(tag, pattern);
  }

  public TagPatterns<T> add(T tag, String pattern) {
    patterns.add(new TagPattern<>(tag, pattern));
    return this;
  }

  /** @return the tag of the first pattern matching {@code path}, or empty if none do */
  public Optional<T> resolveTag(String path) {
    boolean absolute = Utils.isAbsolute(path);
    String p = absolute ? Utils.stripRoot(path) : path;
    for (TagPattern<T> t : patterns) {
      FastIgnoreRule rule = absolute ? t.widened : t.rule;
      if (rule.isMatch(p, false) && rule.getResult()) {
        return Optional.of(t.tag);
      }
    }
    return Optional.empty();
  }

  public boolean matchesAny(String path) {
    return resolveTag(path).isPresent();
  }

  public List<T> getTags() {
    return Seq.seq(patterns).map(t -> t.tag).distinct().toList();
  }

  public List<String> getPatterns() {
    return Seq.seq(patterns).map(t -> t.pattern).toList();
  }

  public boolean isEmpty() {
    return patterns.isEmpty();
  }

  @Override
  public String toString() {
    return Seq.seq(patterns).map(t -> t.tag + "=" + t.pattern).toString(", ", "[", "]");
  }

  private static class TagPattern<T> {
    private final T tag;
    private final String pattern;
    private final FastIgnoreRule rule;
    private final FastIgnoreRule widened;

    private TagPattern(T tag, String pattern) {
      this.tag = tag;
      this.pattern = pattern;
      this.rule = new FastIgnoreRule(pattern);
      this.widened = new FastIgnoreRule(PathRules.widen(pattern));
    }
  }

}
