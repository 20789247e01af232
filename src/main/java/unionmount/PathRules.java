package unionmount;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.jooq.lambda.Seq;

/**
 * Keeps a list of .gitignore-style rules, e.g. the ignore patterns of a mount, and evals
 * logical paths against them.
 *
 * Absolute paths (files reached through a symlinked directory that resolves outside of the
 * root) are matched leniently: every rule is widened with a leading {@code **}{@code /}, so
 * e.g. {@code drafts/*.md} also matches {@code /home/user/notes/drafts/a.md}.
 */
public class PathRules {

  private final List<Pair<String, FastIgnoreRule>> rules = new ArrayList<>();
  private final List<FastIgnoreRule> widenedRules = new ArrayList<>();

  public PathRules() {
  }

  public PathRules(String... lines) {
    setRules(lines);
  }

  public PathRules(List<String> lines) {
    setRules(lines);
  }

  /** @param lines the new rules, new line delimited, e.g. from a .gitignore file. */
  public void setRules(String lines) {
    setRules(lines.split("\n"));
  }

  public void setRules(String... lines) {
    setRules(Arrays.asList(lines));
  }

  public void setRules(List<String> lines) {
    rules.clear();
    widenedRules.clear();
    lines.forEach(this::addRule);
  }

  public void addRules(String... lines) {
    for (String line : lines) {
      addRule(line);
    }
  }

  public void addRule(String line) {
    if (line.length() == 0 || line.startsWith("#") || line.equals("/")) {
      return;
    }
    FastIgnoreRule rule = new FastIgnoreRule(line);
    if (!rule.isEmpty()) {
      rules.add(Pair.of(line, rule));
      widenedRules.add(new FastIgnoreRule(widen(line)));
    }
  }

  /** @return true if {@code path} is ignored, i.e. the last rule matching it is not a negation */
  public boolean matches(String path, boolean isDirectory) {
    boolean absolute = Utils.isAbsolute(path);
    String p = absolute ? Utils.stripRoot(path) : path;
    List<FastIgnoreRule> toCheck = absolute ? widenedRules : Seq.seq(rules).map(Pair::getRight).toList();
    boolean result = false;
    for (FastIgnoreRule rule : toCheck) {
      if (rule.isMatch(p, isDirectory)) {
        result = rule.getResult();
        // don't break, keep going so we can look for a "!..." after this
      }
    }
    return result;
  }

  /** @return true if the file at {@code path} should be dropped */
  public boolean isIgnored(String path) {
    return matches(path, false);
  }

  public List<String> getLines() {
    return Seq.seq(rules).map(t -> t.getLeft()).toList();
  }

  public boolean hasAnyRules() {
    return !rules.isEmpty();
  }

  @Override
  public String toString() {
    return getLines().toString();
  }

  /** @return {@code line} prefixed with {@code **}{@code /}, keeping a leading {@code !} in front */
  static String widen(String line) {
    boolean negated = line.startsWith("!");
    String pattern = StringUtils.stripStart(negated ? line.substring(1) : line, "/");
    if (!pattern.startsWith("**/")) {
      pattern = "**/" + pattern;
    }
    return (negated ? "!" : "") + pattern;
  }

}
