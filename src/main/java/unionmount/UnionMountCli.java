package unionmount;

import static org.apache.commons.lang3.StringUtils.substringAfter;
import static org.apache.commons.lang3.StringUtils.substringBefore;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import java.util.jar.Manifest;

import org.apache.commons.lang3.StringUtils;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.rvesse.airline.annotations.Cli;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.help.Help;
import com.google.common.collect.ImmutableSortedMap;

import unionmount.UnionMountCli.MountCommand;
import unionmount.UnionMountCli.VersionCommand;
import unionmount.tasks.ThreadBasedTaskFactory;

@Cli(name = "unionmount", description = "union-mount directories and watch them for changes", commands = {
  MountCommand.class,
  VersionCommand.class }, defaultCommand = Help.class)
public class UnionMountCli {

  private static final Logger log = LoggerFactory.getLogger(UnionMountCli.class);

  static {
    LoggingConfig.init();
  }

  public static void main(String[] args) throws Exception {
    com.github.rvesse.airline.Cli<Runnable> cli = new com.github.rvesse.airline.Cli<>(UnionMountCli.class);
    cli.parse(args).run();
  }

  @Command(name = "version")
  public static class VersionCommand implements Runnable {
    @Override
    public void run() {
      System.out.println("Current Version: " + getVersion());
    }
  }

  public static abstract class BaseCommand implements Runnable {
    @Option(name = "--skip-limit-checks", description = "skip system inotify watches checks")
    public boolean skipLimitChecks;

    @Option(name = "--enable-log-file", description = "enables logging debug statements to unionmount.log")
    public boolean enableLogFile;

    @Option(name = { "-v", "--verbose" }, description = "log every file event")
    public boolean verbose;

    @Override
    public final void run() {
      if (enableLogFile) {
        LoggingConfig.enableLogFile();
      }
      if (verbose) {
        LoggingConfig.enableDebug();
      }
      if (!skipLimitChecks && !SystemChecks.checkLimits()) {
        // SystemChecks will have log.error'd some output
        System.exit(-1);
      }
      runIfChecksOkay();
    }

    protected abstract void runIfChecksOkay();
  }

  @Command(name = "mount", description = "union-mounts the sources and logs each change until killed")
  public static class MountCommand extends BaseCommand {
    @Option(name = { "-s", "--source" }, description = "a directory to mount, as name=path or just path; later sources are layered over earlier ones")
    public List<String> sources = new ArrayList<>();

    @Option(name = { "-p", "--pattern" }, description = "tag=pattern of files to include, e.g. doc=*.md; the first matching pattern wins, default: file=*")
    public List<String> patterns = new ArrayList<>();

    @Option(name = { "-i", "--ignore" }, description = "pattern of files to skip, .gitignore-style")
    public List<String> ignores = new ArrayList<>();

    @Option(name = { "--use-default-ignores" }, description = "skip VCS directories and editor backup files")
    public boolean useDefaultIgnores;

    @Option(name = { "-d", "--debug-all" }, description = "turn on debugging for all paths")
    public boolean debugAll = false;

    @Option(name = { "--debug-prefixes" }, description = "prefix of paths to print debug lines for, e.g. foo/bar,foo/zaz")
    public List<String> debugPrefixes = new ArrayList<>();

    @Override
    protected void runIfChecksOkay() {
      if (sources.isEmpty()) {
        log.error("At least one --source is required");
        System.exit(-1);
      }
      MountConfig<String, String> config = new MountConfig<>(
        parseSources(sources),
        parsePatterns(patterns),
        setupIgnores(ignores, useDefaultIgnores),
        debugAll,
        debugPrefixes);
      InMemoryModelStore<SortedMap<String, List<String>>> store = new InMemoryModelStore<>();
      store.addListener(model -> log.info("Mounted {} files", model.size()));
      try {
        ModelMount.mount(new ThreadBasedTaskFactory(), config, store, ImmutableSortedMap.of(), UnionMountCli::listingUpdate);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      } catch (Exception e) {
        log.error("Mount failed", e);
        System.exit(-1);
      }
    }
  }

  /** @return the sources in order, from name=path (or just path, which is then also the name) */
  public static Map<String, Path> parseSources(List<String> lines) {
    Map<String, Path> sources = new LinkedHashMap<>();
    for (String line : lines) {
      if (line.contains("=")) {
        sources.put(substringBefore(line, "="), Paths.get(substringAfter(line, "=")));
      } else {
        sources.put(line, Paths.get(line));
      }
    }
    return sources;
  }

  /** @return tag=pattern lines in order, or everything tagged as "file" if there are none */
  public static TagPatterns<String> parsePatterns(List<String> lines) {
    TagPatterns<String> patterns = new TagPatterns<>();
    if (lines.isEmpty()) {
      return patterns.add("file", "*");
    }
    for (String line : lines) {
      if (!line.contains("=")) {
        throw new IllegalArgumentException("Pattern should be tag=pattern: " + line);
      }
      patterns.add(substringBefore(line, "="), substringAfter(line, "="));
    }
    return patterns;
  }

  public static PathRules setupIgnores(List<String> extraIgnores, boolean useDefaultIgnores) {
    PathRules ignores = new PathRules();
    if (useDefaultIgnores) {
      // IntelliJ safe write files
      ignores.addRule("*___jb_bak___");
      ignores.addRule("*___jb_old___");
      // vim/emacs safe write files
      ignores.addRules("*~", ".#*", "*.swp");
      ignores.addRules(".git/", ".svn/", ".hg/");
    }
    extraIgnores.forEach(line -> ignores.addRule(line));
    return ignores;
  }

  /** Keeps a listing of every mounted path and the sources that provide it. */
  static SortedMap<String, List<String>> applyChange(SortedMap<String, List<String>> model, Change<String, String> change) {
    SortedMap<String, List<String>> next = new TreeMap<>(model);
    change.forEach((tag, path, action) -> {
      if (action.isDelete()) {
        next.remove(path);
      } else {
        Set<OverlayFile<String>> files = action.getValue();
        next.put(path, Seq.seq(files).map(OverlayFile::getSource).toList());
      }
      log.debug("{} {}: {}", tag, path, action);
    });
    return ImmutableSortedMap.copyOfSorted(next);
  }

  private static UnaryOperator<SortedMap<String, List<String>>> listingUpdate(Change<String, String> change) {
    return model -> applyChange(model, change);
  }

  public static String getVersion() {
    String version = null;
    URL url = UnionMountCli.class.getResource("/META-INF/MANIFEST.MF");
    try {
      if (url != null) {
        try (InputStream in = url.openStream()) {
          Manifest m = new Manifest(in);
          version = m.getMainAttributes().getValue("Implementation-Version");
        }
      }
    } catch (Exception e) {
      log.error("Error loading manifest", e);
    }
    return StringUtils.defaultIfEmpty(version, "unspecified");
  }

}
