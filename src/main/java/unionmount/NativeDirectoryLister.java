package unionmount;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists files by walking the tree, following symlinks.
 *
 * Directories matched by the ignore rules are skipped entirely, so e.g. a {@code .git/}
 * rule avoids walking the repository's objects.
 */
public class NativeDirectoryLister implements DirectoryLister {

  private static final Logger log = LoggerFactory.getLogger(NativeDirectoryLister.class);

  @Override
  public List<String> list(Path root, TagPatterns<?> include, PathRules ignore) throws IOException {
    Path parent = root.toRealPath();
    log.info("Traversing {} for files matching {}, ignoring {}", parent, include.getPatterns(), ignore.getLines());
    List<String> paths = new ArrayList<>();
    Files.walkFileTree(parent, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        if (!dir.equals(parent) && ignore.matches(Utils.toLogicalPath(parent, dir), true)) {
          return FileVisitResult.SKIP_SUBTREE;
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile()) {
          String path = Utils.toLogicalPath(parent, file);
          if (include.matchesAny(path) && !ignore.isIgnored(path)) {
            paths.add(path);
          }
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
        if (exc instanceof NoSuchFileException || exc instanceof FileSystemLoopException) {
          log.debug("Skipping {}: {}", file, exc.toString());
          return FileVisitResult.CONTINUE;
        }
        throw exc;
      }
    });
    Collections.sort(paths);
    return paths;
  }

}
