package unionmount;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Lists the files under a root, for the initial scan of a mount. */
@FunctionalInterface
public interface DirectoryLister {

  /**
   * @return the {@code /}-separated paths, relative to the canonicalized {@code root}, of every
   *   file matching at least one of {@code include} and not ignored by {@code ignore}
   */
  List<String> list(Path root, TagPatterns<?> include, PathRules ignore) throws IOException;

}
