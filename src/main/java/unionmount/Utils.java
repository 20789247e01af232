package unionmount;

import java.io.File;
import java.nio.file.Path;

import org.apache.commons.lang3.StringUtils;

public class Utils {

  @FunctionalInterface
  public interface InterruptedRunnable {
    void run() throws InterruptedException;
  }

  public static void resetIfInterrupted(InterruptedRunnable r) {
    try {
      r.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  /**
   * @return {@code path} relative to {@code root} with {@code /} separators, or {@code path}
   *   itself (absolute) if it is not under {@code root}, e.g. reached via a symlinked directory.
   */
  public static String toLogicalPath(Path root, Path path) {
    if (path.startsWith(root)) {
      return toSlashes(root.relativize(path).toString());
    }
    return toSlashes(path.toString());
  }

  /** @return whether {@code logicalPath} escaped its root, i.e. is absolute */
  public static boolean isAbsolute(String logicalPath) {
    return logicalPath.startsWith("/") || new File(logicalPath).isAbsolute();
  }

  /** @return {@code logicalPath} without a leading root, e.g. {@code /home/a.md} to {@code home/a.md} */
  public static String stripRoot(String logicalPath) {
    String p = toSlashes(logicalPath);
    if (p.length() > 1 && p.charAt(1) == ':') {
      // windows drive letter
      p = p.substring(2);
    }
    return StringUtils.stripStart(p, "/");
  }

  private static String toSlashes(String path) {
    return path.replace(File.separator, "/");
  }

}
