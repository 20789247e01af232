package unionmount;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One source's copy of a logical path.
 *
 * The path is the logical path, so {@link #resolve(Path)} against the source's root gives
 * the physical file (an absolute logical path resolves to itself).
 */
public final class OverlayFile<S> {

  private final S source;
  private final String path;

  public OverlayFile(S source, String path) {
    this.source = Objects.requireNonNull(source);
    this.path = Objects.requireNonNull(path);
  }

  public S getSource() {
    return source;
  }

  public String getPath() {
    return path;
  }

  public Path resolve(Path root) {
    return root.resolve(path);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof OverlayFile)) {
      return false;
    }
    OverlayFile<?> o = (OverlayFile<?>) other;
    return source.equals(o.source) && path.equals(o.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, path);
  }

  @Override
  public String toString() {
    return "(" + source + "," + path + ")";
  }

}
