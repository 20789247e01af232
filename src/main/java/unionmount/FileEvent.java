package unionmount;

import java.nio.file.Path;
import java.util.Objects;

/** A native notification about one file, with its absolute path. */
public final class FileEvent {

  public enum Kind {
    ADDED, MODIFIED, REMOVED,
    /** Something happened to the path but we couldn't tell what, e.g. it vanished before we could stat it. */
    UNKNOWN
  }

  private final Kind kind;
  private final Path path;

  public FileEvent(Kind kind, Path path) {
    this.kind = Objects.requireNonNull(kind);
    this.path = Objects.requireNonNull(path);
  }

  public Kind getKind() {
    return kind;
  }

  public Path getPath() {
    return path;
  }

  /** @return the event as a file action on its path: added/modified files are refreshed, anything else deleted */
  public FileAction<Path> toAction() {
    switch (kind) {
      case ADDED:
        return FileAction.refresh(RefreshAction.NEW, path);
      case MODIFIED:
        return FileAction.refresh(RefreshAction.UPDATE, path);
      default:
        return FileAction.delete();
    }
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof FileEvent)) {
      return false;
    }
    FileEvent o = (FileEvent) other;
    return kind == o.kind && path.equals(o.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, path);
  }

  @Override
  public String toString() {
    return kind + " " + path;
  }

}
