package unionmount;

import java.nio.file.Path;
import java.util.Objects;

/** A file event from one source, with its logical path; what the watchers hand to the consumer. */
public final class SourceEvent<S> {

  private final S source;
  private final String path;
  private final FileAction<Path> action;

  public SourceEvent(S source, String path, FileAction<Path> action) {
    this.source = Objects.requireNonNull(source);
    this.path = Objects.requireNonNull(path);
    this.action = Objects.requireNonNull(action);
  }

  public S getSource() {
    return source;
  }

  public String getPath() {
    return path;
  }

  public FileAction<Path> getAction() {
    return action;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof SourceEvent)) {
      return false;
    }
    SourceEvent<?> o = (SourceEvent<?>) other;
    return source.equals(o.source) && path.equals(o.path) && action.equals(o.action);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, path, action);
  }

  @Override
  public String toString() {
    return source + ":" + path + " " + action;
  }

}
