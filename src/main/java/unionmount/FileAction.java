package unionmount;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * What happened to a file: either it is (still) available, a {@link #refresh(RefreshAction, Object)}
 * carrying some payload, or it is gone, a {@link #delete()}.
 *
 * Instances are immutable.
 */
public final class FileAction<A> {

  private static final FileAction<?> DELETE = new FileAction<>(null, null);
  private final RefreshAction refreshAction;
  private final A value;

  public static <A> FileAction<A> refresh(RefreshAction action, A value) {
    Preconditions.checkNotNull(action, "action");
    Preconditions.checkNotNull(value, "value");
    return new FileAction<>(action, value);
  }

  @SuppressWarnings("unchecked")
  public static <A> FileAction<A> delete() {
    return (FileAction<A>) DELETE;
  }

  private FileAction(RefreshAction refreshAction, A value) {
    this.refreshAction = refreshAction;
    this.value = value;
  }

  public boolean isDelete() {
    return refreshAction == null;
  }

  public boolean isRefresh() {
    return refreshAction != null;
  }

  /** @return the refresh action, or empty for a delete */
  public Optional<RefreshAction> getRefreshAction() {
    return Optional.ofNullable(refreshAction);
  }

  /** @return the payload of a refresh */
  public A getValue() {
    if (isDelete()) {
      throw new IllegalStateException("A delete has no value");
    }
    return value;
  }

  /** Maps the payload of a refresh, leaving a delete as-is. */
  public <B> FileAction<B> map(Function<? super A, ? extends B> f) {
    if (isDelete()) {
      return delete();
    }
    return refresh(refreshAction, f.apply(value));
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof FileAction)) {
      return false;
    }
    FileAction<?> o = (FileAction<?>) other;
    return refreshAction == o.refreshAction && Objects.equals(value, o.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(refreshAction, value);
  }

  @Override
  public String toString() {
    if (isDelete()) {
      return "Delete";
    }
    return MoreObjects.toStringHelper("Refresh").addValue(refreshAction).addValue(value).toString();
  }

}
