package unionmount;

import java.util.Optional;
import java.util.concurrent.Callable;

/** The outcome of calling user code: either a value, or the exception it threw. */
public final class Attempt<V> {

  private final V value;
  private final Exception failure;

  /** Calls {@code c}, capturing anything it throws other than an {@link Error}. */
  public static <V> Attempt<V> of(Callable<V> c) {
    try {
      return success(c.call());
    } catch (Exception e) {
      return failure(e);
    }
  }

  public static <V> Attempt<V> success(V value) {
    return new Attempt<>(value, null);
  }

  public static <V> Attempt<V> failure(Exception failure) {
    return new Attempt<>(null, failure);
  }

  private Attempt(V value, Exception failure) {
    this.value = value;
    this.failure = failure;
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public V get() {
    if (failure != null) {
      throw new IllegalStateException("Attempt failed", failure);
    }
    return value;
  }

  public Optional<Exception> getFailure() {
    return Optional.ofNullable(failure);
  }

  public V getOrElse(V fallback) {
    return isSuccess() ? value : fallback;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success(" + value + ")" : "Failure(" + failure + ")";
  }

}
