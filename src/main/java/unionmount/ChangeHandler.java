package unionmount;

/** Receives each batch of a mount, exactly once, in order. */
@FunctionalInterface
public interface ChangeHandler<S, T> {

  /** An exception thrown here stops the mount; see {@link ModelMount} for a tolerant handler. */
  void onChange(Change<S, T> change) throws Exception;

}
