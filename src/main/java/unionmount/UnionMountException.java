package unionmount;

/** A mount stopped because one of its tasks failed. */
public class UnionMountException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public UnionMountException(String message, Throwable cause) {
    super(message, cause);
  }

}
