package unionmount;

import java.util.function.UnaryOperator;

/**
 * A reactive container for the model a mount drives, e.g. one that re-renders a site
 * whenever it changes.
 *
 * Implementations must make readers observe a linear sequence of completed
 * {@link #set(Object)}/{@link #modify(UnaryOperator)} calls.
 */
public interface ModelStore<M> {

  /** Sets the initial value; a value already present is overwritten. */
  void set(M value);

  void modify(UnaryOperator<M> f);

  M read();

}
