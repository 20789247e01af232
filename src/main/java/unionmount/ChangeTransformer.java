package unionmount;

import java.util.function.UnaryOperator;

/** Turns a batch into an update of the model. */
@FunctionalInterface
public interface ChangeTransformer<S, T, M> {

  UnaryOperator<M> handle(Change<S, T> change) throws Exception;

}
