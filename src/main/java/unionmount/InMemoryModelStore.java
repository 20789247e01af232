package unionmount;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ModelStore} that just keeps the value in memory and tells listeners about each
 * new value, in order.
 */
public class InMemoryModelStore<M> implements ModelStore<M> {

  private static final Logger log = LoggerFactory.getLogger(InMemoryModelStore.class);
  private final List<Consumer<M>> listeners = new CopyOnWriteArrayList<>();
  private M value;
  private boolean isSet;

  public void addListener(Consumer<M> listener) {
    listeners.add(listener);
  }

  @Override
  public synchronized void set(M value) {
    this.value = value;
    isSet = true;
    notifyListeners();
  }

  @Override
  public synchronized void modify(UnaryOperator<M> f) {
    if (!isSet) {
      throw new IllegalStateException("modify called before set");
    }
    value = f.apply(value);
    notifyListeners();
  }

  @Override
  public synchronized M read() {
    if (!isSet) {
      throw new IllegalStateException("read called before set");
    }
    return value;
  }

  public synchronized boolean isSet() {
    return isSet;
  }

  private void notifyListeners() {
    for (Consumer<M> l : listeners) {
      try {
        l.accept(value);
      } catch (RuntimeException e) {
        log.error("Model listener failed", e);
      }
    }
  }

}
