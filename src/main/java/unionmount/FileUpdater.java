package unionmount;

import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Turns one file's action into an update of the model, for a single-source mount.
 *
 * {@code tag} is the tag of the pattern that selected {@code path}, and a refresh carries the
 * file's physical path.
 */
@FunctionalInterface
public interface FileUpdater<T, M> {

  UnaryOperator<M> update(T tag, String path, FileAction<Path> action) throws Exception;

}
