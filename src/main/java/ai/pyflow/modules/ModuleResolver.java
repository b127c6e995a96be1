package ai.pyflow.modules;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps an imported module name to the file that defines it.
 * Not found is a normal outcome, never an error.
 */
public interface ModuleResolver {

    Optional<Path> resolve(String moduleName);
}
