package device;

import java.nio.file.Path;
import java.util.List;

/**
 * Finds the disassembled form of an interface class.
 */
public interface ArtifactResolver {

    /**
     * @param fqn fully-qualified interface name, e.g. {@code android.app.IActivityManager}
     * @return every matching file, empty when unresolved
     */
    List<Path> resolve(String fqn);
}
