package device;

import java.util.Optional;

/**
 * SELinux label of a service name, used for display only.
 */
public interface SecurityContextLookup {

    SecurityContextLookup NONE = name -> Optional.empty();

    Optional<String> lookup(String serviceName);
}
