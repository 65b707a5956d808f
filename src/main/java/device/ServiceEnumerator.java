package device;

import java.util.List;

import catalog.ServiceEntry;

/**
 * Source of the device's registered services.
 */
public interface ServiceEnumerator {

    List<ServiceEntry> enumerate();
}
