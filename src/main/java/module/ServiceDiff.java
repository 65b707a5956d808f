package module;

import java.util.Collections;
import java.util.List;

import catalog.Service;

/**
 * Changes of one project service against the baseline. A new service lists every transaction as NEW.
 */
public class ServiceDiff {
    private final Service service;
    private final boolean newService;
    private final List<TransactionChange> changes;

    public ServiceDiff(Service service, boolean newService, List<TransactionChange> changes) {
        this.service = service;
        this.newService = newService;
        this.changes = Collections.unmodifiableList(changes);
    }

    public Service getService() {
        return service;
    }

    public String getServiceName() {
        return service.getName();
    }

    public boolean isNewService() {
        return newService;
    }

    public List<TransactionChange> getChanges() {
        return changes;
    }

    public boolean hasChanges() {
        return newService || !changes.isEmpty();
    }
}
