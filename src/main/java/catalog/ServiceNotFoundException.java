package catalog;

/**
 * A service name requested for dump or diff is not tracked by the catalog.
 */
public class ServiceNotFoundException extends CatalogException {
    private final String serviceName;

    public ServiceNotFoundException(String serviceName, String catalog) {
        super("Service " + serviceName + " not found in " + catalog);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
