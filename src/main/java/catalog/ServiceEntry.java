package catalog;

/**
 * A (name, project) pair as produced by service enumeration, before it gets a catalog id.
 */
public class ServiceEntry {
    private final String name;
    private final String project;

    public ServiceEntry(String name, String project) {
        this.name = name;
        this.project = project;
    }

    public String getName() {
        return name;
    }

    public String getProject() {
        return project;
    }

    @Override
    public String toString() {
        return name + ": [" + (project == null ? "" : project) + "]";
    }
}
