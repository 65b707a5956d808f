package catalog;

import java.util.Objects;

/**
 * A registered system service. {@code project} is the fully-qualified interface name backing it,
 * null when enumeration could not resolve one (native services).
 */
public class Service {
    private final long id;
    private final String name;
    private final String project;

    public Service(long id, String name, String project) {
        this.id = id;
        this.name = name;
        this.project = project;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getProject() {
        return project;
    }

    public boolean hasProject() {
        return project != null && !project.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Service)) return false;
        Service other = (Service) o;
        return id == other.id && name.equals(other.name) && Objects.equals(project, other.project);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, project);
    }

    @Override
    public String toString() {
        return name + " [" + (project == null ? "-" : project) + "]";
    }
}
