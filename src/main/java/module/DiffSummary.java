package module;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of diffing every project service. Services that failed are listed by name.
 */
public class DiffSummary {
    private final List<ServiceDiff> diffs = new ArrayList<>();
    private final List<String> failures = new ArrayList<>();

    void add(ServiceDiff diff) {
        diffs.add(diff);
    }

    void fail(String serviceName) {
        failures.add(serviceName);
    }

    public List<ServiceDiff> getDiffs() {
        return Collections.unmodifiableList(diffs);
    }

    public List<String> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean failed() {
        return !failures.isEmpty();
    }
}
