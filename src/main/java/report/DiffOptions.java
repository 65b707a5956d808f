package report;

import java.nio.file.Path;

/**
 * Output switches shared by diff and list.
 */
public class DiffOptions {
    private boolean showContext;
    private boolean brief;
    private Path baselinePath;

    public static DiffOptions defaults() {
        return new DiffOptions();
    }

    /**
     * Append each service's security context label.
     */
    public DiffOptions showContext(boolean showContext) {
        this.showContext = showContext;
        return this;
    }

    /**
     * Names and novelty tags only.
     */
    public DiffOptions brief(boolean brief) {
        this.brief = brief;
        return this;
    }

    /**
     * Baseline catalog to compare with; null selects the configured default location.
     */
    public DiffOptions baselinePath(Path baselinePath) {
        this.baselinePath = baselinePath;
        return this;
    }

    public boolean isShowContext() {
        return showContext;
    }

    public boolean isBrief() {
        return brief;
    }

    public Path getBaselinePath() {
        return baselinePath;
    }
}
