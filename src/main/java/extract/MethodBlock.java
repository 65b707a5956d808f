package extract;

import java.util.Collections;
import java.util.List;

/**
 * Lines of a proxy method from its {@code .method} declaration through the prologue marker.
 */
public class MethodBlock {
    private final String methodName;
    private final List<String> lines;
    private final int startLine;

    public MethodBlock(String methodName, List<String> lines, int startLine) {
        this.methodName = methodName;
        this.lines = Collections.unmodifiableList(lines);
        this.startLine = startLine;
    }

    public String getMethodName() {
        return methodName;
    }

    public String getDeclaration() {
        return lines.get(0);
    }

    public List<String> getBody() {
        return lines.subList(1, lines.size());
    }

    public List<String> getLines() {
        return lines;
    }

    public int getStartLine() {
        return startLine;
    }
}
