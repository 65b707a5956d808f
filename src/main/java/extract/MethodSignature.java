package extract;

import java.util.Collections;
import java.util.List;

/**
 * Raw parameter and return descriptors of one proxy method, plus the {@code .param} names when present.
 */
public class MethodSignature {
    private final String arguments;
    private final String returns;
    private final List<String> parameterNames;

    public MethodSignature(String arguments, String returns, List<String> parameterNames) {
        this.arguments = arguments;
        this.returns = returns;
        this.parameterNames = Collections.unmodifiableList(parameterNames);
    }

    public String getArguments() {
        return arguments;
    }

    public String getReturns() {
        return returns;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }
}
