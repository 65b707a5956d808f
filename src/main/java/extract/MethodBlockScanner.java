package extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates a public proxy method and returns its lines up to and including the prologue marker.
 * The marker is searched past {@code .end method}, so a method without one borrows the next
 * method's prologue; only a file with no marker after the declaration yields no block.
 */
public class MethodBlockScanner {
    private static final Pattern DECLARATION = Pattern.compile("^\\.method\\s+((?:[a-z-]+\\s+)*)([\\w$<>]+)\\((.*)$");

    private final String prologueMarker;

    public MethodBlockScanner(String prologueMarker) {
        this.prologueMarker = prologueMarker;
    }

    /**
     * @return the block, or null when no public {@code methodName} declaration is followed by the marker
     */
    public MethodBlock find(List<String> lines, String methodName) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (!line.startsWith(".method")) {
                continue;
            }
            Matcher m = DECLARATION.matcher(line);
            if (!m.matches() || !m.group(2).equals(methodName)) {
                continue;
            }
            List<String> modifiers = Arrays.asList(m.group(1).trim().split("\\s+"));
            if (!modifiers.contains("public")) {
                continue;
            }
            for (int j = i + 1; j < lines.size(); j++) {
                if (lines.get(j).trim().equals(prologueMarker)) {
                    List<String> block = new ArrayList<>();
                    block.add(line);
                    for (int k = i + 1; k <= j; k++) {
                        block.add(lines.get(k).trim());
                    }
                    return new MethodBlock(methodName, block, i + 1);
                }
            }
            return null;
        }
        return null;
    }

    /**
     * Splits the declaration into raw parameter and return descriptors, e.g.
     * {@code .method public foo(Landroid/content/Intent;I)I} gives {@code Landroid/content/Intent;I} and {@code I}.
     *
     * @throws IllegalArgumentException when the declaration carries no parameter list
     */
    public static MethodSignature parseSignature(MethodBlock block, ParameterAnnotationScanner params) {
        String declaration = block.getDeclaration();
        int nameAt = declaration.indexOf(block.getMethodName() + "(");
        if (nameAt < 0) {
            throw new IllegalArgumentException("No parameter list in: " + declaration);
        }
        String raw = declaration.substring(nameAt + block.getMethodName().length());
        int close = raw.indexOf(')');
        if (close < 0) {
            throw new IllegalArgumentException("Unterminated parameter list in: " + declaration);
        }
        String arguments = raw.substring(0, close);
        if (arguments.startsWith("(")) {
            arguments = arguments.substring(1);
        }
        String returns = raw.substring(close + 1).trim();

        List<String> names = arguments.isEmpty() ? new ArrayList<>() : params.scan(block.getBody());
        return new MethodSignature(arguments, returns, names);
    }
}
