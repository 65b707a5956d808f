package extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code .param p1, "intent"    # Landroid/content/Intent;} lines in declaration order.
 * Stops at {@code .end method} so names of a following method are not picked up.
 */
public class ParameterAnnotationScanner {
    private static final Pattern PARAM = Pattern.compile("^\\.param\\s+[pv]\\d+\\s*,\\s*\"([^\"]*)\"");

    public List<String> scan(List<String> lines) {
        List<String> names = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.startsWith(".end method")) {
                break;
            }
            Matcher m = PARAM.matcher(line);
            if (m.find()) {
                names.add(m.group(1));
            }
        }
        return names;
    }
}
