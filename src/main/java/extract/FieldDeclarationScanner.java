package extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import utils.Log;

/**
 * Collects the {@code static final int TRANSACTION_*} constants of a Stub class, e.g.
 * <pre>
 * .field static final TRANSACTION_startActivity:I = 0x3
 * </pre>
 * Declarations are returned in file order; duplicate numbers are kept.
 */
public class FieldDeclarationScanner {
    public static final String PREFIX = "TRANSACTION_";

    private static final Pattern FIELD = Pattern.compile(
            "^\\.field\\s+((?:[a-z-]+\\s+)+)" + PREFIX + "([\\w$]+):I\\s*=\\s*(\\S+)");

    public List<TransactionField> scan(List<String> lines) {
        List<TransactionField> fields = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (!line.startsWith(".field")) {
                continue;
            }
            Matcher m = FIELD.matcher(line);
            if (!m.find()) {
                continue;
            }
            List<String> modifiers = Arrays.asList(m.group(1).trim().split("\\s+"));
            if (!modifiers.contains("static") || !modifiers.contains("final")) {
                continue;
            }
            try {
                fields.add(new TransactionField(m.group(2), parseHex(m.group(3)), i + 1));
            } catch (NumberFormatException e) {
                Log.warn("Bad literal for " + PREFIX + m.group(2) + " at line " + (i + 1) + ": " + m.group(3));
            }
        }
        return fields;
    }

    /**
     * Parses a smali integer literal as base 16, with or without sign and {@code 0x} prefix.
     *
     * @throws NumberFormatException when the literal is malformed or does not fit a non-negative int
     */
    static int parseHex(String literal) {
        String s = literal;
        boolean negative = false;
        if (s.startsWith("-")) {
            negative = true;
            s = s.substring(1);
        }
        if (s.startsWith("0x") || s.startsWith("0X")) {
            s = s.substring(2);
        }
        long value = Long.parseLong(s, 16);
        if (negative || value > Integer.MAX_VALUE) {
            throw new NumberFormatException("Transaction code out of range: " + literal);
        }
        return (int) value;
    }
}
