package com.foo.extract.service;

import com.foo.extract.match.CellValue;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code $name} and {@code ${name}} with variable values. Names are matched
 * case-insensitively, unknown variables are left as written and {@code $$} yields a single
 * dollar sign.
 */
public final class VariableInterpolator {

    private static final Pattern VARIABLE = Pattern.compile(
            "\\$(?:(\\$)|\\{([A-Za-z_][A-Za-z0-9_]*)}|([A-Za-z_][A-Za-z0-9_]*))");

    private VariableInterpolator() {}

    /**
     * @param variables values keyed by lower-case name
     */
    public static String interpolate(String text, Map<String, CellValue> variables) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }

        Matcher m = VARIABLE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String replacement;
            if (m.group(1) != null) {
                replacement = "$";
            } else {
                String name = m.group(2) != null ? m.group(2) : m.group(3);
                CellValue value = variables.get(name.toLowerCase(Locale.ROOT));
                replacement = value == null ? m.group() : value.toDisplayString();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
