package com.designtool.lowering.normalize;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive name pattern where {@code *} matches any run of characters.
 * The whole name must match.
 */
public final class WildcardPattern {

    private final String source;
    private final Pattern regex;

    private WildcardPattern(String source, Pattern regex) {
        this.source = source;
        this.regex = regex;
    }

    public static WildcardPattern compile(String pattern) {
        String lower = pattern.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder("^");
        int start = 0;
        int star;
        while ((star = lower.indexOf('*', start)) >= 0) {
            if (star > start) {
                sb.append(Pattern.quote(lower.substring(start, star)));
            }
            sb.append(".*");
            start = star + 1;
        }
        if (start < lower.length()) {
            sb.append(Pattern.quote(lower.substring(start)));
        }
        sb.append('$');
        return new WildcardPattern(pattern, Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    public boolean matches(String name) {
        if (name == null) {
            return false;
        }
        return regex.matcher(name.toLowerCase(Locale.ROOT)).matches();
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
