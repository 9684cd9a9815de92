package warden.core.service.revocation;

import java.util.regex.Pattern;

/**
 * Redis-style glob matching for in-process tier keys.
 *
 * <p>Supports {@code *} (any run of characters) and {@code ?} (one character);
 * everything else, including {@code [}, {@code ]} and {@code \}, matches literally.
 */
final class GlobPattern {

    private final Pattern regex;

    private GlobPattern(Pattern regex) {
        this.regex = regex;
    }

    static GlobPattern compile(String glob) {
        if (glob == null || glob.isEmpty()) {
            throw new IllegalArgumentException("Pattern cannot be null or empty");
        }
        var sb = new StringBuilder(glob.length() + 8);
        var literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return new GlobPattern(Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    boolean matches(String key) {
        return regex.matcher(key).matches();
    }
}
