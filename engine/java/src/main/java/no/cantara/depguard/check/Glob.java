package no.cantara.depguard.check;

import java.util.regex.Pattern;

/**
 * A compiled, case-sensitive glob pattern.
 *
 * <p>Supported syntax: {@code *} and {@code **} (any run of characters, separators
 * included), {@code ?} (one character), {@code [abc]}, {@code [a-z]} and {@code [!abc]}
 * classes, {@code {a,b}} alternation (not nested) and {@code \} escapes.
 */
public final class Glob {

    private final String pattern;
    private final Pattern regex;

    private Glob(String pattern, Pattern regex) {
        this.pattern = pattern;
        this.regex = regex;
    }

    public static Glob compile(String pattern) {
        if (pattern == null) {
            throw new GlobSyntaxException("null", "pattern is null");
        }
        return new Glob(pattern, Pattern.compile(toRegex(pattern), Pattern.DOTALL));
    }

    public boolean matches(String value) {
        return value != null && regex.matcher(value).matches();
    }

    public String pattern() {
        return pattern;
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        boolean inAlternation = false;
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> {
                    while (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                        i++;
                    }
                    sb.append(".*");
                }
                case '?' -> sb.append('.');
                case '[' -> i = appendClass(glob, i, sb);
                case '{' -> {
                    if (inAlternation) {
                        throw new GlobSyntaxException(glob, "nested alternation");
                    }
                    inAlternation = true;
                    sb.append("(?:");
                }
                case '}' -> {
                    if (!inAlternation) {
                        throw new GlobSyntaxException(glob, "unopened alternation");
                    }
                    inAlternation = false;
                    sb.append(')');
                }
                case ',' -> sb.append(inAlternation ? "|" : ",");
                case '\\' -> {
                    if (i + 1 >= glob.length()) {
                        throw new GlobSyntaxException(glob, "dangling escape");
                    }
                    i++;
                    sb.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                }
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        if (inAlternation) {
            throw new GlobSyntaxException(glob, "unclosed alternation");
        }
        return sb.toString();
    }

    /** Appends the class starting at {@code start} and returns the index of its closing bracket. */
    private static int appendClass(String glob, int start, StringBuilder sb) {
        int i = start + 1;
        StringBuilder cls = new StringBuilder("[");
        if (i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^')) {
            cls.append('^');
            i++;
        }
        boolean empty = true;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == ']' && !empty) {
                sb.append(cls).append(']');
                return i;
            }
            if (c == '-' && !empty && i + 1 < glob.length() && glob.charAt(i + 1) != ']') {
                cls.append('-');
            } else if (c == '\\' || c == '[' || c == ']' || c == '^' || c == '&' || c == '-') {
                cls.append('\\').append(c);
            } else {
                cls.append(c);
            }
            empty = false;
            i++;
        }
        throw new GlobSyntaxException(glob, "unclosed character class");
    }

    @Override
    public String toString() {
        return pattern;
    }
}
