package com.p14n.pubsub.broker.local;

/**
 * Channel pattern with the glob syntax pub/sub brokers use for pattern
 * subscriptions.
 *
 * <ul>
 * <li>{@code *} any sequence, including the empty one</li>
 * <li>{@code ?} exactly one character</li>
 * <li>{@code [abc]}, {@code [a-z]}, {@code [^a]} character classes</li>
 * <li>{@code \} escapes the next character</li>
 * </ul>
 *
 * An unterminated class is closed by the end of the pattern.
 */
public final class GlobPattern {

    private final String pattern;

    private GlobPattern(String pattern) {
        this.pattern = pattern;
    }

    public static GlobPattern compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Pattern cannot be null or empty");
        }
        return new GlobPattern(pattern);
    }

    public String pattern() {
        return pattern;
    }

    public boolean matches(String channel) {
        return channel != null && match(0, channel, 0);
    }

    private boolean match(int pi, String s, int si) {
        final String p = pattern;
        while (pi < p.length()) {
            char c = p.charAt(pi);
            switch (c) {
                case '*': {
                    while (pi + 1 < p.length() && p.charAt(pi + 1) == '*') {
                        pi++;
                    }
                    if (pi + 1 == p.length()) {
                        return true;
                    }
                    for (int k = si; k <= s.length(); k++) {
                        if (match(pi + 1, s, k)) {
                            return true;
                        }
                    }
                    return false;
                }
                case '?': {
                    if (si >= s.length()) {
                        return false;
                    }
                    si++;
                    pi++;
                    break;
                }
                case '[': {
                    if (si >= s.length()) {
                        return false;
                    }
                    int end = matchClass(pi + 1, s.charAt(si));
                    if (end < 0) {
                        return false;
                    }
                    si++;
                    pi = end;
                    break;
                }
                default: {
                    if (c == '\\' && pi + 1 < p.length()) {
                        pi++;
                        c = p.charAt(pi);
                    }
                    if (si >= s.length() || s.charAt(si) != c) {
                        return false;
                    }
                    si++;
                    pi++;
                }
            }
        }
        return si == s.length();
    }

    /**
     * Matches one character against the class starting at {@code pi} (just past
     * the opening bracket).
     *
     * @return the pattern index after the class, or -1 if the character does not
     *         match
     */
    private int matchClass(int pi, char ch) {
        final String p = pattern;
        boolean negate = pi < p.length() && p.charAt(pi) == '^';
        if (negate) {
            pi++;
        }
        boolean matched = false;
        while (pi < p.length()) {
            char c = p.charAt(pi);
            if (c == '\\' && pi + 1 < p.length()) {
                pi++;
                if (p.charAt(pi) == ch) {
                    matched = true;
                }
            } else if (c == ']') {
                break;
            } else if (pi + 2 < p.length() && p.charAt(pi + 1) == '-') {
                char start = c;
                char end = p.charAt(pi + 2);
                if (start > end) {
                    char t = start;
                    start = end;
                    end = t;
                }
                if (ch >= start && ch <= end) {
                    matched = true;
                }
                pi += 2;
            } else if (c == ch) {
                matched = true;
            }
            pi++;
        }
        if (negate) {
            matched = !matched;
        }
        return matched ? Math.min(pi + 1, p.length()) : -1;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
