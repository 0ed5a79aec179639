package com.largomodo.romcatalog.catalog.merge;

import java.util.regex.Pattern;

/**
 * Shell-style glob: {@code *} matches any run of characters, {@code ?} exactly one, everything
 * else matches itself. The whole input must match.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                flushLiteral(sb, literal);
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(sb, literal);
        return new GlobPattern(glob, Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    private static void flushLiteral(StringBuilder sb, StringBuilder literal) {
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    public boolean matches(String text) {
        return text != null && regex.matcher(text).matches();
    }

    @Override
    public String toString() {
        return glob;
    }
}
