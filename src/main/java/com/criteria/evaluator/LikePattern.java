package com.criteria.evaluator;

import java.util.regex.Pattern;

/**
 * SQL LIKE pattern translated to an anchored regular expression.
 * {@code %} matches any run of characters, {@code _} matches exactly one character and
 * everything else is literal.
 */
public final class LikePattern {

    private final String likePattern;
    private final Pattern regex;

    private LikePattern(String likePattern) {
        this.likePattern = likePattern;
        this.regex = Pattern.compile(toRegex(likePattern), Pattern.DOTALL);
    }

    public static LikePattern compile(String likePattern) {
        return new LikePattern(likePattern);
    }

    /**
     * Whole-string match, not a substring search.
     */
    public boolean matches(CharSequence value) {
        return regex.matcher(value).matches();
    }

    static String toRegex(String likePattern) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < likePattern.length(); i++) {
            char c = likePattern.charAt(i);
            if (c == '%' || c == '_') {
                flushLiteral(literal, regex);
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(literal, regex);
        return regex.toString();
    }

    private static void flushLiteral(StringBuilder literal, StringBuilder regex) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    @Override
    public String toString() {
        return likePattern;
    }
}
