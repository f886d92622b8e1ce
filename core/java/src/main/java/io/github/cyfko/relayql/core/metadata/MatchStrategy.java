package io.github.cyfko.relayql.core.metadata;

/**
 * Matching strategies of {@link FilterKind#SEARCH} filters.
 * <p>
 * {@code I*} variants compare case-insensitively.
 * </p>
 */
public enum MatchStrategy {
    EXACT,
    IEXACT,
    PARTIAL,
    IPARTIAL,
    START,
    ISTART,
    END,
    IEND;

    /**
     * Escape character of the patterns built by {@link #pattern(String)}.
     */
    public static final char ESCAPE = '\\';

    public boolean isExact() {
        return this == EXACT || this == IEXACT;
    }

    public boolean isCaseInsensitive() {
        return this == IEXACT || this == IPARTIAL || this == ISTART || this == IEND;
    }

    /**
     * Builds the LIKE pattern for a non-exact strategy.
     * <p>
     * Wildcards in the searched text are escaped with {@link #ESCAPE}, so the text always matches
     * literally.
     * </p>
     *
     * @param value searched text
     * @return the pattern, or the value itself for exact strategies
     */
    public String pattern(String value) {
        return switch (this) {
            case EXACT, IEXACT -> value;
            case PARTIAL, IPARTIAL -> "%" + escape(value) + "%";
            case START, ISTART -> escape(value) + "%";
            case END, IEND -> "%" + escape(value);
        };
    }

    /**
     * Escapes {@code \}, {@code %} and {@code _} so that the text matches literally in a LIKE pattern.
     *
     * @param text raw text
     * @return the escaped text
     */
    public static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 4);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE || c == '%' || c == '_') {
                escaped.append(ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
