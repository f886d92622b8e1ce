package io.github.cyfko.relayql.core.model;

/**
 * Requested cursor window, as received from the caller.
 * <p>
 * The forward direction is {@code first} with an optional {@code after} cursor, the backward direction
 * {@code last} with an optional {@code before} cursor. The record itself accepts any combination:
 * conflicting directions are rejected by the pagination engine, which reports the offending argument.
 * </p>
 *
 * @param first  forward count, or {@code null}
 * @param after  forward cursor, or {@code null}
 * @param last   backward count, or {@code null}
 * @param before backward cursor, or {@code null}
 */
public record CursorWindowRequest(Integer first, String after, Integer last, String before) {

    private static final CursorWindowRequest UNSPECIFIED = new CursorWindowRequest(null, null, null, null);

    public static CursorWindowRequest unspecified() {
        return UNSPECIFIED;
    }

    public static CursorWindowRequest forward(Integer first, String after) {
        return new CursorWindowRequest(first, after, null, null);
    }

    public static CursorWindowRequest backward(Integer last, String before) {
        return new CursorWindowRequest(null, null, last, before);
    }

    public boolean hasForward() {
        return first != null || after != null;
    }

    public boolean hasBackward() {
        return last != null || before != null;
    }
}
