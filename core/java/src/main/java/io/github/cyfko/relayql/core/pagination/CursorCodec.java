package io.github.cyfko.relayql.core.pagination;

import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.exception.PaginationException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;
import java.util.zip.CRC32;

/**
 * Encodes and decodes opaque cursors.
 * <p>
 * A cursor is the URL-safe base64 (without padding) of {@code <position>:<fingerprint>}, where the
 * position is the zero-based index of the item under the current ordering and the fingerprint
 * identifies the resource, filter and ordering the position is relative to. A cursor issued for a
 * different filter or ordering is stale.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CursorCodec {

    private static final char SEPARATOR = ':';

    private CursorCodec() {
        // Utility class
    }

    /**
     * Computes the fingerprint of a result set.
     *
     * @param resource resource name
     * @param filter   filter specification (order-independent canonical form is used)
     * @param ordering total ordering
     * @return lower-case hexadecimal CRC32
     */
    public static String fingerprint(String resource, FilterSpec filter, List<SortBy> ordering) {
        String source = resource + '|' + filter.canonical() + '|'
                + ordering.stream().map(SortBy::toString).collect(Collectors.joining(","));
        CRC32 crc = new CRC32();
        crc.update(source.getBytes(StandardCharsets.UTF_8));
        return Long.toHexString(crc.getValue());
    }

    public static String encode(long position, String fingerprint) {
        String raw = Long.toString(position) + SEPARATOR + fingerprint;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes a cursor issued for the given fingerprint.
     *
     * @param argument    argument the cursor was passed in ({@code after} or {@code before})
     * @param cursor      opaque cursor
     * @param fingerprint fingerprint of the current result set
     * @return the zero-based position
     * @throws PaginationException {@code INVALID} if the cursor cannot be decoded, {@code STALE} if it
     *                             was issued for another filter or ordering
     */
    public static int decode(String argument, String cursor, String fingerprint) {
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw invalid(argument, e);
        }

        int separator = raw.indexOf(SEPARATOR);
        if (separator <= 0) {
            throw invalid(argument, null);
        }
        int position;
        try {
            position = Integer.parseInt(raw.substring(0, separator));
        } catch (NumberFormatException e) {
            throw invalid(argument, e);
        }
        if (position < 0 || position == Integer.MAX_VALUE) {
            throw invalid(argument, null);
        }

        if (!fingerprint.equals(raw.substring(separator + 1))) {
            throw new PaginationException(PaginationException.Reason.STALE, argument,
                    "Cursor '" + argument + "' no longer matches the current filters or ordering; restart pagination.");
        }
        return position;
    }

    private static PaginationException invalid(String argument, Throwable cause) {
        String message = "Cursor '" + argument + "' is not a valid cursor.";
        return cause == null
                ? new PaginationException(PaginationException.Reason.INVALID, argument, message)
                : new PaginationException(PaginationException.Reason.INVALID, argument, message, cause);
    }
}
