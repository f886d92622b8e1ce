package io.github.cyfko.relayql.core.pagination;

import io.github.cyfko.relayql.core.api.Comparison;
import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.Op;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.exception.PaginationException;
import io.github.cyfko.relayql.core.metadata.PropertyPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CursorCodec Tests")
class CursorCodecTest {

    private static final List<SortBy> ORDERING = List.of(SortBy.asc("title"), SortBy.asc("id"));

    @Test
    @DisplayName("Encoded cursors are URL-safe and decode to their position")
    void shouldDecodeOwnCursor() {
        String fingerprint = CursorCodec.fingerprint("Book", FilterSpec.empty(), ORDERING);

        String cursor = CursorCodec.encode(41, fingerprint);

        assertTrue(cursor.matches("[A-Za-z0-9_-]+"), "cursor should be URL-safe base64 without padding: " + cursor);
        assertEquals(41, CursorCodec.decode("after", cursor, fingerprint));
    }

    @Test
    @DisplayName("Fingerprint ignores the order of criteria but not the ordering")
    void shouldFingerprintCanonically() {
        Comparison a = Comparison.of(PropertyPath.parse("title"), Op.EQ, "x");
        Comparison b = Comparison.of(PropertyPath.parse("isbn"), Op.EQ, "y");

        assertEquals(CursorCodec.fingerprint("Book", FilterSpec.of(a, b), ORDERING),
                CursorCodec.fingerprint("Book", FilterSpec.of(b, a), ORDERING));
        assertNotEquals(CursorCodec.fingerprint("Book", FilterSpec.of(a), ORDERING),
                CursorCodec.fingerprint("Book", FilterSpec.of(a), List.of(SortBy.desc("title"), SortBy.asc("id"))));
    }

    @Test
    @DisplayName("Undecodable cursors are INVALID")
    void shouldRejectGarbage() {
        String fingerprint = CursorCodec.fingerprint("Book", FilterSpec.empty(), ORDERING);
        String notNumeric = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(("abc:" + fingerprint).getBytes(StandardCharsets.UTF_8));

        PaginationException garbage = assertThrows(PaginationException.class,
                () -> CursorCodec.decode("after", "***", fingerprint));
        PaginationException position = assertThrows(PaginationException.class,
                () -> CursorCodec.decode("before", notNumeric, fingerprint));

        assertEquals(PaginationException.Reason.INVALID, garbage.getReason());
        assertEquals("after", garbage.getArgument());
        assertEquals(PaginationException.Reason.INVALID, position.getReason());
        assertEquals("before", position.getArgument());
    }

    @Test
    @DisplayName("Cursors issued for another filter are STALE")
    void shouldRejectStaleCursor() {
        String issuedFor = CursorCodec.fingerprint("Book", FilterSpec.empty(), ORDERING);
        String current = CursorCodec.fingerprint("Book",
                FilterSpec.of(Comparison.of(PropertyPath.parse("title"), Op.EQ, "x")), ORDERING);

        PaginationException e = assertThrows(PaginationException.class,
                () -> CursorCodec.decode("after", CursorCodec.encode(3, issuedFor), current));

        assertEquals(PaginationException.Reason.STALE, e.getReason());
    }
}
