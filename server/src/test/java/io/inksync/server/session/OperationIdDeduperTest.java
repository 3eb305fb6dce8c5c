package io.inksync.server.session;

import io.inksync.server.TestClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OperationIdDeduperTest {

    private final TestClock clock = new TestClock(1_000);

    @Test
    void remembered_id_is_duplicate_until_ttl_passes() {
        var deduper = new OperationIdDeduper(Duration.ofSeconds(10), clock);

        assertFalse(deduper.isDuplicate("op1"));
        deduper.remember("op1");
        assertTrue(deduper.isDuplicate("op1"));

        clock.advance(10_000);
        assertTrue(deduper.isDuplicate("op1"), "still inside the TTL at the boundary");

        clock.advance(1);
        assertFalse(deduper.isDuplicate("op1"));
    }

    @Test
    void remembering_again_restarts_the_ttl() {
        var deduper = new OperationIdDeduper(Duration.ofSeconds(10), clock);
        deduper.remember("op1");

        clock.advance(8_000);
        deduper.remember("op1");
        clock.advance(8_000);

        assertTrue(deduper.isDuplicate("op1"));
    }

    @Test
    void expired_entries_are_cleaned_up_on_remember() {
        var deduper = new OperationIdDeduper(Duration.ofSeconds(1), clock);
        for (int i = 0; i < 20; i++) {
            deduper.remember("old-" + i);
        }
        assertEquals(20, deduper.size());

        clock.advance(5_000);
        deduper.remember("fresh");

        assertEquals(1, deduper.size());
    }

    @Test
    void ttl_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new OperationIdDeduper(Duration.ZERO, clock));
        var deduper = new OperationIdDeduper(Duration.ofSeconds(1), clock);
        assertThrows(IllegalArgumentException.class, () -> deduper.setTtl(Duration.ofSeconds(-1)));
    }
}
