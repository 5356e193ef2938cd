package com.manufacturing.semanticlayer.service;

import com.manufacturing.semanticlayer.exception.OperationCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class OperationDeadlineTest {

    @Test
    void testNoneNeverExpires() {
        OperationDeadline none = OperationDeadline.none();
        none.cancel();

        assertFalse(none.isExpired());
        assertDoesNotThrow(() -> none.checkpoint("anything"));
    }

    @Test
    void testExpiredDeadlineFailsCheckpoint() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        OperationDeadline deadline = OperationDeadline.after(Duration.ofSeconds(30), Clock.fixed(start, ZoneOffset.UTC));
        assertFalse(deadline.isExpired());

        OperationDeadline expired = OperationDeadline.after(Duration.ZERO, Clock.fixed(start, ZoneOffset.UTC));
        OperationCancelledException e = assertThrows(OperationCancelledException.class,
                () -> expired.checkpoint("edge batch 2"));
        assertTrue(e.getMessage().contains("edge batch 2"));
    }

    @Test
    void testCancelFailsCheckpoint() {
        OperationDeadline deadline = OperationDeadline.after(Duration.ofMinutes(1));
        deadline.cancel();

        assertTrue(deadline.isExpired());
        assertThrows(OperationCancelledException.class, () -> deadline.checkpoint("load"));
    }
}
