package io.hookline.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNumberedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("hookline-test-");
        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertEquals("hookline-test-1", first.getName());
        assertEquals("hookline-test-2", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    void logsUncaughtExceptions() {
        Thread thread = new DaemonThreadFactory("hookline-test-").newThread(() -> {});

        assertNotSame(thread.getThreadGroup(), thread.getUncaughtExceptionHandler());
        assertDoesNotThrow(() -> thread.getUncaughtExceptionHandler()
            .uncaughtException(thread, new IllegalStateException("boom")));
    }

    @Test
    void rejectsNullPrefix() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
