package org.gerken.pupu.logic;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Locale;

import org.junit.jupiter.api.*;

class ProgressReporterTest {

    @Test
    void countsUseCompactSuffixes() {
        assertEquals("123", ProgressReporter.formatCount(123));
        assertEquals("5.4K", ProgressReporter.formatCount(5_432));
        assertEquals("123.5M", ProgressReporter.formatCount(123_456_789));
        assertEquals("2.0B", ProgressReporter.formatCount(2_000_000_000L));
        assertEquals("1.5T", ProgressReporter.formatCount(1_500_000_000_000L));
    }

    @Test
    void countsIgnoreTheDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            assertEquals("5.4K", ProgressReporter.formatCount(5_432));
            assertEquals("123.5M", ProgressReporter.formatCount(123_456_789));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void durationsAreFixedWidth() {
        assertEquals("000:00:00", ProgressReporter.formatDuration(0.4));
        assertEquals("001:23:45", ProgressReporter.formatDuration(5025));
    }

    @Test
    void reporterStopsOnceTheSearchIsFinished() throws InterruptedException {
        PendingStates pendingStates = new PendingStates();
        pendingStates.setFinished();
        Thread thread = new Thread(new ProgressReporter(pendingStates, 1));
        thread.start();
        thread.join(5000);
        assertFalse(thread.isAlive());
    }
}
