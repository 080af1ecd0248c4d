package org.gerken.pupu.logic;

import java.util.Locale;

/**
 * Periodically reports progress during the solving process.
 * Runs as a background thread and outputs statistics at configurable intervals.
 */
public class ProgressReporter implements Runnable {

    private final PendingStates pendingStates;
    private final long reportIntervalMs;
    private final long startTime;

    /**
     * Creates a new progress reporter.
     *
     * @param pendingStates the container the search is working on
     * @param reportIntervalSeconds seconds between two reports
     */
    public ProgressReporter(PendingStates pendingStates, int reportIntervalSeconds) {
        this.pendingStates = pendingStates;
        this.reportIntervalMs = reportIntervalSeconds * 1000L;
        this.startTime = System.currentTimeMillis();
    }

    @Override
    public void run() {
        try {
            while (!pendingStates.isFinished()) {
                Thread.sleep(reportIntervalMs);

                // Don't report if the search ended during sleep
                if (pendingStates.isFinished()) {
                    break;
                }

                printProgress();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Prints the current progress statistics.
     */
    private void printProgress() {
        long examined = pendingStates.getBoardsExamined();
        long generated = pendingStates.getStatesGenerated();
        long pruned = pendingStates.getStatesPruned();
        int queueSize = pendingStates.size();
        int visited = pendingStates.getVisitedCount();
        double elapsedSeconds = (System.currentTimeMillis() - startTime) / 1000.0;

        double boardsPerSecond = elapsedSeconds > 0 ? examined / elapsedSeconds : 0.0;
        double pruneRate = generated > 0 ? (100.0 * pruned / generated) : 0.0;

        System.out.printf(
            "[%s] Examined: %s | Queue: %s | Visited: %s | Pruned: %.1f%% | Rate: %s/s%n",
            formatDuration(elapsedSeconds),
            formatCount(examined),
            formatCount(queueSize),
            formatCount(visited),
            pruneRate,
            formatCount((long) boardsPerSecond)
        );
    }

    /**
     * Formats a count with compact suffixes (T, B, M, K) with exactly one decimal place.
     * Examples: 123456789 → "123.5M", 5432 → "5.4K", 123 → "123"
     *
     * @param count the count to format
     * @return formatted string with suffix
     */
    static String formatCount(long count) {
        if (count >= 1_000_000_000_000L) {
            return String.format(Locale.ROOT, "%.1fT", count / 1_000_000_000_000.0);
        } else if (count >= 1_000_000_000L) {
            return String.format(Locale.ROOT, "%.1fB", count / 1_000_000_000.0);
        } else if (count >= 1_000_000L) {
            return String.format(Locale.ROOT, "%.1fM", count / 1_000_000.0);
        } else if (count >= 1_000L) {
            return String.format(Locale.ROOT, "%.1fK", count / 1_000.0);
        } else {
            return String.valueOf(count);
        }
    }

    /**
     * Formats a duration in seconds to a fixed-width string.
     *
     * @param seconds the duration in seconds
     * @return formatted string (e.g., "001:23:45")
     */
    static String formatDuration(double seconds) {
        int totalSeconds = (int) seconds;
        int hours = totalSeconds / 3600;
        int minutes = (totalSeconds % 3600) / 60;
        int secs = totalSeconds % 60;
        return String.format("%03d:%02d:%02d", hours, minutes, secs);
    }

    /**
     * Prints a final summary when solving is complete.
     *
     * @param result the result of the search
     */
    public void printFinalSummary(SearchResult result) {
        double elapsedSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
        double boardsPerSecond = elapsedSeconds > 0 ? result.getBoardsExamined() / elapsedSeconds : 0.0;
        long generated = result.getStatesGenerated();
        double pruneRate = generated > 0 ? (100.0 * result.getStatesPruned() / generated) : 0.0;

        System.out.println("\n" + "=".repeat(80));
        System.out.println(result.isSolved() ? "SOLUTION FOUND!" : "Search complete");
        System.out.println("=".repeat(80));
        System.out.printf("Total time:        %s%n", formatDuration(elapsedSeconds));
        System.out.printf("Boards examined:   %s%n", formatCount(result.getBoardsExamined()));
        System.out.printf("States generated:  %s%n", formatCount(generated));
        System.out.printf("Duplicates:        %s%n", formatCount(result.getStatesDuplicated()));
        System.out.printf("States pruned:     %s (%.1f%%)%n", formatCount(result.getStatesPruned()), pruneRate);
        System.out.printf("Distinct boards:   %s%n", formatCount(result.getVisitedCount()));
        System.out.printf("Processing rate:   %s/second%n", formatCount((long) boardsPerSecond));
        System.out.println("=".repeat(80));
    }
}
