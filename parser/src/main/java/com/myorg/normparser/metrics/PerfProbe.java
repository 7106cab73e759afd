package com.myorg.normparser.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Step timer for one conversion. Writes to the "performance" logger.
 */
public class PerfProbe {
    private static final Logger PERF = LoggerFactory.getLogger("performance");

    private final long t0 = System.nanoTime();
    private long last = t0;
    private final String label;

    public PerfProbe(String label) { this.label = label; }

    public void mark(String stepName, long rows) {
        long now = System.nanoTime();
        double ms = (now - last) / 1_000_000.0;
        last = now;

        double rate = ms > 0 ? rows / (ms / 1000.0) : 0.0;
        PERF.info("{} - {} in {} ms, rows={} ({} rows/s), heap={} MB",
                label,
                stepName,
                String.format("%.2f", ms),
                rows,
                String.format("%.0f", rate),
                String.format("%.2f", usedHeapMb()));
    }

    public void done(String stepName) {
        double totalMs = (System.nanoTime() - t0) / 1_000_000.0;
        PERF.info("{} - {} total {} ms", label, stepName, String.format("%.2f", totalMs));
    }

    private static double usedHeapMb() {
        Runtime rt = Runtime.getRuntime();
        return (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);
    }
}
