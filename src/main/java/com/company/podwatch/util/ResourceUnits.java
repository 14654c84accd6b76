package com.company.podwatch.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public class ResourceUnits {

    private static final long KB = 1024L;
    private static final long MB = KB * 1024;
    private static final long GB = MB * 1024;

    /**
     * e.g. 250 -> "0.25 Cores"
     */
    public static String formatCpu(Long millicores) {
        if (millicores == null) return null;
        return String.format(Locale.ROOT, "%.2f Cores", millicores / 1000.0);
    }

    /**
     * Binary units, two decimals: "512 B", "1.50 KB", "256.00 MB", "2.00 GB"
     */
    public static String formatMemory(Long bytes) {
        if (bytes == null) return null;

        if (bytes >= GB) {
            return String.format(Locale.ROOT, "%.2f GB", bytes / (double) GB);
        } else if (bytes >= MB) {
            return String.format(Locale.ROOT, "%.2f MB", bytes / (double) MB);
        } else if (bytes >= KB) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / (double) KB);
        }
        return bytes + " B";
    }

    public static String formatPercent(Double percent) {
        if (percent == null) return null;
        return String.format(Locale.ROOT, "%.0f%%", percent);
    }

    /**
     * Whole days between {@code since} and {@code now}, never negative
     */
    public static Long ageDays(Instant since, Instant now) {
        if (since == null || now == null) return null;
        long days = Duration.between(since, now).toDays();
        return Math.max(days, 0L);
    }
}
