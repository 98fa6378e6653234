package io.cronhook.metrics;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Object key layout of persisted metrics. All partitions are in UTC.
 *
 * <pre>
 * metrics/workspace={id}/year=YYYY/month=MM/day=DD/hour=HH/metrics-{epochMillis}-{suffix}.json
 * metrics/year=YYYY/month=MM/day=DD/hour=HH/metrics-{epochMillis}.json   (legacy, all workspaces mixed)
 * </pre>
 */
public final class MetricsPaths {

    public static final String ROOT = "metrics/";

    private MetricsPaths() {
    }

    /**
     * Key of one flushed object. {@code suffix} tells apart objects flushed for the same workspace in the
     * same millisecond.
     */
    public static String objectKey(String workspaceId, Instant flushTime, String suffix) {
        return workspacePrefix(workspaceId, flushTime) + "metrics-" + flushTime.toEpochMilli() + "-" + suffix + ".json";
    }

    public static String workspacePrefix(String workspaceId, Instant hour) {
        return ROOT + "workspace=" + workspaceId + "/" + hourPath(hour);
    }

    public static String legacyPrefix(Instant hour) {
        return ROOT + hourPath(hour);
    }

    private static String hourPath(Instant instant) {
        ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
        return String.format("year=%04d/month=%02d/day=%02d/hour=%02d/",
                t.getYear(), t.getMonthValue(), t.getDayOfMonth(), t.getHour());
    }
}
