package io.cronhook.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates over a list of execution records.
 */
public record MetricsStats(
        int total,
        int success,
        int failed,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("avg_duration") long avgDuration,
        @JsonProperty("chart_data") List<HourlyBucket> chartData
) {

    static final int MAX_CHART_BUCKETS = 168;

    private static final DateTimeFormatter HOUR_LABEL =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH':00:00'").withZone(ZoneOffset.UTC);

    public static MetricsStats empty() {
        return new MetricsStats(0, 0, 0, 0, 0, List.of());
    }

    public static MetricsStats of(List<ExecutionRecord> records) {
        if (records.isEmpty()) {
            return empty();
        }

        int success = 0;
        int failed = 0;
        long durationSum = 0;
        Map<String, int[]> hourly = new TreeMap<>();

        for (ExecutionRecord r : records) {
            boolean ok = r.succeeded();
            if (ok) {
                success++;
            } else if (r.status() == ExecutionStatus.FAILED) {
                failed++;
            }
            durationSum += r.durationMs();

            if (r.timestamp() != null && r.status() != null) {
                int[] counts = hourly.computeIfAbsent(HOUR_LABEL.format(r.timestamp()), h -> new int[2]);
                counts[ok ? 0 : 1]++;
            }
        }

        int total = records.size();
        double successRate = Math.round(((double) success / total) * 100 * 100) / 100.0;
        long avgDuration = Math.round((double) durationSum / total);

        List<HourlyBucket> chart = new ArrayList<>(hourly.size());
        hourly.forEach((hour, counts) -> chart.add(new HourlyBucket(hour, counts[0], counts[1])));
        if (chart.size() > MAX_CHART_BUCKETS) {
            chart.subList(0, chart.size() - MAX_CHART_BUCKETS).clear();
        }

        return new MetricsStats(total, success, failed, successRate, avgDuration, List.copyOf(chart));
    }
}
