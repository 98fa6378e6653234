package io.cronhook.metrics;

/**
 * Success / failure counts for one UTC hour, labelled {@code YYYY-MM-DDTHH:00:00}.
 */
public record HourlyBucket(String hour, int success, int failed) {
}
