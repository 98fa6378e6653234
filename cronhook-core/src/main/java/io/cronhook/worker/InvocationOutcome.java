package io.cronhook.worker;

/**
 * Result of one outbound call. Any HTTP response, including 4xx and 5xx, counts as delivered;
 * only transport failures (connect, DNS, TLS, timeout) do not.
 */
public record InvocationOutcome(
        boolean delivered,
        Integer httpStatus,
        String error,
        long durationMs
) {

    public static InvocationOutcome responded(int httpStatus, long durationMs) {
        return new InvocationOutcome(true, httpStatus, null, durationMs);
    }

    public static InvocationOutcome failed(String error, long durationMs) {
        return new InvocationOutcome(false, null, error, durationMs);
    }
}
