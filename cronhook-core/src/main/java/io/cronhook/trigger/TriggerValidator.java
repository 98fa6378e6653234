package io.cronhook.trigger;

import io.cronhook.core.InvalidTriggerException;
import io.cronhook.core.Trigger;
import io.cronhook.utils.CronExpressions;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Stateless validation of a single {@link Trigger}.
 *
 * <p>Checks run in order and stop at the first failure: cron, url, method.
 */
public final class TriggerValidator {

    public static final List<String> SUPPORTED_METHODS = List.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private TriggerValidator() {
    }

    /**
     * @throws InvalidTriggerException naming the failing field
     */
    public static void validate(Trigger trigger) {
        if (trigger == null) {
            throw new InvalidTriggerException("trigger", "Trigger must be an object");
        }

        if (trigger.cron() == null || trigger.cron().isBlank()) {
            throw new InvalidTriggerException("cron", "Trigger must have a cron expression");
        }
        CronExpressions.validationError(trigger.cron()).ifPresent(reason -> {
            throw new InvalidTriggerException("cron", reason);
        });

        if (trigger.url() == null || trigger.url().isBlank()) {
            throw new InvalidTriggerException("url", "Trigger must have a URL");
        }
        if (!isAbsoluteUri(trigger.url().trim())) {
            throw new InvalidTriggerException("url", "Invalid URL: " + trigger.url());
        }

        if (trigger.method() == null || trigger.method().isBlank()) {
            throw new InvalidTriggerException("method", "Trigger must have an HTTP method");
        }
        if (!SUPPORTED_METHODS.contains(trigger.method().trim().toUpperCase(Locale.ROOT))) {
            throw new InvalidTriggerException("method", "Invalid HTTP method: " + trigger.method()
                    + ". Must be one of: " + String.join(", ", SUPPORTED_METHODS));
        }
    }

    private static boolean isAbsoluteUri(String url) {
        try {
            URI uri = new URI(url);
            return uri.isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
