package io.cronhook.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One scheduled HTTP call: a cron pattern plus the request to issue on every tick.
 *
 * <p>Triggers are never edited in place. A workspace replaces its whole trigger set at once.
 *
 * @param cron    5-field (minute precision) or 6-field (leading seconds) cron expression
 * @param url     absolute target URI
 * @param method  one of GET, POST, PUT, PATCH, DELETE
 * @param payload optional structured body, sent as JSON for methods that carry one
 * @param headers optional request headers; override the worker defaults
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Trigger(
        String cron,
        String url,
        String method,
        Object payload,
        Map<String, String> headers
) {

    public Trigger {
        headers = (headers == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static Trigger of(String cron, String url, String method) {
        return new Trigger(cron, url, method, null, null);
    }

    /**
     * Returns a copy with the method upper-cased and surrounding whitespace trimmed.
     */
    public Trigger normalized() {
        return new Trigger(
                cron == null ? null : cron.trim(),
                url == null ? null : url.trim(),
                method == null ? null : method.trim().toUpperCase(Locale.ROOT),
                payload,
                headers
        );
    }
}
