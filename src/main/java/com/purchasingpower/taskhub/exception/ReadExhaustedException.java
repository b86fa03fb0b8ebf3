package com.purchasingpower.taskhub.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every read candidate failed. Each per-source failure is attached as a suppressed exception.
 */
@Getter
public class ReadExhaustedException extends StorageRoutingException {

    /**
     * Failure message per source id, in attempt order.
     */
    private final Map<String, String> failures;

    public ReadExhaustedException(String key, Map<String, Throwable> failuresBySource) {
        super("Read of '" + key + "' failed on all sources: " + summarize(failuresBySource));
        Map<String, String> messages = new LinkedHashMap<>();
        failuresBySource.forEach((sourceId, error) -> messages.put(sourceId, String.valueOf(error.getMessage())));
        this.failures = Collections.unmodifiableMap(messages);
        failuresBySource.values().forEach(this::addSuppressed);
    }

    public List<String> getFailedSources() {
        return List.copyOf(failures.keySet());
    }

    private static String summarize(Map<String, Throwable> failures) {
        return failures.entrySet().stream()
            .map(e -> e.getKey() + " (" + e.getValue().getMessage() + ")")
            .collect(Collectors.joining(", "));
    }
}
