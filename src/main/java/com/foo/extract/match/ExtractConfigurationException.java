package com.foo.extract.match;

import lombok.Getter;

/**
 * A match, comparator or target was built from an invalid combination of settings.
 *
 * <p>Raised at construction time only. "Nothing found" is never reported with this exception;
 * resolution misses are empty {@code Optional}s.
 */
@Getter
public class ExtractConfigurationException extends RuntimeException {

    private final String matchName;

    public ExtractConfigurationException(String message) {
        this(null, message);
    }

    public ExtractConfigurationException(String matchName, String message) {
        super(buildMessage(matchName, message));
        this.matchName = matchName;
    }

    public ExtractConfigurationException(String matchName, String message, Throwable cause) {
        super(buildMessage(matchName, message), cause);
        this.matchName = matchName;
    }

    private static String buildMessage(String matchName, String message) {
        if (matchName == null || matchName.isBlank()) {
            return message;
        }
        return "%s: %s".formatted(matchName, message);
    }
}
