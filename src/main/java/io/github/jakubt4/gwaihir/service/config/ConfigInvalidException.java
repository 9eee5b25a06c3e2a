package io.github.jakubt4.gwaihir.service.config;

/**
 * Mission or vehicle configuration is missing, malformed or inconsistent. No mission starts.
 */
public class ConfigInvalidException extends RuntimeException {

    public ConfigInvalidException(final String message) {
        super(message);
    }

    public ConfigInvalidException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
