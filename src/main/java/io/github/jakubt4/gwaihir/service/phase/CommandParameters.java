package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.service.config.ConfigInvalidException;

import java.util.Map;

/**
 * Typed access to the loosely typed parameter map of a command.
 */
final class CommandParameters {

    private final Map<String, Object> values;

    CommandParameters(final Map<String, Object> values) {
        this.values = values;
    }

    double requireDouble(final String key) {
        final var value = values.get(key);
        if (value == null) {
            throw new ConfigInvalidException("Missing command parameter '" + key + "'");
        }
        return asDouble(key, value);
    }

    double optionalDouble(final String key, final double defaultValue) {
        final var value = values.get(key);
        return value == null ? defaultValue : asDouble(key, value);
    }

    double requirePositive(final String key) {
        final var value = requireDouble(key);
        return positive(key, value);
    }

    double optionalPositive(final String key, final double defaultValue) {
        return positive(key, optionalDouble(key, defaultValue));
    }

    double requireNonNegative(final String key) {
        return nonNegative(key, requireDouble(key));
    }

    double optionalNonNegative(final String key, final double defaultValue) {
        return nonNegative(key, optionalDouble(key, defaultValue));
    }

    boolean requireBoolean(final String key) {
        final var value = values.get(key);
        if (value == null) {
            throw new ConfigInvalidException("Missing command parameter '" + key + "'");
        }
        return asBoolean(key, value);
    }

    boolean optionalBoolean(final String key, final boolean defaultValue) {
        final var value = values.get(key);
        return value == null ? defaultValue : asBoolean(key, value);
    }

    String requireString(final String key) {
        final var value = values.get(key);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ConfigInvalidException("Command parameter '" + key + "' must be a non-empty string");
        }
        return text;
    }

    private static double positive(final String key, final double value) {
        if (value <= 0.0) {
            throw new ConfigInvalidException("Command parameter '" + key + "' must be positive: " + value);
        }
        return value;
    }

    private static double nonNegative(final String key, final double value) {
        if (value < 0.0) {
            throw new ConfigInvalidException("Command parameter '" + key + "' must not be negative: " + value);
        }
        return value;
    }

    private static double asDouble(final String key, final Object value) {
        if (value instanceof Number number) {
            final var result = number.doubleValue();
            if (!Double.isFinite(result)) {
                throw new ConfigInvalidException("Command parameter '" + key + "' must be finite, got: " + value);
            }
            return result;
        }
        throw new ConfigInvalidException("Command parameter '" + key + "' must be a number, got: " + value);
    }

    private static boolean asBoolean(final String key, final Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw new ConfigInvalidException("Command parameter '" + key + "' must be true or false, got: " + value);
    }
}
