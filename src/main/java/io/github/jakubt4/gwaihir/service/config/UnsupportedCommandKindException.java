package io.github.jakubt4.gwaihir.service.config;

import lombok.Getter;

/**
 * A command names a kind outside the supported set.
 */
@Getter
public class UnsupportedCommandKindException extends ConfigInvalidException {

    private final int commandId;
    private final String label;

    public UnsupportedCommandKindException(final int commandId, final String label) {
        super("Unsupported command kind '" + label + "' for command " + commandId);
        this.commandId = commandId;
        this.label = label;
    }
}
