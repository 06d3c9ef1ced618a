package com.williamcallahan.mathcore.service.latex;

import java.util.Objects;

/**
 * Command table entry.
 *
 * @param kind parser behavior
 * @param value primary payload, meaning depends on the kind
 * @param option secondary payload, or null
 */
public record Command(CommandKind kind, String value, String option) {

    public Command {
        Objects.requireNonNull(kind, "Command kind cannot be null");
    }

    static Command of(CommandKind kind) {
        return new Command(kind, null, null);
    }

    static Command of(CommandKind kind, String value) {
        return new Command(kind, value, null);
    }
}
