package com.williamcallahan.mathcore.service.latex;

import java.util.List;
import java.util.Objects;

/**
 * Compiled user macro.
 *
 * @param name command name without the backslash
 * @param replacement replacement text as configured
 * @param body lexed replacement, without the end-of-input token
 * @param arity number of arguments, the highest {@code #n} in the body
 */
public record MacroDefinition(String name, String replacement, List<Token> body, int arity) {

    public MacroDefinition {
        Objects.requireNonNull(name, "Macro name cannot be null");
        Objects.requireNonNull(replacement, "Macro replacement cannot be null");
        body = List.copyOf(body);
        if (arity < 0 || arity > 9) {
            throw new IllegalArgumentException("Macro arity must be 0-9: " + arity);
        }
    }
}
