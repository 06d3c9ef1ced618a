package com.williamcallahan.mathcore.service.latex;

import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User macros compiled once per converter.
 *
 * <p>Each replacement text is lexed and parsed when the table is built. Failures are reported as
 * {@link MacroDefinitionException} with a definition-relative location; conversion calls never
 * re-validate a body.</p>
 */
public final class MacroTable {

    private static final Logger log = LoggerFactory.getLogger(MacroTable.class);

    private static final MacroTable EMPTY = new MacroTable(Map.of());

    private final Map<String, MacroDefinition> definitions;

    private MacroTable(Map<String, MacroDefinition> definitions) {
        this.definitions = definitions;
    }

    public static MacroTable empty() {
        return EMPTY;
    }

    /**
     * Compiles macro definitions in map iteration order.
     *
     * @param macros macro name to replacement text
     * @return compiled table
     * @throws MacroDefinitionException when a name or body is malformed
     */
    public static MacroTable compile(Map<String, String> macros) {
        if (macros == null || macros.isEmpty()) {
            return EMPTY;
        }
        Set<String> names = macros.keySet();
        Map<String, MacroDefinition> compiled = new LinkedHashMap<>();
        int index = 0;
        for (Map.Entry<String, String> entry : macros.entrySet()) {
            String name = entry.getKey();
            String replacement = entry.getValue() == null ? "" : entry.getValue();
            if (!isValidName(name)) {
                throw new MacroDefinitionException(index, 0, name, replacement,
                    "Invalid macro name \"" + name + "\"", null);
            }
            compiled.put(name, compileBody(index, name, replacement, names));
            index++;
        }
        log.debug("Compiled {} macro definitions", compiled.size());
        return new MacroTable(Collections.unmodifiableMap(compiled));
    }

    private static MacroDefinition compileBody(int index, String name, String replacement, Set<String> names) {
        try {
            Lexer lexer = new Lexer(replacement, true);
            List<Token> tokens = lexer.tokenize();
            new Parser(new TokenStream(tokens, EMPTY), MathDisplay.INLINE, false, names).parse();
            return new MacroDefinition(name, replacement, tokens.subList(0, tokens.size() - 1), lexer.highestParameter());
        } catch (LatexConversionException conversionFailure) {
            throw new MacroDefinitionException(index, conversionFailure.getOffset(), name, replacement,
                conversionFailure.getError().message(), conversionFailure);
        }
    }

    /**
     * Accepts a single character of any kind, or one or more ASCII letters.
     */
    static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        if (name.codePointCount(0, name.length()) == 1) {
            return true;
        }
        return name.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'));
    }

    public Optional<MacroDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    public int size() {
        return definitions.size();
    }
}
