package com.williamcallahan.mathcore.service.latex;

/**
 * Signals a malformed macro definition found while constructing a converter.
 *
 * <p>The location has the form {@code macro{N}:{M}}: N is the position of the definition in the
 * configured macro map, M the byte offset inside its replacement text.</p>
 */
public class MacroDefinitionException extends IllegalArgumentException {

    private final int macroIndex;
    private final int bodyOffset;
    private final String macroName;
    private final String definition;
    private final String detail;

    /**
     * Creates a macro definition exception.
     *
     * @param macroIndex zero-based position of the definition
     * @param bodyOffset byte offset inside the replacement text
     * @param macroName macro name as configured
     * @param definition replacement text as configured
     * @param detail failure message without location
     * @param cause underlying conversion failure, or null
     */
    public MacroDefinitionException(
        int macroIndex,
        int bodyOffset,
        String macroName,
        String definition,
        String detail,
        Throwable cause
    ) {
        super("macro" + macroIndex + ":" + bodyOffset + ": " + detail + ".", cause);
        this.macroIndex = macroIndex;
        this.bodyOffset = bodyOffset;
        this.macroName = macroName;
        this.definition = definition;
        this.detail = detail;
    }

    public int getMacroIndex() {
        return macroIndex;
    }

    public int getBodyOffset() {
        return bodyOffset;
    }

    public String getMacroName() {
        return macroName;
    }

    public String getDefinition() {
        return definition;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Returns the definition-relative location.
     *
     * @return {@code macro{N}:{M}}
     */
    public String location() {
        return "macro" + macroIndex + ":" + bodyOffset;
    }

    /**
     * Returns the failure as a {@link LatexError} of kind {@link LatexErrorKind#MACRO_DEFINITION}.
     *
     * @return located error with the body offset
     */
    public LatexError toLatexError() {
        return new LatexError(LatexErrorKind.MACRO_DEFINITION, bodyOffset, detail);
    }
}
