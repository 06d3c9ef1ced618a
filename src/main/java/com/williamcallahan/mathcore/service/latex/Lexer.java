package com.williamcallahan.mathcore.service.latex;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits LaTeX math source into tokens carrying UTF-8 byte offsets.
 *
 * <p>Whitespace runs collapse into one {@link TokenKind#WHITESPACE} token, comments run from
 * {@code %} to the end of the line, and whitespace after a letter command is dropped. The braced
 * argument of a text command is read in text mode and produces a single {@link TokenKind#TEXT}
 * token, unless a macro body puts a parameter inside it.</p>
 */
public final class Lexer {

    private static final Set<String> TEXT_COMMANDS = Set.of(
        "text", "textrm", "textit", "textbf", "textsf", "texttt", "textnormal", "mbox", "hbox"
    );

    private static final String ESCAPABLE = "{}%$&#_";

    private final String source;
    private final boolean macroBody;
    private int index;
    private int byteOffset;
    private int braceDepth;
    private int highestParameter;

    /**
     * Creates a lexer for conversion input.
     *
     * @param source math source
     */
    public Lexer(String source) {
        this(source, false);
    }

    /**
     * Creates a lexer.
     *
     * @param source math source or macro replacement text
     * @param macroBody whether {@code #n} parameters are allowed
     */
    public Lexer(String source, boolean macroBody) {
        this.source = source == null ? "" : source;
        this.macroBody = macroBody;
    }

    /**
     * Tokenizes the whole source. The last token is always {@link TokenKind#END_OF_INPUT}.
     *
     * @return tokens in source order
     * @throws LatexConversionException on a lexical error
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (index < source.length()) {
            Token token = nextToken(tokens);
            if (token != null) {
                tokens.add(token);
            }
        }
        tokens.add(new Token(TokenKind.END_OF_INPUT, "", byteOffset, byteOffset));
        return tokens;
    }

    /**
     * Returns the highest {@code #n} seen; only meaningful for macro bodies.
     *
     * @return macro arity
     */
    public int highestParameter() {
        return highestParameter;
    }

    private Token nextToken(List<Token> previous) {
        int start = byteOffset;
        int cp = source.codePointAt(index);
        if (isWhitespace(cp)) {
            skipWhitespace();
            return new Token(TokenKind.WHITESPACE, " ", start, byteOffset);
        }
        if (cp == '%') {
            skipComment();
            return null;
        }
        advance();
        switch (cp) {
            case '\\':
                return readCommand(start, previous);
            case '{':
                braceDepth++;
                return new Token(TokenKind.GROUP_OPEN, "{", start, byteOffset);
            case '}':
                if (braceDepth == 0) {
                    throw lexError(start, "Unmatched closing token: \"}\"");
                }
                braceDepth--;
                return new Token(TokenKind.GROUP_CLOSE, "}", start, byteOffset);
            case '^':
                return new Token(TokenKind.SUPERSCRIPT, "^", start, byteOffset);
            case '_':
                return new Token(TokenKind.SUBSCRIPT, "_", start, byteOffset);
            case '&':
                return new Token(TokenKind.ALIGNMENT, "&", start, byteOffset);
            case '#':
                return readParameter(start);
            default:
                if (Character.isISOControl(cp)) {
                    throw lexError(start, String.format("Disallowed character: U+%04X", cp));
                }
                return new Token(TokenKind.CHARACTER, new String(Character.toChars(cp)), start, byteOffset);
        }
    }

    private Token readCommand(int start, List<Token> previous) {
        if (index >= source.length()) {
            return new Token(TokenKind.COMMAND, "", start, byteOffset);
        }
        int cp = source.codePointAt(index);
        if (!isAsciiLetter(cp)) {
            advance();
            if (cp == '\\') {
                return new Token(TokenKind.ROW_BREAK, "\\\\", start, byteOffset);
            }
            if (ESCAPABLE.indexOf(cp) >= 0) {
                return new Token(TokenKind.ESCAPED_CHAR, String.valueOf((char) cp), start, byteOffset);
            }
            String name = isWhitespace(cp) ? " " : new String(Character.toChars(cp));
            return new Token(TokenKind.COMMAND, name, start, byteOffset);
        }
        StringBuilder name = new StringBuilder();
        while (index < source.length() && isAsciiLetter(source.charAt(index))) {
            name.append(source.charAt(index));
            advance();
        }
        int commandEnd = byteOffset;
        String commandName = name.toString();
        skipWhitespace();
        if ("begin".equals(commandName) || "end".equals(commandName)) {
            return readEnvironmentName(start, commandName);
        }
        if (TEXT_COMMANDS.contains(commandName) && index < source.length() && source.charAt(index) == '{') {
            previous.add(new Token(TokenKind.COMMAND, commandName, start, commandEnd));
            return readTextGroup(previous);
        }
        return new Token(TokenKind.COMMAND, commandName, start, commandEnd);
    }

    private Token readEnvironmentName(int start, String marker) {
        if (index >= source.length() || source.charAt(index) != '{') {
            throw new LatexConversionException(LatexErrorKind.ARGUMENT, byteOffset,
                "Expected argument group \"{\" after \"\\" + marker + "\"");
        }
        int groupStart = byteOffset;
        advance();
        StringBuilder name = new StringBuilder();
        while (index < source.length() && source.charAt(index) != '}') {
            int cp = source.codePointAt(index);
            if (!isAsciiLetter(cp) && cp != '*') {
                throw new LatexConversionException(LatexErrorKind.LEX, byteOffset,
                    "Disallowed character in text group: '" + new String(Character.toChars(cp)) + "'");
            }
            name.append((char) cp);
            advance();
        }
        if (index >= source.length()) {
            throw new LatexConversionException(LatexErrorKind.STRUCTURAL, groupStart,
                "Expected token \"}\", but not found");
        }
        advance();
        TokenKind kind = "begin".equals(marker) ? TokenKind.BEGIN_ENV : TokenKind.END_ENV;
        return new Token(kind, name.toString(), start, byteOffset);
    }

    /**
     * Reads a text command's braced argument. Inside a macro body a group holding {@code #n} is
     * emitted as an explicit group of text and parameter tokens so the argument can be spliced in.
     */
    private Token readTextGroup(List<Token> previous) {
        int start = byteOffset;
        advance();
        int depth = 1;
        StringBuilder text = new StringBuilder();
        int chunkStart = byteOffset;
        List<Token> parts = new ArrayList<>();
        while (index < source.length()) {
            int position = byteOffset;
            int cp = source.codePointAt(index);
            if (cp == '}') {
                advance();
                depth--;
                if (depth == 0) {
                    if (parts.isEmpty()) {
                        return new Token(TokenKind.TEXT, text.toString(), start, byteOffset);
                    }
                    flushText(parts, text, chunkStart, position);
                    previous.add(new Token(TokenKind.GROUP_OPEN, "{", start, start + 1));
                    previous.addAll(parts);
                    return new Token(TokenKind.GROUP_CLOSE, "}", position, byteOffset);
                }
            } else if (cp == '{') {
                advance();
                depth++;
            } else if (cp == '%') {
                skipComment();
            } else if (isWhitespace(cp)) {
                skipWhitespace();
                text.append(' ');
            } else if (cp == '\\') {
                advance();
                appendTextEscape(text, position);
            } else if (cp == '#' && macroBody) {
                flushText(parts, text, chunkStart, position);
                advance();
                parts.add(readParameter(position));
                chunkStart = byteOffset;
            } else if (cp == '"' || cp == '$' || cp == '#' || Character.isISOControl(cp)) {
                throw lexError(position, "Disallowed character in text group: '" + new String(Character.toChars(cp)) + "'");
            } else {
                text.appendCodePoint(cp);
                advance();
            }
        }
        throw new LatexConversionException(LatexErrorKind.STRUCTURAL, start, "Expected token \"}\", but not found");
    }

    private static void flushText(List<Token> parts, StringBuilder text, int start, int end) {
        if (text.length() > 0) {
            parts.add(new Token(TokenKind.TEXT, text.toString(), start, end));
            text.setLength(0);
        }
    }

    private void appendTextEscape(StringBuilder text, int position) {
        if (index >= source.length()) {
            throw new LatexConversionException(LatexErrorKind.UNKNOWN_COMMAND, position, "Unknown command \"\\\"");
        }
        int cp = source.codePointAt(index);
        if (ESCAPABLE.indexOf(cp) >= 0 || cp == '\\') {
            text.append((char) cp);
            advance();
            return;
        }
        if (isWhitespace(cp)) {
            text.append(' ');
            skipWhitespace();
            return;
        }
        StringBuilder name = new StringBuilder();
        while (index < source.length() && isAsciiLetter(source.charAt(index))) {
            name.append(source.charAt(index));
            advance();
        }
        if (name.length() == 0) {
            name.appendCodePoint(cp);
            advance();
        }
        String command = name.toString();
        switch (command) {
            case "textbackslash" -> text.append('\\');
            case "ldots", "dots" -> text.append('…');
            case "quad" -> text.append(' ');
            case "qquad" -> text.append("  ");
            case "," -> text.append(' ');
            default -> throw new LatexConversionException(LatexErrorKind.UNKNOWN_COMMAND, position,
                "Unknown command \"\\" + command + "\"");
        }
    }

    private Token readParameter(int start) {
        if (!macroBody) {
            throw lexError(start, "Macro parameter found outside of macro definition");
        }
        if (index < source.length()) {
            char digit = source.charAt(index);
            if (digit >= '1' && digit <= '9') {
                advance();
                highestParameter = Math.max(highestParameter, digit - '0');
                return new Token(TokenKind.MACRO_PARAMETER, String.valueOf(digit), start, byteOffset);
            }
        }
        throw new LatexConversionException(LatexErrorKind.MACRO_DEFINITION, byteOffset,
            "Invalid parameter number; must be 1-9");
    }

    private void skipWhitespace() {
        while (index < source.length() && isWhitespace(source.charAt(index))) {
            advance();
        }
    }

    private void skipComment() {
        while (index < source.length() && source.charAt(index) != '\n') {
            advance();
        }
        if (index < source.length()) {
            advance();
        }
    }

    private void advance() {
        int cp = source.codePointAt(index);
        index += Character.charCount(cp);
        byteOffset += Utf8.byteLength(cp);
    }

    private static LatexConversionException lexError(int offset, String message) {
        return new LatexConversionException(LatexErrorKind.LEX, offset, message);
    }

    private static boolean isWhitespace(int cp) {
        return cp == ' ' || cp == '\t' || cp == '\n' || cp == '\r';
    }

    private static boolean isAsciiLetter(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z');
    }
}
