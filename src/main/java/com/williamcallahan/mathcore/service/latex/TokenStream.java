package com.williamcallahan.mathcore.service.latex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Token cursor that splices macro bodies in at their use sites.
 *
 * <p>Spliced tokens take the byte range of the invoking command, so errors found while parsing
 * expanded material point at the use site in the converted source.</p>
 */
public final class TokenStream {

    static final int MAX_EXPANSION_DEPTH = 32;
    static final int MAX_SPLICED_TOKENS = 20_000;

    private final List<Token> source;
    private final MacroTable macros;
    private final Deque<Token> pending = new ArrayDeque<>();
    private int position;
    private int splicedTokens;

    /**
     * Creates a stream over lexed tokens ending with {@link TokenKind#END_OF_INPUT}.
     *
     * @param source lexed tokens
     * @param macros macros expanded on the fly
     */
    public TokenStream(List<Token> source, MacroTable macros) {
        Objects.requireNonNull(source, "Tokens cannot be null");
        if (source.isEmpty() || !source.get(source.size() - 1).is(TokenKind.END_OF_INPUT)) {
            throw new IllegalArgumentException("Token list must end with END_OF_INPUT");
        }
        this.source = source;
        this.macros = macros == null ? MacroTable.empty() : macros;
    }

    /**
     * Returns the next token without consuming it, expanding macros at the head first.
     *
     * @return head token
     */
    public Token peek() {
        Token head = rawPeek();
        while (head.is(TokenKind.COMMAND) && macros.find(head.text()).isPresent()) {
            expand(rawNext(), macros.find(head.text()).orElseThrow());
            head = rawPeek();
        }
        return head;
    }

    public Token next() {
        peek();
        return rawNext();
    }

    /**
     * Skips whitespace tokens and returns the next significant token without consuming it.
     *
     * @return head token, never whitespace
     */
    public Token peekSignificant() {
        while (peek().is(TokenKind.WHITESPACE)) {
            rawNext();
        }
        return peek();
    }

    public Token nextSignificant() {
        peekSignificant();
        return rawNext();
    }

    /**
     * Returns the token after the head without expanding it.
     *
     * @return second token, or the end-of-input token
     */
    Token peekSecond() {
        Token head = peek();
        if (head.is(TokenKind.END_OF_INPUT)) {
            return head;
        }
        if (pending.size() >= 2) {
            return pending.stream().skip(1).findFirst().orElseThrow();
        }
        if (pending.size() == 1) {
            return source.get(position);
        }
        return source.get(Math.min(position + 1, source.size() - 1));
    }

    private Token rawPeek() {
        if (!pending.isEmpty()) {
            return pending.peekFirst();
        }
        return source.get(position);
    }

    private Token rawNext() {
        if (!pending.isEmpty()) {
            return pending.pollFirst();
        }
        Token token = source.get(position);
        if (!token.is(TokenKind.END_OF_INPUT)) {
            position++;
        }
        return token;
    }

    private void expand(Token invocation, MacroDefinition macro) {
        int depth = invocation.expansionDepth() + 1;
        if (depth > MAX_EXPANSION_DEPTH) {
            throw limitExceeded(invocation);
        }
        List<List<Token>> arguments = new ArrayList<>();
        for (int i = 0; i < macro.arity(); i++) {
            arguments.add(readArgument(invocation));
        }
        List<Token> spliced = new ArrayList<>();
        for (Token token : macro.body()) {
            if (token.is(TokenKind.MACRO_PARAMETER)) {
                for (Token argumentToken : arguments.get(Integer.parseInt(token.text()) - 1)) {
                    spliced.add(argumentToken.relocate(invocation.offset(), invocation.end(), depth));
                }
            } else {
                spliced.add(token.relocate(invocation.offset(), invocation.end(), depth));
            }
        }
        splicedTokens += spliced.size();
        if (splicedTokens > MAX_SPLICED_TOKENS) {
            throw limitExceeded(invocation);
        }
        for (int i = spliced.size() - 1; i >= 0; i--) {
            pending.addFirst(spliced.get(i));
        }
    }

    private List<Token> readArgument(Token invocation) {
        while (rawPeek().is(TokenKind.WHITESPACE)) {
            rawNext();
        }
        Token first = rawNext();
        if (first.is(TokenKind.END_OF_INPUT)) {
            throw new LatexConversionException(LatexErrorKind.ARGUMENT, invocation.offset(),
                "Expected argument but reached end of input");
        }
        if (first.is(TokenKind.GROUP_CLOSE)) {
            throw new LatexConversionException(LatexErrorKind.ARGUMENT, first.offset(),
                "Expected argument but got closing token");
        }
        if (!first.is(TokenKind.GROUP_OPEN)) {
            return List.of(first);
        }
        List<Token> group = new ArrayList<>();
        int depth = 1;
        while (true) {
            Token token = rawNext();
            if (token.is(TokenKind.END_OF_INPUT)) {
                throw new LatexConversionException(LatexErrorKind.STRUCTURAL, first.offset(),
                    "Expected token \"}\", but not found");
            }
            if (token.is(TokenKind.GROUP_OPEN)) {
                depth++;
            } else if (token.is(TokenKind.GROUP_CLOSE) && --depth == 0) {
                return group;
            }
            group.add(token);
        }
    }

    private static LatexConversionException limitExceeded(Token invocation) {
        return new LatexConversionException(LatexErrorKind.STRUCTURAL, invocation.offset(),
            "Macro expansion limit exceeded");
    }
}
