package com.williamcallahan.mathcore.service.latex;

import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.service.mathml.EnvironmentKind;
import com.williamcallahan.mathcore.service.mathml.EnvironmentKind.ColumnAlignment;
import com.williamcallahan.mathcore.service.mathml.MathNode;
import com.williamcallahan.mathcore.service.mathml.MathNode.Accented;
import com.williamcallahan.mathcore.service.mathml.MathNode.Environment;
import com.williamcallahan.mathcore.service.mathml.MathNode.EnvironmentRow;
import com.williamcallahan.mathcore.service.mathml.MathNode.Fraction;
import com.williamcallahan.mathcore.service.mathml.MathNode.Identifier;
import com.williamcallahan.mathcore.service.mathml.MathNode.NumberLiteral;
import com.williamcallahan.mathcore.service.mathml.MathNode.Operator;
import com.williamcallahan.mathcore.service.mathml.MathNode.Root;
import com.williamcallahan.mathcore.service.mathml.MathNode.Row;
import com.williamcallahan.mathcore.service.mathml.MathNode.RowLabel;
import com.williamcallahan.mathcore.service.mathml.MathNode.ScriptPlacement;
import com.williamcallahan.mathcore.service.mathml.MathNode.Scripted;
import com.williamcallahan.mathcore.service.mathml.MathNode.Space;
import com.williamcallahan.mathcore.service.mathml.MathNode.Styled;
import com.williamcallahan.mathcore.service.mathml.MathNode.TextGroup;
import com.williamcallahan.mathcore.service.mathml.MathNode.UnknownCommandPlaceholder;
import com.williamcallahan.mathcore.service.mathml.MathVariant;
import com.williamcallahan.mathcore.service.mathml.SourceSpan;
import com.williamcallahan.mathcore.service.mathml.symbol.Stretchy;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolCategory;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolClass;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolDescriptor;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser from tokens to a {@link MathNode} tree.
 *
 * <p>A parser instance handles exactly one conversion and is not thread-safe.</p>
 */
public final class Parser {

    static final int MAX_NESTING = 100;

    private static final String APPLY_FUNCTION = "\u2061";
    private static final String NON_BREAKING_SPACE = "\u00A0";
    private static final String RELATION_SPACE = "0.2778em";
    private static final String BINARY_SPACE = "0.2222em";
    private static final String OPERATOR_SPACE = "0.1667em";
    private static final Pattern LENGTH = Pattern.compile("(-?(?:\\d+(?:\\.\\d*)?|\\.\\d+))(em|ex|pt|px|mm|cm|in|mu)");

    private static final Map<String, String> NEGATED_RELATIONS = Map.ofEntries(
        Map.entry("=", "≠"), Map.entry("<", "≮"), Map.entry(">", "≯"), Map.entry("≤", "≰"),
        Map.entry("≥", "≱"), Map.entry("∈", "∉"), Map.entry("∋", "∌"), Map.entry("⊂", "⊄"),
        Map.entry("⊃", "⊅"), Map.entry("⊆", "⊈"), Map.entry("⊇", "⊉"), Map.entry("≡", "≢"),
        Map.entry("∼", "≁"), Map.entry("≈", "≉"), Map.entry("≅", "≇"), Map.entry("≃", "≄"),
        Map.entry("∣", "∤"), Map.entry("∥", "∦"), Map.entry("≺", "⊀"), Map.entry("≻", "⊁"),
        Map.entry("→", "↛"), Map.entry("←", "↚"), Map.entry("↔", "↮"), Map.entry("⇒", "⇏"),
        Map.entry("⇐", "⇍"), Map.entry("⇔", "⇎"), Map.entry("⊢", "⊬"), Map.entry("⊨", "⊭"));

    private final TokenStream tokens;
    private final MathDisplay display;
    private final boolean ignoreUnknownCommands;
    private final Set<String> opaqueCommands;

    private int depth;
    private MathVariant variant;
    private EnvironmentKind environment;
    private RowLabel rowLabel;

    /**
     * Creates a parser.
     *
     * @param tokens token source
     * @param display display mode, which decides limit placement
     * @param ignoreUnknownCommands render unknown commands as placeholders instead of failing
     * @param opaqueCommands commands accepted as plain atoms (macro names while validating bodies)
     */
    public Parser(TokenStream tokens, MathDisplay display, boolean ignoreUnknownCommands, Set<String> opaqueCommands) {
        this.tokens = Objects.requireNonNull(tokens, "Token stream cannot be null");
        this.display = Objects.requireNonNull(display, "Display mode cannot be null");
        this.ignoreUnknownCommands = ignoreUnknownCommands;
        this.opaqueCommands = opaqueCommands == null ? Set.of() : Set.copyOf(opaqueCommands);
    }

    /**
     * Parses the whole input.
     *
     * @return top-level row
     * @throws LatexConversionException at the first error
     */
    public Row parse() {
        List<MathNode> nodes = parseSequence(Terminator.END_OF_INPUT);
        Token end = tokens.peekSignificant();
        if (!end.is(TokenKind.END_OF_INPUT)) {
            throw new LatexConversionException(LatexErrorKind.LEX, end.offset(), "Unmatched closing token: \"}\"");
        }
        return new Row(nodes, new SourceSpan(0, end.end()));
    }

    private List<MathNode> parseSequence(Terminator terminator) {
        List<MathNode> nodes = new ArrayList<>();
        while (true) {
            Token token = tokens.peekSignificant();
            if (terminator.stopsAt(token)) {
                break;
            }
            switch (token.kind()) {
                case END_OF_INPUT, GROUP_CLOSE -> {
                    return SpacingResolver.resolve(nodes);
                }
                case ALIGNMENT, ROW_BREAK -> throw misplaced(token, "inside a table environment");
                case END_ENV -> throw misplaced(token, "after a matching \"\\begin{" + token.text() + "}\"");
                default -> {
                }
            }
            if (token.is(TokenKind.COMMAND)) {
                Optional<Command> command = opaqueCommands.contains(token.text())
                    ? Optional.empty()
                    : CommandTable.lookup(token.text());
                if (command.isPresent() && handleRowCommand(token, command.get(), terminator, nodes)) {
                    if (command.get().kind() == CommandKind.STYLE) {
                        break;
                    }
                    continue;
                }
            }
            parseScriptedAtom(nodes);
        }
        return SpacingResolver.resolve(nodes);
    }

    /**
     * Handles commands that act on the row being built rather than producing an atom.
     *
     * @return true when the command was consumed
     */
    private boolean handleRowCommand(Token token, Command command, Terminator terminator, List<MathNode> nodes) {
        switch (command.kind()) {
            case RIGHT -> throw misplaced(token, "after \"\\left\"");
            case MIDDLE -> throw misplaced(token, "between \"\\left\" and \"\\right\"");
            case TAG, NOTAG -> {
                if (terminator != Terminator.CELL || environment == null || !environment.acceptsTags()) {
                    throw misplaced(token, "inside a display environment");
                }
                tokens.nextSignificant();
                rowLabel = command.kind() == CommandKind.TAG
                    ? RowLabel.tagged(readRawGroup(token).text().trim())
                    : RowLabel.NONE;
                return true;
            }
            case STYLE -> {
                tokens.nextSignificant();
                enterNesting(token);
                List<MathNode> rest;
                try {
                    rest = parseSequence(terminator);
                } finally {
                    depth--;
                }
                SourceSpan span = spanOf(rest, token);
                nodes.add(new Styled(new Row(rest, span), Boolean.parseBoolean(command.value()),
                    Integer.parseInt(command.option()), span));
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private void parseScriptedAtom(List<MathNode> nodes) {
        Token first = tokens.peekSignificant();
        Atom atom;
        if (first.is(TokenKind.SUPERSCRIPT) || first.is(TokenKind.SUBSCRIPT) || first.isCharacter("'")) {
            atom = new Atom(new Row(List.of(), SourceSpan.at(first.offset())), AtomKind.ORDINARY);
        } else {
            atom = parseAtom(tokens.nextSignificant(), false);
        }
        Boolean limitsOverride = null;
        Token next = tokens.peekSignificant();
        while (next.isCommand("limits") || next.isCommand("nolimits")) {
            if (!atom.kind().acceptsLimits()) {
                throw misplaced(next, "after an operator");
            }
            tokens.nextSignificant();
            limitsOverride = next.isCommand("limits");
            next = tokens.peekSignificant();
        }
        MathNode scripted = parseScripts(atom, limitsOverride);
        nodes.add(scripted);
        if (atom.kind() == AtomKind.FUNCTION || atom.kind() == AtomKind.LIMIT_FUNCTION) {
            SourceSpan span = SourceSpan.at(scripted.span().end());
            nodes.add(new Operator(APPLY_FUNCTION, SymbolTable.lookup(APPLY_FUNCTION.codePointAt(0)), null, span));
        }
    }

    private MathNode parseScripts(Atom atom, Boolean limitsOverride) {
        MathNode base = atom.node();
        MathNode subscript = null;
        MathNode superscript = null;
        int primes = 0;
        SourceSpan span = base.span();
        while (true) {
            Token marker = tokens.peekSignificant();
            if (marker.isCharacter("'")) {
                if (superscript != null) {
                    throw structural(marker, "Duplicate subscript or superscript");
                }
                tokens.nextSignificant();
                primes++;
                span = span.union(new SourceSpan(marker.offset(), marker.end()));
                continue;
            }
            if (!marker.is(TokenKind.SUPERSCRIPT) && !marker.is(TokenKind.SUBSCRIPT)) {
                break;
            }
            tokens.nextSignificant();
            boolean isSuperscript = marker.is(TokenKind.SUPERSCRIPT);
            if (isSuperscript ? superscript != null : subscript != null) {
                throw structural(marker, "Duplicate subscript or superscript");
            }
            Token following = tokens.peekSignificant();
            if (following.is(TokenKind.SUPERSCRIPT) || following.is(TokenKind.SUBSCRIPT) || following.isCharacter("'")) {
                throw structural(marker, "'^' or '_' directly followed by '^', '_' or prime");
            }
            MathNode argument = parseArgument(marker);
            span = span.union(argument.span()).union(new SourceSpan(marker.offset(), marker.end()));
            if (isSuperscript) {
                superscript = argument;
            } else {
                subscript = argument;
            }
        }
        if (primes > 0) {
            Operator prime = primeOperator(primes, span);
            superscript = superscript == null
                ? prime
                : new Row(List.of(prime, superscript), prime.span().union(superscript.span()));
        }
        if (subscript == null && superscript == null) {
            return base;
        }
        return new Scripted(base, subscript, superscript, placement(atom.kind(), limitsOverride), span);
    }

    private ScriptPlacement placement(AtomKind kind, Boolean limitsOverride) {
        if (kind == AtomKind.BRACE) {
            return ScriptPlacement.LIMITS;
        }
        if (limitsOverride != null) {
            return limitsOverride ? ScriptPlacement.LIMITS : ScriptPlacement.SCRIPTS;
        }
        boolean movable = kind == AtomKind.LARGE_OPERATOR_LIMITS || kind == AtomKind.LIMIT_FUNCTION;
        return movable && display == MathDisplay.BLOCK ? ScriptPlacement.LIMITS : ScriptPlacement.SCRIPTS;
    }

    private static Operator primeOperator(int count, SourceSpan span) {
        String text = switch (count) {
            case 1 -> "′";
            case 2 -> "″";
            case 3 -> "‴";
            case 4 -> "⁗";
            default -> "′".repeat(count);
        };
        return new Operator(text, SymbolTable.lookup(text.codePointAt(0)), null, span);
    }

    /**
     * Parses one required argument: a braced group or a single token.
     *
     * @param owner command or marker that takes the argument; end-of-input errors are located there
     */
    private MathNode parseArgument(Token owner) {
        Token token = tokens.peekSignificant();
        switch (token.kind()) {
            case END_OF_INPUT -> throw new LatexConversionException(LatexErrorKind.ARGUMENT, owner.offset(),
                "Expected argument but reached end of input");
            case GROUP_CLOSE, END_ENV, ALIGNMENT, ROW_BREAK -> throw closingInsteadOfArgument(token);
            case GROUP_OPEN -> {
                tokens.nextSignificant();
                List<MathNode> nodes = parseGroupBody(token);
                SourceSpan span = new SourceSpan(token.offset(), Math.max(token.end(), spanOf(nodes, token).end()));
                return nodes.size() == 1 ? nodes.get(0) : new Row(nodes, span);
            }
            case COMMAND -> {
                if (token.isCommand("right") || token.isCommand("middle")) {
                    throw closingInsteadOfArgument(token);
                }
            }
            default -> {
            }
        }
        enterNesting(token);
        try {
            return parseAtom(tokens.nextSignificant(), true).node();
        } finally {
            depth--;
        }
    }

    private List<MathNode> parseGroupBody(Token open) {
        enterNesting(open);
        try {
            List<MathNode> nodes = parseSequence(Terminator.GROUP);
            Token close = tokens.peekSignificant();
            if (!close.is(TokenKind.GROUP_CLOSE)) {
                throw structural(open, "Expected token \"}\", but not found");
            }
            tokens.nextSignificant();
            return nodes;
        } finally {
            depth--;
        }
    }

    private Atom parseAtom(Token token, boolean argument) {
        SourceSpan span = new SourceSpan(token.offset(), token.end());
        return switch (token.kind()) {
            case CHARACTER -> parseCharacter(token, argument);
            case ESCAPED_CHAR -> new Atom(symbol(token.text(), span), AtomKind.ORDINARY);
            case GROUP_OPEN -> {
                List<MathNode> nodes = parseGroupBody(token);
                yield new Atom(new Row(nodes, span.union(spanOf(nodes, token))), AtomKind.ORDINARY);
            }
            case BEGIN_ENV -> new Atom(parseEnvironment(token), AtomKind.ORDINARY);
            case COMMAND -> parseCommand(token, argument);
            case TEXT -> new Atom(new TextGroup(token.text(), null, span), AtomKind.ORDINARY);
            case MACRO_PARAMETER -> new Atom(new Row(List.of(), span), AtomKind.ORDINARY);
            case SUPERSCRIPT, SUBSCRIPT -> throw misplaced(token, "after a base");
            default -> throw closingInsteadOfArgument(token);
        };
    }

    private Atom parseCharacter(Token token, boolean argument) {
        String text = token.text();
        int cp = text.codePointAt(0);
        SourceSpan span = new SourceSpan(token.offset(), token.end());
        if (cp >= '0' && cp <= '9') {
            return new Atom(parseNumber(token, argument), AtomKind.ORDINARY);
        }
        return switch (cp) {
            case '-' -> new Atom(symbol("−", span), AtomKind.ORDINARY);
            case '*' -> new Atom(symbol("∗", span), AtomKind.ORDINARY);
            case '~' -> new Atom(new TextGroup(NON_BREAKING_SPACE, null, span), AtomKind.ORDINARY);
            case '"' -> new Atom(new Identifier("”", false, span), AtomKind.ORDINARY);
            case '`' -> new Atom(new Identifier("‘", false, span), AtomKind.ORDINARY);
            case '\'' -> new Atom(primeOperator(1, span), AtomKind.ORDINARY);
            case ':' -> new Atom(new Operator(":", SymbolTable.lookup(':'),
                orderedAttributes("lspace", RELATION_SPACE, "rspace", RELATION_SPACE), span), AtomKind.ORDINARY);
            default -> {
                if (SymbolTable.find(cp).isEmpty() && Character.isLetter(cp)) {
                    yield new Atom(identifier(text, false, span), AtomKind.ORDINARY);
                }
                yield operatorAtom(text, span);
            }
        };
    }

    private MathNode parseNumber(Token first, boolean argument) {
        StringBuilder digits = new StringBuilder(first.text());
        int end = first.end();
        if (!argument) {
            while (true) {
                Token next = tokens.peek();
                if (next.is(TokenKind.CHARACTER) && isDigit(next.text())) {
                    digits.append(tokens.next().text());
                    end = next.end();
                } else if (next.isCharacter(".") && tokens.peekSecond().is(TokenKind.CHARACTER)
                    && isDigit(tokens.peekSecond().text())) {
                    digits.append(tokens.next().text());
                    end = next.end();
                } else {
                    break;
                }
            }
        }
        String text = variant == null ? digits.toString() : variant.apply(digits.toString());
        return new NumberLiteral(text, new SourceSpan(first.offset(), end));
    }

    private static boolean isDigit(String text) {
        return text.length() == 1 && text.charAt(0) >= '0' && text.charAt(0) <= '9';
    }

    private Atom parseCommand(Token token, boolean argument) {
        String name = token.text();
        SourceSpan span = new SourceSpan(token.offset(), token.end());
        if (opaqueCommands.contains(name)) {
            return new Atom(new Row(List.of(), span), AtomKind.ORDINARY);
        }
        Optional<Command> lookup = CommandTable.lookup(name);
        if (lookup.isEmpty()) {
            if (ignoreUnknownCommands) {
                return new Atom(new UnknownCommandPlaceholder(name, span), AtomKind.ORDINARY);
            }
            throw new LatexConversionException(LatexErrorKind.UNKNOWN_COMMAND, token.offset(),
                "Unknown command \"\\" + name + "\"");
        }
        Command command = lookup.get();
        return switch (command.kind()) {
            case IDENTIFIER -> new Atom(identifier(command.value(), false, span), AtomKind.ORDINARY);
            case UPRIGHT_IDENTIFIER -> new Atom(new Identifier(command.value(), true, span), AtomKind.ORDINARY);
            case OPERATOR -> operatorAtom(command.value(), span);
            case FUNCTION -> new Atom(new Identifier(command.value(), false, span), AtomKind.FUNCTION);
            case LIMIT_FUNCTION -> new Atom(new Identifier(command.value(), false, span), AtomKind.LIMIT_FUNCTION);
            case OPERATORNAME -> {
                String operatorName = readRawGroup(token).text().replace(" ", "");
                yield new Atom(new Identifier(operatorName, false, span), AtomKind.FUNCTION);
            }
            case FRACTION -> {
                MathNode numerator = parseArgument(token);
                MathNode denominator = parseArgument(token);
                yield new Atom(new Fraction(numerator, denominator, null, styleFlag(command.value()),
                    span.union(numerator.span()).union(denominator.span())), AtomKind.ORDINARY);
            }
            case BINOM -> new Atom(parseBinom(token, command, span), AtomKind.ORDINARY);
            case SQRT -> new Atom(parseRoot(token, span), AtomKind.ORDINARY);
            case OVERSET, UNDERSET -> {
                MathNode script = parseArgument(token);
                MathNode base = parseArgument(token);
                SourceSpan full = span.union(script.span()).union(base.span());
                yield new Atom(command.kind() == CommandKind.OVERSET
                    ? new Scripted(base, null, script, ScriptPlacement.LIMITS, full)
                    : new Scripted(base, script, null, ScriptPlacement.LIMITS, full), AtomKind.ORDINARY);
            }
            case MATH_CLASS -> new Atom(parseMathClass(token, command.value(), span),
                "operator".equals(command.value()) ? AtomKind.LARGE_OPERATOR : AtomKind.ORDINARY);
            case BMOD -> new Atom(new Operator("mod", SymbolTable.lookup('m'),
                orderedAttributes("lspace", BINARY_SPACE, "rspace", BINARY_SPACE), span), AtomKind.ORDINARY);
            case PMOD -> new Atom(parsePmod(token, span), AtomKind.ORDINARY);
            case ACCENT, UNDER_ACCENT -> {
                MathNode base = parseArgument(token);
                Operator accent = symbol(command.value(), span);
                if (!Boolean.parseBoolean(command.option())) {
                    accent = accent.withAttribute("stretchy", "false");
                }
                yield new Atom(new Accented(base, accent, command.kind() == CommandKind.UNDER_ACCENT,
                    span.union(base.span())), AtomKind.ORDINARY);
            }
            case OVER_BRACE, UNDER_BRACE -> {
                MathNode base = parseArgument(token);
                yield new Atom(new Accented(base, symbol(command.value(), span),
                    command.kind() == CommandKind.UNDER_BRACE, span.union(base.span())), AtomKind.BRACE);
            }
            case LEFT -> new Atom(parseLeftRight(token), AtomKind.ORDINARY);
            case MIDDLE -> throw misplaced(token, "between \"\\left\" and \"\\right\"");
            case RIGHT -> throw misplaced(token, "after \"\\left\"");
            case SIZED_DELIMITER -> {
                Operator delimiter = parseDelimiter(token, StretchMode.SIZED)
                    .withAttribute("minsize", command.value())
                    .withAttribute("maxsize", command.value());
                yield new Atom(delimiter, AtomKind.ORDINARY);
            }
            case NOT -> new Atom(parseNegation(token), AtomKind.ORDINARY);
            case LIMITS, NOLIMITS -> throw misplaced(token, "after an operator");
            case STYLE -> new Atom(new Styled(new Row(List.of(), span), Boolean.parseBoolean(command.value()),
                Integer.parseInt(command.option()), span), AtomKind.ORDINARY);
            case SPACE -> new Atom(new Space(command.value(), span), AtomKind.ORDINARY);
            case NON_BREAKING_SPACE -> new Atom(new TextGroup(NON_BREAKING_SPACE, null, span), AtomKind.ORDINARY);
            case HSPACE -> new Atom(new Space(parseLength(token), span), AtomKind.ORDINARY);
            case TEXT -> new Atom(parseText(token, command.value()), AtomKind.ORDINARY);
            case MATH_ALPHABET -> {
                MathVariant saved = variant;
                variant = MathVariant.valueOf(command.value());
                try {
                    yield new Atom(parseArgument(token), AtomKind.ORDINARY);
                } finally {
                    variant = saved;
                }
            }
            case TAG, NOTAG -> throw misplaced(token, "inside a display environment");
        };
    }

    private MathNode parseBinom(Token token, Command command, SourceSpan span) {
        MathNode top = parseArgument(token);
        MathNode bottom = parseArgument(token);
        SourceSpan full = span.union(top.span()).union(bottom.span());
        List<MathNode> children = List.of(
            new Operator("(", SymbolTable.lookup('('), null, span),
            new Fraction(top, bottom, SpacingResolver.ZERO, styleFlag(command.value()), full),
            new Operator(")", SymbolTable.lookup(')'), null, SourceSpan.at(full.end())));
        return new Row(children, full);
    }

    /**
     * Gives the argument of {@code \mathbin}, {@code \mathrel} or {@code \mathop} the spacing of that
     * class. A single symbol becomes an operator; anything else is padded with spaces.
     */
    private MathNode parseMathClass(Token token, String spacingClass, SourceSpan span) {
        MathNode argument = parseArgument(token);
        String spacing = switch (spacingClass) {
            case "binary" -> BINARY_SPACE;
            case "relation" -> RELATION_SPACE;
            default -> OPERATOR_SPACE;
        };
        SourceSpan full = span.union(argument.span());
        String text = symbolText(argument);
        if (text != null) {
            return new Operator(text, SymbolTable.lookup(text.codePointAt(0)),
                orderedAttributes("lspace", spacing, "rspace", spacing), full);
        }
        return new Row(List.of(new Space(spacing, span), argument, new Space(spacing, SourceSpan.at(full.end()))), full);
    }

    private static String symbolText(MathNode node) {
        String text = null;
        if (node instanceof Identifier identifier && !identifier.upright()) {
            text = identifier.text();
        } else if (node instanceof Operator operator) {
            text = operator.text();
        } else if (node instanceof NumberLiteral number) {
            text = number.digits();
        }
        return text == null || text.isEmpty() ? null : text;
    }

    private MathNode parsePmod(Token token, SourceSpan span) {
        MathNode argument = parseArgument(token);
        SourceSpan full = span.union(argument.span());
        List<MathNode> children = List.of(
            new Space("0.4444em", span),
            symbol("(", span),
            new Identifier("mod", false, span),
            new Space("0.3333em", span),
            argument,
            symbol(")", SourceSpan.at(full.end())));
        return new Row(children, full);
    }

    private MathNode parseRoot(Token token, SourceSpan span) {
        MathNode index = null;
        Token open = tokens.peekSignificant();
        if (open.isCharacter("[")) {
            tokens.nextSignificant();
            enterNesting(open);
            try {
                List<MathNode> nodes = parseSequence(Terminator.BRACKET);
                if (!tokens.peekSignificant().isCharacter("]")) {
                    throw structural(open, "Expected token \"]\", but not found");
                }
                tokens.nextSignificant();
                if (!nodes.isEmpty()) {
                    index = nodes.size() == 1 ? nodes.get(0) : new Row(nodes, spanOf(nodes, open));
                }
            } finally {
                depth--;
            }
        }
        MathNode radicand = parseArgument(token);
        return new Root(radicand, index, span.union(radicand.span()));
    }

    private MathNode parseLeftRight(Token left) {
        enterNesting(left);
        try {
            List<MathNode> children = new ArrayList<>();
            children.add(parseDelimiter(left, StretchMode.FENCE));
            while (true) {
                children.addAll(parseSequence(Terminator.RIGHT));
                Token next = tokens.peekSignificant();
                if (next.isCommand("middle")) {
                    tokens.nextSignificant();
                    children.add(parseDelimiter(next, StretchMode.MIDDLE));
                } else if (next.isCommand("right")) {
                    tokens.nextSignificant();
                    Operator close = parseDelimiter(next, StretchMode.FENCE);
                    children.add(close);
                    return new Row(children, new SourceSpan(left.offset(), close.span().end()));
                } else {
                    throw structural(left, "Expected token \"\\right\", but not found");
                }
            }
        } finally {
            depth--;
        }
    }

    private Operator parseDelimiter(Token owner, StretchMode mode) {
        Token token = tokens.nextSignificant();
        SourceSpan span = new SourceSpan(token.offset(), token.end());
        String text = switch (token.kind()) {
            case CHARACTER -> switch (token.text()) {
                case "." -> "";
                case "<" -> "⟨";
                case ">" -> "⟩";
                default -> isDelimiter(token.text()) ? token.text() : null;
            };
            case ESCAPED_CHAR -> "{".equals(token.text()) || "}".equals(token.text()) ? token.text() : null;
            case COMMAND -> CommandTable.lookup(token.text())
                .filter(command -> command.kind() == CommandKind.OPERATOR && isDelimiter(command.value()))
                .map(Command::value)
                .orElse(null);
            default -> null;
        };
        if (text == null) {
            throw new LatexConversionException(LatexErrorKind.ARGUMENT, owner.offset(),
                "Expected a delimiter after \"\\" + owner.text() + "\"");
        }
        SymbolDescriptor descriptor = SymbolTable.lookup(text.isEmpty() ? '.' : text.codePointAt(0));
        Operator delimiter = new Operator(text, descriptor, null, span);
        Stretchy stretchy = descriptor.stretchy();
        boolean forceStretch = switch (mode) {
            case FENCE, SIZED -> stretchy == Stretchy.NEVER;
            case MIDDLE -> stretchy == Stretchy.NEVER || stretchy == Stretchy.PRE_POSTFIX;
        };
        return forceStretch && !text.isEmpty() ? delimiter.withAttribute("stretchy", "true") : delimiter;
    }

    private static boolean isDelimiter(String text) {
        SymbolCategory category = SymbolTable.lookup(text.codePointAt(0)).category();
        return switch (category) {
            case ORD_F, ORD_G, ORD_FG, ORD_FG_FORCE_DEFAULT, ORD_K, ORD_K_LEGACY_B, REL_A -> true;
            default -> false;
        };
    }

    private MathNode parseNegation(Token token) {
        Token next = tokens.peekSignificant();
        String relation = null;
        if (next.is(TokenKind.CHARACTER)) {
            relation = next.text();
        } else if (next.is(TokenKind.COMMAND)) {
            relation = CommandTable.lookup(next.text())
                .filter(command -> command.kind() == CommandKind.OPERATOR)
                .map(Command::value)
                .orElse(null);
        }
        if (relation == null || SymbolTable.lookup(relation.codePointAt(0)).symbolClass() != SymbolClass.RELATION) {
            throw structural(token, "Expected a relation after \"\\not\"");
        }
        tokens.nextSignificant();
        String negated = NEGATED_RELATIONS.getOrDefault(relation, relation + "\u0338");
        SourceSpan span = new SourceSpan(token.offset(), next.end());
        return new Operator(negated, SymbolTable.lookup(relation.codePointAt(0)), null, span);
    }

    private String parseLength(Token owner) {
        RawGroup group = readRawGroup(owner);
        if (group.parameterized()) {
            return "0em";
        }
        String text = group.text().replace(" ", "");
        Matcher matcher = LENGTH.matcher(text);
        if (!matcher.matches()) {
            throw new LatexConversionException(LatexErrorKind.ARGUMENT, owner.offset(),
                "Expected length with units, got \"" + text + "\"");
        }
        if ("mu".equals(matcher.group(2))) {
            double em = Double.parseDouble(matcher.group(1)) / 18.0;
            return String.format(Locale.ROOT, "%.4fem", em);
        }
        return text;
    }

    private MathNode parseText(Token owner, String mathVariant) {
        Token next = tokens.peek();
        SourceSpan ownerSpan = new SourceSpan(owner.offset(), owner.end());
        if (next.is(TokenKind.TEXT)) {
            tokens.next();
            return new TextGroup(next.text(), mathVariant, ownerSpan.union(new SourceSpan(next.offset(), next.end())));
        }
        Token argument = tokens.peekSignificant();
        if (argument.is(TokenKind.GROUP_OPEN)) {
            RawGroup group = readRawGroup(owner);
            return new TextGroup(group.text(), mathVariant, ownerSpan.union(group.span()));
        }
        if (argument.is(TokenKind.MACRO_PARAMETER)) {
            tokens.nextSignificant();
            return new TextGroup("", mathVariant, ownerSpan);
        }
        if (argument.is(TokenKind.CHARACTER)) {
            tokens.nextSignificant();
            return new TextGroup(argument.text(), mathVariant, ownerSpan.union(new SourceSpan(argument.offset(), argument.end())));
        }
        if (argument.is(TokenKind.END_OF_INPUT)) {
            throw new LatexConversionException(LatexErrorKind.ARGUMENT, owner.offset(),
                "Expected argument but reached end of input");
        }
        throw new LatexConversionException(LatexErrorKind.ARGUMENT, owner.offset(),
            "Expected argument group \"{\" after \"\\" + owner.text() + "\"");
    }

    /**
     * Reads a braced argument as plain text: characters are kept, whitespace collapses to one space.
     * Unknown commands fail unless they are ignored; macro parameters are recorded but add no text.
     */
    private RawGroup readRawGroup(Token owner) {
        Token open = tokens.peekSignificant();
        if (!open.is(TokenKind.GROUP_OPEN)) {
            throw new LatexConversionException(LatexErrorKind.ARGUMENT, owner.offset(),
                "Expected argument group \"{\" after \"" + owner.spelling() + "\"");
        }
        tokens.nextSignificant();
        StringBuilder text = new StringBuilder();
        boolean parameterized = false;
        int nested = 0;
        while (true) {
            Token token = tokens.next();
            switch (token.kind()) {
                case END_OF_INPUT -> throw structural(open, "Expected token \"}\", but not found");
                case GROUP_OPEN -> nested++;
                case GROUP_CLOSE -> {
                    if (nested == 0) {
                        return new RawGroup(text.toString(), parameterized,
                            new SourceSpan(open.offset(), Math.max(open.end(), token.end())));
                    }
                    nested--;
                }
                case WHITESPACE -> text.append(' ');
                case CHARACTER, ESCAPED_CHAR, TEXT -> text.append(token.text());
                case MACRO_PARAMETER -> parameterized = true;
                case COMMAND -> {
                    if (!ignoreUnknownCommands && !opaqueCommands.contains(token.text())
                        && !CommandTable.contains(token.text())) {
                        throw new LatexConversionException(LatexErrorKind.UNKNOWN_COMMAND, token.offset(),
                            "Unknown command \"\\" + token.text() + "\"");
                    }
                    text.append(token.spelling());
                }
                default -> text.append(token.spelling());
            }
        }
    }

    private Environment parseEnvironment(Token begin) {
        EnvironmentKind kind = EnvironmentKind.fromName(begin.text())
            .orElseThrow(() -> structural(begin, "Unknown environment \"" + begin.text() + "\""));
        List<ColumnAlignment> columns = kind.takesColumnSpec() ? parseColumnSpec(begin) : List.of();
        enterNesting(begin);
        EnvironmentKind savedEnvironment = environment;
        RowLabel savedLabel = rowLabel;
        environment = kind;
        try {
            RowLabel defaultLabel = kind.numbered() ? RowLabel.NUMBERED : RowLabel.NONE;
            rowLabel = defaultLabel;
            List<EnvironmentRow> rows = new ArrayList<>();
            List<MathNode> cells = new ArrayList<>();
            while (true) {
                List<MathNode> cell = parseSequence(Terminator.CELL);
                Token separator = tokens.peekSignificant();
                cells.add(cell.size() == 1 ? cell.get(0) : new Row(cell, spanOf(cell, separator)));
                if (separator.is(TokenKind.ALIGNMENT)) {
                    tokens.nextSignificant();
                } else if (separator.is(TokenKind.ROW_BREAK)) {
                    tokens.nextSignificant();
                    rows.add(new EnvironmentRow(cells, rowLabel));
                    cells = new ArrayList<>();
                    rowLabel = defaultLabel;
                } else if (separator.is(TokenKind.END_ENV)) {
                    if (!separator.text().equals(kind.latexName())) {
                        throw structural(separator, "Expected \"\\end{" + kind.latexName()
                            + "}\", but got \"\\end{" + separator.text() + "}\"");
                    }
                    tokens.nextSignificant();
                    boolean trailingEmptyRow = !rows.isEmpty() && cells.size() == 1 && cell.isEmpty()
                        && rowLabel.kind() != MathNode.RowLabelKind.TAGGED;
                    if (!trailingEmptyRow) {
                        rows.add(new EnvironmentRow(cells, rowLabel));
                    }
                    if (kind.numbersLastRowOnly()) {
                        rows = numberLastRowOnly(rows);
                    }
                    return new Environment(kind, rows, columns, new SourceSpan(begin.offset(), separator.end()));
                } else {
                    throw structural(begin, "Expected token \"\\end{" + kind.latexName() + "}\", but not found");
                }
            }
        } finally {
            environment = savedEnvironment;
            rowLabel = savedLabel;
            depth--;
        }
    }

    private List<ColumnAlignment> parseColumnSpec(Token begin) {
        RawGroup group = readRawGroup(begin);
        List<ColumnAlignment> columns = new ArrayList<>();
        if (group.parameterized()) {
            return columns;
        }
        for (char c : group.text().replace(" ", "").toCharArray()) {
            switch (c) {
                case 'l' -> columns.add(ColumnAlignment.LEFT);
                case 'c' -> columns.add(ColumnAlignment.CENTER);
                case 'r' -> columns.add(ColumnAlignment.RIGHT);
                default -> throw new LatexConversionException(LatexErrorKind.ARGUMENT, begin.offset(),
                    "Unsupported column specification \"" + c + "\"");
            }
        }
        return columns;
    }

    private static List<EnvironmentRow> numberLastRowOnly(List<EnvironmentRow> rows) {
        List<EnvironmentRow> numbered = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            EnvironmentRow row = rows.get(i);
            boolean last = i == rows.size() - 1;
            numbered.add(!last && row.label().kind() == MathNode.RowLabelKind.NUMBERED
                ? new EnvironmentRow(row.cells(), RowLabel.NONE)
                : row);
        }
        return numbered;
    }

    private Atom operatorAtom(String text, SourceSpan span) {
        Operator operator = symbol(text, span);
        SymbolCategory category = operator.descriptor().category();
        AtomKind kind = category == SymbolCategory.OP_J
            ? AtomKind.LARGE_OPERATOR_LIMITS
            : category == SymbolCategory.OP_H ? AtomKind.LARGE_OPERATOR : AtomKind.ORDINARY;
        return new Atom(operator, kind);
    }

    /**
     * Builds an operator for a symbol. Fences used outside {@code \left...\right} do not stretch, and
     * symbols whose consumers apply spacing to them get explicit zero spacing.
     */
    private Operator symbol(String text, SourceSpan span) {
        SymbolDescriptor descriptor = SymbolTable.lookup(text.codePointAt(0));
        Operator operator = new Operator(text, descriptor, null, span);
        SymbolCategory category = descriptor.category();
        switch (category) {
            case ORD_F, ORD_G, ORD_FG -> operator = operator.withAttribute("stretchy", "false");
            case ORD_FG_FORCE_DEFAULT -> operator = operator.withAttribute("stretchy", "false")
                .withAttribute("lspace", SpacingResolver.ZERO)
                .withAttribute("rspace", SpacingResolver.ZERO);
            case ORD_K_LEGACY_B -> operator = operator.withAttribute("lspace", SpacingResolver.ZERO)
                .withAttribute("rspace", SpacingResolver.ZERO);
            default -> {
            }
        }
        return operator;
    }

    private Identifier identifier(String text, boolean upright, SourceSpan span) {
        if (variant == null) {
            return new Identifier(text, upright, span);
        }
        if (variant == MathVariant.NORMAL) {
            return new Identifier(text, true, span);
        }
        return new Identifier(variant.apply(text), false, span);
    }

    private static Boolean styleFlag(String value) {
        return value == null ? null : Boolean.valueOf(value);
    }

    private static Map<String, String> orderedAttributes(String... namesAndValues) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            attributes.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return attributes;
    }

    private void enterNesting(Token token) {
        if (++depth > MAX_NESTING) {
            throw structural(token, "Nesting limit exceeded");
        }
    }

    private static SourceSpan spanOf(List<MathNode> nodes, Token fallback) {
        if (nodes.isEmpty()) {
            return SourceSpan.at(fallback.offset());
        }
        SourceSpan span = nodes.get(0).span();
        for (MathNode node : nodes) {
            span = span.union(node.span());
        }
        return span;
    }

    private static LatexConversionException structural(Token token, String message) {
        return new LatexConversionException(LatexErrorKind.STRUCTURAL, token.offset(), message);
    }

    private static LatexConversionException misplaced(Token token, String place) {
        return structural(token, "Got \"" + token.spelling() + "\", which may only appear " + place);
    }

    private static LatexConversionException closingInsteadOfArgument(Token token) {
        return new LatexConversionException(LatexErrorKind.ARGUMENT, token.offset(),
            "Expected argument but got closing token");
    }

    private enum Terminator {
        END_OF_INPUT,
        GROUP,
        CELL,
        RIGHT,
        BRACKET;

        boolean stopsAt(Token token) {
            return switch (this) {
                case CELL -> token.is(TokenKind.ALIGNMENT) || token.is(TokenKind.ROW_BREAK) || token.is(TokenKind.END_ENV);
                case RIGHT -> token.isCommand("right") || token.isCommand("middle");
                case BRACKET -> token.isCharacter("]");
                default -> false;
            };
        }
    }

    private enum StretchMode {
        FENCE,
        MIDDLE,
        SIZED
    }

    private enum AtomKind {
        ORDINARY,
        FUNCTION,
        LIMIT_FUNCTION,
        LARGE_OPERATOR,
        LARGE_OPERATOR_LIMITS,
        BRACE;

        boolean acceptsLimits() {
            return this != ORDINARY;
        }
    }

    private record Atom(MathNode node, AtomKind kind) {
    }

    private record RawGroup(String text, boolean parameterized, SourceSpan span) {
    }
}
