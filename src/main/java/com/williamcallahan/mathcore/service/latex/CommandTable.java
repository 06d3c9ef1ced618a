package com.williamcallahan.mathcore.service.latex;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every command the parser understands, keyed by name without the backslash.
 */
public final class CommandTable {

    private static final Map<String, Command> COMMANDS;

    static {
        Map<String, Command> table = new HashMap<>();

        identifiers(table, CommandKind.IDENTIFIER,
            "alpha", "α", "beta", "β", "gamma", "γ", "delta", "δ", "epsilon", "ϵ", "varepsilon", "ε",
            "zeta", "ζ", "eta", "η", "theta", "θ", "vartheta", "ϑ", "iota", "ι", "kappa", "κ",
            "varkappa", "ϰ", "lambda", "λ", "mu", "μ", "nu", "ν", "xi", "ξ", "omicron", "ο", "pi", "π",
            "varpi", "ϖ", "rho", "ρ", "varrho", "ϱ", "sigma", "σ", "varsigma", "ς", "tau", "τ",
            "upsilon", "υ", "phi", "ϕ", "varphi", "φ", "chi", "χ", "psi", "ψ", "omega", "ω",
            "ell", "ℓ", "hbar", "ℏ", "hslash", "ℏ", "imath", "ı", "jmath", "ȷ", "wp", "℘",
            "partial", "∂", "aleph", "ℵ", "beth", "ℶ");

        identifiers(table, CommandKind.UPRIGHT_IDENTIFIER,
            "Gamma", "Γ", "Delta", "Δ", "Theta", "Θ", "Lambda", "Λ", "Xi", "Ξ", "Pi", "Π",
            "Sigma", "Σ", "Upsilon", "Υ", "Phi", "Φ", "Psi", "Ψ", "Omega", "Ω",
            "infty", "∞", "nabla", "∇", "emptyset", "∅", "varnothing", "⌀", "Re", "ℜ", "Im", "ℑ",
            "top", "⊤", "bot", "⊥", "angle", "∠", "triangle", "△", "square", "□", "Box", "□",
            "surd", "√", "clubsuit", "♣", "diamondsuit", "♢", "heartsuit", "♡", "spadesuit", "♠",
            "flat", "♭", "natural", "♮", "sharp", "♯", "checkmark", "✓", "degree", "°");

        identifiers(table, CommandKind.OPERATOR,
            // relations
            "lt", "<", "gt", ">", "le", "≤", "leq", "≤", "ge", "≥", "geq", "≥", "ne", "≠", "neq", "≠",
            "equiv", "≡", "approx", "≈", "sim", "∼", "simeq", "≃", "cong", "≅", "propto", "∝",
            "in", "∈", "notin", "∉", "ni", "∋", "owns", "∋", "subset", "⊂", "supset", "⊃",
            "subseteq", "⊆", "supseteq", "⊇", "prec", "≺", "succ", "≻", "preceq", "⪯", "succeq", "⪰",
            "ll", "≪", "gg", "≫", "mid", "∣", "parallel", "∥", "perp", "⊥", "vdash", "⊢",
            "dashv", "⊣", "models", "⊨", "doteq", "≐", "coloneqq", "≔", "lhd", "⊲", "rhd", "⊳",
            "therefore", "∴", "because", "∵", "asymp", "≍", "smile", "⌣", "frown", "⌢",
            "bowtie", "⋈", "nless", "≮", "ngtr", "≯", "nleq", "≰", "ngeq", "≱", "nsim", "≁",
            "nsubseteq", "⊈", "nsupseteq", "⊉",
            // arrows
            "to", "→", "rightarrow", "→", "leftarrow", "←", "gets", "←", "leftrightarrow", "↔",
            "Rightarrow", "⇒", "Leftarrow", "⇐", "Leftrightarrow", "⇔", "iff", "⟺", "implies", "⟹",
            "impliedby", "⟸", "mapsto", "↦", "longrightarrow", "⟶", "longleftarrow", "⟵",
            "longleftrightarrow", "⟷", "Longrightarrow", "⟹", "Longleftarrow", "⟸",
            "Longleftrightarrow", "⟺", "longmapsto", "⟼", "uparrow", "↑", "downarrow", "↓",
            "updownarrow", "↕", "Uparrow", "⇑", "Downarrow", "⇓", "Updownarrow", "⇕",
            "nearrow", "↗", "searrow", "↘", "swarrow", "↙", "nwarrow", "↖",
            "hookrightarrow", "↪", "hookleftarrow", "↩", "rightharpoonup", "⇀", "leftharpoonup", "↼",
            "rightharpoondown", "⇁", "leftharpoondown", "↽", "rightleftharpoons", "⇌",
            // binary operators
            "pm", "±", "mp", "∓", "div", "÷", "cup", "∪", "cap", "∩", "wedge", "∧", "land", "∧",
            "vee", "∨", "lor", "∨", "oplus", "⊕", "otimes", "⊗", "ominus", "⊖", "oslash", "⊘",
            "odot", "⊙", "setminus", "∖", "star", "⋆", "circ", "∘", "bullet", "∙", "diamond", "⋄",
            "uplus", "⊎", "sqcap", "⊓", "sqcup", "⊔", "wr", "≀", "dagger", "†", "ddagger", "‡",
            "amalg", "⨿", "ast", "∗", "bigtriangleup", "△", "bigtriangledown", "▽",
            // operators
            "times", "×", "cdot", "⋅", "centerdot", "·", "ltimes", "⋉", "rtimes", "⋊",
            "int", "∫", "iint", "∬", "iiint", "∭", "iiiint", "⨌", "oint", "∮",
            "sum", "∑", "prod", "∏", "coprod", "∐", "bigcup", "⋃", "bigcap", "⋂", "bigvee", "⋁",
            "bigwedge", "⋀", "bigoplus", "⨁", "bigotimes", "⨂", "bigodot", "⨀", "biguplus", "⨄",
            "bigsqcup", "⨆",
            // prefix and postfix
            "neg", "¬", "lnot", "¬", "forall", "∀", "exists", "∃", "nexists", "∄", "prime", "′",
            // fences
            "langle", "⟨", "rangle", "⟩", "lfloor", "⌊", "rfloor", "⌋", "lceil", "⌈", "rceil", "⌉",
            "lbrace", "{", "rbrace", "}", "lbrack", "[", "rbrack", "]", "vert", "|", "lvert", "|",
            "rvert", "|", "Vert", "‖", "|", "‖", "lVert", "‖", "rVert", "‖", "llbracket", "⟦",
            "rrbracket", "⟧", "backslash", "\\",
            // dots and punctuation
            "ldots", "…", "dots", "…", "cdots", "⋯", "vdots", "⋮", "ddots", "⋱", "colon", ":");

        identifiers(table, CommandKind.FUNCTION,
            "arccos", "arccos", "arcsin", "arcsin", "arctan", "arctan", "arg", "arg", "cos", "cos",
            "cosh", "cosh", "cot", "cot", "coth", "coth", "csc", "csc", "deg", "deg", "dim", "dim",
            "exp", "exp", "hom", "hom", "ker", "ker", "lg", "lg", "ln", "ln", "log", "log",
            "sec", "sec", "sin", "sin", "sinh", "sinh", "tan", "tan", "tanh", "tanh");

        identifiers(table, CommandKind.LIMIT_FUNCTION,
            "det", "det", "gcd", "gcd", "inf", "inf", "lim", "lim", "liminf", "lim inf",
            "limsup", "lim sup", "max", "max", "min", "min", "Pr", "Pr", "sup", "sup");

        table.put("operatorname", Command.of(CommandKind.OPERATORNAME));

        table.put("frac", Command.of(CommandKind.FRACTION));
        table.put("dfrac", Command.of(CommandKind.FRACTION, "true"));
        table.put("cfrac", Command.of(CommandKind.FRACTION, "true"));
        table.put("tfrac", Command.of(CommandKind.FRACTION, "false"));
        table.put("binom", Command.of(CommandKind.BINOM));
        table.put("dbinom", Command.of(CommandKind.BINOM, "true"));
        table.put("tbinom", Command.of(CommandKind.BINOM, "false"));
        table.put("sqrt", Command.of(CommandKind.SQRT));
        table.put("overset", Command.of(CommandKind.OVERSET));
        table.put("stackrel", Command.of(CommandKind.OVERSET));
        table.put("underset", Command.of(CommandKind.UNDERSET));

        table.put("mathbin", Command.of(CommandKind.MATH_CLASS, "binary"));
        table.put("mathrel", Command.of(CommandKind.MATH_CLASS, "relation"));
        table.put("mathop", Command.of(CommandKind.MATH_CLASS, "operator"));
        table.put("bmod", Command.of(CommandKind.BMOD));
        table.put("pmod", Command.of(CommandKind.PMOD));

        accent(table, "hat", "^", false);
        accent(table, "widehat", "^", true);
        accent(table, "bar", "¯", false);
        accent(table, "overline", "‾", true);
        accent(table, "vec", "→", false);
        accent(table, "overrightarrow", "→", true);
        accent(table, "overleftarrow", "←", true);
        accent(table, "dot", "˙", false);
        accent(table, "ddot", "¨", false);
        accent(table, "tilde", "˜", false);
        accent(table, "widetilde", "˜", true);
        accent(table, "check", "ˇ", false);
        accent(table, "breve", "˘", false);
        accent(table, "acute", "´", false);
        accent(table, "grave", "`", false);
        accent(table, "mathring", "˚", false);
        table.put("underline", new Command(CommandKind.UNDER_ACCENT, "_", "true"));
        table.put("overbrace", Command.of(CommandKind.OVER_BRACE, "⏞"));
        table.put("underbrace", Command.of(CommandKind.UNDER_BRACE, "⏟"));
        table.put("overbracket", Command.of(CommandKind.OVER_BRACE, "⎴"));
        table.put("underbracket", Command.of(CommandKind.UNDER_BRACE, "⎵"));

        table.put("left", Command.of(CommandKind.LEFT));
        table.put("middle", Command.of(CommandKind.MIDDLE));
        table.put("right", Command.of(CommandKind.RIGHT));
        sized(table, "1.2em", "big", "bigl", "bigr", "bigm");
        sized(table, "1.623em", "Big", "Bigl", "Bigr", "Bigm");
        sized(table, "2.047em", "bigg", "biggl", "biggr", "biggm");
        sized(table, "2.470em", "Bigg", "Biggl", "Biggr", "Biggm");

        table.put("not", Command.of(CommandKind.NOT));
        table.put("limits", Command.of(CommandKind.LIMITS));
        table.put("nolimits", Command.of(CommandKind.NOLIMITS));

        table.put("displaystyle", new Command(CommandKind.STYLE, "true", "0"));
        table.put("textstyle", new Command(CommandKind.STYLE, "false", "0"));
        table.put("scriptstyle", new Command(CommandKind.STYLE, "false", "1"));
        table.put("scriptscriptstyle", new Command(CommandKind.STYLE, "false", "2"));

        identifiers(table, CommandKind.SPACE,
            ",", "0.1667em", "thinspace", "0.1667em", ":", "0.2222em", ">", "0.2222em",
            "medspace", "0.2222em", ";", "0.2778em", "thickspace", "0.2778em", "!", "-0.1667em",
            "negthinspace", "-0.1667em", "enspace", "0.5em", "quad", "1em", "qquad", "2em");
        table.put(" ", Command.of(CommandKind.NON_BREAKING_SPACE));
        table.put("hspace", Command.of(CommandKind.HSPACE));
        table.put("mspace", Command.of(CommandKind.HSPACE));

        table.put("text", Command.of(CommandKind.TEXT));
        table.put("textrm", Command.of(CommandKind.TEXT));
        table.put("textnormal", Command.of(CommandKind.TEXT));
        table.put("mbox", Command.of(CommandKind.TEXT));
        table.put("hbox", Command.of(CommandKind.TEXT));
        table.put("textit", Command.of(CommandKind.TEXT, "italic"));
        table.put("textbf", Command.of(CommandKind.TEXT, "bold"));
        table.put("textsf", Command.of(CommandKind.TEXT, "sans-serif"));
        table.put("texttt", Command.of(CommandKind.TEXT, "monospace"));

        table.put("mathrm", Command.of(CommandKind.MATH_ALPHABET, "NORMAL"));
        table.put("mathbf", Command.of(CommandKind.MATH_ALPHABET, "BOLD"));
        table.put("boldsymbol", Command.of(CommandKind.MATH_ALPHABET, "BOLD"));
        table.put("mathit", Command.of(CommandKind.MATH_ALPHABET, "ITALIC"));
        table.put("mathbb", Command.of(CommandKind.MATH_ALPHABET, "DOUBLE_STRUCK"));
        table.put("mathcal", Command.of(CommandKind.MATH_ALPHABET, "SCRIPT"));
        table.put("mathsf", Command.of(CommandKind.MATH_ALPHABET, "SANS_SERIF"));
        table.put("mathtt", Command.of(CommandKind.MATH_ALPHABET, "MONOSPACE"));
        table.put("mathfrak", Command.of(CommandKind.MATH_ALPHABET, "FRAKTUR"));

        table.put("tag", Command.of(CommandKind.TAG));
        table.put("notag", Command.of(CommandKind.NOTAG));
        table.put("nonumber", Command.of(CommandKind.NOTAG));

        COMMANDS = Collections.unmodifiableMap(table);
    }

    private CommandTable() {
    }

    private static void identifiers(Map<String, Command> table, CommandKind kind, String... namesAndValues) {
        for (int i = 0; i < namesAndValues.length; i += 2) {
            put(table, namesAndValues[i], Command.of(kind, namesAndValues[i + 1]));
        }
    }

    private static void accent(Map<String, Command> table, String name, String accent, boolean stretchy) {
        put(table, name, new Command(CommandKind.ACCENT, accent, Boolean.toString(stretchy)));
    }

    private static void sized(Map<String, Command> table, String size, String... names) {
        for (String name : names) {
            put(table, name, Command.of(CommandKind.SIZED_DELIMITER, size));
        }
    }

    private static void put(Map<String, Command> table, String name, Command command) {
        if (table.putIfAbsent(name, command) != null) {
            throw new IllegalStateException("Command registered twice: \\" + name);
        }
    }

    /**
     * Looks up a command by name.
     *
     * @param name command name without the backslash
     * @return the command, or empty when the name is unknown
     */
    public static Optional<Command> lookup(String name) {
        return Optional.ofNullable(COMMANDS.get(name));
    }

    /**
     * Indicates whether a name is a known command.
     *
     * @param name command name without the backslash
     * @return true when {@link #lookup} finds it
     */
    public static boolean contains(String name) {
        return COMMANDS.containsKey(name);
    }
}
