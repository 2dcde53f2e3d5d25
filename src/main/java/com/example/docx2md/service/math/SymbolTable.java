package com.example.docx2md.service.math;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static Unicode to LaTeX tables used by the emitter and the spacing normalizer.
 * All maps are built once in the static initializer and never change afterwards.
 */
public final class SymbolTable {

    private static final Map<Integer, String> SYMBOLS;
    private static final Map<String, String> OPERATORS;
    private static final Map<String, String> ACCENTS;
    private static final Map<String, String> DELIMITERS;
    private static final Set<String> FUNCTIONS;
    private static final Set<String> LIMIT_FUNCTIONS;
    private static final Set<String> ORDINARY_SYMBOLS;
    private static final Set<String> KNOWN_COMMANDS;

    private static final Pattern COMMAND = Pattern.compile("\\\\([a-zA-Z]+)");

    /** Operator used by OMML when an n-ary element carries no {@code m:chr}. */
    public static final String DEFAULT_NARY_CHAR = "∫";

    /** Accent used by OMML when an accent element carries no {@code m:chr}. */
    public static final String DEFAULT_ACCENT_CHAR = "\u0302";

    static {
        Map<Integer, String> s = new HashMap<>();

        // Greek lowercase
        put(s, 'α', "\\alpha");
        put(s, 'β', "\\beta");
        put(s, 'γ', "\\gamma");
        put(s, 'δ', "\\delta");
        put(s, 'ε', "\\epsilon");
        put(s, 'ϵ', "\\epsilon");
        put(s, 'ζ', "\\zeta");
        put(s, 'η', "\\eta");
        put(s, 'θ', "\\theta");
        put(s, 'ϑ', "\\vartheta");
        put(s, 'ι', "\\iota");
        put(s, 'κ', "\\kappa");
        put(s, 'λ', "\\lambda");
        put(s, 'μ', "\\mu");
        put(s, 'ν', "\\nu");
        put(s, 'ξ', "\\xi");
        put(s, 'ο', "o");
        put(s, 'π', "\\pi");
        put(s, 'ϖ', "\\varpi");
        put(s, 'ρ', "\\rho");
        put(s, 'ϱ', "\\varrho");
        put(s, 'σ', "\\sigma");
        put(s, 'ς', "\\varsigma");
        put(s, 'τ', "\\tau");
        put(s, 'υ', "\\upsilon");
        put(s, 'φ', "\\phi");
        put(s, 'ϕ', "\\phi");
        put(s, 'χ', "\\chi");
        put(s, 'ψ', "\\psi");
        put(s, 'ω', "\\omega");

        // Greek uppercase; letters identical to Latin ones map to the Latin letter
        put(s, 'Α', "A");
        put(s, 'Β', "B");
        put(s, 'Γ', "\\Gamma");
        put(s, 'Δ', "\\Delta");
        put(s, 'Ε', "E");
        put(s, 'Ζ', "Z");
        put(s, 'Η', "H");
        put(s, 'Θ', "\\Theta");
        put(s, 'Ι', "I");
        put(s, 'Κ', "K");
        put(s, 'Λ', "\\Lambda");
        put(s, 'Μ', "M");
        put(s, 'Ν', "N");
        put(s, 'Ξ', "\\Xi");
        put(s, 'Ο', "O");
        put(s, 'Π', "\\Pi");
        put(s, 'Ρ', "P");
        put(s, 'Σ', "\\Sigma");
        put(s, 'Τ', "T");
        put(s, 'Υ', "\\Upsilon");
        put(s, 'Φ', "\\Phi");
        put(s, 'Χ', "X");
        put(s, 'Ψ', "\\Psi");
        put(s, 'Ω', "\\Omega");

        // Operators appearing as plain run text
        put(s, '∞', "\\infty");
        put(s, '∑', "\\sum");
        put(s, '∫', "\\int");
        put(s, '∏', "\\prod");
        put(s, '∂', "\\partial");
        put(s, '∇', "\\nabla");
        put(s, '∆', "\\Delta");

        // Relations
        put(s, '≤', "\\leq");
        put(s, '≥', "\\geq");
        put(s, '≠', "\\neq");
        put(s, '≈', "\\approx");
        put(s, '≡', "\\equiv");
        put(s, '∝', "\\propto");
        put(s, '∼', "\\sim");
        put(s, '≃', "\\simeq");
        put(s, '≅', "\\cong");
        put(s, '≪', "\\ll");
        put(s, '≫', "\\gg");
        put(s, '≺', "\\prec");
        put(s, '≻', "\\succ");
        put(s, '∣', "\\mid");

        // Sets and logic
        put(s, '∈', "\\in");
        put(s, '∉', "\\notin");
        put(s, '∋', "\\ni");
        put(s, '⊂', "\\subset");
        put(s, '⊆', "\\subseteq");
        put(s, '⊃', "\\supset");
        put(s, '⊇', "\\supseteq");
        put(s, '∪', "\\cup");
        put(s, '∩', "\\cap");
        put(s, '∅', "\\emptyset");
        put(s, '∀', "\\forall");
        put(s, '∃', "\\exists");
        put(s, '∄', "\\nexists");
        put(s, '∖', "\\setminus");
        put(s, '¬', "\\neg");
        put(s, '∧', "\\wedge");
        put(s, '∨', "\\vee");

        // Arrows
        put(s, '→', "\\rightarrow");
        put(s, '←', "\\leftarrow");
        put(s, '↔', "\\leftrightarrow");
        put(s, '⇒', "\\Rightarrow");
        put(s, '⇐', "\\Leftarrow");
        put(s, '⇔', "\\Leftrightarrow");
        put(s, '↑', "\\uparrow");
        put(s, '↓', "\\downarrow");
        put(s, '↕', "\\updownarrow");
        put(s, '↦', "\\mapsto");
        put(s, '⟶', "\\longrightarrow");

        // Miscellaneous
        put(s, '±', "\\pm");
        put(s, '∓', "\\mp");
        put(s, '×', "\\times");
        put(s, '÷', "\\div");
        put(s, '·', "\\cdot");
        put(s, '⋅', "\\cdot");
        put(s, '∘', "\\circ");
        put(s, '√', "\\surd");
        put(s, '∠', "\\angle");
        put(s, '⊥', "\\perp");
        put(s, '∥', "\\parallel");
        put(s, '⊕', "\\oplus");
        put(s, '⊗', "\\otimes");
        put(s, '∴', "\\therefore");
        put(s, '∵', "\\because");
        put(s, 'ℏ', "\\hbar");
        put(s, 'ℓ', "\\ell");
        put(s, '…', "\\ldots");
        put(s, '⋯', "\\cdots");
        put(s, '⋮', "\\vdots");
        put(s, '⋱', "\\ddots");
        put(s, '⟨', "\\langle");
        put(s, '⟩', "\\rangle");
        put(s, '°', "^{\\circ}");
        put(s, 'ℝ', "\\mathbb{R}");
        put(s, 'ℕ', "\\mathbb{N}");
        put(s, 'ℤ', "\\mathbb{Z}");
        put(s, 'ℚ', "\\mathbb{Q}");
        put(s, 'ℂ', "\\mathbb{C}");
        put(s, '−', "-");
        put(s, '∗', "*");
        put(s, '′', "'");
        put(s, '″', "''");

        // Characters with a meaning of their own in LaTeX source
        put(s, '{', "\\{");
        put(s, '}', "\\}");
        put(s, '%', "\\%");
        put(s, '$', "\\$");

        // Invisible operators and zero-width characters
        put(s, '\u2061', "");
        put(s, '\u2062', "");
        put(s, '\u2063', "");
        put(s, '\u200B', "");

        SYMBOLS = Collections.unmodifiableMap(s);

        Map<String, String> ops = new HashMap<>();
        ops.put("∑", "\\sum");
        ops.put("∫", "\\int");
        ops.put("∬", "\\iint");
        ops.put("∭", "\\iiint");
        ops.put("∮", "\\oint");
        ops.put("∏", "\\prod");
        ops.put("∐", "\\coprod");
        ops.put("⋃", "\\bigcup");
        ops.put("⋂", "\\bigcap");
        ops.put("⋁", "\\bigvee");
        ops.put("⋀", "\\bigwedge");
        ops.put("⨁", "\\bigoplus");
        ops.put("⨂", "\\bigotimes");
        ops.put("⨀", "\\bigodot");
        OPERATORS = Collections.unmodifiableMap(ops);

        Map<String, String> acc = new HashMap<>();
        acc.put("\u0300", "\\grave");
        acc.put("\u0301", "\\acute");
        acc.put("\u0302", "\\hat");
        acc.put("\u0303", "\\tilde");
        acc.put("\u0304", "\\bar");
        acc.put("\u0305", "\\bar");
        acc.put("\u0306", "\\breve");
        acc.put("\u0307", "\\dot");
        acc.put("\u0308", "\\ddot");
        acc.put("\u030A", "\\mathring");
        acc.put("\u030C", "\\check");
        acc.put("\u20D6", "\\overleftarrow");
        acc.put("\u20D7", "\\vec");
        acc.put("\u20DB", "\\dddot");
        acc.put("\u20E1", "\\overleftrightarrow");
        acc.put("^", "\\hat");
        acc.put("~", "\\tilde");
        acc.put("¯", "\\bar");
        acc.put("˙", "\\dot");
        acc.put("→", "\\vec");
        ACCENTS = Collections.unmodifiableMap(acc);

        Map<String, String> del = new HashMap<>();
        del.put("(", "(");
        del.put(")", ")");
        del.put("[", "[");
        del.put("]", "]");
        del.put("{", "\\{");
        del.put("}", "\\}");
        del.put("|", "|");
        del.put("‖", "\\|");
        del.put("⟨", "\\langle");
        del.put("⟩", "\\rangle");
        del.put("〈", "\\langle");
        del.put("〉", "\\rangle");
        del.put("⌊", "\\lfloor");
        del.put("⌋", "\\rfloor");
        del.put("⌈", "\\lceil");
        del.put("⌉", "\\rceil");
        del.put("", ".");
        DELIMITERS = Collections.unmodifiableMap(del);

        Set<String> limits = new HashSet<>(Set.of(
                "lim", "limsup", "liminf", "max", "min", "sup", "inf", "det", "gcd", "Pr"));
        LIMIT_FUNCTIONS = Collections.unmodifiableSet(limits);

        Set<String> fn = new HashSet<>(Set.of(
                "sin", "cos", "tan", "cot", "sec", "csc",
                "arcsin", "arccos", "arctan", "sinh", "cosh", "tanh", "coth",
                "log", "ln", "lg", "exp", "dim", "ker", "deg", "arg", "hom"));
        fn.addAll(limits);
        FUNCTIONS = Collections.unmodifiableSet(fn);

        ORDINARY_SYMBOLS = Collections.unmodifiableSet(new HashSet<>(Set.of(
                "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "vartheta",
                "iota", "kappa", "lambda", "mu", "nu", "xi", "pi", "varpi", "rho", "varrho",
                "sigma", "varsigma", "tau", "upsilon", "phi", "chi", "psi", "omega",
                "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega",
                "infty", "partial", "nabla", "emptyset", "hbar", "ell")));

        Set<String> known = new HashSet<>(Set.of(
                "frac", "sqrt", "left", "right", "begin", "end", "genfrac",
                "mathit", "mathbf", "mathrm", "boldsymbol", "mathbb", "mathcal", "mathfrak", "mathsf", "mathtt",
                "operatorname", "overline", "underline", "boxed", "underbrace", "overbrace",
                "underset", "overset", "to"));
        collectCommands(SYMBOLS.values(), known);
        collectCommands(OPERATORS.values(), known);
        collectCommands(ACCENTS.values(), known);
        collectCommands(DELIMITERS.values(), known);
        known.addAll(FUNCTIONS);
        KNOWN_COMMANDS = Collections.unmodifiableSet(known);
    }

    private SymbolTable() {
    }

    private static void put(Map<Integer, String> map, char symbol, String latex) {
        map.put((int) symbol, latex);
    }

    private static void collectCommands(Iterable<String> values, Set<String> into) {
        for (String value : values) {
            Matcher m = COMMAND.matcher(value);
            while (m.find()) {
                into.add(m.group(1));
            }
        }
    }

    /**
     * LaTeX token for a codepoint found inside a math run. An empty token means the
     * character is dropped; an absent result means it is emitted as is.
     */
    public static Optional<String> lookup(int codepoint) {
        return Optional.ofNullable(SYMBOLS.get(codepoint));
    }

    public static Optional<String> lookup(String character) {
        if (character == null || character.isEmpty()
                || character.codePointCount(0, character.length()) != 1) {
            return Optional.empty();
        }
        return lookup(character.codePointAt(0));
    }

    /**
     * Command for an n-ary operator character. OMML omits the character for integrals.
     */
    public static String operator(String character) {
        if (character == null || character.isEmpty()) {
            return OPERATORS.get(DEFAULT_NARY_CHAR);
        }
        String op = OPERATORS.get(character);
        if (op != null) {
            return op;
        }
        return lookup(character).orElse(character);
    }

    public static Optional<String> accent(String character) {
        if (character == null) {
            return Optional.of(ACCENTS.get(DEFAULT_ACCENT_CHAR));
        }
        return Optional.ofNullable(ACCENTS.get(character));
    }

    public static String delimiter(String character) {
        if (character == null) {
            return ".";
        }
        String d = DELIMITERS.get(character);
        return d != null ? d : character;
    }

    public static boolean isFunction(String name) {
        return FUNCTIONS.contains(name);
    }

    public static boolean isLimitFunction(String name) {
        return LIMIT_FUNCTIONS.contains(name);
    }

    public static boolean isOrdinarySymbol(String commandName) {
        return ORDINARY_SYMBOLS.contains(commandName);
    }

    public static boolean isKnownCommand(String commandName) {
        return KNOWN_COMMANDS.contains(commandName);
    }
}
