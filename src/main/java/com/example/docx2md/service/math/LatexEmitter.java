package com.example.docx2md.service.math;

import com.example.docx2md.dto.math.MathNode;
import com.example.docx2md.dto.math.RunStyle;
import com.example.docx2md.dto.math.Slot;
import com.example.docx2md.exception.MathConversionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renders a {@link MathNode} tree as a LaTeX fragment, one template per node kind.
 * Output is not yet normalized; see {@link SpacingNormalizer}.
 */
@Component
public class LatexEmitter {

    private static final Pattern EQUATION_NUMBER = Pattern.compile("#\\([^)]*\\)");
    private static final Pattern TRAILING_COMMAND = Pattern.compile(".*\\\\[a-zA-Z]+$", Pattern.DOTALL);

    private static final String UNDER_BRACE = "⏟";
    private static final String OVER_BRACE = "⏞";

    /**
     * @throws MathConversionException when a node carries slots, children or rows its kind does not accept
     */
    public String emit(MathNode node) {
        if (node == null) {
            return "";
        }
        if (!node.isWellFormed()) {
            throw new MathConversionException(
                    "Node does not match the arity of its kind: " + describe(node), node.getKind());
        }

        return switch (node.getKind()) {
            case GROUP -> concat(node.getChildren());
            case RUN -> emitRun(node);
            case FRACTION -> emitFraction(node);
            case RADICAL -> emitRadical(node);
            case SUPERSCRIPT -> "{" + slot(node, Slot.BASE) + "}^{" + slot(node, Slot.SUPERSCRIPT) + "}";
            case SUBSCRIPT -> "{" + slot(node, Slot.BASE) + "}_{" + slot(node, Slot.SUBSCRIPT) + "}";
            case SUB_SUPERSCRIPT -> "{" + slot(node, Slot.BASE) + "}_{" + slot(node, Slot.SUBSCRIPT)
                    + "}^{" + slot(node, Slot.SUPERSCRIPT) + "}";
            case PRE_SUB_SUPERSCRIPT -> "{}_{" + slot(node, Slot.SUBSCRIPT) + "}^{"
                    + slot(node, Slot.SUPERSCRIPT) + "}{" + slot(node, Slot.BASE) + "}";
            case NARY -> emitNary(node);
            case MATRIX -> emitMatrix(node);
            case ACCENT -> emitAccent(node);
            case DELIMITER -> emitDelimiter(node);
            case FUNCTION -> emitFunction(node);
            case BAR -> (node.getPosition() == MathNode.Position.TOP ? "\\overline{" : "\\underline{")
                    + slot(node, Slot.BASE) + "}";
            case BORDER_BOX -> "\\boxed{" + slot(node, Slot.BASE) + "}";
            case GROUP_CHAR -> emitGroupChar(node);
            case LOWER_LIMIT -> emitLowerLimit(node);
            case UPPER_LIMIT -> "\\overset{" + slot(node, Slot.LIMIT) + "}{" + slot(node, Slot.BASE) + "}";
            case EQUATION_ARRAY -> "\\begin{aligned}" + joinRows(node.getChildren()) + "\\end{aligned}";
        };
    }

    private String slot(MathNode node, Slot slot) {
        return emit(node.slotOrEmpty(slot));
    }

    private String concat(List<MathNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MathNode child : nodes) {
            appendFragment(sb, emit(child));
        }
        return sb.toString();
    }

    /**
     * Appends a fragment, separating it from a command name that ends the text so far.
     * Without the space {@code \in} followed by {@code t} would read as {@code \int}.
     */
    private static void appendFragment(StringBuilder sb, String fragment) {
        if (fragment.isEmpty()) {
            return;
        }
        if (sb.length() > 0 && Character.isLetterOrDigit(fragment.charAt(0))
                && TRAILING_COMMAND.matcher(sb).matches()) {
            sb.append(' ');
        }
        sb.append(fragment);
    }

    private static String joinFragments(String separator, List<String> fragments) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                appendFragment(sb, separator);
            }
            appendFragment(sb, fragments.get(i));
        }
        return sb.toString();
    }

    private String emitRun(MathNode node) {
        String text = node.getText();
        if (text == null || text.isEmpty()) {
            return "";
        }
        text = EQUATION_NUMBER.matcher(text).replaceAll("");
        text = text.replace("#", "");

        List<String> tokens = new ArrayList<>();
        text.codePoints().forEach(cp -> tokens.add(
                SymbolTable.lookup(cp).orElse(new String(Character.toChars(cp)))));

        String latex = joinFragments("", tokens);
        if (latex.isEmpty()) {
            return latex;
        }

        RunStyle style = node.getStyle() != null ? node.getStyle() : RunStyle.NORMAL;
        switch (style) {
            case ITALIC:
                return "\\mathit{" + latex + "}";
            case BOLD:
                return "\\mathbf{" + latex + "}";
            case BOLD_ITALIC:
                return "\\boldsymbol{" + latex + "}";
            case DOUBLE_STRUCK:
                return "\\mathbb{" + latex + "}";
            case SCRIPT:
                return "\\mathcal{" + latex + "}";
            case FRAKTUR:
                return "\\mathfrak{" + latex + "}";
            case SANS_SERIF:
                return "\\mathsf{" + latex + "}";
            case MONOSPACE:
                return "\\mathtt{" + latex + "}";
            default:
                return latex;
        }
    }

    private String emitFraction(MathNode node) {
        String num = slot(node, Slot.NUMERATOR);
        String den = slot(node, Slot.DENOMINATOR);
        MathNode.FractionType type = node.getFractionType();
        if (type == null) {
            type = MathNode.FractionType.BAR;
        }
        switch (type) {
            case SKEWED:
                return "{}^{" + num + "}/_{" + den + "}";
            case LINEAR:
                return "{" + num + "}/{" + den + "}";
            case NO_BAR:
                return "\\genfrac{}{}{0pt}{}{" + num + "}{" + den + "}";
            default:
                return "\\frac{" + num + "}{" + den + "}";
        }
    }

    private String emitRadical(MathNode node) {
        String base = slot(node, Slot.BASE);
        if (node.hasSlot(Slot.DEGREE) && !node.slotOrEmpty(Slot.DEGREE).isBlank()) {
            return "\\sqrt[" + slot(node, Slot.DEGREE) + "]{" + base + "}";
        }
        return "\\sqrt{" + base + "}";
    }

    private String emitNary(MathNode node) {
        StringBuilder sb = new StringBuilder(SymbolTable.operator(node.getCharacter()));
        if (hasContent(node, Slot.SUBSCRIPT)) {
            sb.append("_{").append(slot(node, Slot.SUBSCRIPT)).append('}');
        }
        if (hasContent(node, Slot.SUPERSCRIPT)) {
            sb.append("^{").append(slot(node, Slot.SUPERSCRIPT)).append('}');
        }
        String operand = slot(node, Slot.BASE);
        if (!operand.isEmpty()) {
            sb.append(' ').append(operand);
        }
        return sb.toString();
    }

    private String emitMatrix(MathNode node) {
        MathNode.MatrixBracket bracket = node.getBracket() != null ? node.getBracket() : MathNode.MatrixBracket.NONE;
        String env = bracket.getEnvironment();

        List<String> rows = new ArrayList<>();
        for (List<MathNode> row : node.getRows()) {
            List<String> cells = new ArrayList<>();
            for (MathNode cell : row) {
                cells.add(emit(cell));
            }
            rows.add(joinFragments(" & ", cells));
        }
        return "\\begin{" + env + "}" + String.join(" \\\\", rows) + "\\end{" + env + "}";
    }

    private String emitAccent(MathNode node) {
        String base = slot(node, Slot.BASE);
        Optional<String> command = SymbolTable.accent(node.getCharacter());
        if (command.isPresent()) {
            return command.get() + "{" + base + "}";
        }
        return "\\overset{" + symbol(node.getCharacter()) + "}{" + base + "}";
    }

    private String emitDelimiter(MathNode node) {
        String open = node.getOpenDelimiter() != null ? node.getOpenDelimiter() : "(";
        String close = node.getCloseDelimiter() != null ? node.getCloseDelimiter() : ")";
        String separator = node.getSeparator() != null ? node.getSeparator() : "|";

        List<String> items = new ArrayList<>();
        for (MathNode child : node.getChildren()) {
            items.add(emit(child));
        }
        StringBuilder sb = new StringBuilder("\\left").append(SymbolTable.delimiter(open));
        appendFragment(sb, joinFragments(symbol(separator), items));
        return sb.append("\\right").append(SymbolTable.delimiter(close)).toString();
    }

    private String emitFunction(MathNode node) {
        MathNode name = node.slotOrEmpty(Slot.FUNCTION_NAME);
        String base = slot(node, Slot.BASE);
        String plain = plainText(name);

        String function;
        if (plain == null) {
            function = emit(name);
        } else if (plain.isBlank()) {
            function = "";
        } else if (SymbolTable.isFunction(plain.trim())) {
            function = "\\" + plain.trim();
        } else {
            function = "\\operatorname{" + emit(name).trim() + "}";
        }
        return function + "{" + base + "}";
    }

    private String emitGroupChar(MathNode node) {
        String base = slot(node, Slot.BASE);
        String chr = node.getCharacter();
        if (UNDER_BRACE.equals(chr)) {
            return "\\underbrace{" + base + "}";
        }
        if (OVER_BRACE.equals(chr)) {
            return "\\overbrace{" + base + "}";
        }
        String command = node.getPosition() == MathNode.Position.TOP ? "\\overset{" : "\\underset{";
        return command + symbol(chr) + "}{" + base + "}";
    }

    private String emitLowerLimit(MathNode node) {
        String limit = slot(node, Slot.LIMIT);
        String plain = plainText(node.slotOrEmpty(Slot.BASE));
        if (plain != null && SymbolTable.isLimitFunction(plain.trim())) {
            return "\\" + plain.trim() + "_{" + limit + "}";
        }
        return "\\underset{" + limit + "}{" + slot(node, Slot.BASE) + "}";
    }

    private String joinRows(List<MathNode> rows) {
        List<String> emitted = new ArrayList<>();
        for (MathNode row : rows) {
            emitted.add(emit(row));
        }
        return String.join(" \\\\", emitted);
    }

    private boolean hasContent(MathNode node, Slot slot) {
        return node.hasSlot(slot) && !node.slotOrEmpty(slot).isBlank();
    }

    private String symbol(String character) {
        if (character == null) {
            return "";
        }
        return SymbolTable.lookup(character).orElse(character);
    }

    // Raw text of a subtree made only of runs and groups, otherwise null
    private String plainText(MathNode node) {
        switch (node.getKind()) {
            case RUN:
                return node.getText() != null ? node.getText() : "";
            case GROUP:
                StringBuilder sb = new StringBuilder();
                for (MathNode child : node.getChildren()) {
                    String text = plainText(child);
                    if (text == null) {
                        return null;
                    }
                    sb.append(text);
                }
                return sb.toString();
            default:
                return null;
        }
    }

    private String describe(MathNode node) {
        return "kind=" + node.getKind()
                + ", slots=" + node.getSlots().keySet()
                + ", children=" + node.getChildren().size()
                + ", rows=" + node.getRows().size();
    }
}
