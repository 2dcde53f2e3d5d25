package com.example.docx2md.dto.math;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Immutable node of a math markup tree.
 *
 * <p>Which of {@code slots}, {@code children} and {@code rows} a node may carry is
 * fixed by its {@link NodeKind}; {@link #isWellFormed()} checks that contract.
 * The remaining fields are per-kind properties read from the OMML {@code *Pr}
 * elements and are {@code null} when the markup does not set them.</p>
 */
@Value
@Builder(toBuilder = true)
public class MathNode {

    private static final MathNode EMPTY = MathNode.builder().kind(NodeKind.GROUP).build();

    NodeKind kind;

    @Singular
    Map<Slot, MathNode> slots;

    @Singular
    List<MathNode> children;

    @Singular
    List<List<MathNode>> rows;

    String text;

    @Builder.Default
    RunStyle style = RunStyle.NORMAL;

    String character;          // n-ary operator, accent or group character
    String openDelimiter;
    String closeDelimiter;
    String separator;
    Position position;         // BAR, GROUP_CHAR
    FractionType fractionType;
    MatrixBracket bracket;

    public enum Position {
        TOP,
        BOTTOM
    }

    public enum FractionType {
        BAR,
        SKEWED,
        LINEAR,
        NO_BAR
    }

    public enum MatrixBracket {
        NONE("matrix"),
        PAREN("pmatrix"),
        BRACKET("bmatrix"),
        BRACE("Bmatrix"),
        VBAR("vmatrix"),
        DOUBLE_VBAR("Vmatrix");

        private final String environment;

        MatrixBracket(String environment) {
            this.environment = environment;
        }

        public String getEnvironment() {
            return environment;
        }
    }

    /**
     * Returns the node in the given slot, or an empty group when the slot is absent.
     */
    public MathNode slotOrEmpty(Slot slot) {
        MathNode node = slots.get(slot);
        return node != null ? node : EMPTY;
    }

    public boolean hasSlot(Slot slot) {
        return slots.containsKey(slot);
    }

    /**
     * True for runs without visible text and groups made only of such runs.
     */
    public boolean isBlank() {
        if (kind == NodeKind.RUN) {
            return text == null || text.isBlank();
        }
        if (kind == NodeKind.GROUP) {
            for (MathNode child : children) {
                if (!child.isBlank()) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    public boolean isWellFormed() {
        if (kind == null) {
            return false;
        }
        if (!kind.getSlots().containsAll(slots.keySet())) {
            return false;
        }
        if (!children.isEmpty() && !kind.acceptsChildren()) {
            return false;
        }
        if (!rows.isEmpty() && !kind.acceptsRows()) {
            return false;
        }
        return text == null || kind == NodeKind.RUN;
    }

    public static MathNode empty() {
        return EMPTY;
    }

    public static MathNode run(String text) {
        return MathNode.builder().kind(NodeKind.RUN).text(text).build();
    }

    public static MathNode run(String text, RunStyle style) {
        return MathNode.builder().kind(NodeKind.RUN).text(text).style(style).build();
    }

    public static MathNode group(MathNode... children) {
        return MathNode.builder().kind(NodeKind.GROUP).children(Arrays.asList(children)).build();
    }

    public static MathNode fraction(MathNode numerator, MathNode denominator) {
        return MathNode.builder()
                .kind(NodeKind.FRACTION)
                .slot(Slot.NUMERATOR, numerator)
                .slot(Slot.DENOMINATOR, denominator)
                .build();
    }
}
