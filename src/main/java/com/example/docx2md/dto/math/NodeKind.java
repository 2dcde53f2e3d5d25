package com.example.docx2md.dto.math;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.example.docx2md.dto.math.Slot.*;

/**
 * Closed set of math structures the emitter knows how to render.
 * Each kind fixes which slots it accepts and whether it carries an ordered
 * child list or a row grid.
 */
public enum NodeKind {
    GROUP(EnumSet.noneOf(Slot.class), true, false),
    RUN(EnumSet.noneOf(Slot.class), false, false),
    FRACTION(EnumSet.of(NUMERATOR, DENOMINATOR), false, false),
    RADICAL(EnumSet.of(BASE, DEGREE), false, false),
    SUPERSCRIPT(EnumSet.of(BASE, Slot.SUPERSCRIPT), false, false),
    SUBSCRIPT(EnumSet.of(BASE, Slot.SUBSCRIPT), false, false),
    SUB_SUPERSCRIPT(EnumSet.of(BASE, Slot.SUBSCRIPT, Slot.SUPERSCRIPT), false, false),
    PRE_SUB_SUPERSCRIPT(EnumSet.of(BASE, Slot.SUBSCRIPT, Slot.SUPERSCRIPT), false, false),
    NARY(EnumSet.of(BASE, Slot.SUBSCRIPT, Slot.SUPERSCRIPT), false, false),
    MATRIX(EnumSet.noneOf(Slot.class), false, true),
    ACCENT(EnumSet.of(BASE), false, false),
    DELIMITER(EnumSet.noneOf(Slot.class), true, false),
    FUNCTION(EnumSet.of(FUNCTION_NAME, BASE), false, false),
    BAR(EnumSet.of(BASE), false, false),
    BORDER_BOX(EnumSet.of(BASE), false, false),
    GROUP_CHAR(EnumSet.of(BASE), false, false),
    LOWER_LIMIT(EnumSet.of(BASE, LIMIT), false, false),
    UPPER_LIMIT(EnumSet.of(BASE, LIMIT), false, false),
    EQUATION_ARRAY(EnumSet.noneOf(Slot.class), true, false);

    private final Set<Slot> slots;
    private final boolean acceptsChildren;
    private final boolean acceptsRows;

    NodeKind(Set<Slot> slots, boolean acceptsChildren, boolean acceptsRows) {
        this.slots = Collections.unmodifiableSet(slots);
        this.acceptsChildren = acceptsChildren;
        this.acceptsRows = acceptsRows;
    }

    public Set<Slot> getSlots() {
        return slots;
    }

    public boolean acceptsChildren() {
        return acceptsChildren;
    }

    public boolean acceptsRows() {
        return acceptsRows;
    }
}
