package com.example.docx2md.dto.math;

/**
 * Named argument positions of a structural math node.
 */
public enum Slot {
    BASE,
    NUMERATOR,
    DENOMINATOR,
    DEGREE,
    SUBSCRIPT,   // also the lower limit of an n-ary operator
    SUPERSCRIPT, // also the upper limit of an n-ary operator
    LIMIT,
    FUNCTION_NAME
}
