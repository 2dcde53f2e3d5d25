package com.example.docx2md.dto.math;

/**
 * Character style of a math run, taken from OMML {@code m:sty} and {@code m:scr}.
 * NORMAL means no explicit style, which is what Word writes for ordinary input.
 */
public enum RunStyle {
    NORMAL,
    PLAIN,
    ITALIC,
    BOLD,
    BOLD_ITALIC,
    DOUBLE_STRUCK,
    SCRIPT,
    FRAKTUR,
    SANS_SERIF,
    MONOSPACE
}
