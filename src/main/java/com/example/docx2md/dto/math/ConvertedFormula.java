package com.example.docx2md.dto.math;

import lombok.Value;

/**
 * Result of converting one formula. Never represents an error: a formula that could
 * not be converted carries the placeholder text and {@code rawFallbackUsed}.
 */
@Value
public class ConvertedFormula {

    public static final String PLACEHOLDER = "[Math Formula]";

    String latex;
    boolean display;
    boolean rawFallbackUsed;

    public static ConvertedFormula inline(String latex) {
        return new ConvertedFormula(latex, false, false);
    }

    public static ConvertedFormula display(String latex) {
        return new ConvertedFormula(latex, true, false);
    }

    public static ConvertedFormula fallback() {
        return new ConvertedFormula(PLACEHOLDER, false, true);
    }

    /**
     * Markdown form of the formula: {@code $ latex $} inline, a {@code $$} block on its
     * own lines for display, and the bare placeholder for a failed conversion.
     * Blank lines around a display block are the caller's concern.
     */
    public String toMarkdown() {
        if (rawFallbackUsed) {
            return latex;
        }
        if (display) {
            return "$$\n" + latex + "\n$$";
        }
        return "$ " + latex + " $";
    }
}
