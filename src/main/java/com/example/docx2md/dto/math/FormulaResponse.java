package com.example.docx2md.dto.math;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormulaResponse {
    private String latex;
    private boolean display;
    private boolean rawFallbackUsed;
    private String markdown;

    public static FormulaResponse from(ConvertedFormula formula) {
        return new FormulaResponse(
                formula.getLatex(),
                formula.isDisplay(),
                formula.isRawFallbackUsed(),
                formula.toMarkdown());
    }
}
