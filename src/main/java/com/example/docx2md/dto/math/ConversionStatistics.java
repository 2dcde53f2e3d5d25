package com.example.docx2md.dto.math;

import lombok.Value;

import java.util.List;

/**
 * Formula and image counts for one document. Built by folding over the converted
 * formulas in document order; the image count comes from the document assembler.
 */
@Value
public class ConversionStatistics {

    public static final ConversionStatistics EMPTY = new ConversionStatistics(0, 0, 0, 0);

    int inlineCount;
    int displayCount;
    int fallbackCount;
    int imageCount;

    public int getTotalFormulas() {
        return inlineCount + displayCount;
    }

    public ConversionStatistics add(ConvertedFormula formula) {
        return new ConversionStatistics(
                inlineCount + (formula.isDisplay() ? 0 : 1),
                displayCount + (formula.isDisplay() ? 1 : 0),
                fallbackCount + (formula.isRawFallbackUsed() ? 1 : 0),
                imageCount);
    }

    public ConversionStatistics withImageCount(int images) {
        return new ConversionStatistics(inlineCount, displayCount, fallbackCount, images);
    }

    public static ConversionStatistics of(List<ConvertedFormula> formulas) {
        ConversionStatistics stats = EMPTY;
        for (ConvertedFormula formula : formulas) {
            stats = stats.add(formula);
        }
        return stats;
    }
}
