package com.example.docx2md.service.math;

import com.example.docx2md.dto.math.ConversionStatistics;
import com.example.docx2md.dto.math.ConvertedFormula;
import com.example.docx2md.dto.math.MathNode;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts the formulas of one document and keeps them in document order.
 * Statistics are folded from that list when asked for, so there are no counters
 * to keep in sync. Not thread-safe; one session belongs to one conversion pass.
 */
public class FormulaConversionSession {

    private final MathConversionService conversionService;
    private final List<ConvertedFormula> formulas = new ArrayList<>();

    FormulaConversionSession(MathConversionService conversionService) {
        this.conversionService = conversionService;
    }

    /**
     * Converts and records one formula. Formulas without any content are returned
     * but not recorded.
     */
    public ConvertedFormula convertFormula(Element omml) {
        return record(conversionService.convertFormula(omml));
    }

    public ConvertedFormula convertNode(MathNode node) {
        return record(conversionService.convertNode(node));
    }

    private ConvertedFormula record(ConvertedFormula formula) {
        if (!formula.getLatex().isEmpty()) {
            formulas.add(formula);
        }
        return formula;
    }

    public List<ConvertedFormula> getFormulas() {
        return Collections.unmodifiableList(formulas);
    }

    public ConversionStatistics getStatistics() {
        return ConversionStatistics.of(formulas);
    }

    public ConversionStatistics getStatistics(int imageCount) {
        return getStatistics().withImageCount(imageCount);
    }
}
