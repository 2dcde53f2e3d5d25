package com.example.docx2md.service.math;

import com.example.docx2md.dto.math.ConvertedFormula;
import com.example.docx2md.dto.math.MathNode;
import com.example.docx2md.exception.MathConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;

/**
 * Entry point of the formula engine: OMML subtree in, {@link ConvertedFormula} out.
 *
 * <p>Never throws for bad markup. Unknown elements and missing arguments are absorbed
 * by the reader and emitter; anything worse replaces that single formula with
 * {@link ConvertedFormula#PLACEHOLDER}.</p>
 */
@Service
public class MathConversionService {

    private static final Logger logger = LoggerFactory.getLogger(MathConversionService.class);

    private final OmmlTreeReader treeReader;
    private final LatexEmitter latexEmitter;
    private final SpacingNormalizer spacingNormalizer;
    private final DisplayClassifier displayClassifier;

    @Autowired
    public MathConversionService(OmmlTreeReader treeReader,
                                 LatexEmitter latexEmitter,
                                 SpacingNormalizer spacingNormalizer,
                                 DisplayClassifier displayClassifier) {
        this.treeReader = treeReader;
        this.latexEmitter = latexEmitter;
        this.spacingNormalizer = spacingNormalizer;
        this.displayClassifier = displayClassifier;
    }

    public ConvertedFormula convertFormula(Element omml) {
        MathNode node;
        try {
            node = treeReader.read(omml);
        } catch (RuntimeException e) {
            logger.warn("Could not read math markup <{}>: {}", omml != null ? omml.getNodeName() : null, e.getMessage());
            return ConvertedFormula.fallback();
        }
        return convertNode(node);
    }

    public ConvertedFormula convertNode(MathNode node) {
        try {
            String latex = spacingNormalizer.normalize(latexEmitter.emit(node));
            ConvertedFormula formula = displayClassifier.classify(latex, node);
            logger.debug("Converted formula ({}): {}", formula.isDisplay() ? "display" : "inline", latex);
            return formula;
        } catch (MathConversionException e) {
            logger.warn("Formula replaced by placeholder, {} node could not be rendered: {}",
                    e.getKind(), e.getMessage());
            return ConvertedFormula.fallback();
        } catch (RuntimeException e) {
            logger.warn("Formula replaced by placeholder after unexpected error ({}): {}",
                    e.getClass().getSimpleName(), e.getMessage(), e);
            return ConvertedFormula.fallback();
        }
    }

    /**
     * Starts the formula ledger of one document.
     */
    public FormulaConversionSession openSession() {
        return new FormulaConversionSession(this);
    }
}
