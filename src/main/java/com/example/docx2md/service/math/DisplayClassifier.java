package com.example.docx2md.service.math;

import com.example.docx2md.dto.math.ConvertedFormula;
import com.example.docx2md.dto.math.MathNode;
import com.example.docx2md.dto.math.NodeKind;
import com.example.docx2md.dto.math.Slot;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Decides whether a converted formula is rendered inline or as a display block.
 *
 * <p>The score adds one point each for a matrix, an n-ary operator with both limits,
 * a fraction inside a fraction, and LaTeX longer than the length threshold.
 * Formulas reaching the minimum score are display formulas; everything else,
 * including ties below the minimum, stays inline.</p>
 */
@Component
public class DisplayClassifier {

    private final int lengthThreshold;
    private final int minimumScore;

    public DisplayClassifier(
            @Value("${docx2md.math.display-length-threshold:40}") int lengthThreshold,
            @Value("${docx2md.math.display-min-score:1}") int minimumScore) {
        this.lengthThreshold = lengthThreshold;
        this.minimumScore = minimumScore;
    }

    public ConvertedFormula classify(String latex, MathNode node) {
        if (score(latex, node) >= minimumScore) {
            return ConvertedFormula.display(latex);
        }
        return ConvertedFormula.inline(latex);
    }

    public int score(String latex, MathNode node) {
        int score = 0;
        if (anyMatch(node, n -> n.getKind() == NodeKind.MATRIX)) {
            score++;
        }
        if (anyMatch(node, this::isFullyLimitedNary)) {
            score++;
        }
        if (hasNestedFraction(node, false)) {
            score++;
        }
        if (latex != null && latex.length() > lengthThreshold) {
            score++;
        }
        return score;
    }

    private boolean isFullyLimitedNary(MathNode node) {
        return node.getKind() == NodeKind.NARY
                && node.hasSlot(Slot.SUBSCRIPT) && !node.slotOrEmpty(Slot.SUBSCRIPT).isBlank()
                && node.hasSlot(Slot.SUPERSCRIPT) && !node.slotOrEmpty(Slot.SUPERSCRIPT).isBlank();
    }

    private boolean hasNestedFraction(MathNode node, boolean insideFraction) {
        if (node == null) {
            return false;
        }
        boolean fraction = node.getKind() == NodeKind.FRACTION;
        if (fraction && insideFraction) {
            return true;
        }
        boolean inside = insideFraction || fraction;
        for (MathNode child : childrenOf(node)) {
            if (hasNestedFraction(child, inside)) {
                return true;
            }
        }
        return false;
    }

    private boolean anyMatch(MathNode node, Predicate<MathNode> predicate) {
        if (node == null) {
            return false;
        }
        if (predicate.test(node)) {
            return true;
        }
        for (MathNode child : childrenOf(node)) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    private List<MathNode> childrenOf(MathNode node) {
        List<MathNode> direct = new ArrayList<>(node.getSlots().values());
        direct.addAll(node.getChildren());
        for (List<MathNode> row : node.getRows()) {
            direct.addAll(row);
        }
        return direct;
    }
}
