package com.example.docx2md.service.math;

import com.example.docx2md.dto.math.NodeKind;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps OMML element names to node kinds. Anything not listed, including the
 * argument containers ({@code m:e}, {@code m:num}, ...) and {@code m:oMath}
 * itself, is a {@link NodeKind#GROUP}.
 */
public final class ElementClassifier {

    private static final Map<String, NodeKind> KINDS;

    static {
        Map<String, NodeKind> k = new HashMap<>();
        k.put("r", NodeKind.RUN);
        k.put("f", NodeKind.FRACTION);
        k.put("rad", NodeKind.RADICAL);
        k.put("sSup", NodeKind.SUPERSCRIPT);
        k.put("sSub", NodeKind.SUBSCRIPT);
        k.put("sSubSup", NodeKind.SUB_SUPERSCRIPT);
        k.put("sPre", NodeKind.PRE_SUB_SUPERSCRIPT);
        k.put("nary", NodeKind.NARY);
        k.put("m", NodeKind.MATRIX);
        k.put("acc", NodeKind.ACCENT);
        k.put("d", NodeKind.DELIMITER);
        k.put("func", NodeKind.FUNCTION);
        k.put("bar", NodeKind.BAR);
        k.put("borderBox", NodeKind.BORDER_BOX);
        k.put("groupChr", NodeKind.GROUP_CHAR);
        k.put("limLow", NodeKind.LOWER_LIMIT);
        k.put("limUpp", NodeKind.UPPER_LIMIT);
        k.put("eqArr", NodeKind.EQUATION_ARRAY);
        KINDS = Collections.unmodifiableMap(k);
    }

    private ElementClassifier() {
    }

    public static NodeKind classify(String tagName) {
        NodeKind kind = KINDS.get(localName(tagName));
        return kind != null ? kind : NodeKind.GROUP;
    }

    /**
     * Property elements ({@code m:fPr}, {@code m:rPr}, {@code m:ctrlPr}, ...) describe
     * their parent and are never rendered as content.
     */
    public static boolean isProperties(String tagName) {
        String local = localName(tagName);
        return local.endsWith("Pr");
    }

    /**
     * Strips a namespace prefix ({@code m:f}) or a Clark-notation namespace
     * ({@code {uri}f}) from a qualified tag name.
     */
    public static String localName(String tagName) {
        if (tagName == null) {
            return "";
        }
        int brace = tagName.lastIndexOf('}');
        if (brace >= 0) {
            return tagName.substring(brace + 1);
        }
        int colon = tagName.lastIndexOf(':');
        return colon >= 0 ? tagName.substring(colon + 1) : tagName;
    }
}
