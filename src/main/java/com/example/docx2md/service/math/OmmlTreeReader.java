package com.example.docx2md.service.math;

import com.example.docx2md.dto.math.MathNode;
import com.example.docx2md.dto.math.NodeKind;
import com.example.docx2md.dto.math.RunStyle;
import com.example.docx2md.dto.math.Slot;
import org.springframework.stereotype.Component;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link MathNode} tree from an OMML DOM subtree ({@code m:oMath},
 * {@code m:oMathPara} or any element below them).
 */
@Component
public class OmmlTreeReader {

    public static final String MATH_NS = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    private static final String DEFAULT_GROUP_CHAR = "⏟";

    public MathNode read(Element element) {
        String tag = tagName(element);
        NodeKind kind = ElementClassifier.classify(tag);

        switch (kind) {
            case RUN:
                return readRun(element);
            case FRACTION:
                return readFraction(element);
            case RADICAL:
                return readRadical(element);
            case SUPERSCRIPT:
                return withSlots(element, kind, "e", Slot.BASE, "sup", Slot.SUPERSCRIPT).build();
            case SUBSCRIPT:
                return withSlots(element, kind, "e", Slot.BASE, "sub", Slot.SUBSCRIPT).build();
            case SUB_SUPERSCRIPT:
            case PRE_SUB_SUPERSCRIPT:
                return withSlots(element, kind, "e", Slot.BASE, "sub", Slot.SUBSCRIPT, "sup", Slot.SUPERSCRIPT).build();
            case NARY:
                return readNary(element);
            case MATRIX:
                return readMatrix(element, MathNode.MatrixBracket.NONE);
            case ACCENT: {
                Element chr = property(element, "accPr", "chr");
                return withSlots(element, kind, "e", Slot.BASE)
                        .character(chr != null ? attributeValue(chr) : null)
                        .build();
            }
            case DELIMITER:
                return readDelimiter(element);
            case FUNCTION:
                return withSlots(element, kind, "fName", Slot.FUNCTION_NAME, "e", Slot.BASE).build();
            case BAR: {
                Element pos = property(element, "barPr", "pos");
                return withSlots(element, kind, "e", Slot.BASE)
                        .position(position(pos, MathNode.Position.BOTTOM))
                        .build();
            }
            case BORDER_BOX:
                return withSlots(element, kind, "e", Slot.BASE).build();
            case GROUP_CHAR: {
                Element chr = property(element, "groupChrPr", "chr");
                Element pos = property(element, "groupChrPr", "pos");
                return withSlots(element, kind, "e", Slot.BASE)
                        .character(chr != null ? attributeValue(chr) : DEFAULT_GROUP_CHAR)
                        .position(position(pos, MathNode.Position.BOTTOM))
                        .build();
            }
            case LOWER_LIMIT:
            case UPPER_LIMIT:
                return withSlots(element, kind, "e", Slot.BASE, "lim", Slot.LIMIT).build();
            case EQUATION_ARRAY:
                return MathNode.builder().kind(kind).children(readChildren(element, "e")).build();
            case GROUP:
            default:
                return MathNode.builder().kind(NodeKind.GROUP).children(readContent(element)).build();
        }
    }

    private MathNode readRun(Element element) {
        StringBuilder text = new StringBuilder();
        RunStyle style = RunStyle.NORMAL;
        for (Element child : childElements(element)) {
            String local = ElementClassifier.localName(tagName(child));
            if ("t".equals(local)) {
                text.append(child.getTextContent());
            } else if ("rPr".equals(local)
                    && (MATH_NS.equals(child.getNamespaceURI()) || child.getNodeName().startsWith("m:"))) {
                // w:rPr inside a math run carries fonts only
                style = runStyle(child);
            }
        }
        return MathNode.builder().kind(NodeKind.RUN).text(text.toString()).style(style).build();
    }

    private RunStyle runStyle(Element rPr) {
        if (firstChild(rPr, "nor") != null) {
            return RunStyle.PLAIN;
        }
        Element scr = firstChild(rPr, "scr");
        if (scr != null) {
            String val = attributeValue(scr);
            if ("double-struck".equals(val)) {
                return RunStyle.DOUBLE_STRUCK;
            } else if ("script".equals(val)) {
                return RunStyle.SCRIPT;
            } else if ("fraktur".equals(val)) {
                return RunStyle.FRAKTUR;
            } else if ("sans-serif".equals(val)) {
                return RunStyle.SANS_SERIF;
            } else if ("monospace".equals(val)) {
                return RunStyle.MONOSPACE;
            }
        }
        Element sty = firstChild(rPr, "sty");
        if (sty != null) {
            String val = attributeValue(sty);
            if ("p".equals(val)) {
                return RunStyle.PLAIN;
            } else if ("b".equals(val)) {
                return RunStyle.BOLD;
            } else if ("i".equals(val)) {
                return RunStyle.ITALIC;
            } else if ("bi".equals(val)) {
                return RunStyle.BOLD_ITALIC;
            }
        }
        return RunStyle.NORMAL;
    }

    private MathNode readFraction(Element element) {
        Element type = property(element, "fPr", "type");
        MathNode.FractionType fractionType = MathNode.FractionType.BAR;
        if (type != null) {
            String val = attributeValue(type);
            if ("skw".equals(val)) {
                fractionType = MathNode.FractionType.SKEWED;
            } else if ("lin".equals(val)) {
                fractionType = MathNode.FractionType.LINEAR;
            } else if ("noBar".equals(val)) {
                fractionType = MathNode.FractionType.NO_BAR;
            }
        }
        return withSlots(element, NodeKind.FRACTION, "num", Slot.NUMERATOR, "den", Slot.DENOMINATOR)
                .fractionType(fractionType)
                .build();
    }

    private MathNode readRadical(Element element) {
        MathNode.MathNodeBuilder builder = withSlots(element, NodeKind.RADICAL, "e", Slot.BASE);
        Element deg = firstChild(element, "deg");
        if (deg != null && !isOn(property(element, "radPr", "degHide"))) {
            builder.slot(Slot.DEGREE, read(deg));
        }
        return builder.build();
    }

    private MathNode readNary(Element element) {
        MathNode.MathNodeBuilder builder = MathNode.builder().kind(NodeKind.NARY);
        Element chr = property(element, "naryPr", "chr");
        builder.character(chr != null ? attributeValue(chr) : null);

        Element sub = firstChild(element, "sub");
        if (sub != null && !isOn(property(element, "naryPr", "subHide"))) {
            builder.slot(Slot.SUBSCRIPT, read(sub));
        }
        Element sup = firstChild(element, "sup");
        if (sup != null && !isOn(property(element, "naryPr", "supHide"))) {
            builder.slot(Slot.SUPERSCRIPT, read(sup));
        }
        Element base = firstChild(element, "e");
        if (base != null) {
            builder.slot(Slot.BASE, read(base));
        }
        return builder.build();
    }

    private MathNode readMatrix(Element element, MathNode.MatrixBracket bracket) {
        MathNode.MathNodeBuilder builder = MathNode.builder().kind(NodeKind.MATRIX).bracket(bracket);
        for (Element row : childElements(element)) {
            if ("mr".equals(ElementClassifier.localName(tagName(row)))) {
                builder.row(readChildren(row, "e"));
            }
        }
        return builder.build();
    }

    private MathNode readDelimiter(Element element) {
        String open = delimiterProperty(element, "begChr", "(");
        String close = delimiterProperty(element, "endChr", ")");
        String separator = delimiterProperty(element, "sepChr", "|");

        List<Element> items = new ArrayList<>();
        for (Element child : childElements(element)) {
            if ("e".equals(ElementClassifier.localName(tagName(child)))) {
                items.add(child);
            }
        }

        // A bracketed matrix is written as a delimiter around a single matrix
        if (items.size() == 1) {
            List<Element> content = contentElements(items.get(0));
            MathNode.MatrixBracket bracket = matrixBracket(open, close);
            if (content.size() == 1 && bracket != null
                    && ElementClassifier.classify(tagName(content.get(0))) == NodeKind.MATRIX) {
                return readMatrix(content.get(0), bracket);
            }
        }

        List<MathNode> children = new ArrayList<>();
        for (Element item : items) {
            children.add(read(item));
        }
        return MathNode.builder()
                .kind(NodeKind.DELIMITER)
                .openDelimiter(open)
                .closeDelimiter(close)
                .separator(separator)
                .children(children)
                .build();
    }

    private String delimiterProperty(Element element, String name, String defaultValue) {
        Element prop = property(element, "dPr", name);
        if (prop == null) {
            return defaultValue;
        }
        String val = attributeValue(prop);
        return val != null ? val : defaultValue;
    }

    private MathNode.MatrixBracket matrixBracket(String open, String close) {
        String pair = open + close;
        switch (pair) {
            case "()":
                return MathNode.MatrixBracket.PAREN;
            case "[]":
                return MathNode.MatrixBracket.BRACKET;
            case "{}":
                return MathNode.MatrixBracket.BRACE;
            case "||":
                return MathNode.MatrixBracket.VBAR;
            case "‖‖":
                return MathNode.MatrixBracket.DOUBLE_VBAR;
            default:
                return null;
        }
    }

    private MathNode.MathNodeBuilder withSlots(Element element, NodeKind kind, Object... tagsAndSlots) {
        MathNode.MathNodeBuilder builder = MathNode.builder().kind(kind);
        for (int i = 0; i < tagsAndSlots.length; i += 2) {
            Element child = firstChild(element, (String) tagsAndSlots[i]);
            if (child != null) {
                builder.slot((Slot) tagsAndSlots[i + 1], read(child));
            }
        }
        return builder;
    }

    private List<MathNode> readChildren(Element element, String localName) {
        List<MathNode> nodes = new ArrayList<>();
        for (Element child : childElements(element)) {
            if (localName.equals(ElementClassifier.localName(tagName(child)))) {
                nodes.add(read(child));
            }
        }
        return nodes;
    }

    private List<MathNode> readContent(Element element) {
        List<MathNode> nodes = new ArrayList<>();
        for (Element child : contentElements(element)) {
            nodes.add(read(child));
        }
        return nodes;
    }

    private List<Element> contentElements(Element element) {
        List<Element> content = new ArrayList<>();
        for (Element child : childElements(element)) {
            if (!ElementClassifier.isProperties(tagName(child))) {
                content.add(child);
            }
        }
        return content;
    }

    private MathNode.Position position(Element pos, MathNode.Position defaultPosition) {
        if (pos == null) {
            return defaultPosition;
        }
        String val = attributeValue(pos);
        if ("top".equals(val)) {
            return MathNode.Position.TOP;
        } else if ("bot".equals(val)) {
            return MathNode.Position.BOTTOM;
        }
        return defaultPosition;
    }

    private Element property(Element element, String propertiesName, String name) {
        Element props = firstChild(element, propertiesName);
        return props != null ? firstChild(props, name) : null;
    }

    // On/off properties are on when present without a value
    private boolean isOn(Element flag) {
        if (flag == null) {
            return false;
        }
        String val = attributeValue(flag);
        return val == null || "1".equals(val) || "on".equals(val) || "true".equals(val);
    }

    private static String attributeValue(Element element) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if ("val".equals(ElementClassifier.localName(attr.getName()))) {
                return attr.getValue();
            }
        }
        return null;
    }

    private static Element firstChild(Element element, String localName) {
        for (Element child : childElements(element)) {
            if (localName.equals(ElementClassifier.localName(tagName(child)))) {
                return child;
            }
        }
        return null;
    }

    private static List<Element> childElements(Element element) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    private static String tagName(Element element) {
        String local = element.getLocalName();
        return local != null ? local : element.getTagName();
    }
}
