package com.example.docx2md.service.document;

import com.example.docx2md.service.math.OmmlFixtures;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.xmlbeans.XmlCursor;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.imageio.ImageIO;
import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small .docx documents for tests, with OMML formulas written straight into
 * the paragraph XML.
 */
public final class DocxFixtures {

    public static final String FRACTION = "<m:f><m:num>" + OmmlFixtures.run("a") + "</m:num>"
            + "<m:den>" + OmmlFixtures.run("b") + "</m:den></m:f>";

    public static final String IDENTITY_MATRIX = "<m:m>"
            + "<m:mr><m:e>" + OmmlFixtures.run("1") + "</m:e><m:e>" + OmmlFixtures.run("0") + "</m:e></m:mr>"
            + "<m:mr><m:e>" + OmmlFixtures.run("0") + "</m:e><m:e>" + OmmlFixtures.run("1") + "</m:e></m:mr>"
            + "</m:m>";

    private DocxFixtures() {
    }

    /**
     * Heading, a paragraph with an inline fraction, a paragraph with a display matrix
     * between two sentences, a 2x2 table and a picture.
     */
    public static XWPFDocument sampleDocument() throws Exception {
        XWPFDocument document = new XWPFDocument();

        XWPFParagraph heading = document.createParagraph();
        heading.setStyle("Heading1");
        heading.createRun().setText("Results");

        XWPFParagraph inline = document.createParagraph();
        inline.createRun().setText("The ratio is ");
        XWPFRun afterFraction = inline.createRun();
        afterFraction.setText(" overall.");
        insertMath(afterFraction, FRACTION);

        XWPFParagraph display = document.createParagraph();
        display.createRun().setText("Consider");
        XWPFRun afterMatrix = display.createRun();
        afterMatrix.setText("which is the identity.");
        insertMath(afterMatrix, IDENTITY_MATRIX);

        XWPFTable table = document.createTable(2, 2);
        table.getRow(0).getCell(0).setText("Name");
        table.getRow(0).getCell(1).setText("Value");
        table.getRow(1).getCell(0).setText("x");
        table.getRow(1).getCell(1).setText("1|2");

        XWPFParagraph picture = document.createParagraph();
        picture.createRun().addPicture(new ByteArrayInputStream(pngBytes()), Document.PICTURE_TYPE_PNG,
                "dot.png", Units.toEMU(4), Units.toEMU(4));

        return document;
    }

    public static Path write(XWPFDocument document, Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            document.write(out);
        }
        document.close();
        return target;
    }

    public static byte[] toBytes(XWPFDocument document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.write(out);
        document.close();
        return out.toByteArray();
    }

    /**
     * Inserts {@code <m:oMath>body</m:oMath>} in front of {@code run}.
     */
    public static void insertMath(XWPFRun run, String body) {
        Element math = OmmlFixtures.math(body);
        try (XmlCursor cursor = run.getCTR().newCursor()) {
            copy(math, cursor);
        }
    }

    private static void copy(Element source, XmlCursor cursor) {
        cursor.beginElement(new QName(source.getNamespaceURI(), source.getLocalName(), prefix(source)));
        NamedNodeMap attributes = source.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            String ns = attr.getNamespaceURI() != null ? attr.getNamespaceURI() : "";
            cursor.insertAttributeWithValue(new QName(ns, attr.getLocalName(), prefix(attr)), attr.getValue());
        }
        NodeList children = source.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                copy((Element) child, cursor);
            } else if (child.getNodeType() == Node.TEXT_NODE) {
                cursor.insertChars(child.getNodeValue());
            }
        }
        cursor.toNextToken();
    }

    private static String prefix(Node node) {
        return node.getPrefix() != null ? node.getPrefix() : "";
    }

    static byte[] pngBytes() throws IOException {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
