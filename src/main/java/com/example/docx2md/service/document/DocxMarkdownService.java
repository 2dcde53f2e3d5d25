package com.example.docx2md.service.document;

import com.example.docx2md.dto.document.DocxConversionResult;
import com.example.docx2md.dto.math.ConversionStatistics;
import com.example.docx2md.dto.math.ConvertedFormula;
import com.example.docx2md.exception.DocumentConversionException;
import com.example.docx2md.service.math.FormulaConversionSession;
import com.example.docx2md.service.math.MathConversionService;
import com.example.docx2md.service.math.OmmlTreeReader;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFPictureData;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a .docx document to Markdown: paragraphs and tables in document order,
 * OMML formulas as LaTeX, embedded pictures saved next to the output.
 */
@Service
public class DocxMarkdownService {

    private static final Logger logger = LoggerFactory.getLogger(DocxMarkdownService.class);

    static final String WORD_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    static final String DRAWING_NS = "http://schemas.openxmlformats.org/drawingml/2006/main";
    static final String RELATIONSHIPS_NS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    private static final Pattern HEADING_STYLE = Pattern.compile("(?i)^heading\\s*(\\d)?");

    // Content that is not part of the linear text flow
    private static final Set<String> SKIPPED_WORD_ELEMENTS = Set.of(
            "pPr", "rPr", "drawing", "pict", "object", "txbxContent",
            "footnoteReference", "endnoteReference", "instrText", "delText");

    @Autowired
    private MathConversionService mathConversionService;

    @Autowired
    private ImageExtractionService imageExtractionService;

    @Autowired
    private MarkdownTableRenderer tableRenderer;

    /**
     * Converts {@code docx} and writes the Markdown to {@code output} (UTF-8).
     */
    public DocxConversionResult convert(Path docx, Path output, Path imageDir) {
        logger.info("Converting {} to {}", docx, output);
        DocxConversionResult result;
        try (InputStream in = Files.newInputStream(docx)) {
            result = convert(in, imageDir);
        } catch (IOException e) {
            throw new DocumentConversionException("Could not read " + docx + ": " + e.getMessage(), e);
        }

        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, result.getMarkdown(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocumentConversionException("Could not write " + output + ": " + e.getMessage(), e);
        }
        result.setOutputPath(output.toAbsolutePath().toString());
        logger.info("Markdown file saved to: {}", result.getOutputPath());
        return result;
    }

    /**
     * Converts a .docx stream; the Markdown is returned, only images are written.
     */
    public DocxConversionResult convert(InputStream docx, Path imageDir) {
        try (XWPFDocument document = new XWPFDocument(docx)) {
            DocumentContext context = new DocumentContext(document, imageDir, mathConversionService.openSession());

            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph) {
                    processParagraph((XWPFParagraph) element, context);
                } else if (element instanceof XWPFTable) {
                    String table = tableRenderer.render(tableCells((XWPFTable) element));
                    if (!table.isEmpty()) {
                        context.blocks.add(table);
                    }
                } else {
                    logger.debug("Skipping body element of type {}", element.getElementType());
                }
            }

            ConversionStatistics statistics = context.session.getStatistics(context.imageCount);
            logSummary(imageDir, statistics);
            return new DocxConversionResult(
                    String.join("\n\n", context.blocks),
                    null,
                    imageDir.toAbsolutePath().toString(),
                    statistics);
        } catch (IOException e) {
            throw new DocumentConversionException("Could not read document: " + e.getMessage(), e);
        } catch (UnsupportedFileFormatException | POIXMLException e) {
            throw new DocumentConversionException("Not a .docx document: " + e.getMessage(), e);
        }
    }

    private void processParagraph(XWPFParagraph paragraph, DocumentContext context) {
        int headingLevel = headingLevel(paragraph, context.document);
        if (headingLevel > 0) {
            String text = StringUtils.normalizeSpace(paragraph.getText());
            if (StringUtils.isNotEmpty(text)) {
                context.blocks.add(StringUtils.repeat('#', headingLevel) + " " + text);
                return;
            }
        }

        ParagraphBuilder builder = new ParagraphBuilder(context);
        builder.walk((Element) paragraph.getCTP().getDomNode());
        builder.flush();

        for (String embedId : embeddedImageIds((Element) paragraph.getCTP().getDomNode())) {
            XWPFPictureData picture = context.document.getPictureDataByID(embedId);
            if (picture == null) {
                logger.warn("No picture found for relationship {}", embedId);
                continue;
            }
            int imageId = context.imageCount + 1;
            Path saved = imageExtractionService.saveImage(picture, context.imageDir, imageId);
            if (saved != null) {
                context.blocks.add(imageExtractionService.toMarkdown(saved, imageId));
                context.imageCount = imageId;
            }
        }
    }

    int headingLevel(XWPFParagraph paragraph, XWPFDocument document) {
        String styleId = paragraph.getStyle();
        if (styleId == null) {
            return 0;
        }
        String styleName = styleId;
        if (document.getStyles() != null) {
            XWPFStyle style = document.getStyles().getStyle(styleId);
            if (style != null && style.getName() != null) {
                styleName = style.getName();
            }
        }
        Matcher m = HEADING_STYLE.matcher(styleName);
        if (!m.find()) {
            m = HEADING_STYLE.matcher(styleId);
            if (!m.find()) {
                return 0;
            }
        }
        return m.group(1) != null ? Integer.parseInt(m.group(1)) : 1;
    }

    private List<List<String>> tableCells(XWPFTable table) {
        List<List<String>> rows = new ArrayList<>();
        for (XWPFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
                cells.add(cell.getText());
            }
            rows.add(cells);
        }
        return rows;
    }

    // Choice and fallback branches of mc:AlternateContent may reference the same picture
    private Set<String> embeddedImageIds(Element paragraph) {
        Set<String> ids = new LinkedHashSet<>();
        NodeList blips = paragraph.getElementsByTagNameNS(DRAWING_NS, "blip");
        for (int i = 0; i < blips.getLength(); i++) {
            String id = ((Element) blips.item(i)).getAttributeNS(RELATIONSHIPS_NS, "embed");
            if (StringUtils.isNotEmpty(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    private void logSummary(Path imageDir, ConversionStatistics statistics) {
        logger.info("Images saved to: {}/", imageDir);
        logger.info("Total images found: {}", statistics.getImageCount());
        logger.info("Conversion Statistics: inline formulas={}, display formulas={}, total formulas={}",
                statistics.getInlineCount(), statistics.getDisplayCount(), statistics.getTotalFormulas());
        if (statistics.getFallbackCount() > 0) {
            logger.warn("{} formula(s) could not be converted and were replaced by {}",
                    statistics.getFallbackCount(), ConvertedFormula.PLACEHOLDER);
        }
    }

    private static final class DocumentContext {
        private final XWPFDocument document;
        private final Path imageDir;
        private final FormulaConversionSession session;
        private final List<String> blocks = new ArrayList<>();
        private int imageCount;

        private DocumentContext(XWPFDocument document, Path imageDir, FormulaConversionSession session) {
            this.document = document;
            this.imageDir = imageDir;
            this.session = session;
        }
    }

    /**
     * Collects the text flow of one paragraph. Inline formulas stay in the flow,
     * display formulas close the current text block and stand on their own.
     */
    private static final class ParagraphBuilder {
        private final DocumentContext context;
        private final StringBuilder text = new StringBuilder();

        private ParagraphBuilder(DocumentContext context) {
            this.context = context;
        }

        void walk(Element element) {
            NodeList nodes = element.getChildNodes();
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                if (node.getNodeType() != Node.ELEMENT_NODE) {
                    continue;
                }
                Element child = (Element) node;
                String ns = child.getNamespaceURI();
                String local = child.getLocalName();

                if (OmmlTreeReader.MATH_NS.equals(ns) && "oMathPara".equals(local)) {
                    walk(child);
                } else if (OmmlTreeReader.MATH_NS.equals(ns) && "oMath".equals(local)) {
                    addFormula(context.session.convertFormula(child));
                } else if (WORD_NS.equals(ns) && "t".equals(local)) {
                    text.append(child.getTextContent());
                } else if (WORD_NS.equals(ns) && ("tab".equals(local) || "br".equals(local) || "cr".equals(local))) {
                    text.append(' ');
                } else if (WORD_NS.equals(ns) && SKIPPED_WORD_ELEMENTS.contains(local)) {
                    continue;
                } else if ("AlternateContent".equals(local)) {
                    continue;
                } else {
                    walk(child);
                }
            }
        }

        private void addFormula(ConvertedFormula formula) {
            if (formula.getLatex().isEmpty()) {
                return;
            }
            if (formula.isDisplay()) {
                flush();
                context.blocks.add(formula.toMarkdown());
            } else {
                text.append(' ').append(formula.toMarkdown()).append(' ');
            }
        }

        void flush() {
            String flow = StringUtils.normalizeSpace(text.toString());
            if (StringUtils.isNotEmpty(flow)) {
                context.blocks.add(flow);
            }
            text.setLength(0);
        }
    }
}
