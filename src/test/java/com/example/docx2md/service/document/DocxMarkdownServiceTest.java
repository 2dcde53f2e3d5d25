package com.example.docx2md.service.document;

import com.example.docx2md.dto.document.DocxConversionResult;
import com.example.docx2md.dto.math.ConversionStatistics;
import com.example.docx2md.exception.DocumentConversionException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class DocxMarkdownServiceTest {

    @Autowired
    private DocxMarkdownService docxMarkdownService;

    @TempDir
    Path tempDir;

    @Test
    void convertsSampleDocument() throws Exception {
        Path docx = DocxFixtures.write(DocxFixtures.sampleDocument(), tempDir.resolve("sample.docx"));
        Path output = tempDir.resolve("out/sample.md");
        Path images = tempDir.resolve("images");

        DocxConversionResult result = docxMarkdownService.convert(docx, output, images);

        String markdown = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(markdown).isEqualTo(result.getMarkdown());
        assertThat(markdown.split("\n\n")).startsWith(
                "# Results",
                "The ratio is $ \\frac{a}{b} $ overall.",
                "Consider",
                "$$\n\\begin{matrix}1 & 0 \\\\0 & 1\\end{matrix}\n$$",
                "which is the identity.",
                "| Name | Value |\n|------|-------|\n| x    | 1\\|2  |");

        Path image = images.resolve("image_1.png");
        assertThat(image).exists();
        assertThat(markdown).endsWith("![image_1](" + image.toAbsolutePath().toString().replace('\\', '/') + ")");

        ConversionStatistics statistics = result.getStatistics();
        assertThat(statistics.getInlineCount()).isEqualTo(1);
        assertThat(statistics.getDisplayCount()).isEqualTo(1);
        assertThat(statistics.getTotalFormulas()).isEqualTo(2);
        assertThat(statistics.getImageCount()).isEqualTo(1);
        assertThat(result.getOutputPath()).isEqualTo(output.toAbsolutePath().toString());
    }

    @Test
    void streamConversionDoesNotWriteMarkdown() throws Exception {
        byte[] docx = DocxFixtures.toBytes(DocxFixtures.sampleDocument());

        DocxConversionResult result = docxMarkdownService.convert(new ByteArrayInputStream(docx), tempDir.resolve("img"));

        assertThat(result.getOutputPath()).isNull();
        assertThat(result.getMarkdown()).contains("$ \\frac{a}{b} $");
    }

    @Test
    void documentWithoutFormulas() throws Exception {
        XWPFDocument document = new XWPFDocument();
        document.createParagraph().createRun().setText("Plain   text\twith spacing.");
        document.createParagraph();
        byte[] docx = DocxFixtures.toBytes(document);

        DocxConversionResult result = docxMarkdownService.convert(new ByteArrayInputStream(docx), tempDir);

        assertThat(result.getMarkdown()).isEqualTo("Plain text with spacing.");
        assertThat(result.getStatistics().getTotalFormulas()).isZero();
        assertThat(result.getStatistics().getImageCount()).isZero();
    }

    @Test
    void headingLevelFromStyleId() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph h2 = document.createParagraph();
            h2.setStyle("Heading2");
            XWPFParagraph body = document.createParagraph();
            body.setStyle("BodyText");
            XWPFParagraph unstyled = document.createParagraph();

            assertThat(docxMarkdownService.headingLevel(h2, document)).isEqualTo(2);
            assertThat(docxMarkdownService.headingLevel(body, document)).isZero();
            assertThat(docxMarkdownService.headingLevel(unstyled, document)).isZero();
        }
    }

    @Test
    void rejectsNonDocxInput() {
        byte[] notADocument = "plain text".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> docxMarkdownService.convert(new ByteArrayInputStream(notADocument), tempDir))
                .isInstanceOf(DocumentConversionException.class);
    }
}
