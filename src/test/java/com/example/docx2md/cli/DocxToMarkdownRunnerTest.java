package com.example.docx2md.cli;

import com.example.docx2md.service.document.DocxFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class DocxToMarkdownRunnerTest {

    @Autowired
    private DocxToMarkdownRunner runner;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    @AfterEach
    void restoreConsole() {
        runner.setOut(System.out);
    }

    @Test
    void writesNextToInputByDefault() throws Exception {
        Path docx = DocxFixtures.write(DocxFixtures.sampleDocument(), tempDir.resolve("report.docx"));
        runner.setOut(new PrintStream(console, true, StandardCharsets.UTF_8));

        runner.run(new DefaultApplicationArguments(docx.toString(), "--image-dir=" + tempDir.resolve("pics")));

        Path output = tempDir.resolve("report_with_formulas.md");
        assertThat(output).exists();
        assertThat(Files.readString(output)).contains("$ \\frac{a}{b} $");
        assertThat(tempDir.resolve("pics/image_1.png")).exists();
        assertThat(console.toString(StandardCharsets.UTF_8))
                .contains("Inline formulas: 1")
                .contains("Display formulas: 1")
                .contains("Total formulas: 2")
                .contains("Total images found: 1");
    }

    @Test
    void honoursOutputOption() throws Exception {
        Path docx = DocxFixtures.write(DocxFixtures.sampleDocument(), tempDir.resolve("a.docx"));
        Path output = tempDir.resolve("md/custom.md");
        runner.setOut(new PrintStream(console, true, StandardCharsets.UTF_8));

        runner.run(new DefaultApplicationArguments(docx.toString(), "--output=" + output,
                "--image-dir=" + tempDir.resolve("img")));

        assertThat(output).exists();
        assertThat(console.toString(StandardCharsets.UTF_8)).contains(output.toAbsolutePath().toString());
    }

    @Test
    void noArgumentsDoesNothing() {
        runner.run(new DefaultApplicationArguments());
    }

    @Test
    void missingInputFails() {
        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments(tempDir.resolve("nope.docx").toString())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope.docx");
    }

    @Test
    void defaultOutputName() {
        assertThat(DocxToMarkdownRunner.defaultOutput(Path.of("/docs/Paper.DOCX")))
                .isEqualTo(Path.of("/docs/Paper_with_formulas.md"));
    }
}
