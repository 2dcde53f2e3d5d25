package com.example.docx2md.cli;

import com.example.docx2md.config.OutputStorageConfig;
import com.example.docx2md.dto.document.DocxConversionResult;
import com.example.docx2md.dto.math.ConversionStatistics;
import com.example.docx2md.service.document.DocxMarkdownService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry: {@code input.docx [--output=out.md] [--image-dir=images]}.
 * Does nothing when started without a document argument.
 */
@Component
public class DocxToMarkdownRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DocxToMarkdownRunner.class);

    static final String OUTPUT_SUFFIX = "_with_formulas.md";

    @Autowired
    private DocxMarkdownService docxMarkdownService;

    @Autowired
    private OutputStorageConfig storageConfig;

    private PrintStream out = System.out;

    @Override
    public void run(ApplicationArguments args) {
        List<String> inputs = args.getNonOptionArgs();
        if (inputs.isEmpty()) {
            return;
        }
        Path input = Paths.get(inputs.get(0));
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Input file not found: " + input);
        }
        if (inputs.size() > 1) {
            logger.warn("Only the first document is converted, ignoring {}", inputs.subList(1, inputs.size()));
        }

        Path output = Paths.get(optionValue(args, "output", defaultOutput(input).toString()));
        Path imageDir = Paths.get(optionValue(args, "image-dir", storageConfig.getImageDir().toString()));

        DocxConversionResult result = docxMarkdownService.convert(input, output, imageDir);
        printSummary(result);
    }

    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        String base = StringUtils.removeEndIgnoreCase(name, ".docx");
        return input.resolveSibling(base + OUTPUT_SUFFIX);
    }

    private String optionValue(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || StringUtils.isBlank(values.get(0))) {
            return defaultValue;
        }
        return values.get(0);
    }

    private void printSummary(DocxConversionResult result) {
        ConversionStatistics statistics = result.getStatistics();
        out.println("Markdown file saved to: " + result.getOutputPath());
        out.println("Images saved to: " + result.getImageDirectory() + "/");
        out.println("Total images found: " + statistics.getImageCount());
        out.println();
        out.println("Conversion Statistics:");
        out.println("  Inline formulas: " + statistics.getInlineCount());
        out.println("  Display formulas: " + statistics.getDisplayCount());
        out.println("  Total formulas: " + statistics.getTotalFormulas());
        if (statistics.getFallbackCount() > 0) {
            out.println("  Unconverted formulas: " + statistics.getFallbackCount());
        }
    }

    void setOut(PrintStream out) {
        this.out = out;
    }
}
