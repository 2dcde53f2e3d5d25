package com.example.docx2md.controller;

import com.example.docx2md.config.OutputStorageConfig;
import com.example.docx2md.dto.document.DocxConversionResult;
import com.example.docx2md.exception.DocumentConversionException;
import com.example.docx2md.service.document.DocxMarkdownService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/conversions")
public class ConversionController {

    private static final Logger logger = LoggerFactory.getLogger(ConversionController.class);

    @Autowired
    private DocxMarkdownService docxMarkdownService;

    @Autowired
    private OutputStorageConfig storageConfig;

    @PostMapping
    public ResponseEntity<?> convertDocument(@RequestParam("file") MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (file.isEmpty() || fileName == null || !fileName.toLowerCase().endsWith(".docx")) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "Only .docx files are supported"));
        }

        // Each upload gets its own image folder so numbering never collides
        Path imageDir = storageConfig.getImageDir().resolve(UUID.randomUUID().toString());
        logger.info("=== CONVERSION REQUEST for {} ({} bytes) ===", fileName, file.getSize());

        try (InputStream in = file.getInputStream()) {
            DocxConversionResult result = docxMarkdownService.convert(in, imageDir);
            return ResponseEntity.ok(result);
        } catch (DocumentConversionException | IOException e) {
            logger.error("Error converting {}: {}", fileName, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage() != null ? e.getMessage() : "Internal server error"));
        }
    }
}
