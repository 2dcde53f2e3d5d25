package com.example.docx2md.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Default location of extracted images. The command line can override it per run;
 * uploads get a subdirectory each.
 */
@Configuration
public class OutputStorageConfig {

    @Value("${docx2md.output.image-dir:images}")
    private String imageDir;

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(getImageDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create image directory " + imageDir, e);
        }
    }

    public Path getImageDir() {
        return Paths.get(imageDir);
    }
}
