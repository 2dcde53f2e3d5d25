package com.example.docx2md.service.document;

import org.apache.commons.lang3.StringUtils;
import org.apache.poi.xwpf.usermodel.XWPFPictureData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes pictures embedded in a document to the image directory as {@code image_<n>.<ext>}.
 */
@Service
public class ImageExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(ImageExtractionService.class);

    private static final String DEFAULT_EXTENSION = "png";

    /**
     * @return the written file, or {@code null} when the picture could not be saved
     */
    public Path saveImage(XWPFPictureData picture, Path imageDir, int imageId) {
        try {
            String extension = picture.suggestFileExtension();
            if (StringUtils.isBlank(extension)) {
                extension = DEFAULT_EXTENSION;
            }
            Files.createDirectories(imageDir);
            Path target = imageDir.resolve("image_" + imageId + "." + extension);
            Files.write(target, picture.getData());
            logger.debug("Saved image {} ({} bytes)", target, picture.getData().length);
            return target;
        } catch (IOException e) {
            logger.error("Error extracting image {}: {}", imageId, e.getMessage());
            return null;
        }
    }

    /**
     * Markdown reference to a saved image, with an absolute path using forward slashes.
     */
    public String toMarkdown(Path image, int imageId) {
        String path = image.toAbsolutePath().toString().replace('\\', '/');
        return "![image_" + imageId + "](" + path + ")";
    }
}
