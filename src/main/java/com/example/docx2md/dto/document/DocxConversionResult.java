package com.example.docx2md.dto.document;

import com.example.docx2md.dto.math.ConversionStatistics;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DocxConversionResult {
    private String markdown;
    private String outputPath;      // null when the markdown was not written to disk
    private String imageDirectory;
    private ConversionStatistics statistics;
}
