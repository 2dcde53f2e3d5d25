package com.example.docx2md.exception;

/**
 * Unchecked wrapper for failures reading a .docx package or writing its Markdown output.
 */
public class DocumentConversionException extends RuntimeException {

    public DocumentConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
