package com.example.docx2md.exception;

import com.example.docx2md.dto.math.NodeKind;

/**
 * Raised inside the math engine when a node cannot be rendered by any template,
 * e.g. its children do not match the arity of its kind. The conversion service
 * catches it and substitutes the placeholder for that one formula.
 */
public class MathConversionException extends RuntimeException {

    private final NodeKind kind;

    public MathConversionException(String message, NodeKind kind) {
        super(message);
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }
}
