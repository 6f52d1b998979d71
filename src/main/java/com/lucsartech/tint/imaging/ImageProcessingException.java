package com.lucsartech.tint.imaging;

import java.util.Objects;

/**
 * Per-item failure raised by a pipeline collaborator.
 * Always contained at the stage that detects it and turned into a failure record.
 */
public class ImageProcessingException extends Exception {

    private final FailureKind kind;

    public ImageProcessingException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Failure kind is required");
    }

    public ImageProcessingException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Failure kind is required");
    }

    public FailureKind kind() {
        return kind;
    }
}
