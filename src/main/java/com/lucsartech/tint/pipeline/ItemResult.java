package com.lucsartech.tint.pipeline;

import com.lucsartech.tint.imaging.FailureKind;
import com.lucsartech.tint.imaging.ImageProcessingException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Terminal outcome of one source file.
 * Sealed interface for type-safe success/failure handling.
 */
public sealed interface ItemResult {

    Path source();

    default String sourceIdentifier() {
        return source().getFileName().toString();
    }

    record Success(
            Path source,
            Path output,
            Duration processingTime
    ) implements ItemResult {
    }

    record Failure(
            Path source,
            FailureKind kind,
            String errorMessage,
            Optional<Throwable> cause
    ) implements ItemResult {

        public static Failure of(Path source, ImageProcessingException e) {
            return new Failure(source, e.kind(), e.getMessage(), Optional.of(e));
        }

        public static Failure of(Path source, FailureKind kind, Throwable cause) {
            return new Failure(source, kind, String.valueOf(cause.getMessage()), Optional.of(cause));
        }

        public static Failure of(Path source, FailureKind kind, String message) {
            return new Failure(source, kind, message, Optional.empty());
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default Optional<Success> asSuccess() {
        return this instanceof Success s ? Optional.of(s) : Optional.empty();
    }

    default Optional<Failure> asFailure() {
        return this instanceof Failure f ? Optional.of(f) : Optional.empty();
    }
}
