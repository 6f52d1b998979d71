package com.lucsartech.tint.imaging;

public class PersistException extends ImageProcessingException {

    public PersistException(String message) {
        super(FailureKind.PERSIST, message);
    }

    public PersistException(String message, Throwable cause) {
        super(FailureKind.PERSIST, message, cause);
    }
}
