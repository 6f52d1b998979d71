package com.lucsartech.tint.imaging;

public class DecodeException extends ImageProcessingException {

    public DecodeException(String message) {
        super(FailureKind.DECODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(FailureKind.DECODE, message, cause);
    }
}
