package com.lucsartech.tint.transform;

import com.lucsartech.tint.imaging.FailureKind;
import com.lucsartech.tint.imaging.ImageProcessingException;

public class TransformException extends ImageProcessingException {

    public TransformException(String message) {
        super(FailureKind.TRANSFORM, message);
    }

    public TransformException(String message, Throwable cause) {
        super(FailureKind.TRANSFORM, message, cause);
    }
}
