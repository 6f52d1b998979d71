package com.lucsartech.tint.transform;

import java.awt.image.BufferedImage;

/**
 * Pure pixel-space mapping. Implementations return a new image and never modify the input.
 */
@FunctionalInterface
public interface ImageTransform {

    BufferedImage apply(BufferedImage source) throws TransformException;

    default ImageTransform andThen(ImageTransform next) {
        return source -> next.apply(apply(source));
    }
}
