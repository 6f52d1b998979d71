package com.lucsartech.tint.imaging;

/**
 * Stage boundary at which an item failed.
 */
public enum FailureKind {
    DECODE("Not a valid or supported image"),
    TRANSFORM("Malformed pixel buffer"),
    PERSIST("Output could not be encoded or written"),
    INTERNAL("Stage terminated before accounting for the item");

    private final String description;

    FailureKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
