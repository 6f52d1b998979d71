package com.lucsartech.tint.imaging;

/**
 * Input enumeration failed. Fatal: the run is aborted before any stage starts.
 */
public class DiscoveryException extends Exception {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
