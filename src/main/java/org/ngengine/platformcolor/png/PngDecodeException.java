package org.ngengine.platformcolor.png;

/** Thrown when the input is not a supported or valid PNG stream. */
public final class PngDecodeException extends Exception {
    /**
     * Creates a decode exception with a detail message.
     *
     * @param message failure description
     */
    public PngDecodeException(String message) {
        super(message);
    }

    /**
     * Creates a decode exception with a detail message and root cause.
     *
     * @param message failure description
     * @param cause underlying error that triggered decode failure
     */
    public PngDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
