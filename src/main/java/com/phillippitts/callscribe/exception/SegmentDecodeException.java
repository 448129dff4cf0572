package com.phillippitts.callscribe.exception;

/**
 * Thrown when a captured PCM segment cannot be turned into engine-ready audio.
 */
public class SegmentDecodeException extends CallScribeException {

    public SegmentDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
