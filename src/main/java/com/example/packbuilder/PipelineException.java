package com.example.packbuilder;

import java.io.IOException;

/**
 * Raised when an item of a parallel batch fails; the cause is the original failure.
 */
public class PipelineException extends IOException {
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
