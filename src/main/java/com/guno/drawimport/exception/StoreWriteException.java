package com.guno.drawimport.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Persisting the draw store failed. Always fatal for the run.
 */
@Getter
public class StoreWriteException extends RuntimeException {

    private final Path target;

    public StoreWriteException(String message, Path target, Throwable cause) {
        super(message, cause);
        this.target = target;
    }
}
