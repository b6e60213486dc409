package org.pragmatica.blatte.runtime;

/**
 * Failure while running generated code: undefined variable, argument count mismatch.
 */
public final class BlatteRuntimeException extends RuntimeException {
    public BlatteRuntimeException(String message) {
        super(message);
    }
}
