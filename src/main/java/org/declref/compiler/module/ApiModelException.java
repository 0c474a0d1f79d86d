package org.declref.compiler.module;

/**
 * Thrown when an API model file is structurally invalid.
 */
public class ApiModelException extends RuntimeException {

    public ApiModelException(String message) {
        super(message);
    }

    public ApiModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
