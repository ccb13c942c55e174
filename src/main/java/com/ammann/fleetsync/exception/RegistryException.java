/* (C)2026 */
package com.ammann.fleetsync.exception;

/** Raised when the registry cannot be reached or answers with something other than a tag list. */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
