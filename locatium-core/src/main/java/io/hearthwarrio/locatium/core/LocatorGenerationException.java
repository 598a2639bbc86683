package io.hearthwarrio.locatium.core;

/**
 * Thrown when locators cannot be generated for a requested element.
 */
public class LocatorGenerationException extends RuntimeException {
    public LocatorGenerationException(String message) {
        super(message);
    }

    public LocatorGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
