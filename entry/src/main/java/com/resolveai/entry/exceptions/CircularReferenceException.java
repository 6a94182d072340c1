package com.resolveai.entry.exceptions;

/**
 * Thrown when a structured payload refers back to one of its own enclosing containers and circular references were
 * not asked to be removed.
 */
public class CircularReferenceException extends RuntimeException {

    public CircularReferenceException(String path) {
        super("This object contains a circular reference at '" + path
                + "'. To automatically remove it, set the removeCircular option to true.");
    }
}
