package com.dcruver.clippets.pointer;

/**
 * Thrown when an element has no position it could be moved to.
 */
public class CannotMoveException extends RuntimeException {

    public CannotMoveException(String message) {
        super(message);
    }
}
