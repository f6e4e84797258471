package com.playfactory.core.error;

/**
 * Thrown when a request is malformed or oversized. Nothing has been changed when this is thrown.
 */
public class InvalidInputException extends GameFactoryException {
    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
