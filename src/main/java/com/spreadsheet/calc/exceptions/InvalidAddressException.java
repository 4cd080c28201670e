package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a caller passes a malformed cell address, e.g. "A0" or "1A".
 */
public class InvalidAddressException extends RuntimeException {
    public InvalidAddressException(String message) {
        super(message);
    }
}
