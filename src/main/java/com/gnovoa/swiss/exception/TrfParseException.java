package com.gnovoa.swiss.exception;

/**
 * Thrown for a TRF16 line that is too short for its layout or carries an unknown code.
 */
public class TrfParseException extends PairingEngineException {
    private final int lineNumber;
    private final String line;

    public TrfParseException(int lineNumber, String line, String reason) {
        super(String.format("TRF line %d: %s [%s]", lineNumber, reason, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
