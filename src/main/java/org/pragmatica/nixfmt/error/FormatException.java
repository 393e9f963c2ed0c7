package org.pragmatica.nixfmt.error;

/**
 * Thrown when the input cannot be formatted because it does not parse.
 */
public final class FormatException extends RuntimeException {
    private final ParseError error;

    public FormatException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
