package com.example.jsoncompare.domain;

/**
 * Raised when raw text cannot be parsed into a {@link JsonValue}.
 */
public class InvalidJsonException extends RuntimeException {
    private final DiffSide side;

    public InvalidJsonException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public InvalidJsonException(DiffSide side, String message, Throwable cause) {
        super(message, cause);
        this.side = side;
    }

    /** Side the text came from, or null when the parser was called outside a comparison. */
    public DiffSide getSide() {
        return side;
    }

    public InvalidJsonException onSide(DiffSide side) {
        return new InvalidJsonException(side, getMessage(), getCause());
    }
}
