package edu.kit.kastel.vads.flowchart.lexer;

import edu.kit.kastel.vads.flowchart.Position;

/// Thrown when the source contains a character that starts no token.
public class LexException extends RuntimeException {
    private final char character;
    private final Position position;

    public LexException(String message, char character, Position position) {
        super(message + " at " + position);
        this.character = character;
        this.position = position;
    }

    public char character() {
        return character;
    }

    public Position position() {
        return position;
    }
}
