package edu.kit.kastel.vads.flowchart.parser;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.Position;

public class ParseException extends RuntimeException {
    private final @Nullable Position position;

    public ParseException(String message) {
        super(message);
        this.position = null;
    }

    public ParseException(String message, Position position) {
        super(message + " at " + position);
        this.position = position;
    }

    public @Nullable Position position() {
        return position;
    }
}
