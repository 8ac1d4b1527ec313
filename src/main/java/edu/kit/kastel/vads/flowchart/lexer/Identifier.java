package edu.kit.kastel.vads.flowchart.lexer;

import edu.kit.kastel.vads.flowchart.Span;

public record Identifier(String value, Span span) implements Token {
    @Override
    public String asString() {
        return value();
    }
}
