package edu.kit.kastel.vads.flowchart.lexer;

import edu.kit.kastel.vads.flowchart.Span;

public record Keyword(KeywordType type, Span span) implements Token {
    @Override
    public boolean isKeyword(KeywordType keywordType) {
        return type() == keywordType;
    }

    @Override
    public String asString() {
        return type().keyword();
    }
}
