package edu.kit.kastel.vads.flowchart.lexer;

import edu.kit.kastel.vads.flowchart.Span;
import edu.kit.kastel.vads.flowchart.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.flowchart.lexer.Separator.SeparatorType;

public sealed interface Token permits Identifier, Keyword, NumberLiteral, Operator, Separator {

    Span span();

    default boolean isKeyword(KeywordType keywordType) {
        return false;
    }

    default boolean isOperator(OperatorType operatorType) {
        return false;
    }

    default boolean isSeparator(SeparatorType separatorType) {
        return false;
    }

    /// The token as it is spelled in the source (keywords and word operators in lower case).
    String asString();
}
