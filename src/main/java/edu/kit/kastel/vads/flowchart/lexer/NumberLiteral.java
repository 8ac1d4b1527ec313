package edu.kit.kastel.vads.flowchart.lexer;

import java.math.BigDecimal;
import java.math.BigInteger;

import edu.kit.kastel.vads.flowchart.Span;

/// An integer (`42`) or real (`3.14`) literal. Reals always carry digits on both sides of the point.
public record NumberLiteral(String value, boolean real, Span span) implements Token {

    @Override
    public String asString() {
        return value();
    }

    /// The literal in canonical form: `007` becomes `7`, `1.50` becomes `1.5`, `3.00` becomes `3.0`.
    /// Reals are never written with an exponent.
    public String canonical() {
        if (real()) {
            String plain = new BigDecimal(value()).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
        return new BigInteger(value()).toString();
    }
}
