package edu.kit.kastel.vads.flowchart.lexer;

import java.util.Locale;
import java.util.Optional;

import edu.kit.kastel.vads.flowchart.Span;

public record Operator(OperatorType type, Span span) implements Token {

    @Override
    public boolean isOperator(OperatorType operatorType) {
        return type() == operatorType;
    }

    @Override
    public String asString() {
        return type().toString();
    }

    /// Operators of the source language together with their spelling in the C target.
    public enum OperatorType {
        // Assignment
        ASSIGN(":=", "="),

        // Arithmetic operators
        PLUS("+", "+"),
        MINUS("-", "-"),
        MUL("*", "*"),
        DIVIDE("/", "/"),
        DIV("div", "/"),
        MOD("mod", "%"),

        // Logical operators
        NOT("not", "!"),
        AND("and", "&&"),
        OR("or", "||"),

        // Comparison operators
        EQUAL("=", "=="),
        NOT_EQUAL("<>", "!="),
        LESS("<", "<"),
        LESS_EQUAL("<=", "<="),
        GREATER(">", ">"),
        GREATER_EQUAL(">=", ">=");

        private final String value;
        private final String target;

        OperatorType(String value, String target) {
            this.value = value;
            this.target = target;
        }

        public String target() {
            return this.target;
        }

        public boolean isWord() {
            return Character.isLetter(this.value.charAt(0));
        }

        /// Looks up a word operator (`and`, `or`, `not`, `div`, `mod`) ignoring case.
        public static Optional<OperatorType> fromWord(String word) {
            String lower = word.toLowerCase(Locale.ROOT);
            for (OperatorType type : values()) {
                if (type.isWord() && type.value.equals(lower)) {
                    return Optional.of(type);
                }
            }
            return Optional.empty();
        }

        @Override
        public String toString() {
            return this.value;
        }
    }
}
