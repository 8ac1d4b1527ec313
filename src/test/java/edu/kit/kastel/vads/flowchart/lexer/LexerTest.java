package edu.kit.kastel.vads.flowchart.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.flowchart.Position;
import edu.kit.kastel.vads.flowchart.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.flowchart.lexer.Separator.SeparatorType;

class LexerTest {

    private static List<Token> lexAll(String source) {
        Lexer lexer = Lexer.forString(source);
        List<Token> tokens = new ArrayList<>();
        Optional<Token> token;
        while ((token = lexer.nextToken()).isPresent()) {
            tokens.add(token.get());
        }
        return tokens;
    }

    private static List<String> spellings(String source) {
        List<String> spellings = new ArrayList<>();
        for (Token token : lexAll(source)) {
            spellings.add(token.asString());
        }
        return spellings;
    }

    @Test
    void splitsAssignmentWithoutWhitespace() {
        List<Token> tokens = lexAll("a:=b;");
        assertEquals(4, tokens.size());
        assertInstanceOf(Identifier.class, tokens.get(0));
        assertTrue(tokens.get(1).isOperator(OperatorType.ASSIGN));
        assertInstanceOf(Identifier.class, tokens.get(2));
        assertTrue(tokens.get(3).isSeparator(SeparatorType.SEMICOLON));
    }

    @Test
    void colonWithoutEqualsIsASeparator() {
        List<Token> tokens = lexAll("x : integer");
        assertTrue(tokens.get(1).isSeparator(SeparatorType.COLON));
        assertTrue(tokens.get(2).isKeyword(KeywordType.INTEGER));
    }

    @Test
    void recognizesTwoCharacterComparisons() {
        List<Token> tokens = lexAll("<> <= >= < > =");
        assertTrue(tokens.get(0).isOperator(OperatorType.NOT_EQUAL));
        assertTrue(tokens.get(1).isOperator(OperatorType.LESS_EQUAL));
        assertTrue(tokens.get(2).isOperator(OperatorType.GREATER_EQUAL));
        assertTrue(tokens.get(3).isOperator(OperatorType.LESS));
        assertTrue(tokens.get(4).isOperator(OperatorType.GREATER));
        assertTrue(tokens.get(5).isOperator(OperatorType.EQUAL));
    }

    @Test
    void keywordsAndWordOperatorsIgnoreCase() {
        List<Token> tokens = lexAll("BEGIN While x DIV y And Not z eNd");
        assertTrue(tokens.get(0).isKeyword(KeywordType.BEGIN));
        assertTrue(tokens.get(1).isKeyword(KeywordType.WHILE));
        assertTrue(tokens.get(3).isOperator(OperatorType.DIV));
        assertTrue(tokens.get(5).isOperator(OperatorType.AND));
        assertTrue(tokens.get(6).isOperator(OperatorType.NOT));
        assertTrue(tokens.get(8).isKeyword(KeywordType.END));
        assertEquals(List.of("begin", "while", "x", "div", "y", "and", "not", "z", "end"),
            spellings("BEGIN While x DIV y And Not z eNd"));
    }

    @Test
    void identifiersKeepTheirCase() {
        Identifier identifier = assertInstanceOf(Identifier.class, lexAll("Counter_2").get(0));
        assertEquals("Counter_2", identifier.value());
    }

    @Test
    void finalDotIsNotPartOfANumber() {
        List<Token> tokens = lexAll("1.");
        NumberLiteral literal = assertInstanceOf(NumberLiteral.class, tokens.get(0));
        assertFalse(literal.real());
        assertEquals("1", literal.value());
        assertTrue(tokens.get(1).isSeparator(SeparatorType.DOT));
    }

    @Test
    void readsRealLiterals() {
        NumberLiteral literal = assertInstanceOf(NumberLiteral.class, lexAll("3.14").get(0));
        assertTrue(literal.real());
        assertEquals("3.14", literal.value());
    }

    @Test
    void canonicalNumbersDropRedundantDigits() {
        assertEquals("7", ((NumberLiteral) lexAll("007").get(0)).canonical());
        assertEquals("1.5", ((NumberLiteral) lexAll("1.50").get(0)).canonical());
    }

    @Test
    void canonicalRealsAvoidExponents() {
        assertEquals("12345678.0", ((NumberLiteral) lexAll("12345678.0").get(0)).canonical());
        assertEquals("0.0001", ((NumberLiteral) lexAll("0.0001").get(0)).canonical());
        assertEquals("3.0", ((NumberLiteral) lexAll("3.00").get(0)).canonical());
        assertEquals("100.0", ((NumberLiteral) lexAll("100.0").get(0)).canonical());
        assertEquals("0.0", ((NumberLiteral) lexAll("0.0").get(0)).canonical());
    }

    @Test
    void skipsCommentsAndTracksLines() {
        List<Token> tokens = lexAll("{ first\n  second }\n  x");
        assertEquals(1, tokens.size());
        Position start = tokens.get(0).span().start();
        assertEquals(3, start.line());
        assertEquals(3, start.column());
    }

    @Test
    void spansCoverTheToken() {
        Token token = lexAll("  foo").get(0);
        assertEquals("1:3", token.span().start().toString());
        assertEquals("1:6", token.span().end().toString());
    }

    @Test
    void illegalCharacterReportsPosition() {
        LexException exception = assertThrows(LexException.class, () -> lexAll("begin\n  a := 1 #\nend."));
        assertEquals('#', exception.character());
        assertEquals(2, exception.position().line());
        assertEquals(10, exception.position().column());
        assertTrue(exception.getMessage().contains("'#'"));
    }

    @Test
    void unterminatedCommentIsRejected() {
        LexException exception = assertThrows(LexException.class, () -> lexAll("a { never closed"));
        assertEquals('{', exception.character());
        assertEquals(3, exception.position().column());
    }

    @Test
    void emptyInputHasNoTokens() {
        assertTrue(lexAll("  \n\t ").isEmpty());
    }
}
