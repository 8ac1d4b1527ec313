package edu.kit.kastel.vads.flowchart.lexer;

import java.util.Optional;

import edu.kit.kastel.vads.flowchart.Position;
import edu.kit.kastel.vads.flowchart.Span;
import edu.kit.kastel.vads.flowchart.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.flowchart.lexer.Separator.SeparatorType;

/// Splits source text into tokens on demand. Whitespace and `{ ... }` comments are skipped.
public class Lexer {
    private final String source;
    private int pos;
    private int lineStart;
    private int line = 1;

    private Lexer(String source) {
        this.source = source;
    }

    public static Lexer forString(String source) {
        return new Lexer(source);
    }

    /// Returns the next token, or an empty optional once the input is exhausted.
    ///
    /// @throws LexException if the next character starts no token
    public Optional<Token> nextToken() {
        skipWhitespaceAndComments();
        if (this.pos >= this.source.length()) {
            return Optional.empty();
        }
        char c = peek();
        Token t = switch (c) {
            case '(' -> separator(SeparatorType.PAREN_OPEN);
            case ')' -> separator(SeparatorType.PAREN_CLOSE);
            case ';' -> separator(SeparatorType.SEMICOLON);
            case ',' -> separator(SeparatorType.COMMA);
            case '.' -> separator(SeparatorType.DOT);
            case ':' -> hasMore(1) && peek(1) == '='
                ? new Operator(OperatorType.ASSIGN, buildSpan(2))
                : separator(SeparatorType.COLON);
            case '+' -> new Operator(OperatorType.PLUS, buildSpan(1));
            case '-' -> new Operator(OperatorType.MINUS, buildSpan(1));
            case '*' -> new Operator(OperatorType.MUL, buildSpan(1));
            case '/' -> new Operator(OperatorType.DIVIDE, buildSpan(1));
            case '=' -> new Operator(OperatorType.EQUAL, buildSpan(1));
            case '<' -> lexLess();
            case '>' -> hasMore(1) && peek(1) == '='
                ? new Operator(OperatorType.GREATER_EQUAL, buildSpan(2))
                : new Operator(OperatorType.GREATER, buildSpan(1));
            default -> {
                if (isDigit(c)) {
                    yield lexNumber();
                }
                if (isIdentifierStart(c)) {
                    yield lexIdentifierOrKeyword();
                }
                throw new LexException("illegal character '" + c + "'", c, currentPosition());
            }
        };
        return Optional.of(t);
    }

    /// The position just behind the last character, used to report a premature end of input.
    public Position endPosition() {
        return new Position.SimplePosition(this.line, this.source.length() - this.lineStart + 1);
    }

    private void skipWhitespaceAndComments() {
        while (hasMore(0)) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r' -> this.pos++;
                case '\n' -> {
                    this.pos++;
                    this.lineStart = this.pos;
                    this.line++;
                }
                case '{' -> skipComment();
                default -> {
                    return;
                }
            }
        }
    }

    private void skipComment() {
        Position commentStart = currentPosition();
        int closing = this.source.indexOf('}', this.pos + 1);
        if (closing < 0) {
            throw new LexException("unterminated comment", '{', commentStart);
        }
        while (this.pos <= closing) {
            if (this.source.charAt(this.pos) == '\n') {
                this.lineStart = this.pos + 1;
                this.line++;
            }
            this.pos++;
        }
    }

    private Operator lexLess() {
        if (hasMore(1)) {
            if (peek(1) == '=') {
                return new Operator(OperatorType.LESS_EQUAL, buildSpan(2));
            }
            if (peek(1) == '>') {
                return new Operator(OperatorType.NOT_EQUAL, buildSpan(2));
            }
        }
        return new Operator(OperatorType.LESS, buildSpan(1));
    }

    private Separator separator(SeparatorType type) {
        return new Separator(type, buildSpan(1));
    }

    private Token lexIdentifierOrKeyword() {
        int off = 1;
        while (hasMore(off) && isIdentifierPart(peek(off))) {
            off++;
        }
        String id = this.source.substring(this.pos, this.pos + off);
        Optional<KeywordType> keyword = KeywordType.fromString(id);
        if (keyword.isPresent()) {
            return new Keyword(keyword.get(), buildSpan(off));
        }
        Optional<OperatorType> operator = OperatorType.fromWord(id);
        if (operator.isPresent()) {
            return new Operator(operator.get(), buildSpan(off));
        }
        return new Identifier(id, buildSpan(off));
    }

    private Token lexNumber() {
        int off = 1;
        while (hasMore(off) && isDigit(peek(off))) {
            off++;
        }
        boolean real = false;
        // a dot without a digit behind it is a separator, e.g. the one after the final "end"
        if (hasMore(off + 1) && peek(off) == '.' && isDigit(peek(off + 1))) {
            real = true;
            off += 2;
            while (hasMore(off) && isDigit(peek(off))) {
                off++;
            }
        }
        String value = this.source.substring(this.pos, this.pos + off);
        return new NumberLiteral(value, real, buildSpan(off));
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private Position currentPosition() {
        return new Position.SimplePosition(this.line, this.pos - this.lineStart + 1);
    }

    private Span buildSpan(int proceed) {
        Position start = currentPosition();
        this.pos += proceed;
        Position end = new Position.SimplePosition(this.line, start.column() + proceed);
        return new Span.SimpleSpan(start, end);
    }

    private char peek() {
        return this.source.charAt(this.pos);
    }

    private boolean hasMore(int offset) {
        return this.pos + offset < this.source.length();
    }

    private char peek(int offset) {
        return this.source.charAt(this.pos + offset);
    }
}
