package edu.kit.kastel.vads.flowchart.parser;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.lexer.Identifier;
import edu.kit.kastel.vads.flowchart.lexer.Keyword;
import edu.kit.kastel.vads.flowchart.lexer.KeywordType;
import edu.kit.kastel.vads.flowchart.lexer.Lexer;
import edu.kit.kastel.vads.flowchart.lexer.Operator;
import edu.kit.kastel.vads.flowchart.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.flowchart.lexer.Separator;
import edu.kit.kastel.vads.flowchart.lexer.Separator.SeparatorType;
import edu.kit.kastel.vads.flowchart.lexer.Token;

/// Pulls tokens from a [Lexer] with one token of lookahead. Consumed tokens are not kept.
public class TokenSource {
    private final Lexer lexer;
    private @Nullable Token lookahead;

    public TokenSource(Lexer lexer) {
        this.lexer = lexer;
    }

    public boolean hasMore() {
        return fill() != null;
    }

    public Token peek() {
        Token token = fill();
        if (token == null) {
            throw new ParseException("unexpected end of input", this.lexer.endPosition());
        }
        return token;
    }

    public Token consume() {
        Token token = peek();
        this.lookahead = null;
        return token;
    }

    public Keyword expectKeyword(KeywordType type) {
        Token token = peek();
        if (!(token instanceof Keyword kw) || kw.type() != type) {
            throw unexpected(token, "keyword '" + type + "'");
        }
        this.lookahead = null;
        return kw;
    }

    public Identifier expectIdentifier() {
        Token token = peek();
        if (!(token instanceof Identifier ident)) {
            throw unexpected(token, "identifier");
        }
        this.lookahead = null;
        return ident;
    }

    public Operator expectOperator(OperatorType type) {
        Token token = peek();
        if (!(token instanceof Operator op) || op.type() != type) {
            throw unexpected(token, "'" + type + "'");
        }
        this.lookahead = null;
        return op;
    }

    public Separator expectSeparator(SeparatorType type) {
        Token token = peek();
        if (!(token instanceof Separator sep) || sep.type() != type) {
            throw unexpected(token, "'" + type + "'");
        }
        this.lookahead = null;
        return sep;
    }

    /// Builds the error for a token that does not fit the grammar at this point.
    public static ParseException unexpected(Token token, String expected) {
        return new ParseException(
            "expected " + expected + " but got '" + token.asString() + "'",
            token.span().start()
        );
    }

    private @Nullable Token fill() {
        if (this.lookahead == null) {
            this.lookahead = this.lexer.nextToken().orElse(null);
        }
        return this.lookahead;
    }
}
