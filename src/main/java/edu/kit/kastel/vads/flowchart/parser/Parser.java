package edu.kit.kastel.vads.flowchart.parser;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.ir.ControlFlowFragment;
import edu.kit.kastel.vads.flowchart.ir.FlowGraph;
import edu.kit.kastel.vads.flowchart.ir.GraphConstructor;
import edu.kit.kastel.vads.flowchart.lexer.Identifier;
import edu.kit.kastel.vads.flowchart.lexer.KeywordType;
import edu.kit.kastel.vads.flowchart.lexer.NumberLiteral;
import edu.kit.kastel.vads.flowchart.lexer.Operator;
import edu.kit.kastel.vads.flowchart.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.flowchart.lexer.Separator.SeparatorType;
import edu.kit.kastel.vads.flowchart.lexer.Token;

/// Recursive descent parser that builds the control-flow graph while it recognizes the program.
///
/// Statements are turned into [ControlFlowFragment]s as soon as they are complete. Expressions are never kept as
/// trees: each expression method directly returns its C spelling.
public class Parser {
    private final TokenSource tokenSource;
    private final GraphConstructor constructor;

    public Parser(TokenSource tokenSource) {
        this(tokenSource, "main");
    }

    public Parser(TokenSource tokenSource, String graphName) {
        this.tokenSource = tokenSource;
        this.constructor = new GraphConstructor(graphName);
    }

    public FlowGraph parseProgram() {
        if (this.tokenSource.peek().isKeyword(KeywordType.VAR)) {
            parseVarSection();
        }
        this.tokenSource.expectKeyword(KeywordType.BEGIN);
        ControlFlowFragment body = parseStatementList();
        this.tokenSource.expectKeyword(KeywordType.END);
        this.tokenSource.expectSeparator(SeparatorType.DOT);
        if (this.tokenSource.hasMore()) {
            throw TokenSource.unexpected(this.tokenSource.peek(), "end of input");
        }
        return this.constructor.program(body);
    }

    // declarations are recognized but carry no meaning for the graph
    private void parseVarSection() {
        this.tokenSource.expectKeyword(KeywordType.VAR);
        do {
            parseIdentifierList();
            this.tokenSource.expectSeparator(SeparatorType.COLON);
            parseTypeName();
            this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
        } while (this.tokenSource.peek() instanceof Identifier);
    }

    private void parseTypeName() {
        Token token = this.tokenSource.peek();
        if (token.isKeyword(KeywordType.INTEGER)
            || token.isKeyword(KeywordType.REAL)
            || token.isKeyword(KeywordType.BOOLEAN)) {
            this.tokenSource.consume();
            return;
        }
        throw TokenSource.unexpected(token, "type (integer, real or boolean)");
    }

    private List<String> parseIdentifierList() {
        List<String> identifiers = new ArrayList<>();
        identifiers.add(this.tokenSource.expectIdentifier().value());
        while (this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
            this.tokenSource.expectSeparator(SeparatorType.COMMA);
            identifiers.add(this.tokenSource.expectIdentifier().value());
        }
        return identifiers;
    }

    // empty statements only get a node of their own if the list has nothing else
    private ControlFlowFragment parseStatementList() {
        @Nullable ControlFlowFragment list = parseStatement();
        while (this.tokenSource.peek().isSeparator(SeparatorType.SEMICOLON)) {
            this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
            @Nullable ControlFlowFragment next = parseStatement();
            if (list == null) {
                list = next;
            } else if (next != null) {
                list = this.constructor.sequence(list, next);
            }
        }
        return list != null ? list : this.constructor.emptyStatement();
    }

    private ControlFlowFragment parseSingleStatement() {
        @Nullable ControlFlowFragment statement = parseStatement();
        return statement != null ? statement : this.constructor.emptyStatement();
    }

    /// Returns `null` for the empty statement, which consumes no tokens.
    private @Nullable ControlFlowFragment parseStatement() {
        Token token = this.tokenSource.peek();
        if (token instanceof Identifier) {
            return parseAssignment();
        } else if (token.isKeyword(KeywordType.IF)) {
            return parseIf();
        } else if (token.isKeyword(KeywordType.WHILE)) {
            return parseWhile();
        } else if (token.isKeyword(KeywordType.FOR)) {
            return parseFor();
        } else if (token.isKeyword(KeywordType.REPEAT)) {
            return parseRepeat();
        } else if (token.isKeyword(KeywordType.WRITELN) || token.isKeyword(KeywordType.WRITE)) {
            return parseWrite();
        } else if (token.isKeyword(KeywordType.READLN) || token.isKeyword(KeywordType.READ)) {
            return parseRead();
        } else if (token.isKeyword(KeywordType.BEGIN)) {
            return parseBlock();
        }
        return null;
    }

    private ControlFlowFragment parseAssignment() {
        Identifier target = this.tokenSource.expectIdentifier();
        this.tokenSource.expectOperator(OperatorType.ASSIGN);
        String expression = parseExpression();
        return this.constructor.operation(TargetSyntax.assignment(target.value(), expression));
    }

    private ControlFlowFragment parseIf() {
        this.tokenSource.expectKeyword(KeywordType.IF);
        String condition = parseExpression();
        this.tokenSource.expectKeyword(KeywordType.THEN);
        ControlFlowFragment thenBranch = parseSingleStatement();
        @Nullable ControlFlowFragment elseBranch = null;
        if (this.tokenSource.peek().isKeyword(KeywordType.ELSE)) {
            this.tokenSource.expectKeyword(KeywordType.ELSE);
            elseBranch = parseSingleStatement();
        }
        return this.constructor.branch(condition, thenBranch, elseBranch);
    }

    private ControlFlowFragment parseWhile() {
        this.tokenSource.expectKeyword(KeywordType.WHILE);
        String condition = parseExpression();
        this.tokenSource.expectKeyword(KeywordType.DO);
        ControlFlowFragment body = parseSingleStatement();
        return this.constructor.whileLoop(condition, body);
    }

    private ControlFlowFragment parseFor() {
        this.tokenSource.expectKeyword(KeywordType.FOR);
        String variable = this.tokenSource.expectIdentifier().value();
        this.tokenSource.expectOperator(OperatorType.ASSIGN);
        String from = parseExpression();
        boolean downTo;
        Token direction = this.tokenSource.peek();
        if (direction.isKeyword(KeywordType.TO)) {
            downTo = false;
        } else if (direction.isKeyword(KeywordType.DOWNTO)) {
            downTo = true;
        } else {
            throw TokenSource.unexpected(direction, "'to' or 'downto'");
        }
        this.tokenSource.consume();
        String to = parseExpression();
        this.tokenSource.expectKeyword(KeywordType.DO);
        ControlFlowFragment body = parseSingleStatement();
        return this.constructor.forLoop(
            TargetSyntax.forInit(variable, from),
            TargetSyntax.forCondition(variable, to, downTo),
            TargetSyntax.forStep(variable, downTo),
            body
        );
    }

    private ControlFlowFragment parseRepeat() {
        this.tokenSource.expectKeyword(KeywordType.REPEAT);
        ControlFlowFragment body = parseStatementList();
        this.tokenSource.expectKeyword(KeywordType.UNTIL);
        String condition = parseExpression();
        return this.constructor.repeatUntil(body, condition);
    }

    private ControlFlowFragment parseWrite() {
        boolean newline = this.tokenSource.consume().isKeyword(KeywordType.WRITELN);
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        List<String> arguments = new ArrayList<>();
        arguments.add(parseExpression());
        while (this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
            this.tokenSource.expectSeparator(SeparatorType.COMMA);
            arguments.add(parseExpression());
        }
        this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        return this.constructor.operation(TargetSyntax.print(arguments, newline));
    }

    private ControlFlowFragment parseRead() {
        this.tokenSource.consume();
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        List<String> variables = parseIdentifierList();
        this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        return this.constructor.operation(TargetSyntax.scan(variables));
    }

    private ControlFlowFragment parseBlock() {
        this.tokenSource.expectKeyword(KeywordType.BEGIN);
        ControlFlowFragment body = parseStatementList();
        this.tokenSource.expectKeyword(KeywordType.END);
        return body;
    }

    private String parseExpression() {
        return parseLogicalOr();
    }

    private String parseLogicalOr() {
        String lhs = parseLogicalAnd();
        while (this.tokenSource.peek().isOperator(OperatorType.OR)) {
            Operator op = this.tokenSource.expectOperator(OperatorType.OR);
            lhs = binary(lhs, op, parseLogicalAnd());
        }
        return lhs;
    }

    private String parseLogicalAnd() {
        String lhs = parseRelational();
        while (this.tokenSource.peek().isOperator(OperatorType.AND)) {
            Operator op = this.tokenSource.expectOperator(OperatorType.AND);
            lhs = binary(lhs, op, parseRelational());
        }
        return lhs;
    }

    private String parseRelational() {
        String lhs = parseAdditive();
        while (isOneOf(this.tokenSource.peek(),
            OperatorType.EQUAL, OperatorType.NOT_EQUAL,
            OperatorType.LESS, OperatorType.LESS_EQUAL,
            OperatorType.GREATER, OperatorType.GREATER_EQUAL)) {
            Operator op = (Operator) this.tokenSource.consume();
            lhs = binary(lhs, op, parseAdditive());
        }
        return lhs;
    }

    private String parseAdditive() {
        String lhs = parseMultiplicative();
        while (isOneOf(this.tokenSource.peek(), OperatorType.PLUS, OperatorType.MINUS)) {
            Operator op = (Operator) this.tokenSource.consume();
            lhs = binary(lhs, op, parseMultiplicative());
        }
        return lhs;
    }

    private String parseMultiplicative() {
        String lhs = parseUnary();
        while (isOneOf(this.tokenSource.peek(),
            OperatorType.MUL, OperatorType.DIVIDE, OperatorType.DIV, OperatorType.MOD)) {
            Operator op = (Operator) this.tokenSource.consume();
            lhs = binary(lhs, op, parseUnary());
        }
        return lhs;
    }

    private String parseUnary() {
        if (this.tokenSource.peek().isOperator(OperatorType.MINUS)) {
            this.tokenSource.expectOperator(OperatorType.MINUS);
            return "(-(" + parseUnary() + "))";
        } else if (this.tokenSource.peek().isOperator(OperatorType.NOT)) {
            this.tokenSource.expectOperator(OperatorType.NOT);
            return "!(" + parseUnary() + ")";
        }
        return parseFactor();
    }

    private String parseFactor() {
        Token token = this.tokenSource.peek();
        if (token.isSeparator(SeparatorType.PAREN_OPEN)) {
            this.tokenSource.consume();
            String expression = parseExpression();
            this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
            return "(" + expression + ")";
        } else if (token instanceof Identifier ident) {
            this.tokenSource.consume();
            return ident.value();
        } else if (token instanceof NumberLiteral literal) {
            this.tokenSource.consume();
            return literal.canonical();
        }
        throw TokenSource.unexpected(token, "expression");
    }

    private static boolean isOneOf(Token token, OperatorType... types) {
        for (OperatorType type : types) {
            if (token.isOperator(type)) {
                return true;
            }
        }
        return false;
    }

    private static String binary(String lhs, Operator op, String rhs) {
        return "(" + lhs + " " + op.type().target() + " " + rhs + ")";
    }
}
