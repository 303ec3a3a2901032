package org.csu.edts.compiler.parser;

import org.csu.edts.common.exception.ParseException;
import org.csu.edts.compiler.lexer.Token;
import org.csu.edts.compiler.lexer.TokenType;
import org.csu.edts.compiler.parser.ast.expression.*;

import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)。
 *
 * 文法已消除左递归 (LL(1))：
 * <pre>
 * expr   → term ( ('+'|'-') term )*
 * term   → factor ( ('*'|'/') factor )*
 * factor → '(' expr ')' | IDENTIFIER | NUMBER
 * </pre>
 * 每个 (...)* 用循环实现左折叠：已累积的节点作为左孩子，新解析的操作数作为右孩子，
 * 从而得到左结合的语法树。只看一个 Token 的前瞻，不回溯。
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    public Parser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must be terminated by EOF");
        }
        // EOF 只能出现在末尾，否则它后面的 Token 会被悄悄忽略
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).type() == TokenType.EOF) {
                throw new IllegalArgumentException("EOF token at index " + i + " is not the last token");
            }
        }
        this.tokens = tokens;
    }

    public ExpressionNode parse() {
        ExpressionNode expression = parseExpression();
        if (!isAtEnd()) {
            throw new ParseException("unexpected trailing input", peek());
        }
        return expression;
    }

    // expr → term ( ('+'|'-') term )*
    private ExpressionNode parseExpression() {
        ExpressionNode left = parseTerm();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            ArithmeticOperator operator = ArithmeticOperator.fromTokenType(previous().type());
            ExpressionNode right = parseTerm();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    // term → factor ( ('*'|'/') factor )*
    private ExpressionNode parseTerm() {
        ExpressionNode left = parseFactor();
        while (match(TokenType.ASTERISK, TokenType.SLASH)) {
            ArithmeticOperator operator = ArithmeticOperator.fromTokenType(previous().type());
            ExpressionNode right = parseFactor();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    // factor → '(' expr ')' | IDENTIFIER | NUMBER
    private ExpressionNode parseFactor() {
        if (match(TokenType.LPAREN)) {
            ExpressionNode expr = parseExpression();
            consume(TokenType.RPAREN, "expected ')'");
            return expr;
        }
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierNode(previous().lexeme());
        }
        if (match(TokenType.NUMBER)) {
            return new NumberNode(previous());
        }
        throw new ParseException("expected factor", peek());
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(message, peek());
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
