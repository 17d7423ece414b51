package com.licensenorm.parse;

import com.licensenorm.ErrorKind;
import com.licensenorm.LicenseExpressionException;
import com.licensenorm.config.Constants;
import com.licensenorm.expression.Expression;
import com.licensenorm.vocabulary.LicenseVocabulary;

import java.util.List;
import java.util.Locale;

/**
 * 严格模式递归下降解析器，只接受词表中的标识符（不区分大小写，输出规范拼写）。
 *
 * <pre>
 * Expr     := AndTerm (OR AndTerm)*
 * AndTerm  := WithTerm (AND WithTerm)*
 * WithTerm := Atom (WITH LicenseWord)?
 * Atom     := '(' Expr ')' | LicenseWord '+'? | LicenseRef | DocumentRef | SpecialValue
 * </pre>
 */
public class ExpressionParser {
    private final LicenseVocabulary vocabulary;

    private List<LexToken> tokens;
    private int pos;
    private int depth;
    private String expression;

    public ExpressionParser(LicenseVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * 将表达式解析为语法树。
     *
     * @throws LicenseExpressionException 语法错误或标识符不在词表中
     */
    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new LicenseExpressionException(ErrorKind.EMPTY_INPUT, "");
        }
        this.expression = text;
        this.tokens = new ExpressionLexer().tokenize(text);
        this.pos = 0;
        this.depth = 0;

        Expression root = parseOrExpression();

        if (current().type() == TokenType.RPAREN) {
            throw error(ErrorKind.UNBALANCED_PARENTHESES, current());
        }
        if (current().type() != TokenType.EOF) {
            throw error(ErrorKind.UNEXPECTED_TOKEN, current());
        }
        return root;
    }

    /**
     * 解析 OR 层级，优先级最低。
     */
    private Expression parseOrExpression() {
        Expression left = parseAndExpression();
        while (current().type() == TokenType.OR) {
            LexToken operator = advance();
            Expression right = parseAndExpression();
            requireComposable(left, operator);
            requireComposable(right, operator);
            left = new Expression.OrExpression(left, right);
        }
        return left;
    }

    /**
     * 解析 AND 层级，优先级高于 OR。
     */
    private Expression parseAndExpression() {
        Expression left = parseWithExpression();
        while (current().type() == TokenType.AND) {
            LexToken operator = advance();
            Expression right = parseWithExpression();
            requireComposable(left, operator);
            requireComposable(right, operator);
            left = new Expression.AndExpression(left, right);
        }
        return left;
    }

    /**
     * 解析可选的 WITH 例外，只能附加在单个许可证上。
     */
    private Expression parseWithExpression() {
        Expression atom = parseAtom();
        if (current().type() != TokenType.WITH) {
            return atom;
        }
        LexToken withToken = advance();
        if (atom instanceof Expression.SpecialValue) {
            throw error(ErrorKind.INVALID_SPECIAL_VALUE_PLACEMENT, withToken);
        }
        if (!(atom instanceof Expression.License license) || license.hasException()) {
            throw error(ErrorKind.UNEXPECTED_TOKEN, withToken);
        }

        LexToken exceptionToken = current();
        if (exceptionToken.type() != TokenType.WORD) {
            throw error(ErrorKind.MISSING_OPERAND, exceptionToken);
        }
        advance();
        String exceptionId = vocabulary.lookupException(exceptionToken.value())
                .orElseThrow(() -> error(ErrorKind.INVALID_EXCEPTION_IDENTIFIER, exceptionToken));
        return license.withException(exceptionId);
    }

    /**
     * 解析基础项：分组、许可证、引用或特殊值。
     */
    private Expression parseAtom() {
        LexToken token = current();
        switch (token.type()) {
            case LPAREN:
                return parseGroup();
            case WORD:
                return parseLicenseWord();
            case LICENSE_REF:
                advance();
                return parseLicenseRef(token);
            case DOCUMENT_REF:
                advance();
                return parseDocumentRef(token);
            case EOF:
            case RPAREN:
                throw error(ErrorKind.MISSING_OPERAND, token);
            default:
                throw error(ErrorKind.UNEXPECTED_TOKEN, token);
        }
    }

    /**
     * 解析括号分组；缺少右括号视为括号不匹配，嵌套层数受 {@link Constants#MAX_NESTING_DEPTH} 限制。
     */
    private Expression parseGroup() {
        LexToken open = advance();
        if (++depth > Constants.MAX_NESTING_DEPTH) {
            throw error(ErrorKind.UNEXPECTED_TOKEN, open);
        }
        Expression grouped = parseOrExpression();
        if (current().type() == TokenType.RPAREN) {
            advance();
            depth--;
            return grouped;
        }
        if (current().type() == TokenType.EOF) {
            throw error(ErrorKind.UNBALANCED_PARENTHESES, current());
        }
        throw error(ErrorKind.UNEXPECTED_TOKEN, current());
    }

    private Expression parseLicenseWord() {
        LexToken word = advance();
        Expression.SpecialValue special = Expression.SpecialValue.parse(word.value());
        if (special != null) {
            return special;
        }
        String id = vocabulary.lookupLicense(word.value())
                .orElseThrow(() -> error(ErrorKind.INVALID_LICENSE_IDENTIFIER, word));
        boolean orLater = false;
        if (current().type() == TokenType.PLUS) {
            advance();
            orLater = true;
        }
        return new Expression.License(id, orLater);
    }

    private Expression parseLicenseRef(LexToken token) {
        String ref = token.value().substring(Constants.LICENSE_REF_PREFIX.length());
        if (ref.isEmpty()) {
            throw error(ErrorKind.INVALID_LICENSE_IDENTIFIER, token);
        }
        return new Expression.LicenseRef(null, ref);
    }

    /**
     * DocumentRef-文档:LicenseRef-许可证，两部分都不能为空。
     */
    private Expression parseDocumentRef(LexToken token) {
        String value = token.value();
        String upper = value.toUpperCase(Locale.ROOT);
        int separator = upper.indexOf(Constants.DOCUMENT_REF_SEPARATOR.toUpperCase(Locale.ROOT));
        int documentStart = Constants.DOCUMENT_REF_PREFIX.length();
        if (separator <= documentStart) {
            throw error(ErrorKind.INVALID_LICENSE_IDENTIFIER, token);
        }
        String documentRef = value.substring(documentStart, separator);
        String licenseRef = value.substring(separator + Constants.DOCUMENT_REF_SEPARATOR.length());
        if (licenseRef.isEmpty()) {
            throw error(ErrorKind.INVALID_LICENSE_IDENTIFIER, token);
        }
        return new Expression.LicenseRef(documentRef, licenseRef);
    }

    /**
     * NONE / NOASSERTION 不能作为 AND、OR 的操作数。
     */
    private void requireComposable(Expression operand, LexToken operator) {
        if (operand instanceof Expression.SpecialValue) {
            throw error(ErrorKind.INVALID_SPECIAL_VALUE_PLACEMENT, operator);
        }
    }

    private LicenseExpressionException error(ErrorKind kind, LexToken token) {
        return new LicenseExpressionException(kind, token.value(), token.position(), expression);
    }

    /**
     * 返回当前位置 token。
     */
    private LexToken current() {
        return tokens.get(pos);
    }

    /**
     * 消费并返回当前位置 token。
     */
    private LexToken advance() {
        return tokens.get(pos++);
    }
}
