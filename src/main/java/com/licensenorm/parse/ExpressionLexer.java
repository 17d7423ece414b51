package com.licensenorm.parse;

import com.licensenorm.config.Constants;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ExpressionLexer {
    private static final String LICENSE_REF_UPPER = Constants.LICENSE_REF_PREFIX.toUpperCase(Locale.ROOT);
    private static final String DOCUMENT_REF_UPPER = Constants.DOCUMENT_REF_PREFIX.toUpperCase(Locale.ROOT);

    /**
     * 将表达式切分为 token 序列，末尾总是 EOF。不会失败。
     */
    public List<LexToken> tokenize(String expression) {
        String text = expression == null ? "" : expression;
        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (Character.isWhitespace(currentChar)) {
                index++;
                continue;
            }

            if (currentChar == '(') {
                tokens.add(new LexToken(TokenType.LPAREN, "(", index));
                index++;
                continue;
            }
            if (currentChar == ')') {
                tokens.add(new LexToken(TokenType.RPAREN, ")", index));
                index++;
                continue;
            }
            if (currentChar == '+') {
                tokens.add(new LexToken(TokenType.PLUS, "+", index));
                index++;
                continue;
            }

            int tokenStart = index;
            while (index < text.length() && !isDelimiter(text.charAt(index))) {
                index++;
            }
            tokens.add(classify(text.substring(tokenStart, index), tokenStart));
        }

        tokens.add(new LexToken(TokenType.EOF, "", text.length()));
        return tokens;
    }

    private LexToken classify(String value, int position) {
        String upper = value.toUpperCase(Locale.ROOT);
        if (Constants.OPERATORS.contains(upper)) {
            return new LexToken(TokenType.valueOf(upper), value, position);
        }
        if (upper.startsWith(LICENSE_REF_UPPER)) {
            return new LexToken(TokenType.LICENSE_REF, value, position);
        }
        if (upper.startsWith(DOCUMENT_REF_UPPER)) {
            return new LexToken(TokenType.DOCUMENT_REF, value, position);
        }
        return new LexToken(TokenType.WORD, value, position);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '+';
    }
}
