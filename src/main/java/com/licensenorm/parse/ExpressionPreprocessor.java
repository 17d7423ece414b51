package com.licensenorm.parse;

import com.licensenorm.ErrorKind;
import com.licensenorm.LicenseExpressionException;
import com.licensenorm.normalize.LicenseNormalizer;
import com.licensenorm.vocabulary.LicenseVocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 宽松模式预处理：把非正式许可证名称改写为规范标识符，结构 token 原样保留，
 * 输出可直接交给严格解析器的文本。
 */
public class ExpressionPreprocessor {
    private final LicenseNormalizer normalizer;
    private final LicenseVocabulary vocabulary;
    private final ExpressionLexer lexer = new ExpressionLexer();

    private final List<LexToken> buffer = new ArrayList<>();
    private final List<String> output = new ArrayList<>();
    /** output 中每一段在原始输入中的起始位置 */
    private final List<Integer> sourcePositions = new ArrayList<>();
    private boolean expectException;
    private String expression;

    public ExpressionPreprocessor(LicenseNormalizer normalizer) {
        this.normalizer = normalizer;
        this.vocabulary = normalizer.getVocabulary();
    }

    /**
     * 返回规范化后的表达式文本。
     *
     * @throws LicenseExpressionException 输入为空、短语无法识别或例外不存在
     */
    public String preprocess(String text) {
        if (text == null || text.isBlank()) {
            throw new LicenseExpressionException(ErrorKind.EMPTY_INPUT, "");
        }
        this.expression = text;
        this.buffer.clear();
        this.output.clear();
        this.sourcePositions.clear();
        this.expectException = false;

        for (LexToken token : lexer.tokenize(text)) {
            switch (token.type()) {
                case WORD, LICENSE_REF, DOCUMENT_REF -> buffer.add(token);
                case PLUS -> attachPlus(token);
                case AND, OR, WITH -> {
                    flush();
                    emit(token.value().toUpperCase(Locale.ROOT), token.position());
                    expectException = token.type() == TokenType.WITH;
                }
                case LPAREN, RPAREN -> {
                    flush();
                    emit(token.value(), token.position());
                }
                case EOF -> flush();
                default -> throw new IllegalStateException("未处理的token类型: " + token.type());
            }
        }
        return String.join(" ", output);
    }

    /**
     * 把规范化文本中的位置映射回最近一次 preprocess 的原始输入。
     * 由多个单词合并出的标识符映射到这组单词的起始位置。
     */
    public int originalPosition(int normalizedPosition) {
        if (normalizedPosition < 0) {
            return normalizedPosition;
        }
        int offset = 0;
        for (int i = 0; i < output.size(); i++) {
            int end = offset + output.get(i).length();
            if (normalizedPosition < end) {
                return sourcePositions.get(i);
            }
            offset = end + 1;
        }
        return expression == null ? normalizedPosition : expression.length();
    }

    private void emit(String text, int position) {
        output.add(text);
        sourcePositions.add(position);
    }

    private void attachPlus(LexToken plus) {
        if (buffer.isEmpty()) {
            throw new LicenseExpressionException(ErrorKind.UNEXPECTED_TOKEN, "+", plus.position(), expression);
        }
        int last = buffer.size() - 1;
        LexToken word = buffer.get(last);
        buffer.set(last, new LexToken(word.type(), word.value() + "+", word.position()));
    }

    private void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        List<String> words = new ArrayList<>(buffer.size());
        for (LexToken token : buffer) {
            words.add(token.value());
        }
        int start = buffer.get(0).position();
        if (expectException) {
            emit(resolveException(words), start);
            expectException = false;
        } else {
            for (String license : normalizeLicenses(words)) {
                emit(license, start);
            }
        }
        buffer.clear();
    }

    /**
     * 例外只做精确查找：先试连字符拼接，再试空格拼接。
     */
    private String resolveException(List<String> words) {
        Optional<String> exception = vocabulary.lookupException(String.join("-", words));
        if (exception.isPresent()) {
            return exception.get();
        }
        String spaced = String.join(" ", words);
        return vocabulary.lookupException(spaced)
                .orElseThrow(() -> new LicenseExpressionException(ErrorKind.INVALID_EXCEPTION_IDENTIFIER,
                        spaced, buffer.get(0).position(), expression));
    }

    private List<String> normalizeLicenses(List<String> words) {
        try {
            return normalizer.normalizeWords(words);
        } catch (LicenseExpressionException exception) {
            throw new LicenseExpressionException(exception.getKind(), exception.getOffendingText(),
                    positionOf(exception.getOffendingText()), expression);
        }
    }

    private int positionOf(String word) {
        for (LexToken token : buffer) {
            if (token.value().equals(word)) {
                return token.position();
            }
        }
        return buffer.get(0).position();
    }
}
