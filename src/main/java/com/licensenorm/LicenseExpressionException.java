package com.licensenorm;

public class LicenseExpressionException extends RuntimeException {
    private final ErrorKind kind;
    private final String offendingText;
    private final int position;
    private final String expression;

    public LicenseExpressionException(ErrorKind kind, String offendingText) {
        this(kind, offendingText, -1, null);
    }

    public LicenseExpressionException(ErrorKind kind, String offendingText, int position, String expression) {
        super(buildMessage(kind, offendingText, position, expression));
        this.kind = kind;
        this.offendingText = offendingText == null ? "" : offendingText;
        this.position = position;
        this.expression = expression;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getOffendingText() {
        return offendingText;
    }

    /**
     * 出错位置，基于 {@link #getExpression()} 返回的文本；未知时为 -1。
     */
    public int getPosition() {
        return position;
    }

    public String getExpression() {
        return expression;
    }

    private static String buildMessage(ErrorKind kind, String offending, int pos, String expression) {
        StringBuilder message = new StringBuilder(kind.description());
        if (offending != null && !offending.isEmpty()) {
            message.append(": ").append(offending);
        }
        if (pos >= 0 && expression != null) {
            int caretPos = Math.max(0, Math.min(pos, expression.length()));
            message.append(" (position ").append(pos).append(')')
                    .append(System.lineSeparator()).append(expression)
                    .append(System.lineSeparator()).append(" ".repeat(caretPos)).append('^');
        }
        return message.toString();
    }
}
