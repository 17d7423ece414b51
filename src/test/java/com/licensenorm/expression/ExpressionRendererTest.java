package com.licensenorm.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExpressionRendererTest {

    private static final Expression MIT = new Expression.License("MIT", false);
    private static final Expression APACHE = new Expression.License("Apache-2.0", true);
    private static final Expression GPL_CLASSPATH =
            new Expression.License("GPL-2.0-only", false, "Classpath-exception-2.0");

    @Test
    void testLicenseRendering() {
        assertEquals("MIT", ExpressionRenderer.render(MIT));
        assertEquals("Apache-2.0+", ExpressionRenderer.render(APACHE));
        assertEquals("GPL-2.0-only WITH Classpath-exception-2.0", GPL_CLASSPATH.toString());
    }

    @Test
    @DisplayName("AND 下的 OR 子树加括号")
    void testOrUnderAndIsParenthesized() {
        Expression expression = new Expression.AndExpression(new Expression.OrExpression(MIT, APACHE), MIT);
        assertEquals("(MIT OR Apache-2.0+) AND MIT", expression.toString());
    }

    @Test
    @DisplayName("OR 下的 AND 子树与带例外许可证加括号")
    void testAndAndExceptionUnderOrAreParenthesized() {
        Expression expression = new Expression.OrExpression(MIT, new Expression.AndExpression(APACHE, MIT));
        assertEquals("MIT OR (Apache-2.0+ AND MIT)", expression.toString());

        Expression withException = new Expression.OrExpression(GPL_CLASSPATH, MIT);
        assertEquals("(GPL-2.0-only WITH Classpath-exception-2.0) OR MIT", withException.toString());
    }

    @Test
    void testSameOperatorChainsAreFlat() {
        Expression chain = new Expression.OrExpression(new Expression.OrExpression(MIT, APACHE), MIT);
        assertEquals("MIT OR Apache-2.0+ OR MIT", chain.toString());

        Expression andChain = new Expression.AndExpression(GPL_CLASSPATH, MIT);
        assertEquals("GPL-2.0-only WITH Classpath-exception-2.0 AND MIT", andChain.toString());
    }

    @Test
    void testReferencesAndSpecialValues() {
        assertEquals("LicenseRef-custom", new Expression.LicenseRef(null, "custom").toString());
        assertEquals("DocumentRef-doc:LicenseRef-custom", new Expression.LicenseRef("doc", "custom").toString());
        assertEquals("NOASSERTION", Expression.SpecialValue.NOASSERTION.toString());
    }

    @Test
    @DisplayName("叶子许可证按出现顺序列出且不去重")
    void testLicensesInOrder() {
        Expression expression = new Expression.OrExpression(
                new Expression.AndExpression(GPL_CLASSPATH, new Expression.LicenseRef("doc", "x")),
                new Expression.AndExpression(APACHE, MIT));
        assertEquals(List.of("GPL-2.0-only", "DocumentRef-doc:LicenseRef-x", "Apache-2.0", "MIT"),
                expression.licenses());
        assertEquals(List.of("MIT", "MIT"), new Expression.AndExpression(MIT, MIT).licenses());
    }

    @Test
    void testSpecialValueParsing() {
        assertEquals(Expression.SpecialValue.NONE, Expression.SpecialValue.parse("none"));
        assertEquals(null, Expression.SpecialValue.parse("MIT"));
    }
}
