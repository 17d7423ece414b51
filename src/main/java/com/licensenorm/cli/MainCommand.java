package com.licensenorm.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensenorm.LicenseExpressionException;
import com.licensenorm.LicenseExpressions;
import com.licensenorm.category.LicenseCategory;
import com.licensenorm.config.Constants;
import com.licensenorm.config.NormalizerConfig;
import com.licensenorm.expression.Expression;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "spdx-norm",
    description = "📜 SPDX 许可证表达式规范化工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.NormalizeSubcommand.class,
        MainCommand.ParseSubcommand.class,
        MainCommand.ValidateSubcommand.class,
        MainCommand.CategorySubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--vocabulary"}, description = "类路径中的许可证词表资源",
            defaultValue = Constants.VOCABULARY_RESOURCE)
    private String vocabularyResource;

    @Option(names = {"--categories"}, description = "类路径中的许可证分类资源",
            defaultValue = Constants.CATEGORIES_RESOURCE)
    private String categoriesResource;

    @Option(names = {"--max-length"}, description = "单个表达式最大字符数", defaultValue = "4096")
    private int maxLength;

    @Option(names = {"--strict-by-default"}, description = "parse 子命令默认使用严格模式", defaultValue = "false")
    private boolean strictByDefault;

    private LicenseExpressions expressions;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📜 SPDX 许可证表达式规范化工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    NormalizerConfig buildConfig() {
        NormalizerConfig config = NormalizerConfig.defaults();
        config.setVocabularyResource(vocabularyResource);
        config.setCategoriesResource(categoriesResource);
        config.setMaxExpressionLength(resolveMaxLength());
        config.setLaxByDefault(!strictByDefault);
        return config;
    }

    LicenseExpressions expressions() {
        if (expressions == null) {
            expressions = LicenseExpressions.create(buildConfig());
        }
        return expressions;
    }

    private int resolveMaxLength() {
        if (maxLength <= 0) {
            System.err.printf("⚠️ 非法长度上限 %d，已回退为默认值 %d%n", maxLength, Constants.MAX_EXPRESSION_LENGTH);
            return Constants.MAX_EXPRESSION_LENGTH;
        }
        return maxLength;
    }

    private String sanitizeExpression(String rawExpression) {
        if (rawExpression == null) {
            return "";
        }
        String trimmed = rawExpression.trim();
        int limit = expressions().getConfig().getMaxExpressionLength();
        if (trimmed.length() > limit) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "表达式长度超过限制（最大 " + limit + " 字符）");
        }
        return trimmed;
    }

    @Command(name = "normalize", description = "🔧 将非正式许可证名称规范化为 SPDX 标识符")
    static class NormalizeSubcommand implements Callable<Integer> {

        @Parameters(description = "许可证名称（每个参数为一个名称）", arity = "1..*")
        private List<String> licenses;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            int failures = 0;
            for (String license : licenses) {
                try {
                    String normalized = main.expressions().normalize(main.sanitizeExpression(license));
                    System.out.println(license + " -> " + normalized);
                } catch (LicenseExpressionException exception) {
                    System.err.println("❌ " + license + ": " + exception.getMessage());
                    failures++;
                }
            }
            return failures == 0 ? 0 : 1;
        }
    }

    @Command(name = "parse", description = "🌳 解析许可证表达式并输出规范形式")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "许可证表达式", arity = "1")
        private String expression;

        @Option(names = {"--strict"}, description = "强制使用严格模式", defaultValue = "false")
        private boolean strict;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            String safeExpression = main.sanitizeExpression(expression);
            try {
                LicenseExpressions expressions = main.expressions();
                Expression parsed = strict ? expressions.parseStrict(safeExpression) : expressions.parseDefault(safeExpression);
                boolean strictMode = strict || !expressions.getConfig().isLaxByDefault();
                ParseReport report = new ParseReport(safeExpression, parsed.toString(), parsed.licenses(), strictMode);
                if ("json".equalsIgnoreCase(format)) {
                    printJsonReport(report);
                } else {
                    printTextReport(report);
                }
                return 0;
            } catch (LicenseExpressionException exception) {
                System.err.println("❌ 解析失败 [" + exception.getKind() + "]: " + exception.getMessage());
                return 1;
            } catch (IOException exception) {
                System.err.println("❌ 输出失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextReport(ParseReport report) {
            System.out.println("🔍 输入: \"" + report.input() + "\"");
            System.out.println("✅ 规范形式: " + report.normalized());
            System.out.println("📄 许可证: " + String.join(", ", report.licenses()));
        }

        private void printJsonReport(ParseReport report) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }
    }

    @Command(name = "validate", description = "✔️ 严格校验许可证表达式")
    static class ValidateSubcommand implements Callable<Integer> {

        @Parameters(description = "许可证表达式", arity = "1..*")
        private List<String> expressions;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            int invalid = 0;
            for (String expression : expressions) {
                if (main.expressions().valid(main.sanitizeExpression(expression))) {
                    System.out.println("✅ " + expression);
                } else {
                    System.out.println("❌ " + expression);
                    invalid++;
                }
            }
            return invalid == 0 ? 0 : 1;
        }
    }

    @Command(name = "category", description = "🏷️ 查询许可证或表达式的分类")
    static class CategorySubcommand implements Callable<Integer> {

        @Parameters(description = "SPDX 许可证标识符", arity = "1..*")
        private List<String> licenses;

        @Option(names = {"-e", "--expression"}, description = "将参数视为表达式并列出涉及的分类", defaultValue = "false")
        private boolean expressionMode;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            LicenseExpressions expressions = main.expressions();
            if (!expressionMode) {
                for (String license : licenses) {
                    System.out.println(license + ": " + expressions.categoryOf(license).label());
                }
                return 0;
            }
            int failures = 0;
            for (String expression : licenses) {
                try {
                    List<LicenseCategory> categories = expressions.expressionCategories(main.sanitizeExpression(expression));
                    System.out.println(expression + ": " + categories);
                } catch (LicenseExpressionException exception) {
                    System.err.println("❌ " + expression + ": " + exception.getMessage());
                    failures++;
                }
            }
            return failures == 0 ? 0 : 1;
        }
    }

    /**
     * parse 子命令的 JSON 输出结构。
     */
    public record ParseReport(String input, String normalized, List<String> licenses, boolean strict) {
    }
}
