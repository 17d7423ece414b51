package com.licensenorm.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @Test
    void testCallWithoutSubcommand() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--max-length", "64", "parse", "--strict", "MIT");

        assertNotNull(parseResult.subcommand());
        assertEquals("parse", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testNormalizeSubcommand() {
        String output = captureOut(() -> new CommandLine(new MainCommand()).execute("normalize", "Apache 2", "GPL v3"));

        assertTrue(output.contains("Apache 2 -> Apache-2.0"));
        assertTrue(output.contains("GPL v3 -> GPL-3.0-or-later"));
    }

    @Test
    void testNormalizeSubcommandFailsOnUnknownName() {
        int exitCode = new CommandLine(new MainCommand()).execute("normalize", "MIT", "FAKEYLICENSE");
        assertEquals(1, exitCode);
    }

    @Test
    void testParseSubcommandTextAndJson() {
        String text = captureOut(() -> new CommandLine(new MainCommand()).execute("parse", "MIT OR Apache 2 AND GPL v3"));
        assertTrue(text.contains("MIT OR (Apache-2.0 AND GPL-3.0-or-later)"));

        String json = captureOut(() -> new CommandLine(new MainCommand()).execute("parse", "-f", "json", "mit OR isc"));
        assertTrue(json.contains("\"normalized\" : \"MIT OR ISC\""));
        assertTrue(json.contains("\"licenses\""));
    }

    @Test
    void testParseSubcommandStrictRejectsInformalNames() {
        int exitCode = new CommandLine(new MainCommand()).execute("parse", "--strict", "Apache 2");
        assertEquals(1, exitCode);
    }

    @Test
    void testStrictByDefaultOption() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        commandLine.parseArgs("--strict-by-default");
        MainCommand command = commandLine.getCommand();
        assertFalse(command.buildConfig().isLaxByDefault());

        assertEquals(1, new CommandLine(new MainCommand()).execute("--strict-by-default", "parse", "Apache 2"));
        String json = captureOut(() -> new CommandLine(new MainCommand())
                .execute("--strict-by-default", "parse", "-f", "json", "MIT"));
        assertTrue(json.contains("\"strict\" : true"));
    }

    @Test
    void testExpressionLongerThanLimitIsRejected() {
        int exitCode = new CommandLine(new MainCommand()).execute("--max-length", "5", "parse", "MIT OR Apache-2.0");
        assertEquals(2, exitCode);
    }

    @Test
    void testValidateSubcommand() {
        assertEquals(0, new CommandLine(new MainCommand()).execute("validate", "MIT OR Apache-2.0", "NONE"));
        assertEquals(1, new CommandLine(new MainCommand()).execute("validate", "MIT", "Apache 2"));
    }

    @Test
    void testCategorySubcommand() {
        String output = captureOut(() -> new CommandLine(new MainCommand()).execute("category", "MIT", "MPL-2.0"));
        assertTrue(output.contains("MIT: Permissive"));
        assertTrue(output.contains("MPL-2.0: Copyleft Limited"));

        String expressionOutput = captureOut(() ->
                new CommandLine(new MainCommand()).execute("category", "-e", "MIT AND GPL-3.0-only"));
        assertTrue(expressionOutput.contains("[Copyleft, Permissive]"));
    }

    @Test
    void testInvalidMaxLengthFallsBackToDefault() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        commandLine.parseArgs("--max-length", "0");
        MainCommand command = commandLine.getCommand();

        assertEquals(4096, command.buildConfig().getMaxExpressionLength());
    }

    private String captureOut(Callable<Integer> action) {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            action.call();
        } catch (Exception exception) {
            throw new IllegalStateException(exception);
        } finally {
            System.setOut(originalOut);
        }
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }
}
