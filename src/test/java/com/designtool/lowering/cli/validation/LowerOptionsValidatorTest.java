package com.designtool.lowering.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.designtool.lowering.cli.exception.OptionsValidationException;
import com.designtool.lowering.cli.model.LowerOptions;
import com.designtool.lowering.cli.model.ValidatedLowerOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LowerOptionsValidator.
 */
class LowerOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path input;
    private final LowerOptionsValidator validator = new LowerOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("home.json");
        Files.writeString(input, "{}");
    }

    @Test
    void testDefaultOutputBesideInput() {
        ValidatedLowerOptions validated = validator.validate(parse("-i", input.toString()));

        assertThat(validated.getInputPath()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(validated.getOutputPath().getFileName().toString()).isEqualTo("home.lowered.json");
        assertThat(validated.getOutputPath().getParent()).isEqualTo(validated.getInputPath().getParent());
        assertThat(validated.isOverwriting()).isFalse();
    }

    @Test
    void testMissingInput() {
        assertThat(errorsOf(parse())).containsExactly("Input file is required (--input / -i).");
    }

    @Test
    void testNonexistentInputAndBadPatternsCollected() {
        List<String> errors = errorsOf(parse(
                "-i", tempDir.resolve("missing.json").toString(),
                "--ignore-pattern", "*",
                "--ignore-pattern", " ",
                "--exclude-id", " "));

        assertThat(errors).hasSize(4);
        assertThat(errors.get(0)).startsWith("Input file does not exist");
        assertThat(errors).contains("Ignore pattern '*' matches every layer name.",
                "Ignore patterns must not be blank.", "Excluded node ids must not be blank.");
    }

    @Test
    void testInputDirectoryRejected() {
        List<String> errors = errorsOf(parse("-i", tempDir.toString(), "-o", tempDir.resolve("x.json").toString()));

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).startsWith("Input is not a regular file");
    }

    @Test
    void testOutputMustNotBeInputOrDirectory() {
        List<String> same = errorsOf(parse("-i", input.toString(), "-o", input.toString()));
        List<String> dir = errorsOf(parse("-i", input.toString(), "-o", tempDir.toString()));

        assertThat(same).hasSize(1);
        assertThat(same.get(0)).contains("must not overwrite the input");
        assertThat(dir).hasSize(1);
        assertThat(dir.get(0)).contains("is a directory");
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path output = tempDir.resolve("out.json");
        Files.writeString(output, "{}");

        assertThatThrownBy(() -> validator.validate(parse("-i", input.toString(), "-o", output.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--force");

        ValidatedLowerOptions forced = validator.validate(
                parse("-i", input.toString(), "-o", output.toString(), "--force"));
        assertThat(forced.isOverwriting()).isTrue();
    }

    private List<String> errorsOf(LowerOptions options) {
        try {
            validator.validate(options);
        } catch (OptionsValidationException e) {
            return e.getErrors();
        }
        return fail("Expected validation errors");
    }

    private static LowerOptions parse(String... args) {
        LowerOptions options = new LowerOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
