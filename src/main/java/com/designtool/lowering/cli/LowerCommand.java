package com.designtool.lowering.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.cli.exception.OptionsValidationException;
import com.designtool.lowering.cli.model.LowerOptions;
import com.designtool.lowering.cli.model.ValidatedLowerOptions;
import com.designtool.lowering.cli.output.LoweringResultsPrinter;
import com.designtool.lowering.cli.validation.LowerOptionsValidator;
import com.designtool.lowering.io.LoweringResultWriter;
import com.designtool.lowering.io.RawNodeReader;
import com.designtool.lowering.model.raw.RawNode;
import com.designtool.lowering.pipeline.LoweringPipeline;
import com.designtool.lowering.pipeline.LoweringResult;
import com.designtool.lowering.pipeline.PipelineOptions;
import com.fasterxml.jackson.core.JsonProcessingException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that lowers a design-tool JSON export into screen IR.
 */
@Command(
        name = "lower",
        mixinStandardHelpOptions = true,
        version = "screen-ir-lowering 1.0.0",
        description = "Lowers a design-tool node tree into layout-annotated semantic IR, deduplicated styles and detected patterns."
)
public class LowerCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LowerCommand.class);

    @Mixin
    private LowerOptions options = new LowerOptions();

    private final LowerOptionsValidator validator = new LowerOptionsValidator();
    private final LoweringResultsPrinter printer = new LoweringResultsPrinter();

    @Override
    public Integer call() {
        ValidatedLowerOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            RawNode input = new RawNodeReader().read(validated.getInputPath());
            LoweringResult result = new LoweringPipeline().lower(input, toPipelineOptions());
            new LoweringResultWriter(!options.isCompact()).write(result, validated.getOutputPath());
            printer.printSuccess(validated, result);
            return 0;
        } catch (JsonProcessingException e) {
            printer.printFailure("input is not valid JSON: " + e.getOriginalMessage());
            return 1;
        } catch (IOException e) {
            printer.printFailure(e.getMessage());
            log.debug("I/O failure", e);
            return 1;
        } catch (RuntimeException e) {
            log.error("Lowering failed with exception", e);
            return 1;
        }
    }

    private PipelineOptions toPipelineOptions() {
        return PipelineOptions.builder()
                .ignorePatterns(options.getIgnorePatterns())
                .excludeIds(options.getExcludeIds())
                .useDefaultIgnorePatterns(!options.isNoDefaultIgnores())
                .detectModalOverlay(!options.isNoModalDetection())
                .detectSafeArea(!options.isNoSafeAreaDetection())
                .build();
    }
}
