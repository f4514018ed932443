package com.designtool.lowering;

import com.designtool.lowering.cli.LowerCommand;
import picocli.CommandLine;

/**
 * Main entry point for the screen IR lowering tool.
 * Reads a design-tool export and writes the lowered IR, styles and detections as JSON.
 */
public class LoweringApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LowerCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
