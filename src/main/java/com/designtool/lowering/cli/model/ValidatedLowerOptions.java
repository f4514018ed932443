package com.designtool.lowering.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps LowerCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedLowerOptions {
    Path inputPath;
    Path outputPath;
    boolean overwriting;
}
