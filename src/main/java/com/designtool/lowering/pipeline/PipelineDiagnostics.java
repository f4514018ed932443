package com.designtool.lowering.pipeline;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings and notes accumulated during a lowering run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class PipelineDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
