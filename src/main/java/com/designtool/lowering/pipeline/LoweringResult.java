package com.designtool.lowering.pipeline;

import com.designtool.lowering.model.detection.DetectionResult;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.style.StylesBundle;

import lombok.Builder;
import lombok.Value;

/**
 * Everything a code generator needs for one screen.
 */
@Value
@Builder
public class LoweringResult {
    /** Id of the node that was lowered (the modal content when one was found). */
    String id;
    String name;
    IrNode root;
    StylesBundle stylesBundle;
    DetectionResult detection;
    PipelineDiagnostics diagnostics;
    /** True when the whole tree was filtered and {@link #root} is an empty container. */
    boolean placeholder;
}
