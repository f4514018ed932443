package com.designtool.lowering.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.cli.model.LowerOptions;
import com.designtool.lowering.cli.model.ValidatedLowerOptions;
import com.designtool.lowering.model.detection.ComponentHint;
import com.designtool.lowering.model.detection.DetectionResult;
import com.designtool.lowering.model.detection.ListHint;
import com.designtool.lowering.pipeline.LoweringResult;

/**
 * Responsible only for printing CLI output for the "lower" command.
 * No validation, no execution.
 */
public class LoweringResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(LoweringResultsPrinter.class);

    public void printBanner(LowerOptions o, ValidatedLowerOptions v) {
        log.info("=================================================");
        log.info("Screen IR Lowering");
        log.info("=================================================");
        log.info("Input: {}", v.getInputPath());
        log.info("Output: {}{}", v.getOutputPath(), v.isOverwriting() ? " (overwriting)" : "");
        log.info("Default Ignore Patterns: {}", o.isNoDefaultIgnores() ? "off" : "on");
        if (!o.getIgnorePatterns().isEmpty()) {
            log.info("Extra Ignore Patterns: {}", String.join(", ", o.getIgnorePatterns()));
        }
        if (!o.getExcludeIds().isEmpty()) {
            log.info("Excluded Node Ids: {}", String.join(", ", o.getExcludeIds()));
        }
        log.info("Modal Detection: {}", o.isNoModalDetection() ? "off" : "on");
        log.info("Safe Area Detection: {}", o.isNoSafeAreaDetection() ? "off" : "on");
        log.info("=================================================");
    }

    public void printSuccess(ValidatedLowerOptions v, LoweringResult result) {
        DetectionResult detection = result.getDetection();

        log.info("");
        log.info("=================================================");
        log.info("LOWERING SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getOutputPath());
        log.info("Root: {} '{}'", result.getId(), result.getName());
        log.info("Styles: {}", result.getStylesBundle().getStyles().size());

        if (detection.getModalOverlay().isHasModalOverlay()) {
            log.info("");
            log.info("Modal Overlay:");
            log.info("  Type: {}", detection.getModalOverlay().getModalType().getValue());
            log.info("  Content: {}", detection.getModalOverlay().getContentName());
        }
        if (!detection.getSafeArea().getElements().isEmpty()) {
            log.info("");
            log.info("Safe Area:");
            log.info("  Top Inset: {}", detection.getSafeArea().getInsets().getTop());
            log.info("  Bottom Inset: {}", detection.getSafeArea().getInsets().getBottom());
        }

        log.info("");
        log.info("Detected Patterns:");
        log.info("  Lists: {}", detection.getLists().size());
        for (ListHint list : detection.getLists()) {
            log.info("    {} ({} x {}, {})", list.getContainerId(), list.getItemIds().size(), list.getItemType(),
                    list.getOrientation().getValue());
        }
        log.info("  Component Candidates: {}", detection.getComponents().size());
        for (ComponentHint component : detection.getComponents()) {
            log.info("    {} ({} instances)", component.getComponentName(), component.getInstanceIds().size());
        }
        log.info("  Component Sets: {}", detection.getVariants().size());

        if (!result.getDiagnostics().getWarnings().isEmpty()) {
            log.info("");
            log.info("Warnings:");
            result.getDiagnostics().getWarnings().forEach(w -> log.warn("  {}", w));
        }
        log.info("=================================================");
    }

    public void printFailure(String message) {
        log.error("Lowering failed: {}", message);
    }
}
