package com.designtool.lowering.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "lower" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class LowerOptions {

	@Option(names = { "--input", "-i" }, description = "Design export JSON (a node or a nodes-endpoint response)")
	private Path input;

	@Option(names = { "--output",
			"-o" }, description = "Where to write the lowered JSON (defaults to <input>.lowered.json next to the input)")
	private Path output;

	@Option(names = { "--ignore-pattern" }, description = "Extra layer-name pattern to drop, '*' matches anything (repeatable)")
	private List<String> ignorePatterns = new ArrayList<>();

	@Option(names = { "--exclude-id" }, description = "Node id to drop together with its subtree (repeatable)")
	private List<String> excludeIds = new ArrayList<>();

	@Option(names = { "--no-default-ignores" }, description = "Do not apply the built-in annotation and guide patterns")
	private boolean noDefaultIgnores;

	@Option(names = { "--no-modal-detection" }, description = "Lower the full screen even when it shows a modal overlay")
	private boolean noModalDetection;

	@Option(names = { "--no-safe-area-detection" }, description = "Keep status bars and home indicators in the tree")
	private boolean noSafeAreaDetection;

	@Option(names = { "--compact" }, description = "Write JSON without indentation")
	private boolean compact;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

}
