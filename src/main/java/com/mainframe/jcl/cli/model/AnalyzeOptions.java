package com.mainframe.jcl.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.jcl.config.HostConvention;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "analyze" command. Values given here override the
 * config file. No validation, no execution logic, no printing.
 */
@Getter
public class AnalyzeOptions {

	@Option(names = { "--config", "-c" }, description = "JSON or YAML config file (keys PATH, LIB, FILE, SYSTEM, EXT, PROJECT)")
	private Path configFile;

	@Option(names = { "--root", "-r" }, description = "Base lookup root for members (config key PATH)")
	private Path root;

	@Option(names = { "--lib", "-l" }, description = "Additional libraries searched after the root (comma-separated)")
	private String libraries;

	@Option(names = { "--system" }, description = "Host convention: LWM (directory tree) or Z (partitioned data sets)")
	private HostConvention hostConvention;

	@Option(names = { "--ext" }, description = "Member file extension, e.g. jcl")
	private String extension;

	@Option(names = { "--project", "-n" }, description = "Project name recorded in the output")
	private String projectName;

	@Option(names = { "--output", "-o" }, description = "Write the resolved model as JSON to this file")
	private Path output;

	@Option(names = { "--max-depth" }, description = "Maximum INCLUDE/PROC nesting depth (default: 15)")
	private Integer maxDepth;

	@Option(names = { "--max-passes" }, description = "Maximum symbol substitution passes per statement (default: 16)")
	private Integer maxPasses;

	@Option(names = { "--tier" }, description = "Tier letter for relative step identifiers (default: X)")
	private String tier;

	@Option(names = { "--parallelism", "-j" }, defaultValue = "1", description = "Members analyzed in parallel (default: 1)")
	private int parallelism;

	@Option(names = { "--allow-missing-procs" }, description = "Keep EXECs of missing procedures unexpanded instead of failing")
	private boolean allowMissingProcs;

	@Parameters(paramLabel = "MEMBER", arity = "0..*", description = "Members to analyze (defaults to the config FILE)")
	private List<String> members = new ArrayList<>();
}
