package com.mainframe.jcl.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.mainframe.jcl.cli.exception.OptionsValidationException;
import com.mainframe.jcl.cli.model.AnalyzeOptions;
import com.mainframe.jcl.cli.model.ValidatedAnalyzeOptions;
import com.mainframe.jcl.config.JclConfig;
import com.mainframe.jcl.config.JclConfigLoader;

/**
 * Merges the config file with the command-line options and checks the result.
 * Command-line values win over the file.
 */
public class AnalyzeOptionsValidator {

	private final JclConfigLoader configLoader;

	public AnalyzeOptionsValidator() {
		this(new JclConfigLoader());
	}

	public AnalyzeOptionsValidator(JclConfigLoader configLoader) {
		this.configLoader = configLoader;
	}

	public ValidatedAnalyzeOptions validate(AnalyzeOptions o) {
		List<String> errors = new ArrayList<>();

		JclConfig base = JclConfig.builder().build();
		if (o.getConfigFile() != null) {
			try {
				base = configLoader.load(o.getConfigFile());
			} catch (IOException | IllegalArgumentException e) {
				errors.add("Invalid config file " + o.getConfigFile() + ": " + e.getMessage());
			}
		}

		JclConfig.JclConfigBuilder merged = base.toBuilder();

		if (o.getRoot() != null) {
			merged.root(o.getRoot().toAbsolutePath().normalize());
		}
		if (!isBlank(o.getLibraries())) {
			merged.libraries(parseLibraries(o.getLibraries()));
		}
		if (o.getHostConvention() != null) {
			merged.hostConvention(o.getHostConvention());
		}
		if (!isBlank(o.getExtension())) {
			merged.extension(o.getExtension().trim());
		}
		if (!isBlank(o.getProjectName())) {
			merged.projectName(o.getProjectName().trim());
		}
		if (o.isAllowMissingProcs()) {
			merged.allowMissingProcs(true);
		}

		if (o.getMaxDepth() != null) {
			if (o.getMaxDepth() < 1) {
				errors.add("Max depth must be >= 1. Got: " + o.getMaxDepth());
			} else {
				merged.maxIncludeDepth(o.getMaxDepth());
			}
		}
		if (o.getMaxPasses() != null) {
			if (o.getMaxPasses() < 1) {
				errors.add("Max passes must be >= 1. Got: " + o.getMaxPasses());
			} else {
				merged.maxExpansionPasses(o.getMaxPasses());
			}
		}
		if (o.getTier() != null) {
			String tier = o.getTier().trim();
			if (tier.length() != 1 || !Character.isLetter(tier.charAt(0))) {
				errors.add("Tier must be a single letter A-Z. Got: " + o.getTier());
			} else {
				merged.tierLetter(Character.toUpperCase(tier.charAt(0)));
			}
		}
		if (o.getParallelism() < 1) {
			errors.add("Parallelism must be >= 1. Got: " + o.getParallelism());
		}

		JclConfig config = merged.build();

		if (config.getRoot() == null) {
			errors.add("Member root is required (--root / config PATH).");
		} else if (!existsDirectory(config.getRoot())) {
			errors.add("Member root does not exist or is not a directory: " + config.getRoot());
		}
		if (isBlank(config.getProjectName())) {
			config.setProjectName("default");
		}

		List<String> members = new ArrayList<>();
		for (String member : o.getMembers()) {
			if (!isBlank(member)) {
				members.add(member.trim());
			}
		}
		if (members.isEmpty() && !isBlank(config.getTargetMember())) {
			members.add(config.getTargetMember().trim());
		}
		if (members.isEmpty()) {
			errors.add("At least one MEMBER is required (positional argument / config FILE).");
		}

		Path output = o.getOutput();
		if (output != null && Files.isDirectory(output)) {
			errors.add("Output must be a file, not a directory: " + output);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedAnalyzeOptions(config, List.copyOf(members), output, o.getParallelism());
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static List<String> parseLibraries(String raw) {
		return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
	}
}
