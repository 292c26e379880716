package com.mainframe.jcl.cli;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.cli.exception.OptionsValidationException;
import com.mainframe.jcl.cli.model.AnalyzeOptions;
import com.mainframe.jcl.cli.model.ValidatedAnalyzeOptions;
import com.mainframe.jcl.cli.output.AnalyzeResultsPrinter;
import com.mainframe.jcl.cli.validation.AnalyzeOptionsValidator;
import com.mainframe.jcl.config.JclConfig;
import com.mainframe.jcl.export.JsonModelExporter;
import com.mainframe.jcl.pipeline.AnalysisResult;
import com.mainframe.jcl.pipeline.BatchAnalyzer;
import com.mainframe.jcl.pipeline.JclPipeline;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Resolves one or more JCL members into steps and allocations.
 *
 * Exit codes: 0 when every member was analyzed, 1 when any run failed or the output
 * could not be written, 2 for invalid options.
 */
@Command(
        name = "analyze",
        mixinStandardHelpOptions = true,
        description = "Resolves INCLUDEs, procedures and symbols in JCL members and builds the step/allocation model."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private AnalyzeOptions options;

    private final AnalyzeOptionsValidator validator;
    private final AnalyzeResultsPrinter printer;
    private final JsonModelExporter exporter;

    public AnalyzeCommand() {
        this(new AnalyzeOptionsValidator(), new AnalyzeResultsPrinter(), new JsonModelExporter());
    }

    AnalyzeCommand(AnalyzeOptionsValidator validator, AnalyzeResultsPrinter printer, JsonModelExporter exporter) {
        this.validator = validator;
        this.printer = printer;
        this.exporter = exporter;
    }

    @Override
    public Integer call() {
        ValidatedAnalyzeOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(validated);

        JclConfig config = validated.getConfig();
        List<String> members = validated.getMembers();
        List<AnalysisResult> results = members.size() == 1
                ? List.of(new JclPipeline(config).analyze(members.get(0)))
                : new BatchAnalyzer(() -> new JclPipeline(config)).analyzeAll(members, validated.getParallelism());

        results.forEach(printer::printResult);
        if (results.size() > 1) {
            printer.printSummary(results);
        }

        if (validated.getOutput() != null) {
            try {
                if (results.size() == 1) {
                    exporter.write(results.get(0), validated.getOutput());
                } else {
                    exporter.writeAll(results, validated.getOutput());
                }
            } catch (IOException e) {
                log.error("Failed to write {}", validated.getOutput(), e);
                return EXIT_FAILED;
            }
        }

        return results.stream().allMatch(AnalysisResult::isSuccess) ? EXIT_OK : EXIT_FAILED;
    }
}
