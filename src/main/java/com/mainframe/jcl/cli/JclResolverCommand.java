package com.mainframe.jcl.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; the work happens in its subcommands.
 */
@Command(
        name = "jcl-resolver",
        mixinStandardHelpOptions = true,
        version = "jcl-resolver 1.0.0",
        description = "Turns mainframe JCL into a resolved model of job steps and data allocations.",
        subcommands = { AnalyzeCommand.class }
)
public class JclResolverCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
