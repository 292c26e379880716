package com.mainframe.jcl;

import com.mainframe.jcl.cli.JclResolverCommand;
import picocli.CommandLine;

/**
 * Main entry point for the JCL resolver.
 * Reads JCL members, expands INCLUDEs, procedures and symbols, and reports the
 * resulting job steps and data allocations.
 */
public class JclResolverApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new JclResolverCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
