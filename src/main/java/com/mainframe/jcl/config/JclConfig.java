package com.mainframe.jcl.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.jcl.builder.RelativeStepSequence;
import com.mainframe.jcl.resolver.DatasetMemberSource;
import com.mainframe.jcl.resolver.DirectoryMemberSource;
import com.mainframe.jcl.resolver.ExpansionContext;
import com.mainframe.jcl.resolver.MemberSource;
import com.mainframe.jcl.symbol.SymbolicExpander;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one analysis run.
 */
@Data
@Builder(toBuilder = true)
public class JclConfig {
    public static final String ROOT_LOCATION = ".";

    private String projectName;
    private String targetMember;
    private Path root;
    @Builder.Default
    private List<String> libraries = List.of();
    @Builder.Default
    private HostConvention hostConvention = HostConvention.LWM;
    private String extension;
    @Builder.Default
    private int maxIncludeDepth = ExpansionContext.DEFAULT_MAX_DEPTH;
    @Builder.Default
    private int maxExpansionPasses = SymbolicExpander.DEFAULT_MAX_PASSES;
    @Builder.Default
    private char tierLetter = RelativeStepSequence.DEFAULT_TIER;
    private boolean allowMissingProcs;

    /**
     * Initial library search path: the root first, then the configured libraries.
     */
    public List<String> getSearchPaths() {
        List<String> paths = new ArrayList<>();
        paths.add(ROOT_LOCATION);
        if (libraries != null) {
            for (String library : libraries) {
                if (library != null && !library.isBlank() && !paths.contains(library.trim())) {
                    paths.add(library.trim());
                }
            }
        }
        return paths;
    }

    public MemberSource createMemberSource() {
        return switch (hostConvention) {
            case Z -> new DatasetMemberSource(root, extension);
            case LWM -> new DirectoryMemberSource(root, extension);
        };
    }
}
