package com.mainframe.jcl.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.mainframe.jcl.config.JclConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AnalyzeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnalyzeOptions {
    JclConfig config;
    List<String> members;
    Path output;
    int parallelism;
}
