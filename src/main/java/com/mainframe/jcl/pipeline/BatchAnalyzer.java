package com.mainframe.jcl.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes independent members in parallel, one pipeline run per member.
 * Results come back in input order.
 */
public class BatchAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final Supplier<JclPipeline> pipelineFactory;

    public BatchAnalyzer(Supplier<JclPipeline> pipelineFactory) {
        this.pipelineFactory = pipelineFactory;
    }

    public List<AnalysisResult> analyzeAll(List<String> members, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (members.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(parallelism, members.size());
        log.info("Analyzing {} member(s) on {} thread(s)", members.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<AnalysisResult>> futures = new ArrayList<>();
            for (String member : members) {
                futures.add(executor.submit(() -> pipelineFactory.get().analyze(member)));
            }

            List<AnalysisResult> results = new ArrayList<>();
            for (Future<AnalysisResult> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private AnalysisResult await(Future<AnalysisResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for analysis results", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Analysis failed", cause);
        }
    }
}
