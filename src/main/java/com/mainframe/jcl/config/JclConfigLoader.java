package com.mainframe.jcl.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads a {@link JclConfig} from a JSON or YAML file.
 *
 * Keys: PATH (member root), LIB (additional libraries), FILE (target member),
 * SYSTEM (LWM or Z), EXT (member file extension), PROJECT (project name), plus the
 * optional limits MAX_DEPTH, MAX_PASSES, TIER and ALLOW_MISSING_PROCS. A relative PATH
 * is resolved against the directory holding the config file.
 */
public class JclConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(JclConfigLoader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * @throws IOException when the file cannot be read or parsed
     * @throws IllegalArgumentException when a value is out of range
     */
    public JclConfig load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file not found: " + file);
        }

        ObjectMapper mapper = isYaml(file) ? yamlMapper : jsonMapper;
        ConfigFile raw = mapper.readValue(file.toFile(), ConfigFile.class);
        if (raw == null) {
            throw new IOException("Config file is empty: " + file);
        }

        Path baseDir = file.toAbsolutePath().getParent();
        Path root = null;
        if (raw.path != null && !raw.path.isBlank()) {
            Path p = Path.of(raw.path.trim());
            root = p.isAbsolute() ? p : baseDir.resolve(p).normalize();
        }

        JclConfig.JclConfigBuilder builder = JclConfig.builder()
                .projectName(raw.project)
                .targetMember(raw.file)
                .root(root)
                .libraries(raw.lib != null ? List.copyOf(raw.lib) : List.of())
                .hostConvention(HostConvention.fromString(raw.system))
                .extension(raw.ext)
                .allowMissingProcs(Boolean.TRUE.equals(raw.allowMissingProcs));

        if (raw.maxDepth != null) {
            builder.maxIncludeDepth(positive("MAX_DEPTH", raw.maxDepth));
        }
        if (raw.maxPasses != null) {
            builder.maxExpansionPasses(positive("MAX_PASSES", raw.maxPasses));
        }
        if (raw.tier != null && !raw.tier.isBlank()) {
            builder.tierLetter(tier(raw.tier));
        }

        JclConfig config = builder.build();
        log.info("Loaded config {} (project={}, root={}, system={})",
                file, config.getProjectName(), config.getRoot(), config.getHostConvention());
        return config;
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static int positive(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be >= 1, got " + value);
        }
        return value;
    }

    private static char tier(String value) {
        String trimmed = value.trim();
        if (trimmed.length() != 1 || !Character.isLetter(trimmed.charAt(0))) {
            throw new IllegalArgumentException("TIER must be a single letter, got '" + value + "'");
        }
        return Character.toUpperCase(trimmed.charAt(0));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class ConfigFile {
        @JsonProperty("PATH")
        public String path;
        @JsonProperty("LIB")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        public List<String> lib;
        @JsonProperty("FILE")
        public String file;
        @JsonProperty("SYSTEM")
        public String system;
        @JsonProperty("EXT")
        public String ext;
        @JsonProperty("PROJECT")
        public String project;
        @JsonProperty("MAX_DEPTH")
        public Integer maxDepth;
        @JsonProperty("MAX_PASSES")
        public Integer maxPasses;
        @JsonProperty("TIER")
        public String tier;
        @JsonProperty("ALLOW_MISSING_PROCS")
        public Boolean allowMissingProcs;
    }
}
