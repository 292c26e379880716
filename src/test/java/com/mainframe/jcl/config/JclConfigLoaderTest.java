package com.mainframe.jcl.config;

import com.mainframe.jcl.resolver.DatasetMemberSource;
import com.mainframe.jcl.resolver.DirectoryMemberSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JclConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final JclConfigLoader loader = new JclConfigLoader();

    @Test
    void testLoadJson() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, """
                {
                  "PROJECT": "billing",
                  "PATH": "members",
                  "LIB": ["SYS1.PROCLIB", "MY.PROCLIB"],
                  "FILE": "JOB1",
                  "SYSTEM": "z",
                  "EXT": "jcl",
                  "MAX_DEPTH": 8,
                  "TIER": "b",
                  "UNKNOWN_KEY": true
                }
                """);

        JclConfig config = loader.load(file);

        assertThat(config.getProjectName()).isEqualTo("billing");
        assertThat(config.getRoot()).isEqualTo(tempDir.toAbsolutePath().resolve("members").normalize());
        assertThat(config.getLibraries()).containsExactly("SYS1.PROCLIB", "MY.PROCLIB");
        assertThat(config.getTargetMember()).isEqualTo("JOB1");
        assertThat(config.getHostConvention()).isEqualTo(HostConvention.Z);
        assertThat(config.getExtension()).isEqualTo("jcl");
        assertThat(config.getMaxIncludeDepth()).isEqualTo(8);
        assertThat(config.getMaxExpansionPasses()).isEqualTo(16);
        assertThat(config.getTierLetter()).isEqualTo('B');
        assertThat(config.createMemberSource()).isInstanceOf(DatasetMemberSource.class);
    }

    @Test
    void testLoadYamlWithSingleLibrary() throws IOException {
        Path absoluteRoot = Files.createDirectories(tempDir.resolve("jcl"));
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                PATH: %s
                LIB: PROCLIB
                ALLOW_MISSING_PROCS: true
                """.formatted(absoluteRoot));

        JclConfig config = loader.load(file);

        assertThat(config.getRoot()).isEqualTo(absoluteRoot);
        assertThat(config.getLibraries()).containsExactly("PROCLIB");
        assertThat(config.getSearchPaths()).containsExactly(".", "PROCLIB");
        assertThat(config.getHostConvention()).isEqualTo(HostConvention.LWM);
        assertThat(config.isAllowMissingProcs()).isTrue();
        assertThat(config.createMemberSource()).isInstanceOf(DirectoryMemberSource.class);
    }

    @Test
    void testInvalidValues() throws IOException {
        Path badSystem = tempDir.resolve("bad-system.json");
        Files.writeString(badSystem, "{\"SYSTEM\": \"MVS\"}");
        Path badDepth = tempDir.resolve("bad-depth.yml");
        Files.writeString(badDepth, "MAX_DEPTH: 0\n");

        assertThatThrownBy(() -> loader.load(badSystem))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MVS");
        assertThatThrownBy(() -> loader.load(badDepth))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MAX_DEPTH");
    }

    @Test
    void testMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void testSearchPathsAreDeduplicated() {
        JclConfig config = JclConfig.builder()
                .libraries(List.of("A", " A ", "", "B", "."))
                .build();

        assertThat(config.getSearchPaths()).containsExactly(".", "A", "B");
    }
}
