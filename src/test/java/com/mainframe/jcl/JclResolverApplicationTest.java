package com.mainframe.jcl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the command line end to end against members on disk.
 */
class JclResolverApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void testAnalyzeWritesModel() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("jcl"));
        Files.writeString(root.resolve("PAYROLL.jcl"), """
                //PAYROLL JOB (ACCT),'PAY'
                //EXTRACT EXEC PGM=PAYEXT
                //INPUT DD DSN=PAY.MASTER,DISP=SHR
                //      DD DSN=PAY.DELTA,DISP=SHR
                //REPORT DD SYSOUT=*
                """);
        Path out = tempDir.resolve("out/payroll.json");

        int exit = JclResolverApplication.run("analyze", "--root", root.toString(), "-n", "payroll",
                "-o", out.toString(), "PAYROLL");

        assertThat(exit).isZero();
        JsonNode model = new ObjectMapper().readTree(Files.readString(out));
        assertThat(model.get("project").asText()).isEqualTo("payroll");
        assertThat(model.get("steps")).hasSize(1);
        assertThat(model.get("steps").get(0).get("allocations")).hasSize(3);
        assertThat(model.get("steps").get(0).get("allocations").get(1).get("allocation_offset").asInt()).isEqualTo(2);
    }

    @Test
    void testFailedRunExitsWithOne() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("jcl"));
        Files.writeString(root.resolve("LOOP.jcl"), "//  INCLUDE MEMBER=LOOP\n");

        assertThat(JclResolverApplication.run("analyze", "--root", root.toString(), "LOOP")).isEqualTo(1);
    }

    @Test
    void testInvalidOptionsExitWithTwo() {
        assertThat(JclResolverApplication.run("analyze", "--root", tempDir.resolve("missing").toString(), "JOB1"))
                .isEqualTo(2);
        assertThat(JclResolverApplication.run()).isEqualTo(2);
    }
}
