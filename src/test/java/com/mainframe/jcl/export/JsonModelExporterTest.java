package com.mainframe.jcl.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.exception.MemberNotFoundException;
import com.mainframe.jcl.model.DataAllocation;
import com.mainframe.jcl.model.DcbAttributes;
import com.mainframe.jcl.model.Disposition;
import com.mainframe.jcl.model.Step;
import com.mainframe.jcl.pipeline.AnalysisResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JsonModelExporterTest {

    @TempDir
    Path tempDir;

    private final JsonModelExporter exporter = new JsonModelExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testSuccessfulRun() throws IOException {
        JsonNode root = mapper.readTree(exporter.toJson(successfulRun()));

        assertThat(root.get("project").asText()).isEqualTo("billing");
        assertThat(root.get("success").asBoolean()).isTrue();
        assertThat(root.has("error")).isFalse();

        JsonNode step = root.get("steps").get(0);
        assertThat(step.get("relative_step").asText()).isEqualTo("X0000001");
        assertThat(step.get("step_name").asText()).isEqualTo("S1");
        assertThat(step.get("cond_logic").isNull()).isTrue();

        JsonNode allocation = step.get("allocations").get(0);
        assertThat(allocation.get("dd_name").asText()).isEqualTo("SYSUT1");
        assertThat(allocation.get("allocation_offset").asInt()).isEqualTo(1);
        assertThat(allocation.get("is_dummy").asBoolean()).isFalse();
        assertThat(allocation.get("disp_status").asText()).isEqualTo("SHR");
        assertThat(allocation.get("disp_normal").asText()).isEqualTo("DELETE");
        assertThat(allocation.get("dcb_attributes").get("BUFNO").asLong()).isEqualTo(5L);
        assertThat(allocation.get("dcb_attributes").get("DSORG").asText()).isEqualTo("PS");
        assertThat(allocation.has("dummy")).isFalse();

        assertThat(root.get("diagnostics").get("skip_count").asInt()).isZero();
    }

    @Test
    void testFailedRunCarriesError() throws IOException {
        MemberNotFoundException error = new MemberNotFoundException("NOPE", List.of("/lib"), "JOB1", 4);
        AnalysisResult failed = AnalysisResult.failure("billing", "JOB1", error, new JclDiagnostics());

        JsonNode root = mapper.readTree(exporter.toJson(failed));

        assertThat(root.get("success").asBoolean()).isFalse();
        assertThat(root.get("steps")).isEmpty();
        assertThat(root.get("error").get("kind").asText()).isEqualTo("MemberNotFound");
        assertThat(root.get("error").get("member").asText()).isEqualTo("JOB1");
        assertThat(root.get("error").get("line").asInt()).isEqualTo(4);
    }

    @Test
    void testWriteAllCreatesParentDirectories() throws IOException {
        Path out = tempDir.resolve("nested/dir/model.json");

        exporter.writeAll(List.of(successfulRun(), successfulRun()), out);

        JsonNode root = mapper.readTree(Files.readString(out));
        assertThat(root.isArray()).isTrue();
        assertThat(root).hasSize(2);
    }

    private static AnalysisResult successfulRun() {
        DataAllocation allocation = DataAllocation.builder()
                .ddName("SYSUT1")
                .allocationOffset(1)
                .dsn("PROD.INPUT")
                .disposition(new Disposition("SHR", "DELETE", "DELETE"))
                .dcbAttributes(DcbAttributes.builder().put("BUFNO", "5").put("DSORG", "PS").build())
                .build();
        Step step = Step.builder()
                .stepId(1)
                .relativeStep("X0000001")
                .stepName("S1")
                .programName("IEBGENER")
                .sourceMember("JOB1")
                .sourceLine(2)
                .allocations(List.of(allocation))
                .build();
        return AnalysisResult.builder()
                .success(true)
                .projectName("billing")
                .member("JOB1")
                .steps(List.of(step))
                .diagnostics(new JclDiagnostics())
                .build();
    }
}
