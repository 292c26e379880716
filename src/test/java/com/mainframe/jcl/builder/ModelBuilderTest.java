package com.mainframe.jcl.builder;

import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.model.DataAllocation;
import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.Step;
import com.mainframe.jcl.model.node.DdNode;
import com.mainframe.jcl.model.node.ExecNode;
import com.mainframe.jcl.model.node.JclNode;
import com.mainframe.jcl.parser.SourceNormalizer;
import com.mainframe.jcl.parser.StatementClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModelBuilder and AllocationFactory.
 */
class ModelBuilderTest {

    private final SourceNormalizer normalizer = new SourceNormalizer();
    private final StatementClassifier classifier = new StatementClassifier();
    private JclDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new JclDiagnostics();
    }

    @Test
    void testConcatenationOffsets() {
        List<Step> steps = build("""
                //S1 EXEC PGM=P1
                //IN DD DSN=A.ONE,DISP=SHR
                //   DD DSN=A.TWO,DISP=SHR
                //   DD DSN=A.THREE,DISP=SHR
                //OUT DD DSN=B.OUT,DISP=(NEW,CATLG,DELETE)
                """);

        assertThat(steps).hasSize(1);
        assertThat(steps.get(0).getAllocations())
                .extracting(DataAllocation::getDdName, DataAllocation::getAllocationOffset, DataAllocation::getDsn)
                .containsExactly(
                        tuple("IN", 1, "A.ONE"),
                        tuple("IN", 2, "A.TWO"),
                        tuple("IN", 3, "A.THREE"),
                        tuple("OUT", 1, "B.OUT"));
    }

    @Test
    void testStepFields() {
        List<Step> steps = build("""
                //COPY EXEC PGM=IEBGENER,PARM='NOLIST'
                //S2 EXEC MYPROC
                """);

        Step copy = steps.get(0);
        assertThat(copy.getStepId()).isEqualTo(1);
        assertThat(copy.getStepName()).isEqualTo("COPY");
        assertThat(copy.getProgramName()).isEqualTo("IEBGENER");
        assertThat(copy.getParameters()).isEqualTo("NOLIST");
        assertThat(copy.getSourceMember()).isEqualTo("TEST");
        assertThat(copy.getSourceLine()).isEqualTo(1);

        Step call = steps.get(1);
        assertThat(call.isProcCall()).isTrue();
        assertThat(call.getProcName()).isEqualTo("MYPROC");
        assertThat(call.getProgramName()).isNull();
    }

    @Test
    void testRelativeStepsIncrease() {
        List<Step> steps = build("""
                //S1 EXEC PGM=A
                //S2 EXEC PGM=B
                //S3 EXEC PGM=C
                """);

        assertThat(steps).extracting(Step::getRelativeStep)
                .containsExactly("X0000001", "X0000002", "X0000003")
                .allMatch(id -> id.matches("[A-Z]\\d{7}"));
        assertThat(Set.copyOf(steps.stream().map(Step::getRelativeStep).toList())).hasSize(3);
    }

    @Test
    void testCustomTier() {
        ModelBuilder builder = new ModelBuilder('p', diagnostics);

        List<Step> steps = builder.build(nodes("//S1 EXEC PGM=A\n"));

        assertThat(steps.get(0).getRelativeStep()).isEqualTo("P0000001");
    }

    @Test
    void testDummyWinsOverEverything() {
        List<Step> steps = build("""
                //S1 EXEC PGM=A
                //D1 DD DUMMY,DSN=REAL.NAME
                //D2 DD DSN=NULLFILE
                //D3 DD DUMMY,SYSOUT=A
                """);

        assertThat(steps.get(0).getAllocations()).allSatisfy(a -> {
            assertThat(a.isDummy()).isTrue();
            assertThat(a.getDsn()).isEqualTo(DataAllocation.DUMMY_DSN);
        });
    }

    @Test
    void testInstreamSysoutAndWorkDataSets() {
        List<Step> steps = build("""
                //S1 EXEC PGM=SORT
                //SYSIN DD *
                  SORT FIELDS=(1,5,CH,A)
                /*
                //SYSOUT DD SYSOUT=*
                //WORK DD UNIT=sysda,SPACE=(CYL,(1,1))
                //TEMP DD DSN=&&TEMP,DISP=(NEW,PASS)
                """);

        List<DataAllocation> allocations = steps.get(0).getAllocations();
        assertThat(allocations).extracting(DataAllocation::getDsn).containsExactly(
                DataAllocation.INSTREAM_DSN, DataAllocation.SYSOUT_DSN, DataAllocation.WORK_DSN, "&&TEMP");
        assertThat(allocations.get(0).getInstreamRef()).contains("SORT FIELDS=(1,5,CH,A)");
        assertThat(allocations.get(1).getInstreamRef()).isNull();
        assertThat(allocations.get(2).getUnit()).isEqualTo("SYSDA");
        assertThat(allocations.get(3).getDispNormal()).isEqualTo("PASS");
    }

    @Test
    void testDispositionDefaults() {
        List<Step> steps = build("""
                //S1 EXEC PGM=A
                //D1 DD DSN=A.B
                //D2 DD DSN=A.C,DISP=(,CATLG)
                //D3 DD DSN=A.D,DISP=SHR
                """);

        List<DataAllocation> allocations = steps.get(0).getAllocations();
        assertThat(allocations.get(0))
                .extracting(DataAllocation::getDispStatus, DataAllocation::getDispNormal, DataAllocation::getDispAbnormal)
                .containsExactly("NEW", "DELETE", "DELETE");
        assertThat(allocations.get(1))
                .extracting(DataAllocation::getDispStatus, DataAllocation::getDispNormal, DataAllocation::getDispAbnormal)
                .containsExactly("NEW", "CATLG", "DELETE");
        assertThat(allocations.get(2).getDispStatus()).isEqualTo("SHR");
    }

    @Test
    void testDcbAttributes() {
        List<Step> steps = build("""
                //S1 EXEC PGM=A
                //REP DD SYSOUT=*,DCB=(RECFM=fba,LRECL=121,BLKSIZE=1210,BUFNO=5),
                //             LRECL=133,DSORG=PS
                //MOD DD DSN=X.Y,DCB=MODEL.DSCB
                //MIX DD DSN=X.Z,DCB=(SYS1.MODEL,LRECL=80)
                """);

        DataAllocation rep = steps.get(0).getAllocations().get(0);
        assertThat(rep.getLrecl()).isEqualTo("133");
        assertThat(rep.getBlksize()).isEqualTo("1210");
        assertThat(rep.getRecfm()).isEqualTo("FBA");
        assertThat(rep.getDcbAttributes().get("BUFNO")).contains(5L);
        assertThat(rep.getDcbAttributes().get("DSORG")).contains("PS");
        assertThat(rep.getDcbAttributes().get("LRECL")).isEmpty();

        DataAllocation model = steps.get(0).getAllocations().get(1);
        assertThat(model.getDcbAttributes().asMap()).containsExactly(entry("MODEL", "MODEL.DSCB"));

        DataAllocation mixed = steps.get(0).getAllocations().get(2);
        assertThat(mixed.getDcbAttributes().get("MODEL")).contains("SYS1.MODEL");
        assertThat(mixed.getLrecl()).isEqualTo("80");
    }

    @Test
    void testVolumeSerials() {
        List<Step> steps = build("""
                //S1 EXEC PGM=A
                //D1 DD DSN=A.B,VOL=SER=(v1,V2),UNIT=TAPE
                //D2 DD DSN=A.C,VOLUME=SER=PACK01
                //D3 DD DSN=A.D
                """);

        List<DataAllocation> allocations = steps.get(0).getAllocations();
        assertThat(allocations).extracting(DataAllocation::getVolSer).containsExactly("V1,V2", "PACK01", null);
    }

    @Test
    void testCondAndIfLogic() {
        List<Step> steps = build("""
                //S1 EXEC PGM=A,COND=(4,LT)
                // IF (RC = 0) THEN
                //S2 EXEC PGM=B
                // ELSE
                //S3 EXEC PGM=C
                // ENDIF
                //S4 EXEC PGM=D
                """);

        assertThat(steps).extracting(Step::getCondLogic)
                .containsExactly("(4,LT)", "(RC = 0)", "NOT ((RC = 0))", null);
    }

    @Test
    void testNestedIfConditionsAreJoined() {
        List<Step> steps = build("""
                //S1 EXEC PGM=A
                // IF RC=0 THEN
                // IF (S1.RC < 4) THEN
                //S2 EXEC PGM=B
                // ENDIF
                // ENDIF
                """);

        assertThat(steps.get(1).getCondLogic()).isEqualTo("(RC=0) AND (S1.RC < 4)");
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testUnclosedIfIsWarned() {
        build("""
                // IF (RC = 0) THEN
                //S1 EXEC PGM=A
                """);

        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("without ENDIF"));
    }

    @Test
    void testOrphanStatementsAreSkipped() {
        List<Step> steps = build("""
                //EARLY DD DSN=A.B
                // ENDIF
                //S1 EXEC PGM=A
                //   DD DSN=ORPHAN
                //OK DD DSN=C.D
                """);

        assertThat(steps.get(0).getAllocations()).extracting(DataAllocation::getDdName).containsExactly("OK");
        assertThat(diagnostics.getSkipCount()).isEqualTo(3);
        assertThat(diagnostics.getSkippedStatements()).extracting(s -> s.getFirstLine()).containsExactly(1, 2, 4);
    }

    @Test
    void testProcStepOverrides() {
        List<JclNode> nodes = new ArrayList<>(nodes("""
                //STEP1 EXEC MYPROC
                //PS1 EXEC PGM=A
                //IN DD DSN=ORIG.IN,DISP=SHR
                //OUT DD DSN=ORIG.OUT,DISP=SHR
                //PS2 EXEC PGM=B
                //PS1.IN DD DSN=NEW.IN,DISP=SHR
                //   DD DSN=EXTRA.IN,DISP=SHR
                //PS2.ADDED DD DSN=ADDED.DS
                //NOSUCH.DD1 DD DSN=LOST
                """));
        tagAsProcBody(nodes, 1, 4, "STEP1", "MYPROC");

        List<Step> steps = new ModelBuilder(diagnostics).build(nodes);

        assertThat(steps).extracting(Step::getStepName, Step::getProcStepName)
                .containsExactly(tuple("STEP1", null), tuple("STEP1", "PS1"), tuple("STEP1", "PS2"));
        assertThat(steps.get(1).getAllocations())
                .extracting(DataAllocation::getDdName, DataAllocation::getAllocationOffset, DataAllocation::getDsn)
                .containsExactly(
                        tuple("IN", 1, "NEW.IN"),
                        tuple("IN", 2, "EXTRA.IN"),
                        tuple("OUT", 1, "ORIG.OUT"));
        assertThat(steps.get(2).getAllocations()).extracting(DataAllocation::getDdName).containsExactly("ADDED");
        assertThat(diagnostics.getSkipCount()).isEqualTo(1);
    }

    @Test
    void testOverrideKeepsDdPosition() {
        List<JclNode> nodes = new ArrayList<>(nodes("""
                //STEP1 EXEC MYPROC
                //PS EXEC PGM=A
                //A DD DSN=OLD.A
                //B DD DSN=OLD.B
                //PS.A DD DSN=NEW.A
                """));
        tagAsProcBody(nodes, 1, 3, "STEP1", "MYPROC");

        List<Step> steps = new ModelBuilder(diagnostics).build(nodes);

        assertThat(steps.get(1).getAllocations()).extracting(DataAllocation::getDdName, DataAllocation::getDsn)
                .containsExactly(tuple("A", "NEW.A"), tuple("B", "OLD.B"));
    }

    @Test
    void testUnqualifiedDdAfterProcCallGoesToFirstProcStep() {
        List<JclNode> nodes = new ArrayList<>(nodes("""
                //STEP1 EXEC MYPROC
                //PS1 EXEC PGM=A
                //IN DD DSN=ORIG.IN
                //PS2 EXEC PGM=B
                //OUT DD DSN=ORIG.OUT
                //EXTRA DD DSN=ADDED.DS
                //   DD DSN=ADDED.DS2
                //IN DD DSN=NEW.IN
                //STEP2 EXEC PGM=C
                //SYSIN DD DSN=PLAIN
                """));
        tagAsProcBody(nodes, 1, 4, "STEP1", "MYPROC");

        List<Step> steps = new ModelBuilder(diagnostics).build(nodes);

        assertThat(steps.get(1).getAllocations())
                .extracting(DataAllocation::getDdName, DataAllocation::getAllocationOffset, DataAllocation::getDsn)
                .containsExactly(
                        tuple("IN", 1, "NEW.IN"),
                        tuple("EXTRA", 1, "ADDED.DS"),
                        tuple("EXTRA", 2, "ADDED.DS2"));
        assertThat(steps.get(2).getAllocations()).extracting(DataAllocation::getDsn).containsExactly("ORIG.OUT");
        assertThat(steps.get(3).getAllocations()).extracting(DataAllocation::getDsn).containsExactly("PLAIN");
        assertThat(diagnostics.getSkipCount()).isZero();
    }

    @Test
    void testBuildResetsState() {
        ModelBuilder builder = new ModelBuilder(diagnostics);
        List<JclNode> nodes = nodes("//S1 EXEC PGM=A\n");

        builder.build(nodes);
        List<Step> second = builder.build(nodes);

        assertThat(second).hasSize(1);
        assertThat(second.get(0).getRelativeStep()).isEqualTo("X0000001");
    }

    private List<Step> build(String text) {
        return new ModelBuilder(diagnostics).build(nodes(text));
    }

    /**
     * Mark nodes {@code from..to} as expanded from a procedure called by {@code stepName}.
     */
    private static void tagAsProcBody(List<JclNode> nodes, int from, int to, String stepName, String procName) {
        for (int i = from; i <= to; i++) {
            JclNode node = nodes.get(i);
            if (node instanceof ExecNode exec) {
                nodes.set(i, exec.withProcContext(stepName, procName));
            } else if (node instanceof DdNode dd) {
                nodes.set(i, dd.withProcContext(procName));
            }
        }
    }

    private List<JclNode> nodes(String text) {
        List<JclNode> nodes = new ArrayList<>();
        for (Statement statement : normalizer.joinStatements("TEST", text.lines().toList())) {
            classifier.classify(statement).ifPresent(nodes::add);
        }
        return nodes;
    }
}
