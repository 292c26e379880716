package com.mainframe.jcl.parser;

import com.mainframe.jcl.exception.JclParseException;
import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.node.ConditionNode;
import com.mainframe.jcl.model.node.DdNode;
import com.mainframe.jcl.model.node.ExecNode;
import com.mainframe.jcl.model.node.IncludeNode;
import com.mainframe.jcl.model.node.JclNode;
import com.mainframe.jcl.model.node.JclOpcode;
import com.mainframe.jcl.model.node.JclValue;
import com.mainframe.jcl.model.node.JcllibNode;
import com.mainframe.jcl.model.node.ProcNode;
import com.mainframe.jcl.model.node.SetNode;
import com.mainframe.jcl.parser.JclToken.TokenType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StatementTokenizer, OperandParser and StatementClassifier.
 */
class StatementClassifierTest {

    private final StatementClassifier classifier = new StatementClassifier();

    @Test
    void testTokenizeSeparatesFields() {
        JclTokenStream stream = classifier.tokenize(statement("//DD1 DD DSN=A.B,DISP=(OLD,KEEP)"));

        assertThat(stream.getLabel()).isEqualTo("DD1");
        assertThat(stream.getOpcode()).isEqualTo(JclOpcode.DD);
        assertThat(stream.getTokens()).extracting(JclToken::getType).containsExactly(
                TokenType.LABEL, TokenType.OPCODE,
                TokenType.WORD, TokenType.EQUALS, TokenType.WORD, TokenType.COMMA,
                TokenType.WORD, TokenType.EQUALS, TokenType.LPAREN, TokenType.WORD, TokenType.COMMA,
                TokenType.WORD, TokenType.RPAREN, TokenType.EOF);
    }

    @Test
    void testOpcodeWinsOverLabel() {
        JclNode node = classify("//INCLUDE MEMBER=COMMON");

        assertThat(node).isInstanceOf(IncludeNode.class);
        assertThat(node.hasLabel()).isFalse();
        assertThat(((IncludeNode) node).getTargetMember()).isEqualTo("COMMON");
    }

    @Test
    void testExecProgram() {
        ExecNode exec = (ExecNode) classify("//STEP1 EXEC PGM=IEFBR14,PARM='A,B',COND=(4,LT)");

        assertThat(exec.getLabel()).isEqualTo("STEP1");
        assertThat(exec.getProgramName()).isEqualTo("IEFBR14");
        assertThat(exec.getProcName()).isNull();
        assertThat(exec.isProcCall()).isFalse();
        assertThat(exec.getParm()).isEqualTo("A,B");
        assertThat(exec.getCond()).isEqualTo("(4,LT)");
    }

    @Test
    void testExecProcedureByPosition() {
        ExecNode exec = (ExecNode) classify("//S2 EXEC MYPROC,HLQ=PROD,REGION=0M");

        assertThat(exec.getProcName()).isEqualTo("MYPROC");
        assertThat(exec.getProgramName()).isNull();
        assertThat(exec.getSymbolicOverrides()).containsExactly(entry("HLQ", "PROD"));
    }

    @Test
    void testExecProcedureByKeyword() {
        ExecNode exec = (ExecNode) classify("//S3 EXEC PROC=MYPROC");

        assertThat(exec.getProcName()).isEqualTo("MYPROC");
        assertThat(exec.isProcCall()).isTrue();
    }

    @Test
    void testExecWithoutProgramIsParseError() {
        assertThatThrownBy(() -> classify("//S1 EXEC PARM='X'"))
                .isInstanceOf(JclParseException.class)
                .satisfies(e -> {
                    JclParseException pe = (JclParseException) e;
                    assertThat(pe.getMemberName()).isEqualTo("TEST");
                    assertThat(pe.getFirstLine()).isEqualTo(7);
                    assertThat(pe.getStatementText()).isEqualTo("//S1 EXEC PARM='X'");
                });
    }

    @Test
    void testExecWithProgramAndProcedureIsParseError() {
        assertThatThrownBy(() -> classify("//S1 EXEC MYPROC,PGM=X"))
                .isInstanceOf(JclParseException.class);
    }

    @Test
    void testDispositionKeepsEmptySlots() {
        DdNode dd = (DdNode) classify("//DD1 DD DSN=A.B,DISP=(,CATLG,DELETE)");

        JclValue disp = dd.keyword("DISP").orElseThrow();
        assertThat(disp.isList()).isTrue();
        assertThat(disp.positionalSlots()).containsExactly(null, "CATLG", "DELETE");
    }

    @Test
    void testQuotedValuesKeepCommasAndParens() {
        ExecNode exec = (ExecNode) classify("//S1 EXEC PGM=X,PARM='A,(B)'");

        assertThat(exec.getParm()).isEqualTo("A,(B)");
    }

    @Test
    void testDoubledQuoteCollapses() {
        ExecNode exec = (ExecNode) classify("//S1 EXEC PGM=X,PARM='IT''S'");

        assertThat(exec.getParm()).isEqualTo("IT'S");
    }

    @Test
    void testUnterminatedQuoteIsParseError() {
        assertThatThrownBy(() -> classify("//S1 EXEC PGM=X,PARM='OPEN"))
                .isInstanceOf(JclParseException.class)
                .hasMessageContaining("Unterminated quoted string");
    }

    @Test
    void testNestedKeywordAndMemberSuffix() {
        DdNode dd = (DdNode) classify("//DD1 DD DSN=LIB.PDS(MEM),VOL=SER=123456,UNIT=SYSDA");

        assertThat(dd.keyword("DSN").orElseThrow().getText()).isEqualTo("LIB.PDS(MEM)");
        assertThat(dd.keyword("VOL").orElseThrow().keyword("SER").orElseThrow().getText()).isEqualTo("123456");
        assertThat(dd.keyword("UNIT").flatMap(JclValue::firstScalar)).contains("SYSDA");
    }

    @Test
    void testDsnameAliasAndPositionals() {
        DdNode dd = (DdNode) classify("//DD1 DD DUMMY,DSNAME=A.B");

        assertThat(dd.isDummy()).isTrue();
        assertThat(dd.hasKeyword("DSN")).isTrue();
        assertThat(dd.getPositionals()).containsExactly("DUMMY");
    }

    @Test
    void testProcStepOverrideLabel() {
        DdNode dd = (DdNode) classify("//STEP1.SYSUT1 DD DSN=X");

        assertThat(dd.getLabel()).isEqualTo("STEP1.SYSUT1");
        assertThat(dd.getProcStepQualifier()).contains("STEP1");
        assertThat(dd.getDdName()).isEqualTo("SYSUT1");
    }

    @Test
    void testSetProcAndJcllib() {
        SetNode set = (SetNode) classify("// SET HLQ=PROD,ENV=TEST");
        assertThat(set.getAssignments()).containsExactly(entry("HLQ", "PROD"), entry("ENV", "TEST"));

        ProcNode proc = (ProcNode) classify("//MYPROC PROC SUF=A,OUT=");
        assertThat(proc.getProcName()).isEqualTo("MYPROC");
        assertThat(proc.getDefaults()).containsExactly(entry("SUF", "A"), entry("OUT", ""));

        JcllibNode jcllib = (JcllibNode) classify("//LIBS JCLLIB ORDER=(SYS1.PROCLIB,MY.PROCLIB)");
        assertThat(jcllib.getOrder()).containsExactly("SYS1.PROCLIB", "MY.PROCLIB");
    }

    @Test
    void testIfKeepsExpressionText() {
        ConditionNode node = (ConditionNode) classify("// IF (RC = 0 & STEP1.RC < 8) THEN");

        assertThat(node.getKind()).isEqualTo(JclOpcode.IF);
        assertThat(node.getExpression()).isEqualTo("(RC = 0 & STEP1.RC < 8)");
    }

    @Test
    void testStatementsOutsideTheModelYieldNoNode() {
        Optional<JclNode> job = classifier.classify(statement("//MYJOB JOB (ACCT),'A NAME',CLASS=A"));
        Optional<JclNode> output = classifier.classify(statement("//OUT1 OUTPUT CLASS=X"));

        assertThat(job).isEmpty();
        assertThat(output).isEmpty();
    }

    @Test
    void testInvalidNameFieldIsParseError() {
        assertThatThrownBy(() -> classify("//1BAD DD DSN=X"))
                .isInstanceOf(JclParseException.class)
                .hasMessageContaining("Invalid name field");
    }

    @Test
    void testUnknownOperationIsParseError() {
        assertThatThrownBy(() -> classify("//S1 EXECUTE PGM=X"))
                .isInstanceOf(JclParseException.class)
                .hasMessageContaining("Unknown operation");
    }

    @Test
    void testFieldMatcherOrder() {
        assertThat(Arrays.asList(FieldMatcher.values()))
                .containsExactly(FieldMatcher.OPCODE, FieldMatcher.LABEL, FieldMatcher.UNMATCHED);
        assertThat(FieldMatcher.match("PEND")).isEqualTo(FieldMatcher.OPCODE);
        assertThat(FieldMatcher.match("STEP#1")).isEqualTo(FieldMatcher.LABEL);
        assertThat(FieldMatcher.match("TOOLONGNAME")).isEqualTo(FieldMatcher.UNMATCHED);
    }

    private JclNode classify(String text) {
        return classifier.classify(statement(text)).orElseThrow();
    }

    private static Statement statement(String text) {
        return Statement.builder().text(text).memberName("TEST").firstLine(7).lastLine(7).build();
    }
}
