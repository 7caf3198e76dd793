package com.svdac.parser;

import com.svdac.exception.MalformedTokenException;
import com.svdac.model.ConditionTag;
import com.svdac.model.FlatStatement;
import com.svdac.model.LineText;
import com.svdac.model.SourceToken;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementFlattenerTest {

    private final SourcePreprocessor preprocessor = new SourcePreprocessor();
    private final SourceTokenizer tokenizer = new SourceTokenizer();
    private final StatementFlattener flattener = new StatementFlattener();

    @Test
    void shouldEmitOneStatementPerSemicolon() {
        List<FlatStatement> statements = flatten("""
                assign a_s0 = b_s0;
                assign c_s0 = d_s0;
                assign e_s0 = f_s0;
                """);

        assertEquals(3, statements.size());
        assertEquals("assign a_s0 = b_s0 ;", statements.get(0).code());
        assertEquals(List.of(1, 2, 3), statements.stream().map(FlatStatement::lineNumber).toList());
        assertTrue(statements.stream().allMatch(s -> s.conditions().isEmpty()));
    }

    @Test
    void shouldTagIfAndElseBranches() {
        List<FlatStatement> statements = flatten("if (en) x = y; else x = z;");

        assertEquals(2, statements.size());
        assertEquals("x = y ;", statements.get(0).code());
        assertEquals(List.of(ConditionTag.ifTag("(en)")), statements.get(0).conditions());
        assertEquals("x = z ;", statements.get(1).code());
        assertEquals(List.of(ConditionTag.ifTag("! (en)")), statements.get(1).conditions());
        assertEquals("x = y ; :if: (en)", statements.get(0).text());
    }

    @Test
    void shouldStackTagsInnermostFirst() {
        List<FlatStatement> statements = flatten("""
                if (a) begin
                    if (b) x = y;
                end
                """);

        assertEquals(1, statements.size());
        assertEquals(List.of(ConditionTag.ifTag("(b)"), ConditionTag.ifTag("(a)")), statements.get(0).conditions());
        assertEquals(2, statements.get(0).lineNumber());
    }

    @Test
    void shouldNegateOuterConditionAcrossElseIfChain() {
        List<FlatStatement> statements = flatten("if (a) x = 1; else if (b) x = 2; else x = 3;");

        assertEquals(3, statements.size());
        assertEquals("x = 2 ; :if: (b) :if: ! (a)", statements.get(1).text());
        assertEquals("x = 3 ; :if: ! (b) :if: ! (a)", statements.get(2).text());
    }

    @Test
    void shouldTagCaseItemsWithSelector() {
        List<FlatStatement> statements = flatten("""
                case (state)
                    IDLE: next_s0 = idle_s0;
                    BUSY: begin
                        next_s0 = busy_s0;
                    end
                endcase
                """);

        assertTrue(statements.stream()
                .allMatch(s -> s.conditions().equals(List.of(ConditionTag.caseTag("(state)")))));
        List<FlatStatement> assignments = statements.stream()
                .filter(s -> s.code().contains(" = "))
                .toList();
        assertEquals(2, assignments.size());
        assertEquals("IDLE : next_s0 = idle_s0 ;", assignments.get(0).code());
        assertEquals(2, assignments.get(0).lineNumber());
        assertEquals("next_s0 = busy_s0 ;", assignments.get(1).code());
        assertEquals(4, assignments.get(1).lineNumber());
    }

    @Test
    void shouldTreatCasezLikeCase() {
        List<FlatStatement> statements = flatten("casez (sel) 2'b1?: y_s0 = a_s0; endcase");

        assertEquals(1, statements.size());
        assertEquals(ConditionTag.Kind.CASE, statements.get(0).conditions().get(0).kind());
    }

    @Test
    void shouldDropBlockLabel() {
        List<FlatStatement> statements = flatten("begin : stage1\n  x_s1 = y_s1;\nend");

        assertEquals(1, statements.size());
        assertEquals("x_s1 = y_s1 ;", statements.get(0).code());
    }

    @Test
    void shouldRemoveCalleeNameBeforeParentheses() {
        List<FlatStatement> statements = flatten("assign y_s1 = func(a_s0, b_s0);");

        assertEquals("assign y_s1 = (a_s0, b_s0) ;", statements.get(0).code());
    }

    @Test
    void shouldKeepNestedParenthesesAsOneGroup() {
        List<FlatStatement> statements = flatten("assign y = (a & (b | c));");

        assertEquals("assign y = (a & (b | c)) ;", statements.get(0).code());
    }

    @Test
    void shouldUseLineOfFirstToken() {
        List<FlatStatement> statements = flatten("/* header\n   comment */\nassign x_s0 =\n    y_s0; // tail\n");

        assertEquals(1, statements.size());
        assertEquals(3, statements.get(0).lineNumber());
    }

    @Test
    void shouldEndStatementAtEndfunction() {
        List<FlatStatement> statements = flatten("function f; f = a; endfunction assign b = c;");

        assertEquals(List.of("function f ;", "f = a ;", "endfunction", "assign b = c ;"),
                statements.stream().map(FlatStatement::code).toList());
    }

    @Test
    void shouldCloseUnterminatedScopesAtEndOfInput() {
        List<FlatStatement> statements = assertDoesNotThrow(
                () -> flatten("always begin x_s0 = y_s0; if (a) begin z = w;"));

        List<String> texts = statements.stream().map(FlatStatement::text).toList();
        assertTrue(texts.contains("x_s0 = y_s0 ;"));
        assertTrue(texts.contains("z = w ; :if: (a)"));
    }

    @Test
    void shouldRejectFusedParenthesisInsideGroup() {
        TokenCursor cursor = new TokenCursor(List.of(new SourceToken("a(b", 4), new SourceToken(")", 4)));

        MalformedTokenException e = assertThrows(MalformedTokenException.class,
                () -> flattener.parenthesized(cursor, new SourceToken("(", 4)));
        assertEquals(4, e.getLineNumber());
    }

    @Test
    void shouldKeepOpeningParenthesisWhenStrippingCallee() {
        assertEquals("(", StatementFlattener.stripCallee(new LineText("(foo ", 1)).text());
        assertEquals("x = ", StatementFlattener.stripCallee(new LineText("x = foo ", 1)).text());
        assertEquals("x = ", StatementFlattener.stripCallee(new LineText("x = ", 1)).text());
    }

    private List<FlatStatement> flatten(String source) {
        return flattener.flatten(tokenizer.tokenize(preprocessor.preprocess(source)));
    }
}
