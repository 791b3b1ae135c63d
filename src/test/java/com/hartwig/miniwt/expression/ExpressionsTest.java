package com.hartwig.miniwt.expression;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ExpressionsTest {
    private final Expression expression = Interpolation.of(List.of(TemplatePart.text("align "),
            TemplatePart.placeholder(VariableRef.of("reads")),
            TemplatePart.text(" "),
            TemplatePart.placeholder(FunctionCall.of("sep", Literal.ofString(","), MemberRef.of("index", "files"))),
            TemplatePart.placeholder(Operation.binary(Operator.ADD, VariableRef.of("threads"), VariableRef.of("reads")))));

    @Test
    void referencesAreListedInSourceOrderWithDuplicates() {
        assertThat(Expressions.references(expression)).containsExactly(VariableRef.of("reads"),
                VariableRef.of("threads"),
                VariableRef.of("reads"));
    }

    @Test
    void memberReferencesAreFoundInsideFunctionArguments() {
        assertThat(Expressions.memberRefs(expression)).containsExactly(MemberRef.of("index", "files"));
    }

    @Test
    void substituteReplacesVariablesEverywhere() {
        var substituted = Expressions.substitute(expression, Map.of("reads", Literal.ofString("a.fq")));

        assertThat(Expressions.references(substituted)).containsExactly(VariableRef.of("threads"));
        assertThat(Expressions.memberRefs(substituted)).containsExactly(MemberRef.of("index", "files"));
    }

    @Test
    void substituteLeavesUnrelatedExpressionsEqual() {
        assertThat(Expressions.substitute(expression, Map.of("unknown", Literal.ofInt(1)))).isEqualTo(expression);
    }

    @Test
    void javascriptIsDetectedInNestedCalls() {
        var script = FunctionCall.of(FunctionCall.JAVASCRIPT, Literal.ofString("$(inputs.x * 2)"), VariableRef.of("x"));

        assertThat(Expressions.containsJavascript(ArrayLiteral.of(Literal.ofInt(1), script))).isTrue();
        assertThat(Expressions.containsJavascript(expression)).isFalse();
    }

    @Test
    void interpolationKnowsWhenItIsBlank() {
        assertThat(Interpolation.ofText("  \n").isBlank()).isTrue();
        assertThat(Interpolation.empty().isBlank()).isTrue();
        assertThat(Interpolation.of(List.of(TemplatePart.placeholder(VariableRef.of("x")))).isBlank()).isFalse();
    }
}
