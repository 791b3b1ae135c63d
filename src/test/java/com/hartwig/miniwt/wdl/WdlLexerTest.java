package com.hartwig.miniwt.wdl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import com.hartwig.miniwt.diagnostics.SyntaxException;

import org.junit.jupiter.api.Test;

class WdlLexerTest {
    @Test
    void tokensCarryTypeAndPosition() throws SyntaxException {
        var tokens = new WdlLexer("version 1.0\n\ntask t {\n  Int? x = -3\n}").tokenize();

        assertThat(types(tokens)).containsExactly(WdlTokenType.KEYWORD,
                WdlTokenType.FLOAT,
                WdlTokenType.KEYWORD,
                WdlTokenType.IDENTIFIER,
                WdlTokenType.LBRACE,
                WdlTokenType.IDENTIFIER,
                WdlTokenType.QUESTION,
                WdlTokenType.IDENTIFIER,
                WdlTokenType.ASSIGN,
                WdlTokenType.OPERATOR,
                WdlTokenType.INTEGER,
                WdlTokenType.RBRACE,
                WdlTokenType.EOF);
        var x = tokens.get(7);
        assertThat(x.text()).isEqualTo("x");
        assertThat(x.line()).isEqualTo(4);
        assertThat(x.column()).isEqualTo(8);
    }

    @Test
    void commentsAreSkipped() throws SyntaxException {
        var tokens = new WdlLexer("# header\ncall a # trailing\n").tokenize();

        assertThat(tokens.stream().map(WdlToken::text).collect(Collectors.toList())).containsExactly("call", "a", "");
    }

    @Test
    void heredocCommandIsCapturedRaw() throws SyntaxException {
        var tokens = new WdlLexer("command <<<\n  echo ${HOME} ~{x} }\n>>>").tokenize();

        assertThat(tokens.get(0).isKeyword("command")).isTrue();
        assertThat(tokens.get(1).type()).isEqualTo(WdlTokenType.COMMAND);
        assertThat(tokens.get(1).text()).isEqualTo("\n  echo ${HOME} ~{x} }\n");
    }

    @Test
    void bracedCommandBalancesBraces() throws SyntaxException {
        var tokens = new WdlLexer("command { if true; then echo ${x}; fi }").tokenize();

        assertThat(tokens.get(1).type()).isEqualTo(WdlTokenType.COMMAND_BRACES);
        assertThat(tokens.get(1).text()).isEqualTo(" if true; then echo ${x}; fi ");
        assertThat(tokens.get(2).type()).isEqualTo(WdlTokenType.EOF);
    }

    @Test
    void stringsMayNestQuotesInsidePlaceholders() throws SyntaxException {
        var tokens = new WdlLexer("\"~{sep=\", \" names}.txt\"").tokenize();

        assertThat(tokens.get(0).type()).isEqualTo(WdlTokenType.STRING);
        assertThat(tokens.get(0).text()).isEqualTo("~{sep=\", \" names}.txt");
    }

    @Test
    void unexpectedCharacterReportsLineAndColumn() {
        var e = assertThrows(SyntaxException.class, () -> new WdlLexer("version 1.0\ntask t {\n    Int x = @\n}").tokenize());

        assertThat(e.line()).isEqualTo(3);
        assertThat(e.column()).isEqualTo(13);
        assertThat(e.getMessage()).isEqualTo("line 3, column 13: Unexpected character '@'");
    }

    @Test
    void unterminatedCommandIsReported() {
        var e = assertThrows(SyntaxException.class, () -> new WdlLexer("task t {\n  command <<<\n echo").tokenize());

        assertThat(e.reason()).isEqualTo("Command section is not closed with '>>>'");
        assertThat(e.line()).isEqualTo(2);
    }

    private static List<WdlTokenType> types(List<WdlToken> tokens) {
        return tokens.stream().map(WdlToken::type).collect(Collectors.toList());
    }
}
