package com.hartwig.miniwt.wdl;

enum WdlTokenType {
    KEYWORD,
    IDENTIFIER,
    INTEGER,
    FLOAT,
    /**
     * Quoted string, raw content between the quotes with escapes and placeholders untouched.
     */
    STRING,
    /**
     * Raw body of a {@code command <<< >>>} section.
     */
    COMMAND,
    /**
     * Raw body of a {@code command { }} section.
     */
    COMMAND_BRACES,
    OPERATOR,
    ASSIGN,
    QUESTION,
    COLON,
    COMMA,
    DOT,
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    EOF
}
