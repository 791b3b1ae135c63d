package com.hartwig.miniwt.wdl;

final class WdlToken {
    private final WdlTokenType type;
    private final String text;
    private final int line;
    private final int column;

    WdlToken(final WdlTokenType type, final String text, final int line, final int column) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    WdlTokenType type() {
        return type;
    }

    String text() {
        return text;
    }

    int line() {
        return line;
    }

    int column() {
        return column;
    }

    boolean is(WdlTokenType type) {
        return this.type == type;
    }

    boolean is(WdlTokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    boolean isKeyword(String keyword) {
        return is(WdlTokenType.KEYWORD, keyword);
    }

    /**
     * Human readable form for error messages.
     */
    String describe() {
        switch (type) {
            case EOF:
                return "end of input";
            case STRING:
                return "string \"" + text + "\"";
            case COMMAND:
                return "command section";
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
