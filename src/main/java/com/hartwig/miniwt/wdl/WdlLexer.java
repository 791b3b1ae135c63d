package com.hartwig.miniwt.wdl;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hartwig.miniwt.diagnostics.SyntaxException;

/**
 * Regex driven tokenizer. Strings and command sections are scanned by hand since they nest placeholders.
 */
class WdlLexer {
    private static final Set<String> KEYWORDS = Set.of("version",
            "import",
            "as",
            "task",
            "workflow",
            "struct",
            "input",
            "output",
            "runtime",
            "meta",
            "parameter_meta",
            "call",
            "scatter",
            "in",
            "if",
            "then",
            "else",
            "true",
            "false",
            "None");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMMENT = Pattern.compile("#[^\\n]*");
    private static final Pattern COMMAND_HEREDOC = Pattern.compile("command\\s*(?=<<<)");
    private static final Pattern COMMAND_BRACES = Pattern.compile("command\\s*(?=\\{)");

    private static final List<Rule> RULES = List.of(new Rule(WdlTokenType.FLOAT, "\\d+\\.\\d+(?:[eE][+-]?\\d+)?|\\d+[eE][+-]?\\d+"),
            new Rule(WdlTokenType.INTEGER, "\\d+"),
            new Rule(WdlTokenType.IDENTIFIER, "[A-Za-z][A-Za-z0-9_]*"),
            new Rule(WdlTokenType.OPERATOR, "\\|\\||&&|==|!=|<=|>=|<|>|\\+|-|\\*|/|%|!"),
            new Rule(WdlTokenType.ASSIGN, "="),
            new Rule(WdlTokenType.QUESTION, "\\?"),
            new Rule(WdlTokenType.COLON, ":"),
            new Rule(WdlTokenType.COMMA, ","),
            new Rule(WdlTokenType.DOT, "\\."),
            new Rule(WdlTokenType.LBRACE, "\\{"),
            new Rule(WdlTokenType.RBRACE, "\\}"),
            new Rule(WdlTokenType.LPAREN, "\\("),
            new Rule(WdlTokenType.RPAREN, "\\)"),
            new Rule(WdlTokenType.LBRACKET, "\\["),
            new Rule(WdlTokenType.RBRACKET, "\\]"));

    private final String text;
    private final List<WdlToken> tokens = new ArrayList<>();
    private int position;
    private int line;
    private int column;

    WdlLexer(final String text) {
        this(text, 1, 1);
    }

    /**
     * Tokenizes a fragment that starts at the given position of an enclosing document.
     */
    WdlLexer(final String text, final int line, final int column) {
        this.text = text;
        this.line = line;
        this.column = column;
    }

    List<WdlToken> tokenize() throws SyntaxException {
        while (position < text.length()) {
            if (skip(WHITESPACE) || skip(COMMENT)) {
                continue;
            }
            var c = text.charAt(position);
            if (c == '"' || c == '\'') {
                scanString(c);
            } else if (matches(COMMAND_HEREDOC)) {
                emit(WdlTokenType.KEYWORD, "command");
                scanHeredocCommand();
            } else if (matches(COMMAND_BRACES)) {
                emit(WdlTokenType.KEYWORD, "command");
                scanBracedCommand();
            } else {
                scanRule();
            }
        }
        tokens.add(new WdlToken(WdlTokenType.EOF, "", line, column));
        return tokens;
    }

    private void scanRule() throws SyntaxException {
        for (Rule rule : RULES) {
            var matcher = matcher(rule.pattern);
            if (matcher.lookingAt()) {
                var value = matcher.group();
                var type = rule.type == WdlTokenType.IDENTIFIER && KEYWORDS.contains(value) ? WdlTokenType.KEYWORD : rule.type;
                emit(type, value);
                return;
            }
        }
        throw new SyntaxException(String.format("Unexpected character '%s'", text.charAt(position)), line, column);
    }

    private void scanString(char quote) throws SyntaxException {
        var startLine = line;
        var startColumn = column;
        var i = position + 1;
        var depth = 0;
        while (true) {
            if (i >= text.length()) {
                throw new SyntaxException("Unterminated string", startLine, startColumn);
            }
            var c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (depth == 0) {
                if (c == quote) {
                    break;
                }
                if (c == '\n') {
                    throw new SyntaxException("Unterminated string", startLine, startColumn);
                }
                if ((c == '~' || c == '$') && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                    depth++;
                    i += 2;
                    continue;
                }
            } else if (c == '"' || c == '\'') {
                i = skipNestedString(i, c, startLine, startColumn);
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            i++;
        }
        var content = text.substring(position + 1, i);
        tokens.add(new WdlToken(WdlTokenType.STRING, content, startLine, startColumn));
        advance(i + 1 - position);
    }

    private int skipNestedString(int start, char quote, int startLine, int startColumn) throws SyntaxException {
        var i = start + 1;
        while (i < text.length() && text.charAt(i) != quote) {
            i += text.charAt(i) == '\\' ? 2 : 1;
        }
        if (i >= text.length()) {
            throw new SyntaxException("Unterminated string inside placeholder", startLine, startColumn);
        }
        return i;
    }

    private void scanHeredocCommand() throws SyntaxException {
        var startLine = line;
        var startColumn = column;
        var end = text.indexOf(">>>", position + 3);
        if (end < 0) {
            throw new SyntaxException("Command section is not closed with '>>>'", startLine, startColumn);
        }
        advance(3);
        tokens.add(new WdlToken(WdlTokenType.COMMAND, text.substring(position, end), line, column));
        advance(end + 3 - position);
    }

    private void scanBracedCommand() throws SyntaxException {
        var startLine = line;
        var startColumn = column;
        var depth = 0;
        var i = position;
        do {
            if (i >= text.length()) {
                throw new SyntaxException("Command section is not closed with '}'", startLine, startColumn);
            }
            var c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            i++;
        } while (depth > 0);
        advance(1);
        tokens.add(new WdlToken(WdlTokenType.COMMAND_BRACES, text.substring(position, i - 1), line, column));
        advance(i - position);
    }

    private boolean skip(Pattern pattern) {
        var matcher = matcher(pattern);
        if (matcher.lookingAt()) {
            advance(matcher.end() - position);
            return true;
        }
        return false;
    }

    private boolean matches(Pattern pattern) {
        return matcher(pattern).lookingAt();
    }

    private Matcher matcher(Pattern pattern) {
        return pattern.matcher(text).region(position, text.length());
    }

    private void emit(WdlTokenType type, String value) {
        tokens.add(new WdlToken(type, value, line, column));
        var matcher = Pattern.compile("\\s*").matcher(text).region(position + value.length(), text.length());
        // the command keyword pattern also consumes trailing whitespace
        var length = type == WdlTokenType.KEYWORD && value.equals("command") && matcher.lookingAt()
                ? matcher.end() - position
                : value.length();
        advance(length);
    }

    private void advance(int count) {
        for (var i = 0; i < count; i++) {
            if (text.charAt(position) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            position++;
        }
    }

    private static final class Rule {
        private final WdlTokenType type;
        private final Pattern pattern;

        private Rule(final WdlTokenType type, final String regex) {
            this.type = type;
            this.pattern = Pattern.compile(regex);
        }
    }
}
