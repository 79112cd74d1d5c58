package org.sqlgate.guard;

import java.util.ArrayList;
import java.util.List;

// Quote- and comment-aware tokenizer; unterminated or unbalanced input is ambiguous
public final class SqlTokenizer {

    private final String sql;
    private final List<SqlToken> tokens = new ArrayList<>();
    private int pos;
    private int depth;

    private SqlTokenizer(String sql) {
        this.sql = sql;
    }

    public static List<SqlToken> tokenize(String sql) {
        SqlTokenizer t = new SqlTokenizer(sql);
        t.run();
        return t.tokens;
    }

    private void run() {
        while (pos < sql.length()) {
            char c = sql.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '-' && peek(1) == '-') {
                lineComment();
            } else if (c == '/' && peek(1) == '*') {
                blockComment();
            } else if (c == '\'') {
                quoted(SqlToken.Type.STRING, '\'', "string literal");
            } else if (c == '"') {
                quoted(SqlToken.Type.QUOTED_IDENTIFIER, '"', "quoted identifier");
            } else if (c == '`') {
                quoted(SqlToken.Type.QUOTED_IDENTIFIER, '`', "quoted identifier");
            } else if (c == '$') {
                dollar();
            } else if (c == ';') {
                single(SqlToken.Type.TERMINATOR);
            } else if (c == '(') {
                add(SqlToken.Type.OPEN_PAREN, pos, pos + 1);
                depth++;
                pos++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new ParseAmbiguousException("unbalanced parentheses at offset " + pos);
                }
                single(SqlToken.Type.CLOSE_PAREN);
            } else if (c == ',') {
                single(SqlToken.Type.COMMA);
            } else if (c == '.' && !Character.isDigit(peek(1))) {
                single(SqlToken.Type.DOT);
            } else if (c == '?') {
                single(SqlToken.Type.PARAMETER);
            } else if (c == ':' && peek(1) == ':') {
                add(SqlToken.Type.OPERATOR, pos, pos + 2);
                pos += 2;
            } else if (c == ':' && isWordStart(peek(1))) {
                int start = pos;
                pos++;
                while (pos < sql.length() && isWordPart(sql.charAt(pos))) pos++;
                add(SqlToken.Type.PARAMETER, start, pos);
            } else if (Character.isDigit(c) || c == '.') {
                number();
            } else if (isWordStart(c)) {
                int start = pos;
                while (pos < sql.length() && isWordPart(sql.charAt(pos))) pos++;
                add(SqlToken.Type.WORD, start, pos);
            } else {
                single(SqlToken.Type.OPERATOR);
            }
        }
        if (depth != 0) {
            throw new ParseAmbiguousException("unbalanced parentheses");
        }
    }

    private void lineComment() {
        int start = pos;
        while (pos < sql.length() && sql.charAt(pos) != '\n') pos++;
        add(SqlToken.Type.LINE_COMMENT, start, pos);
    }

    private void blockComment() {
        int start = pos;
        int close = sql.indexOf("*/", pos + 2);
        if (close < 0) {
            throw new ParseAmbiguousException("unterminated block comment at offset " + start);
        }
        pos = close + 2;
        add(SqlToken.Type.BLOCK_COMMENT, start, pos);
    }

    // Doubled quote characters escape the quote itself
    private void quoted(SqlToken.Type type, char quote, String what) {
        int start = pos;
        pos++;
        while (true) {
            if (pos >= sql.length()) {
                throw new ParseAmbiguousException("unterminated " + what + " at offset " + start);
            }
            if (sql.charAt(pos) == quote) {
                if (peek(1) == quote) {
                    pos += 2;
                    continue;
                }
                pos++;
                break;
            }
            pos++;
        }
        add(type, start, pos);
    }

    // $1 positional parameter, or a $tag$ ... $tag$ dollar-quoted string
    private void dollar() {
        int start = pos;
        if (Character.isDigit(peek(1))) {
            pos++;
            while (pos < sql.length() && Character.isDigit(sql.charAt(pos))) pos++;
            add(SqlToken.Type.PARAMETER, start, pos);
            return;
        }
        int tagEnd = pos + 1;
        while (tagEnd < sql.length() && isWordPart(sql.charAt(tagEnd)) && sql.charAt(tagEnd) != '$') tagEnd++;
        if (tagEnd >= sql.length() || sql.charAt(tagEnd) != '$') {
            single(SqlToken.Type.OPERATOR);
            return;
        }
        String tag = sql.substring(start, tagEnd + 1);
        int close = sql.indexOf(tag, tagEnd + 1);
        if (close < 0) {
            throw new ParseAmbiguousException("unterminated dollar-quoted string at offset " + start);
        }
        pos = close + tag.length();
        add(SqlToken.Type.STRING, start, pos);
    }

    private void number() {
        int start = pos;
        while (pos < sql.length() && (Character.isDigit(sql.charAt(pos)) || sql.charAt(pos) == '.')) pos++;
        if (pos < sql.length() && (sql.charAt(pos) == 'e' || sql.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < sql.length() && (sql.charAt(pos) == '+' || sql.charAt(pos) == '-')) pos++;
            if (pos < sql.length() && Character.isDigit(sql.charAt(pos))) {
                while (pos < sql.length() && Character.isDigit(sql.charAt(pos))) pos++;
            } else {
                pos = save;
            }
        }
        add(SqlToken.Type.NUMBER, start, pos);
    }

    private void single(SqlToken.Type type) {
        add(type, pos, pos + 1);
        pos++;
    }

    private void add(SqlToken.Type type, int start, int end) {
        tokens.add(new SqlToken(type, sql.substring(start, end), start, end, depth));
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < sql.length() ? sql.charAt(i) : '\0';
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
