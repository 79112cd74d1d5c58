package org.sqlgate.guard;

import java.util.Locale;

// One lexical unit of a SQL string, with its offsets in the raw text
public final class SqlToken {

    public enum Type {
        WORD,
        QUOTED_IDENTIFIER,
        STRING,
        NUMBER,
        PARAMETER,
        LINE_COMMENT,
        BLOCK_COMMENT,
        TERMINATOR,
        OPEN_PAREN,
        CLOSE_PAREN,
        COMMA,
        DOT,
        OPERATOR
    }

    private final Type type;
    private final String text;
    private final int start;
    private final int end;
    private final int depth;

    public SqlToken(Type type, String text, int start, int end, int depth) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
        this.depth = depth;
    }

    public Type type() {
        return type;
    }

    public String text() {
        return text;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    // Parenthesis nesting level the token sits at; 0 is the top level
    public int depth() {
        return depth;
    }

    public boolean isComment() {
        return type == Type.LINE_COMMENT || type == Type.BLOCK_COMMENT;
    }

    public boolean isWord(String word) {
        return type == Type.WORD && text.equalsIgnoreCase(word);
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    // Identifier as the database resolves it: unquoted folds to lowercase, quoted keeps its case
    public String identifier() {
        if (type == Type.QUOTED_IDENTIFIER && text.length() >= 2) {
            String inner = text.substring(1, text.length() - 1);
            char open = text.charAt(0);
            if (open == '"') inner = inner.replace("\"\"", "\"");
            if (open == '`') inner = inner.replace("``", "`");
            return inner;
        }
        return text.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + start;
    }
}
