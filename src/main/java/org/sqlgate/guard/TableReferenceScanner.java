package org.sqlgate.guard;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Table names after FROM and JOIN at any depth, lowercased unless quoted; unreadable targets are ambiguous
public final class TableReferenceScanner {

    // Words that close a FROM list at its own depth
    private static final Set<String> END_OF_FROM = Set.of(
            "WHERE", "GROUP", "HAVING", "ORDER", "LIMIT", "OFFSET", "FETCH", "FOR", "WINDOW", "QUALIFY",
            "UNION", "INTERSECT", "EXCEPT", "MINUS", "RETURNING"
    );

    private static final Set<String> SUBQUERY_START = Set.of("SELECT", "WITH", "VALUES", "TABLE");

    // Functions whose argument syntax uses FROM without naming a table
    private static final Set<String> FROM_FUNCTIONS = Set.of(
            "EXTRACT", "SUBSTRING", "SUBSTR", "TRIM", "POSITION", "OVERLAY"
    );

    private static final Set<String> TABLE_PREFIX = Set.of("ONLY", "LATERAL");

    private TableReferenceScanner() {
    }

    public static List<String> scan(CandidateStatement statement) {
        List<SqlToken> toks = new ArrayList<>();
        for (SqlToken t : statement.tokens()) {
            if (!t.isComment()) toks.add(t);
        }

        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < toks.size(); i++) {
            SqlToken t = toks.get(i);
            if (t.isWord("JOIN") || (t.isWord("FROM") && !isArgumentFrom(toks, i))) {
                readTableList(toks, i + 1, t.depth(), names);
            }
        }
        return new ArrayList<>(names);
    }

    // Comma-separated FROM items at one depth; joins, aliases, column lists and ON clauses are stepped over
    private static void readTableList(List<SqlToken> toks, int j, int depth, Set<String> names) {
        while (j < toks.size()) {
            j = readTableItem(toks, j, depth, names);
            j = nextItem(toks, j, depth);
            if (j < 0) return;
        }
    }

    private static int readTableItem(List<SqlToken> toks, int j, int depth, Set<String> names) {
        while (j < toks.size() && toks.get(j).type() == SqlToken.Type.WORD && TABLE_PREFIX.contains(toks.get(j).upper())) {
            j++;
        }
        if (j >= toks.size()) return j;

        SqlToken t = toks.get(j);
        if (t.type() == SqlToken.Type.OPEN_PAREN) {
            // Subqueries are read through their own FROM; anything else is a parenthesized join
            SqlToken next = (j + 1 < toks.size()) ? toks.get(j + 1) : null;
            boolean subquery = next != null && next.type() == SqlToken.Type.WORD && SUBQUERY_START.contains(next.upper());
            if (!subquery) readTableList(toks, j + 1, depth + 1, names);
            return j + 1;
        }
        if (!isName(t)) throw new ParseAmbiguousException("unreadable table reference " + t.text());

        StringBuilder name = new StringBuilder(t.identifier());
        j++;
        while (j + 1 < toks.size() && toks.get(j).type() == SqlToken.Type.DOT && isName(toks.get(j + 1))) {
            name.append('.').append(toks.get(j + 1).identifier());
            j += 2;
        }
        names.add(name.toString());
        return j;
    }

    // Index just past the next comma at this depth, or -1 when the list ends first
    private static int nextItem(List<SqlToken> toks, int j, int depth) {
        for (; j < toks.size(); j++) {
            SqlToken t = toks.get(j);
            if (t.type() == SqlToken.Type.TERMINATOR) return -1;
            if (t.type() == SqlToken.Type.CLOSE_PAREN && t.depth() < depth) return -1;
            if (t.depth() != depth) continue;
            if (t.type() == SqlToken.Type.COMMA) return j + 1;
            if (t.type() == SqlToken.Type.WORD && END_OF_FROM.contains(t.upper())) return -1;
        }
        return -1;
    }

    // EXTRACT(YEAR FROM ts) or a IS DISTINCT FROM b
    private static boolean isArgumentFrom(List<SqlToken> toks, int i) {
        if (i > 0 && toks.get(i - 1).isWord("DISTINCT") && i > 1
                && (toks.get(i - 2).isWord("IS") || toks.get(i - 2).isWord("NOT"))) {
            return true;
        }
        int depth = toks.get(i).depth();
        if (depth == 0) return false;
        for (int k = i - 1; k > 0; k--) {
            SqlToken t = toks.get(k);
            if (t.type() == SqlToken.Type.OPEN_PAREN && t.depth() == depth - 1) {
                SqlToken fn = toks.get(k - 1);
                return fn.type() == SqlToken.Type.WORD && FROM_FUNCTIONS.contains(fn.upper());
            }
        }
        return false;
    }

    private static boolean isName(SqlToken t) {
        return t.type() == SqlToken.Type.WORD || t.type() == SqlToken.Type.QUOTED_IDENTIFIER;
    }
}
