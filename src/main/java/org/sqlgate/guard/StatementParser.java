package org.sqlgate.guard;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Leading verb, statement count and WITH names of raw SQL
public class StatementParser {

    private static final Set<String> CTE_FILLER = Set.of("AS", "NOT", "MATERIALIZED", "RECURSIVE");

    private final int maxSqlChars;

    public StatementParser(int maxSqlChars) {
        this.maxSqlChars = maxSqlChars;
    }

    public CandidateStatement parse(String sql) {
        String s = (sql == null) ? "" : sql;
        if (s.trim().isEmpty()) throw new ParseAmbiguousException("sql required");
        if (s.length() > maxSqlChars) throw new ParseAmbiguousException("sql too long");

        List<SqlToken> tokens = SqlTokenizer.tokenize(s);
        List<List<SqlToken>> segments = segments(tokens);
        if (segments.isEmpty()) throw new ParseAmbiguousException("sql required");

        List<SqlToken> first = segments.get(0);
        Set<String> cteNames = new LinkedHashSet<>();
        String verb = leadingVerb(first, cteNames);
        return new CandidateStatement(s, tokens, verb, StatementKind.fromVerb(verb), statementCount(tokens), cteNames);
    }

    // Every unquoted ';' at any depth that has anything after it, even a comment or another ';', starts a statement
    static int statementCount(List<SqlToken> tokens) {
        int count = 1;
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).type() == SqlToken.Type.TERMINATOR) count++;
        }
        return count;
    }

    // Significant tokens grouped by top-level terminator; empty groups are dropped
    static List<List<SqlToken>> segments(List<SqlToken> tokens) {
        List<List<SqlToken>> out = new ArrayList<>();
        List<SqlToken> current = new ArrayList<>();
        for (SqlToken t : tokens) {
            if (t.isComment()) continue;
            if (t.type() == SqlToken.Type.TERMINATOR && t.depth() == 0) {
                if (!current.isEmpty()) out.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(t);
        }
        if (!current.isEmpty()) out.add(current);
        return out;
    }

    private static String leadingVerb(List<SqlToken> segment, Set<String> cteNames) {
        int i = 0;
        while (i < segment.size() && segment.get(i).type() == SqlToken.Type.OPEN_PAREN) i++;
        if (i >= segment.size() || segment.get(i).type() != SqlToken.Type.WORD) return null;

        SqlToken lead = segment.get(i);
        if (!lead.isWord("WITH")) return lead.upper();
        return verbAfterWith(segment, i + 1, cteNames);
    }

    // WITH a AS (...), b AS (...) SELECT ... -> SELECT, collecting a and b
    private static String verbAfterWith(List<SqlToken> segment, int from, Set<String> cteNames) {
        boolean expectName = true;
        for (int i = from; i < segment.size(); i++) {
            SqlToken t = segment.get(i);
            if (t.depth() != 0) continue;
            if (t.type() == SqlToken.Type.COMMA) {
                expectName = true;
            } else if (t.type() == SqlToken.Type.WORD || t.type() == SqlToken.Type.QUOTED_IDENTIFIER) {
                String upper = t.upper();
                if (t.type() == SqlToken.Type.WORD && CTE_FILLER.contains(upper)) continue;
                if (expectName) {
                    cteNames.add(t.identifier());
                    expectName = false;
                } else if (t.type() == SqlToken.Type.WORD) {
                    return upper;
                }
            }
        }
        return "WITH";
    }
}
