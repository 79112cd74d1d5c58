package org.sqlgate.guard;

import java.util.List;
import java.util.Optional;
import java.util.Set;

// The built-in rules, in evaluation order
public final class PolicyRules {

    public static final String SELECT_ONLY = "select-only";
    public static final String SINGLE_STATEMENT = "single-statement";
    public static final String FORBIDDEN_KEYWORD = "forbidden-keyword";
    public static final String TABLE_WHITELIST = "table-whitelist";

    private PolicyRules() {
    }

    public static List<PolicyRule> defaults() {
        return List.of(selectOnly(), singleStatement(), forbiddenKeyword(), tableWhitelist());
    }

    public static PolicyRule selectOnly() {
        return PolicyRule.of(SELECT_ONLY, (st, policy) -> {
            if (st.kind() == StatementKind.SELECT) return Optional.empty();
            String found = st.verb() == null ? st.kind().name() : st.verb();
            return Optional.of(ValidationVerdict.reject(RejectReason.NON_SELECT, SELECT_ONLY, found));
        });
    }

    public static PolicyRule singleStatement() {
        return PolicyRule.of(SINGLE_STATEMENT, (st, policy) -> {
            if (st.statementCount() == 1) return Optional.empty();
            return Optional.of(ValidationVerdict.reject(RejectReason.MULTIPLE_STATEMENTS, SINGLE_STATEMENT,
                    st.statementCount() + " statements"));
        });
    }

    // Whole unquoted words only, so dropdown_id never matches DROP
    public static PolicyRule forbiddenKeyword() {
        return PolicyRule.of(FORBIDDEN_KEYWORD, (st, policy) -> {
            Set<String> denied = policy.forbiddenKeywords();
            for (SqlToken t : st.tokens()) {
                String hit = null;
                if (t.type() == SqlToken.Type.WORD && denied.contains(t.upper())) {
                    hit = t.upper();
                } else if (t.type() == SqlToken.Type.LINE_COMMENT && denied.contains("--")) {
                    hit = "--";
                } else if (t.type() == SqlToken.Type.BLOCK_COMMENT && denied.contains("/*")) {
                    hit = "/*";
                }
                if (hit != null) {
                    return Optional.of(ValidationVerdict.reject(RejectReason.FORBIDDEN_KEYWORD, FORBIDDEN_KEYWORD, hit));
                }
            }
            return Optional.empty();
        });
    }

    public static PolicyRule tableWhitelist() {
        return PolicyRule.of(TABLE_WHITELIST, (st, policy) -> {
            if (!policy.whitelistEnabled()) return Optional.empty();
            List<String> tables;
            try {
                tables = TableReferenceScanner.scan(st);
            } catch (ParseAmbiguousException e) {
                return Optional.of(ValidationVerdict.reject(RejectReason.PARSE_AMBIGUOUS, TABLE_WHITELIST, e.getMessage()));
            }
            for (String table : tables) {
                if (st.cteNames().contains(table)) continue;
                if (!policy.schemaWhitelist().contains(table)) {
                    return Optional.of(ValidationVerdict.reject(RejectReason.TABLE_NOT_WHITELISTED, TABLE_WHITELIST, table));
                }
            }
            return Optional.empty();
        });
    }
}
