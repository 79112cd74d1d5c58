package org.sqlgate.guard;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

// Row ceiling, table whitelist and keyword denylist, built once at startup
public final class GuardPolicy {

    public static final int DEFAULT_ROW_LIMIT_CEILING = 100;
    public static final int DEFAULT_MAX_SQL_CHARS = 10_000;

    public static final List<String> DEFAULT_FORBIDDEN_KEYWORDS = List.of(
            "DROP", "DELETE", "UPDATE", "INSERT", "ALTER", "TRUNCATE", "ATTACH", "PRAGMA", "EXEC",
            "CREATE", "GRANT", "REVOKE", "COPY", "MERGE", "EXECUTE", "CALL",
            "--", "/*"
    );

    private final int rowLimitCeiling;
    private final int maxSqlChars;
    private final Set<String> schemaWhitelist;
    private final Set<String> forbiddenKeywords;

    private GuardPolicy(Builder b) {
        this.rowLimitCeiling = b.rowLimitCeiling;
        this.maxSqlChars = b.maxSqlChars;
        this.schemaWhitelist = Set.copyOf(b.schemaWhitelist);
        this.forbiddenKeywords = Set.copyOf(b.forbiddenKeywords);
    }

    public static GuardPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int rowLimitCeiling() {
        return rowLimitCeiling;
    }

    public int maxSqlChars() {
        return maxSqlChars;
    }

    // Lowercased table names; empty means the whitelist rule is off
    public Set<String> schemaWhitelist() {
        return schemaWhitelist;
    }

    public boolean whitelistEnabled() {
        return !schemaWhitelist.isEmpty();
    }

    // Uppercased keywords plus the comment markers "--" and "/*"
    public Set<String> forbiddenKeywords() {
        return forbiddenKeywords;
    }

    // Folds a table name the way SQL does: unquoted parts lowercase, quoted parts exact
    public static String tableKey(String name) {
        if (name == null) return "";
        StringBuilder out = new StringBuilder();
        for (String part : name.trim().split("\\.", -1)) {
            String p = part.trim();
            if (out.length() > 0) out.append('.');
            if (p.length() >= 2 && ((p.startsWith("\"") && p.endsWith("\"")) || (p.startsWith("`") && p.endsWith("`")))) {
                out.append(p, 1, p.length() - 1);
            } else {
                out.append(p.toLowerCase(Locale.ROOT));
            }
        }
        return out.toString();
    }

    public static final class Builder {
        private int rowLimitCeiling = DEFAULT_ROW_LIMIT_CEILING;
        private int maxSqlChars = DEFAULT_MAX_SQL_CHARS;
        private final Set<String> schemaWhitelist = new LinkedHashSet<>();
        private final Set<String> forbiddenKeywords = new LinkedHashSet<>(DEFAULT_FORBIDDEN_KEYWORDS);

        private Builder() {
        }

        public Builder rowLimitCeiling(int rowLimitCeiling) {
            if (rowLimitCeiling < 1) throw new IllegalArgumentException("rowLimitCeiling must be positive");
            this.rowLimitCeiling = rowLimitCeiling;
            return this;
        }

        public Builder maxSqlChars(int maxSqlChars) {
            if (maxSqlChars < 1) throw new IllegalArgumentException("maxSqlChars must be positive");
            this.maxSqlChars = maxSqlChars;
            return this;
        }

        public Builder schemaWhitelist(Collection<String> tables) {
            schemaWhitelist.clear();
            if (tables != null) {
                for (String t : tables) {
                    String name = tableKey(t);
                    if (!name.isEmpty()) schemaWhitelist.add(name);
                }
            }
            return this;
        }

        public Builder schemaWhitelist(String... tables) {
            return schemaWhitelist(List.of(tables));
        }

        // Replaces the default denylist; null or empty keeps the default
        public Builder forbiddenKeywords(Collection<String> keywords) {
            if (keywords == null || keywords.isEmpty()) return this;
            forbiddenKeywords.clear();
            for (String k : keywords) {
                if (k != null && !k.trim().isEmpty()) forbiddenKeywords.add(k.trim().toUpperCase(Locale.ROOT));
            }
            return this;
        }

        public GuardPolicy build() {
            return new GuardPolicy(this);
        }

    }
}
