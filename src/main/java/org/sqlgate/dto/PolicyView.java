package org.sqlgate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.sqlgate.guard.GuardPolicy;

import java.util.List;
import java.util.TreeSet;

// Read-only view of the active guard policy, for agents planning their queries
public class PolicyView {
    @JsonProperty("row_limit_ceiling")
    public int rowLimitCeiling;
    @JsonProperty("max_sql_chars")
    public int maxSqlChars;
    @JsonProperty("whitelist_enabled")
    public boolean whitelistEnabled;
    @JsonProperty("schema_whitelist")
    public List<String> schemaWhitelist;
    @JsonProperty("forbidden_keywords")
    public List<String> forbiddenKeywords;

    public PolicyView() {}

    public static PolicyView of(GuardPolicy policy) {
        PolicyView v = new PolicyView();
        v.rowLimitCeiling = policy.rowLimitCeiling();
        v.maxSqlChars = policy.maxSqlChars();
        v.whitelistEnabled = policy.whitelistEnabled();
        v.schemaWhitelist = List.copyOf(new TreeSet<>(policy.schemaWhitelist()));
        v.forbiddenKeywords = List.copyOf(new TreeSet<>(policy.forbiddenKeywords()));
        return v;
    }
}
