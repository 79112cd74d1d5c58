package org.sqlgate.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class GuardPolicyTest {

    @Test
    void defaults() {
        GuardPolicy policy = GuardPolicy.defaults();

        assertThat(policy.rowLimitCeiling()).isEqualTo(100);
        assertThat(policy.whitelistEnabled()).isFalse();
        assertThat(policy.forbiddenKeywords())
                .contains("DROP", "DELETE", "UPDATE", "INSERT", "ALTER", "TRUNCATE", "ATTACH", "PRAGMA", "EXEC", "--", "/*");
    }

    @Test
    void whitelistIsNormalized() {
        GuardPolicy policy = GuardPolicy.builder()
                .schemaWhitelist(List.of(" Customers ", "\"Orders\"", "", "public.Items"))
                .build();

        assertThat(policy.schemaWhitelist()).containsExactlyInAnyOrder("customers", "Orders", "public.items");
    }

    @Test
    void emptyKeywordOverrideKeepsDefault() {
        GuardPolicy policy = GuardPolicy.builder().forbiddenKeywords(List.of()).build();

        assertThat(policy.forbiddenKeywords()).containsExactlyInAnyOrderElementsOf(GuardPolicy.DEFAULT_FORBIDDEN_KEYWORDS);
    }

    @Test
    void keywordOverrideIsUppercased() {
        GuardPolicy policy = GuardPolicy.builder().forbiddenKeywords(List.of("sleep", " benchmark ")).build();

        assertThat(policy.forbiddenKeywords()).containsExactlyInAnyOrder("SLEEP", "BENCHMARK");
    }

    @Test
    void policyIsImmutable() {
        GuardPolicy policy = GuardPolicy.builder().schemaWhitelist("customers").build();

        assertThatThrownBy(() -> policy.schemaWhitelist().add("secret"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsBadCeiling() {
        assertThatThrownBy(() -> GuardPolicy.builder().rowLimitCeiling(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
