package org.sqlgate.guard;

import java.util.List;
import java.util.Optional;

// Ordered rules; the first objection decides
public class SqlGuard {
    private final GuardPolicy policy;
    private final List<PolicyRule> rules;

    public SqlGuard(GuardPolicy policy) {
        this(policy, PolicyRules.defaults());
    }

    public SqlGuard(GuardPolicy policy, List<PolicyRule> rules) {
        this.policy = policy;
        this.rules = List.copyOf(rules);
    }

    public ValidationVerdict validate(CandidateStatement statement) {
        for (PolicyRule rule : rules) {
            Optional<ValidationVerdict> objection = rule.evaluate(statement, policy);
            if (objection.isPresent()) return objection.get();
        }
        return ValidationVerdict.ok();
    }

    public GuardPolicy policy() {
        return policy;
    }

    public List<PolicyRule> rules() {
        return rules;
    }
}
