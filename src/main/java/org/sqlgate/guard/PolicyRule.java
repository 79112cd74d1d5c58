package org.sqlgate.guard;

import java.util.Optional;
import java.util.function.BiFunction;

// Empty means no objection
public interface PolicyRule {

    String name();

    Optional<ValidationVerdict> evaluate(CandidateStatement statement, GuardPolicy policy);

    static PolicyRule of(String name, BiFunction<CandidateStatement, GuardPolicy, Optional<ValidationVerdict>> fn) {
        return new PolicyRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<ValidationVerdict> evaluate(CandidateStatement statement, GuardPolicy policy) {
                return fn.apply(statement, policy);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
