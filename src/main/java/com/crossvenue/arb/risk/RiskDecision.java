package com.crossvenue.arb.risk;

import java.util.List;

public record RiskDecision(boolean approved, List<RiskViolation> violations) {

    public static RiskDecision approve() {
        return new RiskDecision(true, List.of());
    }

    public static RiskDecision reject(List<RiskViolation> violations) {
        return new RiskDecision(false, List.copyOf(violations));
    }

    public boolean hasViolation(RiskViolation.Type type) {
        return violations.stream().anyMatch(v -> v.type() == type);
    }
}
