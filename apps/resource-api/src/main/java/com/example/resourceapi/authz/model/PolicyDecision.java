package com.example.resourceapi.authz.model;

/**
 * The result of evaluating a permission policy.
 */
public record PolicyDecision(
        Decision decision,
        String reason,
        String policyId
) {
    public enum Decision {
        ALLOW,
        DENY
    }

    public static PolicyDecision allow(String policyId, String reason) {
        return new PolicyDecision(Decision.ALLOW, reason, policyId);
    }

    public static PolicyDecision deny(String policyId, String reason) {
        return new PolicyDecision(Decision.DENY, reason, policyId);
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public boolean isDenied() {
        return decision == Decision.DENY;
    }
}
