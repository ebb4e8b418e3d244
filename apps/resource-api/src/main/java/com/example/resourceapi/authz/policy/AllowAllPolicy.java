package com.example.resourceapi.authz.policy;

import com.example.resourceapi.authz.model.Operation;
import com.example.resourceapi.authz.model.PolicyDecision;
import com.example.resourceapi.security.context.Token;

/**
 * Default policy: any authenticated caller may perform any operation.
 */
public class AllowAllPolicy implements PermissionPolicy {

    public static final String POLICY_ID = "ALLOW_ALL";

    @Override
    public String getPolicyId() {
        return POLICY_ID;
    }

    @Override
    public PolicyDecision evaluate(Token token, Operation operation, String resource) {
        return PolicyDecision.allow(POLICY_ID, "Authenticated caller");
    }
}
