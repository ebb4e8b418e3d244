package com.example.resourceapi.authz.policy;

import com.example.resourceapi.authz.model.Operation;
import com.example.resourceapi.authz.model.PolicyDecision;
import com.example.resourceapi.security.context.Token;

/**
 * Permission hook consulted by every resource service before it touches the store.
 * Implementations must be thread-safe; one instance serves all resources.
 */
public interface PermissionPolicy {

    /**
     * Unique identifier for this policy, reported in decisions and logs.
     */
    String getPolicyId();

    /**
     * Decide whether {@code token} may perform {@code operation} on the resource named {@code resource}.
     */
    PolicyDecision evaluate(Token token, Operation operation, String resource);
}
