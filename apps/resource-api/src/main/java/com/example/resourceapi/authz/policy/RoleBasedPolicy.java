package com.example.resourceapi.authz.policy;

import com.example.resourceapi.authz.model.Operation;
import com.example.resourceapi.authz.model.PolicyDecision;
import com.example.resourceapi.config.AppProperties;
import com.example.resourceapi.security.context.Token;

import java.util.List;

/**
 * Config-driven role policy.
 *
 * <p>A rule applies when its operation matches and its resource is either unset or equal to the
 * requested resource. Access is granted when the caller holds a role listed by any applicable rule.
 * When no rule applies the request is denied.
 */
public class RoleBasedPolicy implements PermissionPolicy {

    public static final String POLICY_ID = "ROLE_BASED";

    private final List<CompiledRule> rules;

    public RoleBasedPolicy(List<AppProperties.Rule> rules) {
        this.rules = rules.stream()
                .map(rule -> new CompiledRule(
                        Operation.fromString(rule.getOperation()),
                        rule.getResource(),
                        List.copyOf(rule.getRoles())))
                .toList();
    }

    @Override
    public String getPolicyId() {
        return POLICY_ID;
    }

    @Override
    public PolicyDecision evaluate(Token token, Operation operation, String resource) {
        List<CompiledRule> applicable = rules.stream()
                .filter(rule -> rule.appliesTo(operation, resource))
                .toList();

        if (applicable.isEmpty()) {
            return PolicyDecision.deny(POLICY_ID,
                    "No rule grants " + operation + " on " + resource);
        }

        for (CompiledRule rule : applicable) {
            if (token.hasAnyRole(rule.roles())) {
                return PolicyDecision.allow(POLICY_ID,
                        "Caller holds one of " + rule.roles());
            }
        }

        return PolicyDecision.deny(POLICY_ID,
                "Caller lacks a role required for " + operation + " on " + resource);
    }

    int ruleCount() {
        return rules.size();
    }

    private record CompiledRule(Operation operation, String resource, List<String> roles) {

        boolean appliesTo(Operation requested, String requestedResource) {
            return operation == requested
                    && (resource == null || resource.isBlank() || resource.equalsIgnoreCase(requestedResource));
        }
    }
}
