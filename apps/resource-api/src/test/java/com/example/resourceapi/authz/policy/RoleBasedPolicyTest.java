package com.example.resourceapi.authz.policy;

import com.example.resourceapi.authz.model.Operation;
import com.example.resourceapi.authz.model.PolicyDecision;
import com.example.resourceapi.config.AppProperties;
import com.example.resourceapi.util.TokenTestBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoleBasedPolicy")
class RoleBasedPolicyTest {

    private RoleBasedPolicy policy;

    private static AppProperties.Rule rule(String operation, String resource, String... roles) {
        AppProperties.Rule rule = new AppProperties.Rule();
        rule.setOperation(operation);
        rule.setResource(resource);
        rule.setRoles(List.of(roles));
        return rule;
    }

    @BeforeEach
    void setUp() {
        policy = new RoleBasedPolicy(List.of(
                rule("read", null, "reader", "admin"),
                rule("CREATE", "grade", "instructor"),
                rule("update", "testrun", "ci")));
    }

    @Test
    @DisplayName("should compile every configured rule")
    void shouldCompileRules() {
        assertThat(policy.ruleCount()).isEqualTo(3);
        assertThat(policy.getPolicyId()).isEqualTo(RoleBasedPolicy.POLICY_ID);
    }

    @Test
    @DisplayName("should allow a resource-independent rule on every resource")
    void shouldApplyGlobalRule() {
        PolicyDecision decision = policy.evaluate(
                TokenTestBuilder.aToken().withRoles("READER").build(), Operation.READ, "profile");

        assertThat(decision.isAllowed()).isTrue();
    }

    @Test
    @DisplayName("should scope a resource rule to that resource")
    void shouldScopeResourceRule() {
        var instructor = TokenTestBuilder.aToken().withRoles("instructor").build();

        assertThat(policy.evaluate(instructor, Operation.CREATE, "grade").isAllowed()).isTrue();
        assertThat(policy.evaluate(instructor, Operation.CREATE, "profile").isDenied()).isTrue();
    }

    @Test
    @DisplayName("should deny a caller without any listed role")
    void shouldDenyWithoutRole() {
        PolicyDecision decision = policy.evaluate(
                TokenTestBuilder.aToken().withRoles("guest").build(), Operation.UPDATE, "testrun");

        assertThat(decision.isDenied()).isTrue();
        assertThat(decision.policyId()).isEqualTo(RoleBasedPolicy.POLICY_ID);
    }

    @Test
    @DisplayName("should reject an unknown operation at construction")
    void shouldRejectUnknownOperation() {
        assertThatThrownBy(() -> new RoleBasedPolicy(List.of(rule("delete", null, "admin"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
