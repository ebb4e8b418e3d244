package com.example.resourceapi.authz.config;

import com.example.resourceapi.authz.policy.AllowAllPolicy;
import com.example.resourceapi.authz.policy.PermissionPolicy;
import com.example.resourceapi.authz.policy.RoleBasedPolicy;
import com.example.resourceapi.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the permission policy from {@code app.authz.policy}.
 */
@Slf4j
@Configuration
public class PermissionPolicyConfig {

    @Bean
    public PermissionPolicy permissionPolicy(AppProperties properties) {
        AppProperties.Authz authz = properties.getAuthz();
        PermissionPolicy policy = switch (authz.getPolicy()) {
            case "allow-all" -> new AllowAllPolicy();
            case "role-based" -> new RoleBasedPolicy(authz.getRules());
            default -> throw new IllegalStateException(
                    "Unknown app.authz.policy: " + authz.getPolicy());
        };

        log.info("Permission policy: {} ({} rules configured)", policy.getPolicyId(), authz.getRules().size());
        return policy;
    }
}
