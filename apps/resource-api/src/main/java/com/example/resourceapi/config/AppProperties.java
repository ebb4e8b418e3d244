package com.example.resourceapi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Store store = new Store();
    private Auth auth = new Auth();
    private Authz authz = new Authz();
    private List<Resource> resources = new ArrayList<>();

    @Data
    public static class Store {
        private String type = "mongo";  // "mongo" or "in-memory"
        private boolean createIndexes = true;
    }

    @Data
    public static class Auth {
        private String jwtSecret;
        private String issuer = "resource-api";
        private int tokenTtlMinutes = 60;
        private boolean devLoginEnabled = false;
    }

    @Data
    public static class Authz {
        private String policy = "allow-all";  // "allow-all" or "role-based"
        private List<Rule> rules = new ArrayList<>();
    }

    /**
     * Grants an operation to any caller holding one of {@code roles}.
     * A rule without a resource applies to every resource.
     */
    @Data
    public static class Rule {
        private String operation;
        private String resource;
        private List<String> roles = new ArrayList<>();
    }

    @Data
    public static class Resource {
        private String name;
        private String collection;
        private List<String> sortFields = new ArrayList<>();
        private boolean supportsCreate = true;
        private boolean supportsUpdate = false;
    }
}
