package com.example.resourceapi.util;

import com.example.resourceapi.security.context.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Test builder for Token.
 */
public class TokenTestBuilder {

    private String userId = "test-user";
    private List<String> roles = new ArrayList<>();

    public static TokenTestBuilder aToken() {
        return new TokenTestBuilder();
    }

    public static Token aReader() {
        return aToken().withRoles("reader").build();
    }

    public static Token anAdmin() {
        return aToken().withUserId("admin-user").withRoles("admin").build();
    }

    public TokenTestBuilder withUserId(String userId) {
        this.userId = userId;
        return this;
    }

    public TokenTestBuilder withRoles(String... roles) {
        this.roles = new ArrayList<>(List.of(roles));
        return this;
    }

    public Token build() {
        return new Token(userId, roles);
    }
}
