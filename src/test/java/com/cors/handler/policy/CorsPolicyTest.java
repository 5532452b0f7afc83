package com.cors.handler.policy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorsPolicyTest {

    private static CorsPolicy policyWithMethods(List<String> methods) {
        return new CorsPolicy(AllOriginsMatcher.instance(), methods, false,
                List.of("Origin", "X-Header-1"), List.of(), false, 0, false);
    }

    @Test
    void isMethodAllowed_falseForUnlistedMethod() {
        CorsPolicy policy = PolicyCompiler.compile(CorsOptions.defaults());

        assertFalse(policy.isMethodAllowed("PUT"));
        assertTrue(policy.isMethodAllowed("get"));
    }

    @Test
    void isMethodAllowed_trueForOptions() {
        CorsPolicy policy = PolicyCompiler.compile(CorsOptions.defaults());

        assertTrue(policy.isMethodAllowed("OPTIONS"));
        assertTrue(policy.isMethodAllowed("options"));
    }

    @Test
    void isMethodAllowed_emptyListOnlyAllowsOptions() {
        CorsPolicy policy = policyWithMethods(List.of());

        assertFalse(policy.isMethodAllowed("GET"));
        assertFalse(policy.isMethodAllowed("PUT"));
        assertTrue(policy.isMethodAllowed("OPTIONS"));
    }

    @Test
    void areHeadersAllowed_emptyRequestIsAllowed() {
        CorsPolicy policy = policyWithMethods(List.of("GET"));

        assertTrue(policy.areHeadersAllowed(List.of()));
    }

    @Test
    void areHeadersAllowed_rejectsPartialMatch() {
        CorsPolicy policy = policyWithMethods(List.of("GET"));

        assertTrue(policy.areHeadersAllowed(List.of("x-header-1", "ORIGIN")));
        assertFalse(policy.areHeadersAllowed(List.of("X-Header-1", "X-Header-3")));
    }

    @Test
    void listsAreImmutable() {
        CorsPolicy policy = PolicyCompiler.compile(CorsOptions.defaults());

        assertThrows(UnsupportedOperationException.class, () -> policy.getAllowedMethods().add("PUT"));
        assertThrows(UnsupportedOperationException.class, () -> policy.getAllowedHeaders().add("X"));
    }
}
