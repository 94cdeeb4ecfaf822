package de.entwicklertraining.capi.cache;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CachingPolicyTest {

    @Test
    void testDefaultPolicy() {
        CachingPolicy policy = CachingPolicy.defaults();

        assertTrue(policy.shouldCache("GET", "/v3/apps", 200));
        assertFalse(policy.shouldCache("POST", "/v3/apps", 201));
        assertFalse(policy.shouldCache("DELETE", "/v3/apps/1", 204));
        assertFalse(policy.shouldCache("GET", "/v3/apps/1", 404));
        assertFalse(policy.shouldCache("GET", "/v3/apps", 500));
        assertFalse(policy.shouldCache("GET", "/v3/jobs/123", 200));
        assertFalse(policy.shouldCache("GET", "/v3/deployments", 200));
    }

    @Test
    void testCacheErrorsOnlyCoversClientErrors() {
        CachingPolicy policy = CachingPolicy.builder().cacheErrors(true).build();

        assertTrue(policy.shouldCache("GET", "/v3/apps/1", 404));
        assertFalse(policy.shouldCache("GET", "/v3/apps/1", 503));
    }

    @Test
    void testIncludePathsRestrict() {
        CachingPolicy policy = CachingPolicy.builder()
                .includePaths(List.of("/v3/organizations"))
                .cachePost(true)
                .build();

        assertTrue(policy.shouldCache("GET", "/v3/organizations/o1", 200));
        assertTrue(policy.shouldCache("POST", "/v3/organizations", 201));
        assertFalse(policy.shouldCache("GET", "/v3/spaces", 200));
    }

    @Test
    void testReadableOnlyForGet() {
        CachingPolicy policy = CachingPolicy.defaults().toBuilder().cachePost(true).build();

        assertTrue(policy.isReadable("GET", "/v3/apps"));
        assertFalse(policy.isReadable("POST", "/v3/apps"));
        assertFalse(policy.isReadable("GET", "/v3/jobs/1"));
    }
}
