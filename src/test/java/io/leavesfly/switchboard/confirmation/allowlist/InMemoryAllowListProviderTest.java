package io.leavesfly.switchboard.confirmation.allowlist;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryAllowListProvider 单元测试
 */
class InMemoryAllowListProviderTest {

    @Test
    void testScopedEntryDoesNotLeakToOtherScopes() {
        InMemoryAllowListProvider provider = new InMemoryAllowListProvider();
        provider.allow("toolA", "user-1").block();

        assertTrue(provider.isAllowed("toolA", "user-1").block());
        assertFalse(provider.isAllowed("toolA", "user-2").block());
        assertFalse(provider.isAllowed("toolA", null).block(), "范围内的批准不应影响全局");
    }

    @Test
    void testGlobalEntryAppliesToEveryScope() {
        InMemoryAllowListProvider provider = new InMemoryAllowListProvider();
        provider.allow("toolA", null).block();

        assertTrue(provider.isAllowed("toolA", null).block());
        assertTrue(provider.isAllowed("toolA", "user-1").block());
    }

    @Test
    void testDisallowAndListing() {
        InMemoryAllowListProvider provider = new InMemoryAllowListProvider();
        provider.allow("toolB", null).block();
        provider.allow("toolA", null).block();

        assertEquals(Set.of("toolA", "toolB"), provider.getAllowed(null).block());

        provider.disallow("toolA", null).block();

        assertFalse(provider.isAllowed("toolA", null).block());
        assertEquals(Set.of("toolB"), provider.getAllowed(null).block());
        assertTrue(provider.getAllowed("nobody").block().isEmpty());
    }
}
