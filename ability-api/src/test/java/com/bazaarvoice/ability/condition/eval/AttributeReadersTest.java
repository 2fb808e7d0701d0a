package com.bazaarvoice.ability.condition.eval;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.fail;

public class AttributeReadersTest {

    @Test
    public void testDocuments() {
        AttributeReader reader = AttributeReaders.documents();
        assertEquals(reader.read(ImmutableMap.of("a", 1), "a"), 1);
        assertNull(reader.read(ImmutableMap.of("a", 1), "b"));
        assertNull(reader.read(null, "a"));
        assertNull(reader.read("string", "length"));
        assertNull(reader.read(ImmutableList.of(ImmutableMap.of("a", 1)), "a"));
    }

    @Test
    public void testBeanAccessors() {
        AttributeReader reader = AttributeReaders.beans();
        Account account = new Account();
        assertEquals(reader.read(account, "ownerId"), 42L);
        assertEquals(reader.read(account, "owner_id"), 42L);
        assertEquals(reader.read(account, "active"), true);
        assertEquals(reader.read(account, "name"), "acme");
        assertEquals(reader.read(account, "region"), "us");
        assertEquals(reader.read(account, "plan_tier"), "gold");
        // Read twice to go through the cached accessor.
        assertEquals(reader.read(account, "owner_id"), 42L);
    }

    @Test
    public void testBeanReadsMaps() {
        assertEquals(AttributeReaders.beans().read(ImmutableMap.of("owner_id", 1), "owner_id"), 1);
        assertNull(AttributeReaders.beans().read(ImmutableMap.of(), "owner_id"));
    }

    @Test
    public void testBeanMissingAttribute() {
        try {
            AttributeReaders.beans().read(new Account(), "secret");
            fail();
        } catch (MissingAttributeException e) {
            assertEquals(e.getTargetClass(), Account.class);
            assertEquals(e.getAttribute(), "secret");
        }
    }

    @Test
    public void testBeanStaticMembersIgnored() {
        try {
            AttributeReaders.beans().read(new Account(), "defaultRegion");
            fail();
        } catch (MissingAttributeException e) {
            assertEquals(e.getAttribute(), "defaultRegion");
        }
    }

    @Test(expectedExceptions = MissingAttributeException.class)
    public void testBeanOfNull() {
        AttributeReaders.beans().read(null, "owner_id");
    }

    public static class Account {
        public static String defaultRegion = "eu";

        public String region = "us";
        public String planTier = "gold";
        private final String secret = "hidden";

        public long getOwnerId() {
            return 42L;
        }

        public boolean isActive() {
            return true;
        }

        public String name() {
            return "acme";
        }

        public static String getDefaultRegion() {
            return defaultRegion;
        }
    }
}
