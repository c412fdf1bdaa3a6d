package com.mimecast.replyrouter.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IncomingEmailConfig.
 */
class IncomingEmailConfigTest {

    @Test
    void testDefaultConfig() {
        IncomingEmailConfig config = new IncomingEmailConfig((Map<String, Object>) null);
        assertFalse(config.isEnabled());
        assertEquals("", config.getAddress());
        assertFalse(config.isKeySupported());
        assertEquals("localhost", config.getHost());
        assertEquals("auto-(generated|replied)", config.getAutoGeneratedPattern());
        assertTrue(config.isRejectionEnabled());
        assertFalse(config.isBounceUnparsable());
        assertEquals("noreply@localhost", config.getRejectionFrom());
        assertEquals("store/outbox", config.getRejectionOutboxPath());
        assertEquals("store/uploads", config.getAttachmentStoragePath());
        assertEquals("/uploads", config.getAttachmentUrlPrefix());
    }

    @Test
    void testMapConfig() {
        Map<String, Object> rejection = new HashMap<>();
        rejection.put("enabled", false);

        Map<String, Object> map = new HashMap<>();
        map.put("enabled", true);
        map.put("address", "reply+%{key}@example.com");
        map.put("host", "example.com");
        map.put("rejection", rejection);

        IncomingEmailConfig config = new IncomingEmailConfig(map);
        assertTrue(config.isEnabled());
        assertTrue(config.isKeySupported());
        assertEquals("reply+%{key}@example.com", config.getAddress());
        assertFalse(config.isRejectionEnabled());
        assertEquals("noreply@example.com", config.getRejectionFrom());
    }

    @Test
    void testLoadJson5File() throws Exception {
        Path path = Paths.get(getClass().getResource("/cfg/incoming-email.json5").toURI());
        IncomingEmailConfig config = new IncomingEmailConfig(path);

        assertTrue(config.isEnabled());
        assertEquals("incoming+%{key}@appmail.example.com", config.getAddress());
        assertEquals("git.example.com", config.getHost());
        assertTrue(config.isBounceUnparsable());
        assertEquals("bounces@git.example.com", config.getRejectionFrom());
        assertEquals("target/test-uploads", config.getAttachmentStoragePath());
        assertEquals("https://git.example.com/uploads/", config.getAttachmentUrlPrefix());
        // Not set in the file.
        assertEquals("auto-(generated|replied)", config.getAutoGeneratedPattern());
    }

    @Test
    void testShippedDefaults() throws Exception {
        IncomingEmailConfig config = new IncomingEmailConfig(Paths.get("src/main/resources/cfg/incoming-email.json5"));

        assertFalse(config.isEnabled());
        assertTrue(config.isKeySupported());
        assertTrue(config.isRejectionEnabled());
        assertFalse(config.isBounceUnparsable());
        assertEquals("noreply@example.com", config.getRejectionFrom());
        assertEquals("store/outbox", config.getRejectionOutboxPath());
    }

    @Test
    void testBasicConfigTypedGetters() {
        Map<String, Object> map = new HashMap<>();
        map.put("double", 25.0);
        map.put("string", "42");
        map.put("bad", "forty-two");
        map.put("flag", "true");
        map.put("list", List.of("a", "b"));

        BasicConfig config = new BasicConfig(map);
        assertEquals(25L, config.getLongProperty("double", 0L));
        assertEquals(42L, config.getLongProperty("string", 0L));
        assertEquals(7L, config.getLongProperty("bad", 7L));
        assertEquals(7L, config.getLongProperty("missing", 7L));
        assertTrue(config.getBooleanProperty("flag"));
        assertFalse(config.getBooleanProperty("missing"));
        assertEquals(List.of("a", "b"), config.getListProperty("list"));
        assertTrue(config.getListProperty("missing").isEmpty());
        assertTrue(config.getMapProperty("missing").isEmpty());
        assertTrue(config.hasProperty("flag"));
        assertNull(config.getStringProperty("missing"));
    }
}
