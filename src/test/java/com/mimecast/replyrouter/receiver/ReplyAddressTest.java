package com.mimecast.replyrouter.receiver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.junit.jupiter.api.Assertions.*;

class ReplyAddressTest {
    private final ReplyAddress replyAddress = new ReplyAddress("incoming+%{key}@appmail.example.com", "git.example.com");

    @ParameterizedTest
    @DisplayName("Reply address permutations")
    @CsvSource({
        // Plain key
        "incoming+59d8df8370b7e95c5a49fbf86aeb2c93@appmail.example.com,59d8df8370b7e95c5a49fbf86aeb2c93",
        // Domain case differs, key case kept
        "INCOMING+AbC123@APPMAIL.Example.com,AbC123",
        // Namespace path key
        "incoming+group/project@appmail.example.com,group/project",
        // Surrounding whitespace
        "'  incoming+abc@appmail.example.com ',abc",
        // No key
        "incoming@appmail.example.com,",
        // Empty key
        "incoming+@appmail.example.com,",
        // Other domain
        "incoming+abc@other.example.com,",
        // Subdomain suffix
        "incoming+abc@appmail.example.com.evil.org,",
        // Unrelated address
        "someone@example.org,"
    })
    void testKeyFromAddress(String address, String expectedKey) {
        assertEquals(expectedKey, replyAddress.keyFromAddress(address).orElse(null));
    }

    @ParameterizedTest
    @DisplayName("Fallback Message-ID permutations")
    @CsvSource({
        "<reply-59d8df8370b7e95c5a49fbf86aeb2c93@git.example.com>,59d8df8370b7e95c5a49fbf86aeb2c93",
        "reply-abc@git.example.com,abc",
        "<REPLY-abc@GIT.example.com>,abc",
        "<reply-abc@other.example.com>,",
        "<issue_1@git.example.com>,",
        "<reply-@git.example.com>,"
    })
    void testKeyFromFallbackMessageId(String messageId, String expectedKey) {
        assertEquals(expectedKey, replyAddress.keyFromFallbackMessageId(messageId).orElse(null));
    }

    @ParameterizedTest
    @DisplayName("Null and empty values")
    @NullAndEmptySource
    void testNullAndEmpty(String value) {
        assertTrue(replyAddress.keyFromAddress(value).isEmpty());
        assertTrue(replyAddress.keyFromFallbackMessageId(value).isEmpty());
    }

    @Test
    void testTemplateWithoutPlaceholder() {
        ReplyAddress noKey = new ReplyAddress("incoming@appmail.example.com", "git.example.com");
        assertTrue(noKey.keyFromAddress("incoming@appmail.example.com").isEmpty());
        assertTrue(noKey.keyFromAddress("incoming+abc@appmail.example.com").isEmpty());
        // Fallback ids do not depend on the template.
        assertEquals("abc", noKey.keyFromFallbackMessageId("<reply-abc@git.example.com>").orElse(null));
    }

    @Test
    void testGeneratedAddressesResolveBack() {
        String address = replyAddress.replyAddress("f00ba4");
        String messageId = replyAddress.fallbackMessageId("f00ba4");

        assertEquals("incoming+f00ba4@appmail.example.com", address);
        assertEquals("reply-f00ba4@git.example.com", messageId);
        assertEquals("f00ba4", replyAddress.keyFromAddress(address).orElse(null));
        assertEquals("f00ba4", replyAddress.keyFromFallbackMessageId("<" + messageId + ">").orElse(null));
    }

    @Test
    void testMissingHostDefaultsToLocalhost() {
        ReplyAddress noHost = new ReplyAddress("incoming+%{key}@appmail.example.com", null);

        assertEquals("reply-abc@localhost", noHost.fallbackMessageId("abc"));
        assertEquals("abc", noHost.keyFromFallbackMessageId("<reply-abc@localhost>").orElse(null));
        assertEquals("abc", noHost.keyFromAddress("incoming+abc@appmail.example.com").orElse(null));
    }
}
