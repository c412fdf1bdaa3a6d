package com.mimecast.replyrouter.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SentNotificationTest {

    @Test
    void testNoteableFillsThreadingFields() {
        SentNotification notification = SentNotification.builder("key")
                .recipient(new User(1L, "jake", false))
                .project(new Project(10L, "group/project"))
                .noteable(new Noteable("MergeRequest", "42"))
                .build();

        assertEquals("key", notification.getReplyKey());
        assertEquals("MergeRequest", notification.getNoteableType());
        assertEquals(42L, notification.getNoteableId());
        assertTrue(notification.getNoteable().isPresent());
    }

    @Test
    void testCommitNoteable() {
        SentNotification notification = SentNotification.builder("key")
                .noteable(new Noteable("Commit", "a1b2c3d4"))
                .commitId("a1b2c3d4")
                .lineCode("f00_1_1")
                .build();

        assertNull(notification.getNoteableId());
        assertEquals("Commit", notification.getNoteableType());
        assertEquals("a1b2c3d4", notification.getCommitId());
        assertEquals("f00_1_1", notification.getLineCode());
    }

    @Test
    void testAllDigitIdBeyondLong() {
        SentNotification notification = SentNotification.builder("key")
                .noteable(new Noteable("Commit", "12345678901234567890123"))
                .build();

        assertEquals("Commit", notification.getNoteableType());
        assertNull(notification.getNoteableId());
        assertEquals("12345678901234567890123", notification.getNoteable().get().id());
    }

    @Test
    void testMissingNoteable() {
        SentNotification notification = SentNotification.builder("key").build();

        assertTrue(notification.getNoteable().isEmpty());
        assertNull(notification.getRecipient());
        assertNull(notification.getProject());
    }

    @Test
    void testCreationResult() {
        assertTrue(CreationResult.success().persisted());
        assertTrue(CreationResult.success().errors().isEmpty());
        assertFalse(CreationResult.failure(null).persisted());
        assertTrue(CreationResult.failure(null).errors().isEmpty());
    }

    @Test
    void testImageAttachment() {
        assertTrue(new MessageAttachment("a.png", "IMAGE/PNG", new byte[0]).isImage());
        assertFalse(new MessageAttachment("a.pdf", "application/pdf", new byte[0]).isImage());
        assertFalse(new MessageAttachment("a", null, new byte[0]).isImage());
    }
}
