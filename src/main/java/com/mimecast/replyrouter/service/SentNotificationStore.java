package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.SentNotification;

import java.util.Optional;

/**
 * Read access to sent notifications.
 */
public interface SentNotificationStore {

    /**
     * Finds the notification a reply key was issued for.
     *
     * @param replyKey Reply key.
     * @return Optional of SentNotification.
     */
    Optional<SentNotification> find(String replyKey);
}
