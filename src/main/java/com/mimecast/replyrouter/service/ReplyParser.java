package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.ParsedMessage;

/**
 * Quote stripper interface.
 * <p>Separates the text the sender wrote from quoted history and signatures.
 */
public interface ReplyParser {

    /**
     * Extracts the reply text.
     *
     * @param message Parsed message.
     * @return Reply text, possibly empty, never null.
     */
    String extractReply(ParsedMessage message);
}
