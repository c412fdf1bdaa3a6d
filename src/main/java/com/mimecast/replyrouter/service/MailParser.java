package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.ParsedMessage;

/**
 * MIME parser interface.
 * <p>Turns raw message bytes into a structured message.
 */
public interface MailParser {

    /**
     * Parses raw message bytes.
     *
     * @param raw Raw message.
     * @return ParsedMessage instance.
     * @throws MailParseException When the message cannot be decoded, e.g. an unknown charset.
     */
    ParsedMessage parse(byte[] raw) throws MailParseException;
}
