package com.mimecast.replyrouter.receiver;

import com.mimecast.replyrouter.domain.ParsedMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the routing key of an inbound message.
 *
 * <p>Priority order:
 * <ol>
 *   <li>To header addresses, in header order</li>
 *   <li>References header message ids, in header order</li>
 * </ol>
 * The first candidate yielding a key wins. References are only consulted when no To address matched.
 */
public class ReplyKeyResolver {
    private static final Logger log = LogManager.getLogger(ReplyKeyResolver.class);

    /**
     * Reply address scheme.
     */
    private final ReplyAddress replyAddress;

    /**
     * Constructs a new ReplyKeyResolver instance.
     *
     * @param replyAddress Reply address scheme.
     */
    public ReplyKeyResolver(ReplyAddress replyAddress) {
        this.replyAddress = replyAddress;
    }

    /**
     * Resolves the routing key.
     *
     * @param message Parsed message.
     * @return Optional of key, empty if no header carries one.
     */
    public Optional<String> resolve(ParsedMessage message) {
        Optional<String> key = firstMatch(message.getTo(), replyAddress::keyFromAddress);
        if (key.isPresent()) {
            log.debug("Reply key found in To header: {}", key.get());
            return key;
        }

        key = firstMatch(message.getReferences(), replyAddress::keyFromFallbackMessageId);
        if (key.isPresent()) {
            log.debug("Reply key found in References header: {}", key.get());
        } else {
            log.debug("No reply key in To or References headers");
        }

        return key;
    }

    private static Optional<String> firstMatch(List<String> candidates, Function<String, Optional<String>> extractor) {
        return candidates.stream()
                .map(extractor)
                .flatMap(Optional::stream)
                .findFirst();
    }
}
