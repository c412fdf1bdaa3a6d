package com.mimecast.replyrouter.receiver;

import com.mimecast.replyrouter.config.IncomingEmailConfig;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reply address scheme.
 *
 * <p>Outbound notifications are sent from a reply address carrying a routing key
 * <br>and with a Message-ID carrying the same key as a fallback for relays that rewrite recipients.
 * <p>Formats:
 * <ul>
 *   <li>Address: the configured template with {@code %{key}} replaced, e.g. {@code reply+abc123@example.com}</li>
 *   <li>Fallback Message-ID: {@code reply-abc123@example.com}, angle brackets optional</li>
 * </ul>
 * Both patterns match the whole value, case-insensitively. The key keeps its original case.
 */
public class ReplyAddress {
    private static final Logger log = LogManager.getLogger(ReplyAddress.class);

    /**
     * Address template.
     */
    private final String template;

    /**
     * Fallback Message-ID host.
     */
    private final String host;

    /**
     * Compiled address pattern, null when the template has no key placeholder.
     * <p>Group 1: routing key.
     */
    private final Pattern addressPattern;

    /**
     * Compiled fallback Message-ID pattern.
     * <p>Group 1: routing key.
     */
    private final Pattern fallbackPattern;

    /**
     * Constructs a new ReplyAddress instance from configuration.
     *
     * @param config IncomingEmailConfig instance.
     */
    public ReplyAddress(IncomingEmailConfig config) {
        this(config.getAddress(), config.getHost());
    }

    /**
     * Constructs a new ReplyAddress instance.
     *
     * @param template Address template, e.g. {@code reply+%{key}@example.com}.
     * @param host     Fallback Message-ID host, localhost when blank.
     */
    public ReplyAddress(String template, String host) {
        this.template = template == null ? "" : template;
        this.host = StringUtils.defaultIfBlank(host, "localhost");

        int index = this.template.indexOf(IncomingEmailConfig.KEY_PLACEHOLDER);
        if (index >= 0) {
            String prefix = this.template.substring(0, index);
            String suffix = this.template.substring(index + IncomingEmailConfig.KEY_PLACEHOLDER.length());
            addressPattern = Pattern.compile("^" + Pattern.quote(prefix) + "(.+)" + Pattern.quote(suffix) + "$",
                    Pattern.CASE_INSENSITIVE);
        } else {
            log.warn("Reply address template has no key placeholder, addresses will not be routed: {}", this.template);
            addressPattern = null;
        }

        fallbackPattern = Pattern.compile("^reply-(.+)@" + Pattern.quote(this.host) + "$", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Extracts the routing key from a recipient address.
     *
     * @param address Email address.
     * @return Optional of key.
     */
    public Optional<String> keyFromAddress(String address) {
        if (addressPattern == null || address == null || address.isBlank()) {
            return Optional.empty();
        }

        Matcher matcher = addressPattern.matcher(address.trim());
        if (matcher.matches()) {
            return Optional.of(matcher.group(1));
        }

        return Optional.empty();
    }

    /**
     * Extracts the routing key from a fallback reply Message-ID.
     *
     * @param messageId Message-ID with or without angle brackets.
     * @return Optional of key.
     */
    public Optional<String> keyFromFallbackMessageId(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return Optional.empty();
        }

        String id = messageId.trim();
        if (id.startsWith("<") && id.endsWith(">")) {
            id = id.substring(1, id.length() - 1);
        }

        Matcher matcher = fallbackPattern.matcher(id);
        if (matcher.matches()) {
            return Optional.of(matcher.group(1));
        }

        return Optional.empty();
    }

    /**
     * Builds the reply address for a key.
     *
     * @param key Routing key.
     * @return Address, or the bare template when it has no key placeholder.
     */
    public String replyAddress(String key) {
        return template.replace(IncomingEmailConfig.KEY_PLACEHOLDER, key);
    }

    /**
     * Builds the fallback Message-ID for a key, without angle brackets.
     *
     * @param key Routing key.
     * @return Message-ID.
     */
    public String fallbackMessageId(String key) {
        return "reply-" + key + "@" + host;
    }
}
