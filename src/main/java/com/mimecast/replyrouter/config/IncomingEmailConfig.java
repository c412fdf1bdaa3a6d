package com.mimecast.replyrouter.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Incoming email configuration.
 *
 * <p>This class provides type safe access to the reply address scheme, the auto-generated
 * <br>header marker, rejection notices and local attachment storage.
 *
 * <p>Example configuration:
 * <pre>{@code
 * {
 *   enabled: true,
 *   address: "reply+%{key}@example.com",
 *   host: "example.com",
 *   autoGeneratedPattern: "auto-(generated|replied)",
 *   rejection: {
 *     enabled: true,
 *     bounceUnparsable: false,
 *     from: "noreply@example.com",
 *     outboxPath: "store/outbox"
 *   },
 *   attachments: {
 *     storagePath: "store/uploads",
 *     urlPrefix: "/uploads"
 *   }
 * }
 * }</pre>
 */
public class IncomingEmailConfig extends BasicConfig {

    /**
     * Routing key placeholder in the address template.
     */
    public static final String KEY_PLACEHOLDER = "%{key}";

    /**
     * Constructs a new IncomingEmailConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public IncomingEmailConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new IncomingEmailConfig instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public IncomingEmailConfig(Path path) throws IOException {
        super(path);
    }

    /**
     * Is incoming email processing enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    /**
     * Gets reply address template.
     *
     * @return Address template string.
     */
    public String getAddress() {
        return getStringProperty("address", "");
    }

    /**
     * Does the address template carry a routing key placeholder.
     *
     * @return Boolean.
     */
    public boolean isKeySupported() {
        return getAddress().contains(KEY_PLACEHOLDER);
    }

    /**
     * Gets host used in fallback reply message ids.
     *
     * @return Host string.
     */
    public String getHost() {
        return getStringProperty("host", "localhost");
    }

    /**
     * Gets auto-generated header marker regex.
     *
     * @return Regex string.
     */
    public String getAutoGeneratedPattern() {
        return getStringProperty("autoGeneratedPattern", "auto-(generated|replied)");
    }

    /**
     * Gets rejection notice config.
     *
     * @return BasicConfig instance.
     */
    public BasicConfig getRejection() {
        return new BasicConfig(getMapProperty("rejection"));
    }

    /**
     * Are rejection notices sent back to the sender.
     *
     * @return Boolean.
     */
    public boolean isRejectionEnabled() {
        return getRejection().getBooleanProperty("enabled", true);
    }

    /**
     * Are rejection notices sent for messages that could not be parsed.
     *
     * @return Boolean.
     */
    public boolean isBounceUnparsable() {
        return getRejection().getBooleanProperty("bounceUnparsable", false);
    }

    /**
     * Gets rejection notice sender address.
     *
     * @return Address string.
     */
    public String getRejectionFrom() {
        return getRejection().getStringProperty("from", "noreply@" + getHost());
    }

    /**
     * Gets folder rejection notices are written to for delivery.
     *
     * @return Path string.
     */
    public String getRejectionOutboxPath() {
        return getRejection().getStringProperty("outboxPath", "store/outbox");
    }

    /**
     * Gets attachment storage config.
     *
     * @return BasicConfig instance.
     */
    public BasicConfig getAttachments() {
        return new BasicConfig(getMapProperty("attachments"));
    }

    /**
     * Gets attachment storage path.
     *
     * @return Path string.
     */
    public String getAttachmentStoragePath() {
        return getAttachments().getStringProperty("storagePath", "store/uploads");
    }

    /**
     * Gets attachment URL prefix.
     *
     * @return URL prefix string.
     */
    public String getAttachmentUrlPrefix() {
        return getAttachments().getStringProperty("urlPrefix", "/uploads");
    }
}
