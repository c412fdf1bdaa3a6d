package com.mimecast.replyrouter.worker;

import com.mimecast.replyrouter.config.IncomingEmailConfig;
import jakarta.activation.DataHandler;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Properties;
import java.util.UUID;

/**
 * Rejection notifier writing notices to an outbox folder.
 *
 * <p>The notice goes to the Reply-To or From address of the rejected email and contains:
 * <ul>
 *   <li>The reason as text</li>
 *   <li>The rejected email attached as {@code message/rfc822}</li>
 * </ul>
 * <p>Notices are marked {@code Auto-Submitted: auto-replied} so they are never routed back in as replies.
 * <br>Delivery of the outbox is left to the mail transport.
 */
public class RejectionMailer implements RejectionNotifier {
    private static final Logger log = LogManager.getLogger(RejectionMailer.class);

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    /**
     * Outbox folder.
     */
    private final Path outbox;

    /**
     * Notice sender address.
     */
    private final String from;

    /**
     * Mail session, only used to build messages.
     */
    private final Session session = Session.getInstance(new Properties());

    /**
     * Constructs a new RejectionMailer instance from configuration.
     *
     * @param config IncomingEmailConfig instance.
     */
    public RejectionMailer(IncomingEmailConfig config) {
        this(Paths.get(config.getRejectionOutboxPath()), config.getRejectionFrom());
    }

    /**
     * Constructs a new RejectionMailer instance.
     *
     * @param outbox Outbox folder.
     * @param from   Notice sender address.
     */
    public RejectionMailer(Path outbox, String from) {
        this.outbox = outbox;
        this.from = from;
    }

    @Override
    public void reject(String reason, byte[] raw) throws IOException {
        try {
            MimeMessage original = new MimeMessage(session, new ByteArrayInputStream(raw));

            Address[] recipients = original.getReplyTo();
            if (recipients == null || recipients.length == 0) {
                log.warn("Dropping rejection notice, rejected email has no sender address");
                return;
            }

            MimeMessage notice = build(reason, original, raw, recipients);

            Files.createDirectories(outbox);
            Path file = outbox.resolve(String.format("%s-%s.eml",
                    LocalDateTime.now().format(FILE_DATE), UUID.randomUUID()));
            try (OutputStream stream = Files.newOutputStream(file)) {
                notice.writeTo(stream);
            }

            log.info("Wrote rejection notice for {} to {}", recipients[0], file);

        } catch (MessagingException e) {
            throw new IOException("Unable to build rejection notice: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the notice.
     *
     * @param reason     Reason text.
     * @param original   Parsed rejected email.
     * @param raw        Rejected email bytes.
     * @param recipients Notice recipients.
     * @return MimeMessage.
     * @throws MessagingException Unable to build message.
     */
    private MimeMessage build(String reason, MimeMessage original, byte[] raw, Address[] recipients)
            throws MessagingException {
        MimeMessage notice = new MimeMessage(session);
        notice.setFrom(new InternetAddress(from));
        notice.setRecipients(Message.RecipientType.TO, recipients);
        notice.setSubject("[Rejected] " + StringUtils.defaultString(original.getSubject()), StandardCharsets.UTF_8.name());
        notice.setHeader("Auto-Submitted", "auto-replied");

        String messageId = original.getMessageID();
        if (messageId != null) {
            notice.setHeader("In-Reply-To", messageId);
            notice.setHeader("References", messageId);
        }

        MimeBodyPart text = new MimeBodyPart();
        text.setText("Unfortunately, your email could not be processed.\n\n" + reason + "\n",
                StandardCharsets.UTF_8.name());

        MimeBodyPart attached = new MimeBodyPart();
        attached.setDataHandler(new DataHandler(new ByteArrayDataSource(raw, "message/rfc822")));
        attached.setFileName("original.eml");

        MimeMultipart multipart = new MimeMultipart("mixed");
        multipart.addBodyPart(text);
        multipart.addBodyPart(attached);

        notice.setContent(multipart);
        notice.saveChanges();
        return notice;
    }
}
