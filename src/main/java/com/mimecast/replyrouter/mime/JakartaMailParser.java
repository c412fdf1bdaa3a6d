package com.mimecast.replyrouter.mime;

import com.mimecast.replyrouter.domain.MessageAttachment;
import com.mimecast.replyrouter.domain.ParsedMessage;
import com.mimecast.replyrouter.service.MailParseException;
import com.mimecast.replyrouter.service.MailParser;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Jakarta Mail backed MIME parser.
 *
 * <p>Produces a {@link ParsedMessage} with:
 * <ul>
 *     <li>From and To as bare addresses in header order</li>
 *     <li>References as message ids without angle brackets</li>
 *     <li>The unfolded header section as header blob</li>
 *     <li>The first text/plain part as body, or the first text/html part with tags removed</li>
 *     <li>Parts with a file name or attachment disposition as attachments</li>
 * </ul>
 * <p>Decoding failures such as unknown charsets or byte sequences invalid in the declared charset
 * <br>are reported as {@link MailParseException}.
 */
public class JakartaMailParser implements MailParser {
    private static final Logger log = LogManager.getLogger(JakartaMailParser.class);

    /**
     * Message ids inside angle brackets.
     */
    private static final Pattern MESSAGE_ID_PATTERN = Pattern.compile("<([^<>]+)>");

    /**
     * Mail session, no transport or store is ever opened on it.
     */
    private final Session session = Session.getInstance(new Properties());

    @Override
    public ParsedMessage parse(byte[] raw) throws MailParseException {
        try (InputStream stream = new ByteArrayInputStream(raw)) {
            MimeMessage mime = new MimeMessage(session, stream);
            ParsedMessage.Builder builder = ParsedMessage.builder();

            addresses(mime.getFrom()).forEach(builder::addFrom);
            addresses(mime.getRecipients(Message.RecipientType.TO)).forEach(builder::addTo);
            messageIds(mime.getHeader("References", " ")).forEach(builder::addReference);

            builder.subject(StringUtils.defaultString(mime.getSubject()));
            builder.headerBlob(String.join("\n", Collections.list(mime.getAllHeaderLines())));

            Content content = new Content();
            collect(mime, content);
            content.attachments.forEach(builder::addAttachment);

            if (content.plain != null) {
                builder.body(content.plain);
            } else if (content.html != null) {
                builder.body(htmlToText(content.html));
            }

            return builder.build();

        } catch (MessagingException | IOException e) {
            log.warn("Unable to parse email: {}", e.getMessage());
            throw new MailParseException("Unable to parse email: " + e.getMessage(), e);
        }
    }

    /**
     * Walks the part tree collecting the text bodies and attachments.
     *
     * @param part    Part to walk.
     * @param content Collected content.
     * @throws MessagingException On malformed structure.
     * @throws IOException        On decoding error.
     */
    private void collect(Part part, Content content) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Object multipart = part.getContent();
            if (multipart instanceof Multipart) {
                Multipart mp = (Multipart) multipart;
                for (int i = 0; i < mp.getCount(); i++) {
                    collect(mp.getBodyPart(i), content);
                }
            }
            return;
        }

        String fileName = part.getFileName();
        if (fileName != null || Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
            try (InputStream stream = part.getInputStream()) {
                content.attachments.add(new MessageAttachment(
                        fileName != null ? MimeUtility.decodeText(fileName) : "attachment-" + content.attachments.size(),
                        new ContentType(part.getContentType()).getBaseType().toLowerCase(),
                        stream.readAllBytes()
                ));
            }
            return;
        }

        if (part.isMimeType("text/plain") && content.plain == null) {
            content.plain = text(part);
        } else if (part.isMimeType("text/html") && content.html == null) {
            content.html = text(part);
        }
    }

    /**
     * Decodes a text part strictly.
     * <p>Malformed or unmappable bytes fail instead of turning into replacement characters.
     * <br>Parts without a charset are read as UTF-8.
     *
     * @param part Text part.
     * @return Text.
     * @throws MessagingException On malformed headers.
     * @throws IOException        On unknown charset or invalid byte sequence.
     */
    private static String text(Part part) throws MessagingException, IOException {
        String declared = new ContentType(part.getContentType()).getParameter("charset");
        String name = MimeUtility.javaCharset(StringUtils.defaultIfBlank(declared, StandardCharsets.UTF_8.name()));

        Charset charset;
        try {
            charset = Charset.forName(name);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedEncodingException(name);
        }

        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        try (InputStream stream = part.getInputStream()) {
            return decoder.decode(ByteBuffer.wrap(stream.readAllBytes())).toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Invalid " + charset.name() + " byte sequence in text part", e);
        }
    }

    private static List<String> addresses(Address[] addresses) {
        List<String> list = new ArrayList<>();
        if (addresses != null) {
            for (Address address : addresses) {
                if (address instanceof InternetAddress) {
                    list.add(((InternetAddress) address).getAddress());
                }
            }
        }
        return list;
    }

    /**
     * Splits a References header into message ids.
     * <p>Ids without angle brackets are split on whitespace.
     *
     * @param header Header value or null.
     * @return List of message ids.
     */
    static List<String> messageIds(String header) {
        List<String> ids = new ArrayList<>();
        if (StringUtils.isBlank(header)) {
            return ids;
        }

        Matcher matcher = MESSAGE_ID_PATTERN.matcher(header);
        while (matcher.find()) {
            ids.add(matcher.group(1).trim());
        }

        if (ids.isEmpty()) {
            for (String id : header.trim().split("\\s+")) {
                ids.add(id);
            }
        }

        return ids;
    }

    /**
     * Reduces HTML to plain text.
     *
     * @param html HTML content.
     * @return Text.
     */
    static String htmlToText(String html) {
        return html
                .replaceAll("(?is)<(script|style)[^>]*>.*?</\\1>", "")
                .replaceAll("(?i)<br\\s*/?>", "\n")
                .replaceAll("(?i)</(p|div)>", "\n\n")
                .replaceAll("<[^>]+>", "")
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&amp;", "&")
                .trim();
    }

    /**
     * Content collected while walking parts.
     */
    private static class Content {
        private String plain;
        private String html;
        private final List<MessageAttachment> attachments = new ArrayList<>();
    }
}
