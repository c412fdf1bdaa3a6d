package com.mimecast.replyrouter.receiver;

import com.mimecast.replyrouter.config.IncomingEmailConfig;
import com.mimecast.replyrouter.domain.Capability;
import com.mimecast.replyrouter.domain.CreationResult;
import com.mimecast.replyrouter.domain.IssueRequest;
import com.mimecast.replyrouter.domain.NoteRequest;
import com.mimecast.replyrouter.domain.ParsedMessage;
import com.mimecast.replyrouter.domain.Project;
import com.mimecast.replyrouter.domain.SentNotification;
import com.mimecast.replyrouter.domain.User;
import com.mimecast.replyrouter.exception.AutoGeneratedEmailException;
import com.mimecast.replyrouter.exception.EmailUnparsableException;
import com.mimecast.replyrouter.exception.EmptyInputException;
import com.mimecast.replyrouter.exception.InvalidIssueException;
import com.mimecast.replyrouter.exception.InvalidNoteException;
import com.mimecast.replyrouter.exception.NoteableNotFoundException;
import com.mimecast.replyrouter.exception.ProcessingException;
import com.mimecast.replyrouter.exception.RoutingNotFoundException;
import com.mimecast.replyrouter.service.MailParseException;
import com.mimecast.replyrouter.service.ReceiverServices;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Inbound reply email receiver.
 *
 * <p>Decides what an email sent to a reply address becomes:
 * <ul>
 *   <li>A note, when its reply key matches a sent notification</li>
 *   <li>An issue, when its reply key names a project</li>
 *   <li>A {@link ProcessingException} otherwise</li>
 * </ul>
 * <p>Every check runs before attachments are uploaded or content is created,
 * <br>so a rejected email leaves nothing persisted.
 * <p>The receiver keeps no per-message state and may be shared between threads
 * <br>when its collaborators are thread safe.
 */
public class EmailReceiver {
    private static final Logger log = LogManager.getLogger(EmailReceiver.class);

    private final ReceiverServices services;
    private final ReplyKeyResolver keyResolver;
    private final AuthorizationGate authorizationGate;
    private final ReplyBodyExtractor bodyExtractor;

    /**
     * Auto-generated or auto-replied header marker.
     */
    private final Pattern autoGeneratedPattern;

    /**
     * Constructs a new EmailReceiver instance.
     *
     * @param services Collaborators.
     * @param config   Incoming email configuration.
     */
    public EmailReceiver(ReceiverServices services, IncomingEmailConfig config) {
        this.services = services;
        this.keyResolver = new ReplyKeyResolver(new ReplyAddress(config));
        this.authorizationGate = new AuthorizationGate(services.getAuthorizationPolicy());
        this.bodyExtractor = new ReplyBodyExtractor(services.getReplyParser(), services.getAttachmentUploader());
        this.autoGeneratedPattern = Pattern.compile(config.getAutoGeneratedPattern(), Pattern.CASE_INSENSITIVE);
    }

    /**
     * Processes a raw email given as text.
     *
     * @param raw Raw email.
     * @throws ProcessingException When the email is rejected.
     */
    public void process(String raw) throws ProcessingException {
        process(raw == null ? null : raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Processes a raw email.
     *
     * @param raw Raw email bytes.
     * @throws ProcessingException When the email is rejected.
     */
    public void process(byte[] raw) throws ProcessingException {
        if (raw == null || StringUtils.isBlank(new String(raw, StandardCharsets.UTF_8))) {
            throw new EmptyInputException();
        }

        ParsedMessage message = parse(raw);
        Optional<String> key = keyResolver.resolve(message);

        Optional<SentNotification> notification = key.flatMap(services.getSentNotificationStore()::find);
        if (notification.isPresent()) {
            processReply(message, notification.get());
            return;
        }

        Optional<Project> project = key.flatMap(services.getProjectResolver()::findByRoutingKey);
        if (project.isPresent()) {
            processCreateIssue(message, project.get());
            return;
        }

        // Also covers a key naming a project the sender cannot see.
        throw new RoutingNotFoundException(key
                .map(k -> "No sent notification or project matches reply key: " + k)
                .orElse("No reply key found in To or References headers."));
    }

    /**
     * Turns a reply into a note on the discussed item.
     *
     * @param message      Parsed message.
     * @param notification Sent notification matched by the reply key.
     * @throws ProcessingException When the reply is rejected.
     */
    private void processReply(ParsedMessage message, SentNotification notification) throws ProcessingException {
        if (autoGeneratedPattern.matcher(StringUtils.defaultString(message.getHeaderBlob())).find()) {
            throw new AutoGeneratedEmailException();
        }

        User author = notification.getRecipient();
        Project project = notification.getProject();

        authorizationGate.check(author, project, Capability.CREATE_NOTE);

        if (notification.getNoteable().isEmpty()) {
            throw new NoteableNotFoundException();
        }

        String body = bodyExtractor.extract(message, project);

        CreationResult result = services.getNoteCreator().create(new NoteRequest(
                project,
                author,
                body,
                notification.getNoteableType(),
                notification.getNoteableId(),
                notification.getCommitId(),
                notification.getLineCode()
        ));

        if (!result.persisted()) {
            throw new InvalidNoteException(result.errors());
        }

        log.info("Created note by {} on {} {} in {}", author.getUsername(),
                notification.getNoteableType(), notification.getNoteableId(), project.getFullPath());
    }

    /**
     * Turns an email into a new issue.
     *
     * @param message Parsed message.
     * @param project Project named by the reply key.
     * @throws ProcessingException When the email is rejected.
     */
    private void processCreateIssue(ParsedMessage message, Project project) throws ProcessingException {
        // TODO: From can be forged; require a per-user token in the address before trusting it.
        User author = findSender(message).orElse(null);

        authorizationGate.check(author, project, Capability.CREATE_ISSUE);

        String description = bodyExtractor.extract(message, project);
        String title = StringUtils.defaultString(message.getSubject());

        CreationResult result = services.getIssueCreator().create(new IssueRequest(project, author, title, description));

        if (!result.persisted()) {
            throw new InvalidIssueException(result.errors());
        }

        log.info("Created issue \"{}\" by {} in {}", title, author.getUsername(), project.getFullPath());
    }

    /**
     * Finds the first From address that belongs to a user.
     *
     * @param message Parsed message.
     * @return Optional of User.
     */
    private Optional<User> findSender(ParsedMessage message) {
        return message.getFrom().stream()
                .map(services.getUserLookup()::findByAnyEmail)
                .flatMap(Optional::stream)
                .findFirst();
    }

    private ParsedMessage parse(byte[] raw) throws EmailUnparsableException {
        try {
            return services.getMailParser().parse(raw);
        } catch (MailParseException e) {
            log.debug("Unable to parse email: {}", e.getMessage());
            throw new EmailUnparsableException(e);
        }
    }
}
