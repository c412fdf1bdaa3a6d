package com.mimecast.replyrouter.receiver;

import com.mimecast.replyrouter.attachment.LocalAttachmentUploader;
import com.mimecast.replyrouter.config.IncomingEmailConfig;
import com.mimecast.replyrouter.domain.CreationResult;
import com.mimecast.replyrouter.domain.IssueRequest;
import com.mimecast.replyrouter.domain.NoteRequest;
import com.mimecast.replyrouter.domain.Noteable;
import com.mimecast.replyrouter.domain.Project;
import com.mimecast.replyrouter.domain.SentNotification;
import com.mimecast.replyrouter.domain.User;
import com.mimecast.replyrouter.exception.AutoGeneratedEmailException;
import com.mimecast.replyrouter.exception.EmailUnparsableException;
import com.mimecast.replyrouter.mime.EmailReplyParser;
import com.mimecast.replyrouter.mime.JakartaMailParser;
import com.mimecast.replyrouter.service.AuthorizationPolicy;
import com.mimecast.replyrouter.service.IssueCreator;
import com.mimecast.replyrouter.service.NoteCreator;
import com.mimecast.replyrouter.service.ProjectResolver;
import com.mimecast.replyrouter.service.ReceiverServices;
import com.mimecast.replyrouter.service.SentNotificationStore;
import com.mimecast.replyrouter.service.UserLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Pipeline tests over raw emails using the default MIME, reply and attachment adapters.
 */
class EmailReceiverEmlTest {
    private static final String KEY = "59d8df8370b7e95c5a49fbf86aeb2c93";

    @TempDir
    Path uploads;

    @Mock
    private UserLookup userLookup;
    @Mock
    private AuthorizationPolicy policy;
    @Mock
    private ProjectResolver projectResolver;
    @Mock
    private SentNotificationStore notificationStore;
    @Mock
    private NoteCreator noteCreator;
    @Mock
    private IssueCreator issueCreator;

    private EmailReceiver receiver;

    private final User jake = new User(1L, "jake", false);
    private final Project project = new Project(10L, "group/project");

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);

        IncomingEmailConfig config = new IncomingEmailConfig(
                Paths.get(getClass().getResource("/cfg/incoming-email.json5").toURI()));

        ReceiverServices services = ReceiverServices.builder()
                .mailParser(new JakartaMailParser())
                .userLookup(userLookup)
                .authorizationPolicy(policy)
                .projectResolver(projectResolver)
                .sentNotificationStore(notificationStore)
                .replyParser(new EmailReplyParser())
                .attachmentUploader(new LocalAttachmentUploader(uploads, "https://git.example.com/uploads/"))
                .noteCreator(noteCreator)
                .issueCreator(issueCreator)
                .build();

        receiver = new EmailReceiver(services, config);

        when(noteCreator.create(any())).thenReturn(CreationResult.success());
        when(issueCreator.create(any())).thenReturn(CreationResult.success());
        when(policy.hasCapability(any(), any(), any())).thenReturn(true);
        when(notificationStore.find(anyString())).thenReturn(Optional.empty());
        when(projectResolver.findByRoutingKey(anyString())).thenReturn(Optional.empty());
        when(userLookup.findByAnyEmail(anyString())).thenReturn(Optional.empty());
        when(notificationStore.find(KEY)).thenReturn(Optional.of(SentNotification.builder(KEY)
                .recipient(jake)
                .project(project)
                .noteable(new Noteable("Issue", "1"))
                .build()));
    }

    private byte[] load(String name) throws IOException {
        try (InputStream stream = getClass().getResourceAsStream("/mail/" + name)) {
            assertNotNull(stream, name);
            return stream.readAllBytes();
        }
    }

    @Test
    void testReply() throws Exception {
        receiver.process(load("reply.eml"));

        ArgumentCaptor<NoteRequest> captor = ArgumentCaptor.forClass(NoteRequest.class);
        verify(noteCreator).create(captor.capture());

        assertEquals("I could not disagree more. I am obviously biased but adventure time is the\n"
                + "greatest show ever created. Everyone should watch it.\n\n"
                + "- Jake out", captor.getValue().note());
        assertEquals(jake, captor.getValue().author());
        assertEquals(1L, captor.getValue().noteableId());
    }

    @Test
    void testReplyAsString() throws Exception {
        receiver.process(new String(load("reply.eml")));

        verify(noteCreator).create(any());
    }

    @Test
    void testReplyThroughMailingList() throws Exception {
        receiver.process(load("fallback_references.eml"));

        ArgumentCaptor<NoteRequest> captor = ArgumentCaptor.forClass(NoteRequest.class);
        verify(noteCreator).create(captor.capture());
        assertEquals("Relayed through the list.", captor.getValue().note());
    }

    @Test
    void testAutoReplied() throws Exception {
        byte[] raw = load("auto_replied.eml");

        assertThrows(AutoGeneratedEmailException.class, () -> receiver.process(raw));
        verifyNoInteractions(noteCreator, issueCreator);
    }

    @Test
    void testUnknownCharset() throws Exception {
        byte[] raw = load("bad_charset.eml");

        assertThrows(EmailUnparsableException.class, () -> receiver.process(raw));
        verifyNoInteractions(notificationStore, noteCreator, issueCreator);
    }

    @Test
    void testInvalidUtf8() throws Exception {
        byte[] raw = load("invalid_utf8.eml");

        assertThrows(EmailUnparsableException.class, () -> receiver.process(raw));
        verifyNoInteractions(notificationStore, noteCreator, issueCreator);
    }

    @Test
    void testHtmlOnlyReply() throws Exception {
        receiver.process(load("html_only.eml"));

        ArgumentCaptor<NoteRequest> captor = ArgumentCaptor.forClass(NoteRequest.class);
        verify(noteCreator).create(captor.capture());
        assertEquals("Fixed & deployed\n\nThanks", captor.getValue().note());
    }

    @Test
    void testNewIssueWithAttachments() throws Exception {
        when(projectResolver.findByRoutingKey("group/project")).thenReturn(Optional.of(project));
        when(userLookup.findByAnyEmail("jake@example.org")).thenReturn(Optional.of(jake));

        receiver.process(load("new_issue.eml"));

        ArgumentCaptor<IssueRequest> captor = ArgumentCaptor.forClass(IssueRequest.class);
        verify(issueCreator).create(captor.capture());
        IssueRequest request = captor.getValue();

        assertEquals("New issue from email", request.title());
        assertEquals(jake, request.author());

        String[] sections = request.description().split("\n\n");
        assertEquals(4, sections.length, request.description());
        assertEquals("The login form rejects valid passwords.", sections[0]);
        assertEquals("Steps are attached.", sections[1]);
        assertTrue(sections[2].matches("!\\[screen_shot]\\(https://git\\.example\\.com/uploads/group/project/[0-9a-f]{64}/screen_shot\\.png\\)"),
                sections[2]);
        assertTrue(sections[3].matches("\\[steps\\.txt]\\(https://git\\.example\\.com/uploads/group/project/[0-9a-f]{64}/steps\\.txt\\)"),
                sections[3]);

        try (Stream<Path> files = Files.walk(uploads.resolve("group/project"))) {
            assertEquals(2, files.filter(Files::isRegularFile).count());
        }
    }
}
