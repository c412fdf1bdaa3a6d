package com.mimecast.replyrouter.exception;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingExceptionTest {

    @Test
    void testKinds() {
        assertEquals(ErrorKind.EMPTY_INPUT, new EmptyInputException().getKind());
        assertEquals(ErrorKind.ROUTING_NOT_FOUND, new RoutingNotFoundException().getKind());
        assertEquals(ErrorKind.USER_NOT_FOUND, new UserNotFoundException().getKind());
        assertEquals(ErrorKind.USER_BLOCKED, new UserBlockedException().getKind());
        assertEquals(ErrorKind.USER_NOT_AUTHORIZED, new UserNotAuthorizedException().getKind());
        assertEquals(ErrorKind.AUTO_GENERATED_EMAIL, new AutoGeneratedEmailException().getKind());
        assertEquals(ErrorKind.NOTEABLE_NOT_FOUND, new NoteableNotFoundException().getKind());
        assertEquals(ErrorKind.EMPTY_REPLY, new EmptyReplyException().getKind());
        assertEquals(ErrorKind.INVALID_NOTE, new InvalidNoteException(List.of()).getKind());
        assertEquals(ErrorKind.INVALID_ISSUE, new InvalidIssueException(List.of()).getKind());
    }

    @Test
    void testCustomMessage() {
        RoutingNotFoundException e = new RoutingNotFoundException("No reply key found in To or References headers.");
        assertEquals("No reply key found in To or References headers.", e.getMessage());
    }

    @Test
    void testUnparsableKeepsCause() {
        IllegalArgumentException cause = new IllegalArgumentException("x-no-such-charset-42");
        EmailUnparsableException e = new EmailUnparsableException(cause);

        assertSame(cause, e.getCause());
        assertEquals("The email could not be parsed: x-no-such-charset-42", e.getMessage());
        assertEquals(ErrorKind.EMAIL_UNPARSABLE, e.getKind());
    }

    @Test
    void testInvalidRecordMessage() {
        InvalidIssueException e = new InvalidIssueException(List.of("Title can't be blank", "Project is archived"));

        assertEquals("The issue could not be created for the following reasons:\n\n"
                + "- Title can't be blank\n\n"
                + "- Project is archived", e.getMessage());
    }

    @Test
    void testInvalidRecordErrorsAreCopied() {
        List<String> errors = new ArrayList<>(List.of("Note can't be blank"));
        InvalidNoteException e = new InvalidNoteException(errors);
        errors.add("later");

        assertEquals(List.of("Note can't be blank"), e.getErrors());
        assertThrows(UnsupportedOperationException.class, () -> e.getErrors().add("more"));
        assertEquals(InvalidNoteException.HEADER, new InvalidNoteException(null).getMessage());
    }
}
