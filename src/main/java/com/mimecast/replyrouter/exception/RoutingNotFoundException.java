package com.mimecast.replyrouter.exception;

/**
 * Neither a sent notification nor a project matched the reply key, or no key was found.
 */
public class RoutingNotFoundException extends ProcessingException {

    public RoutingNotFoundException() {
        this("No reply key or project could be resolved for the email.");
    }

    public RoutingNotFoundException(String message) {
        super(ErrorKind.ROUTING_NOT_FOUND, message);
    }
}
