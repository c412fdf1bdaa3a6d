package com.mimecast.replyrouter.receiver;

import com.mimecast.replyrouter.domain.Capability;
import com.mimecast.replyrouter.domain.Project;
import com.mimecast.replyrouter.domain.User;
import com.mimecast.replyrouter.exception.UserBlockedException;
import com.mimecast.replyrouter.exception.UserNotAuthorizedException;
import com.mimecast.replyrouter.exception.UserNotFoundException;
import com.mimecast.replyrouter.service.AuthorizationPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks that the acting user may create content in the target project.
 *
 * <p>Checks run in a fixed order and the first failure is thrown:
 * <ol>
 *   <li>User exists</li>
 *   <li>User is not blocked</li>
 *   <li>Project exists and the user holds the capability on it</li>
 * </ol>
 */
public class AuthorizationGate {
    private static final Logger log = LogManager.getLogger(AuthorizationGate.class);

    /**
     * Capability check.
     */
    private final AuthorizationPolicy policy;

    /**
     * Constructs a new AuthorizationGate instance.
     *
     * @param policy AuthorizationPolicy instance.
     */
    public AuthorizationGate(AuthorizationPolicy policy) {
        this.policy = policy;
    }

    /**
     * Checks the acting user.
     *
     * @param user       User or null.
     * @param project    Project or null.
     * @param capability Required capability.
     * @throws UserNotFoundException      No user.
     * @throws UserBlockedException       User is blocked.
     * @throws UserNotAuthorizedException No project or missing capability.
     */
    public void check(User user, Project project, Capability capability)
            throws UserNotFoundException, UserBlockedException, UserNotAuthorizedException {
        if (user == null) {
            throw new UserNotFoundException();
        }

        if (user.isBlocked()) {
            log.info("Blocked user {} tried to {}", user.getUsername(), capability.getKey());
            throw new UserBlockedException();
        }

        // Project absence is reported as unauthorized too, so project existence is not disclosed.
        if (project == null || !policy.hasCapability(user, project, capability)) {
            log.info("User {} may not {} in {}", user.getUsername(), capability.getKey(),
                    project != null ? project.getFullPath() : "missing project");
            throw new UserNotAuthorizedException();
        }
    }
}
