package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.Capability;
import com.mimecast.replyrouter.domain.Project;
import com.mimecast.replyrouter.domain.User;

/**
 * Capability check against the platform permission engine.
 */
public interface AuthorizationPolicy {

    /**
     * Checks whether the user holds a capability on the project.
     *
     * @param user       User, never null.
     * @param project    Project, never null.
     * @param capability Capability.
     * @return Boolean.
     */
    boolean hasCapability(User user, Project project, Capability capability);
}
