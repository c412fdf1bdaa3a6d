package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.Project;

import java.util.Optional;

/**
 * Resolves a project from a routing key interpreted as a namespace path.
 */
public interface ProjectResolver {

    /**
     * Finds a project.
     *
     * @param key Routing key, e.g. {@code group/project}.
     * @return Optional of Project.
     */
    Optional<Project> findByRoutingKey(String key);
}
