package com.mimecast.replyrouter.domain;

import java.util.Objects;

/**
 * Project owning notes and issues.
 * <p>The full path is the namespace path a routing key may name directly, e.g. {@code group/project}.
 */
public class Project {

    /**
     * Project id.
     */
    private final long id;

    /**
     * Namespace path.
     */
    private final String fullPath;

    /**
     * Constructs a new Project instance.
     *
     * @param id       Project id.
     * @param fullPath Namespace path.
     */
    public Project(long id, String fullPath) {
        this.id = id;
        this.fullPath = fullPath;
    }

    public long getId() {
        return id;
    }

    public String getFullPath() {
        return fullPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Project)) return false;
        Project project = (Project) o;
        return id == project.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Project{id=" + id + ", fullPath='" + fullPath + "'}";
    }
}
