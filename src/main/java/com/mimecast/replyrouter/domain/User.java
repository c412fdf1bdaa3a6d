package com.mimecast.replyrouter.domain;

import java.util.Objects;

/**
 * Platform user acting on a message.
 */
public class User {

    /**
     * User id.
     */
    private final long id;

    /**
     * Username.
     */
    private final String username;

    /**
     * Blocked users may not create any content.
     */
    private final boolean blocked;

    /**
     * Constructs a new User instance.
     *
     * @param id       User id.
     * @param username Username.
     * @param blocked  Blocked status.
     */
    public User(long id, String username, boolean blocked) {
        this.id = id;
        this.username = username;
        this.blocked = blocked;
    }

    public long getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public boolean isBlocked() {
        return blocked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof User)) return false;
        User user = (User) o;
        return id == user.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "User{id=" + id + ", username='" + username + "', blocked=" + blocked + "}";
    }
}
