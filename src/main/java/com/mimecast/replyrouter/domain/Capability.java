package com.mimecast.replyrouter.domain;

/**
 * Named permissions checked against a user and project pair.
 */
public enum Capability {
    CREATE_NOTE("create_note"),
    CREATE_ISSUE("create_issue");

    private final String key;

    Capability(String key) {
        this.key = key;
    }

    /**
     * Gets the permission key as known to the permission engine.
     *
     * @return Key string.
     */
    public String getKey() {
        return key;
    }
}
