package com.outcast.rivalry.model;

public record AccountInfo(
        String accountId,
        String displayName,
        String username
) {
    /** Display name, else username, else null. */
    public String preferredName() {
        if (displayName != null && !displayName.isBlank()) return displayName;
        if (username != null && !username.isBlank()) return username;
        return null;
    }
}
