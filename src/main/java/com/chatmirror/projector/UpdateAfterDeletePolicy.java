package com.chatmirror.projector;

/**
 * What an update to an already deleted message does.
 */
public enum UpdateAfterDeletePolicy {
    /** Revive the message: move it back to the active index and clear the deleted flag. */
    UNDO,
    /** Record the new revision but keep the message deleted. */
    IGNORE;

    public static UpdateAfterDeletePolicy fromConfig(String value, UpdateAfterDeletePolicy defaultPolicy) {
        if (value == null || value.isBlank()) {
            return defaultPolicy;
        }
        return UpdateAfterDeletePolicy.valueOf(value.trim().toUpperCase());
    }
}
