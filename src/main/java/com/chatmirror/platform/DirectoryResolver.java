package com.chatmirror.platform;

import java.io.UncheckedIOException;

/**
 * Maps a platform-local sender id to an internal directory handle.
 */
public interface DirectoryResolver {

    /**
     * @return the directory handle, or null when the sender is outside the synchronized directory
     * @throws UncheckedIOException when the directory cannot be reached
     */
    String resolveHandle(String platformSenderId);

    /**
     * A resolver that answers without further directory calls. Used once per backfill run.
     */
    default DirectoryResolver snapshot() {
        return this;
    }
}
