package com.chatmirror.pull;

import com.chatmirror.Const;
import io.vertx.core.json.JsonObject;

/**
 * Receive and shutdown parameters shared by all pullers of a process.
 * The long-poll wait must stay below the stop timeout for a stop to complete in time.
 */
public record PullerSettings(int maxMessages, int waitTimeSeconds, int visibilityTimeoutSeconds, long stopTimeoutMs) {

    public static PullerSettings defaults() {
        return new PullerSettings(Const.Pull.DefaultMaxMessages, Const.Pull.DefaultWaitTimeSeconds,
                Const.Pull.DefaultVisibilityTimeoutSeconds, Const.Pull.DefaultStopTimeoutMs);
    }

    public static PullerSettings fromConfig(JsonObject config) {
        return new PullerSettings(
                config.getInteger(Const.Config.PullMaxMessagesProp, Const.Pull.DefaultMaxMessages),
                config.getInteger(Const.Config.PullWaitTimeSecondsProp, Const.Pull.DefaultWaitTimeSeconds),
                config.getInteger(Const.Config.PullVisibilityTimeoutProp, Const.Pull.DefaultVisibilityTimeoutSeconds),
                config.getLong(Const.Config.PullStopTimeoutMsProp, Const.Pull.DefaultStopTimeoutMs));
    }
}
