package com.chatmirror.pull;

/**
 * Lifecycle state of a subscription puller, stored as {@code task_status}.
 */
public enum PullStatus {
    NOT_STARTED("not_started", "Pulling has not started for %s."),
    RUNNING("running", "Pulling started for %s."),
    STOPPED("stopped", "Pulling explicitly stopped for %s."),
    FAILED("failed", "Pulling failed for %s: %s.");

    private final String code;
    private final String messageTemplate;

    PullStatus(String code, String messageTemplate) {
        this.code = code;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    public String defaultMessage(String subscriptionId) {
        return String.format(messageTemplate, subscriptionId);
    }

    public String defaultMessage(String subscriptionId, String error) {
        return String.format(messageTemplate, subscriptionId, error);
    }

    public static PullStatus fromCode(String code) {
        for (PullStatus s : values()) {
            if (s.code.equals(code)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown pull status: " + code);
    }
}
