package com.chatmirror.projector;

public enum Platform {
    MICROSOFT("microsoft", UpdateAfterDeletePolicy.UNDO),
    GOOGLE("google", UpdateAfterDeletePolicy.IGNORE);

    private final String keyPrefix;
    private final UpdateAfterDeletePolicy defaultPolicy;

    Platform(String keyPrefix, UpdateAfterDeletePolicy defaultPolicy) {
        this.keyPrefix = keyPrefix;
        this.defaultPolicy = defaultPolicy;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    public UpdateAfterDeletePolicy defaultPolicy() {
        return defaultPolicy;
    }

    public static Platform fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("platform is required");
        }
        for (Platform p : values()) {
            if (p.keyPrefix.equalsIgnoreCase(name.trim())) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + name);
    }

    @Override
    public String toString() {
        return keyPrefix;
    }
}
