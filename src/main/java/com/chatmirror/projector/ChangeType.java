package com.chatmirror.projector;

public enum ChangeType {
    CREATED("created"),
    UPDATED("updated"),
    DELETED("deleted");

    private final String wireName;

    ChangeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws InvalidEventException for a missing or unknown change type
     */
    public static ChangeType fromWire(String value) {
        if (value != null) {
            for (ChangeType t : values()) {
                if (t.wireName.equalsIgnoreCase(value.trim())) {
                    return t;
                }
            }
        }
        throw new InvalidEventException("Unsupported change type: " + value);
    }
}
