package io.recallr.memory.tier2;

public enum DigestType {
    INTERACTION(0),
    LEARNING(1),
    PROJECT(2),
    MIXED(3);

    private final int code;

    DigestType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static DigestType fromCode(int code) {
        for (DigestType type : values()) {
            if (type.code == code) return type;
        }
        return INTERACTION;
    }
}
