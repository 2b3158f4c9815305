package io.recallr.memory;

/**
 * Kinds of experience records. The numeric code is what goes on disk.
 */
public enum MemoryType {
    EXPERIENCE(1),
    KNOWLEDGE(2),
    REFLECTION(3),
    PATTERN(4),
    GOAL(5),
    DECISION(6);

    private final int code;

    MemoryType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Unknown codes fall back to EXPERIENCE. */
    public static MemoryType fromCode(int code) {
        for (MemoryType type : values()) {
            if (type.code == code) return type;
        }
        return EXPERIENCE;
    }
}
