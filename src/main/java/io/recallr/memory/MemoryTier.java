package io.recallr.memory;

/**
 * Storage tier a record lives in. Records are written to {@code TIER1};
 * digests are {@code TIER2}.
 */
public enum MemoryTier {
    TIER1(1),
    TIER2(2),
    TIER3(3);

    private final int level;

    MemoryTier(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static MemoryTier fromLevel(int level) {
        return switch (level) {
            case 2 -> TIER2;
            case 3 -> TIER3;
            default -> TIER1;
        };
    }
}
