package io.recallr.memory.tier2;

/**
 * Calendar bucket a digest covers. The numeric code is what goes on disk.
 */
public enum PeriodType {
    WEEKLY(0, "weekly"),
    MONTHLY(1, "monthly");

    private final int code;
    private final String directory;

    PeriodType(int code, String directory) {
        this.code = code;
        this.directory = directory;
    }

    public int code() {
        return code;
    }

    /** Directory name under tier2, also used in digest ids. */
    public String directory() {
        return directory;
    }

    public static PeriodType fromCode(int code) {
        return code == 1 ? MONTHLY : WEEKLY;
    }
}
