package io.recallr.memory.retention;

import java.util.List;

/**
 * One cluster found during an archival run.
 *
 * @param patternId  id shared by every member
 * @param memberIds  record ids in candidate order, seed first
 * @param outlierIds the three members kept out of archival
 */
public record DetectedPattern(String patternId, List<String> memberIds, List<String> outlierIds) {

    public DetectedPattern {
        memberIds = List.copyOf(memberIds);
        outlierIds = List.copyOf(outlierIds);
    }

    public int frequency() {
        return memberIds.size();
    }
}
