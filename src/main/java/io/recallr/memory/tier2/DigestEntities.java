package io.recallr.memory.tier2;

import java.util.List;

/**
 * Named entities mentioned by the records a digest summarizes.
 */
public record DigestEntities(List<String> files, List<String> concepts, List<String> people) {

    public static final DigestEntities EMPTY = new DigestEntities(List.of(), List.of(), List.of());

    public DigestEntities {
        files = files == null ? List.of() : List.copyOf(files);
        concepts = concepts == null ? List.of() : List.copyOf(concepts);
        people = people == null ? List.of() : List.copyOf(people);
    }
}
