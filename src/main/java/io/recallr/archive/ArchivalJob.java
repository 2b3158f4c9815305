package io.recallr.archive;

import io.recallr.memory.Memory;
import io.recallr.memory.MemoryException;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The archival pass that runs as a recurring JobRunr job, one per identity.
 */
@Component
public class ArchivalJob {

    private static final Logger log = LoggerFactory.getLogger(ArchivalJob.class);

    private final Memory memory;

    public ArchivalJob(Memory memory) {
        this.memory = memory;
    }

    /**
     * Archives eligible records of one identity. Failures are rethrown so
     * JobRunr marks the job failed and retries it; a retry re-archives whatever
     * the failed run did not mark.
     *
     * @return number of records archived
     */
    @Job(name = "Archive memories for %0")
    public int execute(String ciId, int maxAgeDays) {
        try {
            int archived = memory.archive(ciId, maxAgeDays);
            if (archived > 0) {
                log.info("Archival for {} archived {} records", ciId, archived);
            } else {
                log.debug("Archival for {}: nothing eligible", ciId);
            }
            return archived;
        } catch (MemoryException e) {
            log.error("Archival for {} failed with {}", ciId, e.code(), e);
            throw e;
        }
    }
}
