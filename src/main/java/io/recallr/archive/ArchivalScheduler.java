package io.recallr.archive;

import io.recallr.config.MemoryProperties;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Registers the recurring archival jobs with JobRunr on startup, one per
 * configured identity.
 */
@Service
public class ArchivalScheduler {

    private static final Logger log = LoggerFactory.getLogger(ArchivalScheduler.class);
    private static final String JOB_ID_PREFIX = "memory-archival-";

    private final JobScheduler jobScheduler;
    private final ArchivalJob archivalJob;
    private final MemoryProperties properties;

    public ArchivalScheduler(JobScheduler jobScheduler, ArchivalJob archivalJob, MemoryProperties properties) {
        this.jobScheduler = jobScheduler;
        this.archivalJob = archivalJob;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        MemoryProperties.Archival archival = properties.archival();
        if (!archival.enabled()) {
            log.info("Scheduled archival disabled via configuration");
            return;
        }
        List<String> identities = archival.identities();
        if (identities.isEmpty()) {
            log.info("Scheduled archival enabled but no identities configured");
            return;
        }

        int maxAgeDays = properties.maxAgeDays();
        for (String ciId : identities) {
            jobScheduler.<ArchivalJob>scheduleRecurrently(jobId(ciId), archival.cron(),
                    x -> x.execute(ciId, maxAgeDays));
            log.info("Registered archival job for {} with cron: {}", ciId, archival.cron());
        }
    }

    /**
     * Runs an archival pass immediately, outside the schedule.
     */
    public int triggerNow(String ciId) {
        log.info("Triggering immediate archival for {}", ciId);
        return archivalJob.execute(ciId, properties.maxAgeDays());
    }

    /**
     * Removes the recurring job of one identity.
     */
    public void stop(String ciId) {
        jobScheduler.deleteRecurringJob(jobId(ciId));
        log.info("Archival job for {} stopped", ciId);
    }

    static String jobId(String ciId) {
        return JOB_ID_PREFIX + ciId;
    }
}
