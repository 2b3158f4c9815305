package io.recallr.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Job storage for scheduled archival. The jobrunr-spring-boot-3-starter picks
 * up this DataSource for its StorageProvider; it is separate from the digest index.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);

    @Bean
    public DataSource dataSource(
            @Value("${recallr.jobs.database.url:jdbc:sqlite:./data/jobs.db}") String url
    ) {
        createParentDirectory(url);
        var ds = new SQLiteDataSource();
        ds.setUrl(url);
        log.info("Job storage DataSource configured: {}", url);
        return ds;
    }

    private static void createParentDirectory(String url) {
        if (!url.startsWith("jdbc:sqlite:")) return;
        String file = url.substring("jdbc:sqlite:".length());
        if (file.isBlank() || file.startsWith(":memory:")) return;
        Path parent = Path.of(file).toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create job storage directory: " + parent, e);
        }
    }
}
