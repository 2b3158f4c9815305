package io.recallr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Recallr: tiered memory engine with scheduled archival powered by JobRunr.
 */
@SpringBootApplication
public class RecallrApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallrApplication.class, args);
    }
}
