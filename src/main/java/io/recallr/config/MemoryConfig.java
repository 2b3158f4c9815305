package io.recallr.config;

import io.recallr.memory.retention.CentralityAnnotator;
import io.recallr.memory.tier2.DigestEnricher;
import io.recallr.memory.tier2.KeywordDigestEnricher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Collaborators of the memory engine. Hosts override the centrality source or
 * the digest enrichment by declaring their own beans.
 */
@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CentralityAnnotator centralityAnnotator() {
        return CentralityAnnotator.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public DigestEnricher digestEnricher() {
        return new KeywordDigestEnricher();
    }
}
