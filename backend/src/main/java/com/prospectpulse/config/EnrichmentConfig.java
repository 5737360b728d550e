package com.prospectpulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.prospectpulse.enrichment.persistence.JobQueueRepository;
import com.prospectpulse.enrichment.service.EnrichmentWorker;
import com.prospectpulse.enrichment.service.InlineJobDispatcher;
import com.prospectpulse.enrichment.service.JobDispatcher;
import com.prospectpulse.enrichment.service.QueuedJobDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EnrichmentConfig {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentConfig.class);

    @Bean
    public JobDispatcher jobDispatcher(
        ProspectProperties properties,
        JobQueueRepository queueRepository,
        EnrichmentWorker worker
    ) {
        InlineJobDispatcher inline = new InlineJobDispatcher(worker);
        if (!properties.getQueue().isEnabled()) {
            log.info("Queue delivery disabled, jobs run inline");
            return inline;
        }
        return new QueuedJobDispatcher(queueRepository, inline);
    }

    @Bean(name = "streamExecutor", destroyMethod = "shutdown")
    public ExecutorService streamExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("job-stream");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }
}
