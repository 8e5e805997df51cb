package com.di.adbatch.config;

import com.di.adbatch.checkpoint.CheckpointStore;
import com.di.adbatch.checkpoint.FileCheckpointStore;
import com.di.adbatch.checkpoint.InMemoryCheckpointStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Shared infrastructure beans: JSON mapper, checkpoint store, clock.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AdBatchConfig {

    private final AdBatchProperties properties;

    /**
     * ISO-8601 timestamps, indented output (checkpoint and report files are read by people).
     */
    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    public CheckpointStore checkpointStore(ObjectMapper objectMapper) {
        String kind = properties.getCheckpointStore();
        if ("auto".equals(kind)) {
            kind = "dry-run".equals(properties.getRemote().getMode()) ? "memory" : "file";
        }
        if ("memory".equals(kind)) {
            log.info("[CONFIG] checkpoints kept in memory (remote mode {})", properties.getRemote().getMode());
            return new InMemoryCheckpointStore();
        }
        Path dir = Path.of(properties.getCheckpointDir());
        log.info("[CONFIG] checkpoints written to {}", dir.toAbsolutePath());
        return new FileCheckpointStore(dir, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
