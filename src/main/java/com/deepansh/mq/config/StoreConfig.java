package com.deepansh.mq.config;

import com.deepansh.mq.batch.BatchDispatcher;
import com.deepansh.mq.batch.BatchInputReader;
import com.deepansh.mq.batch.WorkerPoolFactory;
import com.deepansh.mq.registry.ModelRegistry;
import com.deepansh.mq.store.AtomicFileStore;
import com.deepansh.mq.store.FallbackLatestPointer;
import com.deepansh.mq.store.LatestPointer;
import com.deepansh.mq.store.MqHome;
import com.deepansh.mq.store.PlainFileLatestPointer;
import com.deepansh.mq.store.SessionStore;
import com.deepansh.mq.store.SymlinkLatestPointer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * State directory wiring: file store, latest pointer, session store, model registry,
 * and the batch pieces that share the ObjectMapper.
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Bean
    public MqHome mqHome(MqProperties properties) {
        MqHome home = new MqHome(properties.homePath());
        log.debug("mq home: {}", home.root());
        return home;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AtomicFileStore atomicFileStore(ObjectMapper objectMapper) {
        return new AtomicFileStore(objectMapper);
    }

    /** Symlink first; a plain file holding the id where symlinks are unavailable. */
    @Bean
    public LatestPointer latestPointer(MqHome home, AtomicFileStore fileStore) {
        return new FallbackLatestPointer(
                new SymlinkLatestPointer(home),
                new PlainFileLatestPointer(home, fileStore));
    }

    @Bean
    public SessionStore sessionStore(MqHome home, AtomicFileStore fileStore, LatestPointer latestPointer, Clock clock) {
        return new SessionStore(home, fileStore, latestPointer, clock);
    }

    @Bean
    public ModelRegistry modelRegistry(MqHome home, AtomicFileStore fileStore) {
        return new ModelRegistry(home, fileStore);
    }

    @Bean
    public BatchInputReader batchInputReader(ObjectMapper objectMapper) {
        return new BatchInputReader(objectMapper);
    }

    @Bean
    public BatchDispatcher batchDispatcher(WorkerPoolFactory workerPoolFactory, ObjectMapper objectMapper) {
        return new BatchDispatcher(workerPoolFactory, objectMapper);
    }
}
