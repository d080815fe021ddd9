package com.deepansh.mq.batch;

import com.deepansh.mq.config.HttpClientConfig.ConnectionCapacity;
import com.deepansh.mq.llm.LlmClient;
import com.deepansh.mq.llm.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point of the batch path: validate the provider, read all input, dispatch.
 * Nothing touches the network until the whole input has parsed.
 */
@Service
@Slf4j
public class BatchRunner {

    private final LlmClient llmClient;
    private final ProviderRegistry providers;
    private final BatchInputReader inputReader;
    private final BatchDispatcher dispatcher;
    private final ConnectionCapacity connectionCapacity;

    public BatchRunner(LlmClient llmClient,
                       ProviderRegistry providers,
                       BatchInputReader inputReader,
                       BatchDispatcher dispatcher,
                       ConnectionCapacity connectionCapacity) {
        this.llmClient = llmClient;
        this.providers = providers;
        this.inputReader = inputReader;
        this.dispatcher = dispatcher;
        this.connectionCapacity = connectionCapacity;
    }

    public BatchSummary run(BatchOptions options, BufferedReader input, Supplier<StagedOutput> output) {
        providers.require(options.getModel().getProvider());
        List<BatchRow> rows = inputReader.read(input);
        log.debug("Read {} batch rows for model {}", rows.size(), options.getModelShortname());
        connectionCapacity.ensure(options.getWorkers());
        return dispatcher.dispatch(rows, options.getWorkers(), options.isExtractTags(),
                new RowProcessor(llmClient, options), output);
    }
}
