package com.deepansh.mq.config;

import com.deepansh.mq.batch.BatchRunner;
import com.deepansh.mq.cli.CliConsole;
import com.deepansh.mq.cli.MqCli;
import com.deepansh.mq.llm.LlmClient;
import com.deepansh.mq.llm.ProviderRegistry;
import com.deepansh.mq.registry.ModelRegistry;
import com.deepansh.mq.store.SessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CliConfig {

    @Bean
    public CliConsole cliConsole() {
        return CliConsole.system();
    }

    @Bean
    public MqCli mqCli(ModelRegistry registry,
                       SessionStore sessions,
                       LlmClient llmClient,
                       ProviderRegistry providers,
                       BatchRunner batchRunner,
                       MqProperties properties,
                       ObjectMapper objectMapper,
                       CliConsole console) {
        return new MqCli(registry, sessions, llmClient, providers, batchRunner, properties, objectMapper, console);
    }
}
