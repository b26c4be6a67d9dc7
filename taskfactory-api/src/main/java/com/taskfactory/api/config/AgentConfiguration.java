package com.taskfactory.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskfactory.agent.HttpAgentClient;
import com.taskfactory.engine.config.TaskFactoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connects the engine to the agent runner. The one client serves as both
 * execution and planning collaborator.
 */
@Configuration
public class AgentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentConfiguration.class);

    @Bean
    public HttpAgentClient httpAgentClient(TaskFactoryProperties properties, ObjectMapper objectMapper) {
        TaskFactoryProperties.Agent agent = properties.getAgent();
        log.info("Agent runner at {}", agent.getBaseUrl());
        return new HttpAgentClient(agent.getBaseUrl(), objectMapper,
            agent.getConnectTimeout(), agent.getRequestTimeout());
    }
}
