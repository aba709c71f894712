package com.deepansh.graphagent;

import com.deepansh.graphagent.config.AgentProperties;
import com.deepansh.graphagent.config.ToolProperties;
import com.deepansh.graphagent.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({LlmProperties.class, AgentProperties.class, ToolProperties.class})
public class GraphAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphAgentApplication.class, args);
    }
}
