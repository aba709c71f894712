package com.deepansh.graphagent.tool.impl;

import com.deepansh.graphagent.config.ToolProperties;
import com.deepansh.graphagent.exception.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class KnowledgeBaseToolTest {

    private static final String URL = "http://kb.test/api/v1/chats_openai/chat-1/chat/completions";

    private ToolProperties props;
    private RestClient.Builder builder;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        props = new ToolProperties();
        props.getKnowledgeBase().setBaseUrl("http://kb.test/api/v1/");
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
    }

    @Test
    void getName_returnsQueryKnowledgeBase() {
        assertThat(new KnowledgeBaseTool(props, builder).getName()).isEqualTo("query_knowledge_base");
    }

    @Test
    void execute_notConfigured_explainsInsteadOfCalling() {
        String result = new KnowledgeBaseTool(props, builder).execute(Map.of("query", "refunds"));

        assertThat(result).contains("not configured");
        server.verify();
    }

    @Test
    void execute_configured_postsQueryAndReturnsAnswer() {
        configure();
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer kb-key"))
                .andExpect(jsonPath("$.model").value("ragflow"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.messages[0].content").value("refund policy"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"Refunds take 5 days."}}]}
                        """, MediaType.APPLICATION_JSON));

        String result = new KnowledgeBaseTool(props, builder).execute(Map.of("query", "refund policy"));

        assertThat(result).isEqualTo("Refunds take 5 days.");
        server.verify();
    }

    @Test
    void execute_noChoices_saysSo() {
        configure();
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        String result = new KnowledgeBaseTool(props, builder).execute(Map.of("query", "x"));

        assertThat(result).isEqualTo("No response from the knowledge base.");
    }

    @Test
    void execute_httpFailure_throwsToolExecutionException() {
        configure();
        server.expect(requestTo(URL)).andRespond(withServerError());
        KnowledgeBaseTool tool = new KnowledgeBaseTool(props, builder);

        assertThatThrownBy(() -> tool.execute(Map.of("query", "x")))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageStartingWith("Knowledge base request failed");
        server.verify();
    }

    @Test
    void execute_missingQuery_returnsError() {
        configure();

        assertThat(new KnowledgeBaseTool(props, builder).execute(Map.of())).startsWith("ERROR:").contains("query");
    }

    private void configure() {
        props.getKnowledgeBase().setApiKey("kb-key");
        props.getKnowledgeBase().setChatId("chat-1");
    }
}
