package com.demo.chatbot.infrastructure;

import com.demo.chatbot.config.RestTemplateConfig;
import com.demo.chatbot.domain.NluFragment;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class NluBackendClientTest {

    private static final String BASE_URL = "http://rasa:5005";

    private MockRestServiceServer server;
    private NluBackendClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateConfig().restTemplate(new ObjectMapper(), 2000);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new NluBackendClient(restTemplate, BASE_URL + "/");
    }

    @Test
    void probeIsHealthyOnlyOn200() {
        server.expect(requestTo(BASE_URL + "/status")).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
        assertThat(client.probe()).isTrue();
        server.verify();
    }

    @Test
    void probeAcceptsRasaStatusDocument() {
        server.expect(requestTo(BASE_URL + "/status")).andRespond(withSuccess(
                "{\"model_file\":\"models/20240501-nlu.tar.gz\",\"model_id\":\"c0ffee\","
                        + "\"num_active_training_jobs\":0}",
                MediaType.APPLICATION_JSON));

        assertThat(client.probe()).isTrue();
        server.verify();
    }

    @Test
    void probeFailureMeansUnavailable() {
        server.expect(requestTo(BASE_URL + "/status")).andRespond(withServerError());
        assertThat(client.probe()).isFalse();
    }

    @Test
    void sendPostsMessageAndParsesFragments() {
        server.expect(requestTo(BASE_URL + "/webhooks/rest/webhook"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.sender").value("u1"))
                .andExpect(jsonPath("$.message").value("hi"))
                .andExpect(jsonPath("$.metadata.channel").value("web"))
                .andRespond(withSuccess(
                        "[{\"recipient_id\":\"u1\",\"text\":\"Hey!\"},"
                                + "{\"recipient_id\":\"u1\",\"buttons\":[{\"title\":\"Courses\",\"payload\":\"/courses\"}]}]",
                        MediaType.APPLICATION_JSON));

        List<NluFragment> fragments = client.send("hi", "u1", Map.of("channel", "web"));

        assertThat(fragments).hasSize(2);
        assertThat(fragments.get(0).getText()).isEqualTo("Hey!");
        assertThat(fragments.get(1).getButtons()).hasSize(1);
        server.verify();
    }

    @Test
    void non200StatusIsBackendFailure() {
        server.expect(requestTo(BASE_URL + "/webhooks/rest/webhook"))
                .andRespond(withStatus(HttpStatus.ACCEPTED));

        assertThatThrownBy(() -> client.send("hi", "u1", null))
                .isInstanceOf(NluBackendException.class)
                .hasMessageContaining("202");
    }

    @Test
    void transportFailureIsBackendFailure() {
        server.expect(requestTo(BASE_URL + "/webhooks/rest/webhook")).andRespond(withServerError());

        assertThatThrownBy(() -> client.send("hi", "u1", null))
                .isInstanceOf(NluBackendException.class)
                .hasCauseInstanceOf(org.springframework.web.client.RestClientException.class);
    }
}
