package com.demo.chatbot.infrastructure;

import com.demo.chatbot.domain.NluFragment;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST client for a Rasa-compatible NLU server.
 */
@Slf4j
@Component
public class NluBackendClient {

    private static final String STATUS_PATH = "/status";
    private static final String WEBHOOK_PATH = "/webhooks/rest/webhook";
    private static final ParameterizedTypeReference<List<NluFragment>> FRAGMENT_LIST =
            new ParameterizedTypeReference<>() { };

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public NluBackendClient(RestTemplate restTemplate,
                            @Value("${chatbot.nlu.url:http://localhost:5005}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        log.info("NluBackendClient initialized: url={}", this.baseUrl);
    }

    /**
     * Health probe. Only a 200 on {@code GET /status} counts as healthy.
     */
    public boolean probe() {
        try {
            ResponseEntity<JsonNode> response = restTemplate.getForEntity(baseUrl + STATUS_PATH, JsonNode.class);
            boolean healthy = response.getStatusCode().value() == HttpStatus.OK.value();
            JsonNode status = response.getBody();
            log.info("NLU backend probe: url={}, status={}, model={}", baseUrl, response.getStatusCode(),
                    status != null ? status.path("model_file").asText("") : "");
            return healthy;
        } catch (RestClientException e) {
            log.warn("NLU backend not available: url={}, error={}", baseUrl, e.getMessage());
            return false;
        }
    }

    /**
     * Post one user message to the REST webhook.
     *
     * @return the fragments the backend replied with, possibly empty
     * @throws NluBackendException on transport failure or a status other than 200
     */
    public List<NluFragment> send(String message, String senderId, Map<String, Object> metadata) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sender", senderId);
        body.put("message", message);
        body.put("metadata", metadata != null ? metadata : Map.of());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<List<NluFragment>> response;
        try {
            response = restTemplate.exchange(
                    baseUrl + WEBHOOK_PATH,
                    HttpMethod.POST,
                    new HttpEntity<>(body, headers),
                    FRAGMENT_LIST);
        } catch (RestClientException e) {
            throw new NluBackendException("Error communicating with NLU backend", e);
        }

        if (response.getStatusCode().value() != HttpStatus.OK.value()) {
            throw new NluBackendException("NLU backend returned status " + response.getStatusCode().value());
        }
        List<NluFragment> fragments = response.getBody();
        log.debug("NLU backend replied: senderId={}, fragments={}",
                senderId, fragments != null ? fragments.size() : 0);
        return fragments != null ? fragments : List.of();
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
