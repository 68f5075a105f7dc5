package adcp.workflow.webhook;

import adcp.workflow.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * POSTs payloads as JSON to a URL. Any 2xx response counts as delivered.
 */
public class HttpWebhookReceiver implements WebhookReceiver {

    private static final String USER_AGENT = "adcp-workflow/1.0 (webhooks)";

    private final URI url;
    private final String bearerToken;
    private final Duration timeout;
    private final HttpClient client;
    private final ObjectMapper mapper;

    public HttpWebhookReceiver(String url, String bearerToken, Duration timeout) {
        this.url = URI.create(url);
        this.bearerToken = bearerToken;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.mapper = Json.mapper();
    }

    @Override
    public String name() {
        return url.toString();
    }

    @Override
    public void deliver(WebhookPayload payload) throws WebhookDeliveryException {
        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new WebhookDeliveryException("payload not serializable", e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (bearerToken != null && !bearerToken.isBlank()) {
            request.header("Authorization", "Bearer " + bearerToken);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WebhookDeliveryException("POST " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WebhookDeliveryException("POST " + url + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new WebhookDeliveryException("POST " + url + " returned " + status);
        }
    }
}
