package io.kudos.delivery;

import io.kudos.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WebhookSender} that POSTs the JSON payload with the JDK {@link HttpClient}.
 *
 * <p>When a secret is present the body is signed with HMAC-SHA256 and the signature is sent in
 * the {@value WebhookSignatures#HEADER} header. Any 2xx response counts as success.
 */
public final class HttpWebhookSender implements WebhookSender {
    private static final Logger logger = Logger.getLogger(HttpWebhookSender.class.getName());

    static final String USER_AGENT = "Kudos-Webhook/1.0";

    private final HttpClient client;
    private final Duration requestTimeout;
    private final JsonCodec jsonCodec;

    public HttpWebhookSender() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    public HttpWebhookSender(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), requestTimeout, JsonCodec.getDefault());
    }

    public HttpWebhookSender(HttpClient client, Duration requestTimeout, JsonCodec jsonCodec) {
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    @Override
    public boolean sendMessage(String url, WebhookPayload payload, String secret) {
        try {
            String body = payload.toJson(jsonCodec);
            HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("User-Agent", USER_AGENT)
                    .POST(HttpRequest.BodyPublishers.ofString(body));
            if (secret != null && !secret.isEmpty()) {
                request.header(WebhookSignatures.HEADER, WebhookSignatures.sign(body, secret));
            }
            HttpResponse<Void> response = client.send(request.build(), HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                logger.log(Level.WARNING, "Webhook delivery failed with status {0}", status);
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Webhook delivery interrupted", e);
            return false;
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Webhook delivery failed", e);
            return false;
        }
    }
}
