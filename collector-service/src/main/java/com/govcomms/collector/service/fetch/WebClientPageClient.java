package com.govcomms.collector.service.fetch;

import com.govcomms.collector.exception.PermanentFetchException;
import com.govcomms.collector.exception.TransientFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Set;
import java.util.concurrent.TimeoutException;

@Component
@RequiredArgsConstructor
@Slf4j
public class WebClientPageClient implements PageClient {

    // statuses worth another attempt
    private static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(
            429, // Too Many Requests
            500,
            502,
            503,
            504
    );

    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final WebClient webClient;

    @Override
    public String get(String url) {
        try {
            String body = webClient.get()
                    .uri(toUri(url))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toException(url, response))
                    .bodyToMono(String.class)
                    .block();
            return body != null ? body : "";
        } catch (TransientFetchException | PermanentFetchException e) {
            throw e;
        } catch (WebClientRequestException e) {
            throw new TransientFetchException("Request failed for " + redact(url) + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new TransientFetchException("Timed out fetching " + redact(url), cause);
            }
            throw e;
        }
    }

    /**
     * Parses {@code url} as is, or percent-encodes it when it carries characters such as
     * spaces that a URI does not allow. Hrefs taken from page markup are often not encoded.
     */
    static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            try {
                return UriComponentsBuilder.fromHttpUrl(url).encode().build().toUri();
            } catch (IllegalArgumentException invalid) {
                throw new PermanentFetchException(0, "Invalid URL: " + redact(url), invalid);
            }
        }
    }

    private static Mono<Throwable> toException(String url, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    String message = "HTTP " + status + " for " + redact(url) + abbreviate(body);
                    if (RETRYABLE_STATUS_CODES.contains(status)) {
                        return new TransientFetchException(status, message);
                    }
                    return new PermanentFetchException(status, message);
                });
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_ERROR_BODY_LENGTH
                ? trimmed.substring(0, MAX_ERROR_BODY_LENGTH) + "..."
                : trimmed);
    }

    /**
     * Keep API keys out of logs and error messages.
     */
    static String redact(String url) {
        return url == null ? null : url.replaceAll("([?&]key=)[^&]*", "$1***");
    }
}
