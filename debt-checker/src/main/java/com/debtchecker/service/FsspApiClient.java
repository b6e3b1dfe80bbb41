package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.ApiReply;
import com.debtchecker.model.ErrorKind;
import com.debtchecker.model.FsspApiResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;

/**
 * Thin client over the api-cloud.ru FSSP endpoint.
 *
 * GET {base-url}?type=ip&number={identifier}&token={token}
 *
 * Never throws for a single identifier: every HTTP status, transport failure
 * and body shape is classified into an {@link ApiReply}. The per-request
 * timeout lives on the RestTemplate's request factory.
 */
@Service
@Slf4j
public class FsspApiClient implements DebtApi {

    private final RestTemplate restTemplate;
    private final FsspReplyMapper mapper;
    private final ObjectMapper objectMapper;
    private final DebtCheckerProperties properties;

    public FsspApiClient(@Qualifier("debtApiRestTemplate") RestTemplate restTemplate,
                         FsspReplyMapper mapper,
                         ObjectMapper objectMapper,
                         DebtCheckerProperties properties) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void verifyCredentials() {
        String token = properties.getApi().getToken();
        if (token == null || token.isBlank()) {
            throw new FatalRunException(FatalReason.MISSING_TOKEN,
                    "set the API_TOKEN environment variable or debt-checker.api.token");
        }
    }

    @Override
    public ApiReply query(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return ApiReply.error(ErrorKind.MALFORMED_IDENTIFIER, "blank identifier");
        }
        URI uri = buildUri(identifier);
        log.debug("Calling FSSP API for {}", identifier);

        long start = System.nanoTime();
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            log.debug("API request for {} took {} ms", identifier, (System.nanoTime() - start) / 1_000_000);
            return mapBody(response.getBody(), identifier);

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by FSSP API for {}", identifier);
            return ApiReply.error(ErrorKind.RATE_LIMITED, "HTTP 429");

        } catch (HttpClientErrorException e) {
            // only a 200 body with count 0 means no debt; 404 included here
            int status = e.getStatusCode().value();
            log.warn("HTTP {} from FSSP API for {}", status, identifier);
            return ApiReply.error(FsspReplyMapper.classifyStatus(status), "HTTP " + status);

        } catch (HttpServerErrorException e) {
            return ApiReply.error(ErrorKind.SERVER_ERROR, "HTTP " + e.getStatusCode().value());

        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                return ApiReply.error(ErrorKind.TIMEOUT, e.getMessage());
            }
            return ApiReply.error(ErrorKind.NETWORK, e.getMessage());

        } catch (RestClientException e) {
            log.error("Request failed for {}: {}", identifier, e.getMessage());
            return ApiReply.error(ErrorKind.INVALID_RESPONSE, e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ApiReply mapBody(String body, String identifier) {
        if (body == null || body.isBlank()) {
            return ApiReply.error(ErrorKind.INVALID_RESPONSE, "empty response body");
        }
        try {
            return mapper.map(objectMapper.readValue(body, FsspApiResponse.class), identifier);
        } catch (JsonProcessingException e) {
            log.error("Invalid JSON for {}: {}", identifier, e.getOriginalMessage());
            return ApiReply.error(ErrorKind.INVALID_RESPONSE, "invalid JSON");
        }
    }

    private URI buildUri(String identifier) {
        return UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl())
                .queryParam("type", "ip")
                .queryParam("number", identifier)
                .queryParam("token", properties.getApi().getToken())
                .build()
                .encode()
                .toUri();
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
