package com.github.dimitryivaniuta.callpipeline.transport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;

/**
 * {@link ApiTransport} over a {@link RestTemplate}. The template must not throw on 4xx/5xx
 * (install {@link #passThroughErrors()}) so that error bodies reach the error mapper.
 */
@Slf4j
@RequiredArgsConstructor
public class RestTemplateApiTransport implements ApiTransport {

    private final RestTemplate restTemplate;

    /** Error handler that leaves every status to the caller. */
    public static ResponseErrorHandler passThroughErrors() {
        return new ResponseErrorHandler() {
            @Override
            public boolean hasError(ClientHttpResponse response) {
                return false;
            }

            @Override
            public void handleError(ClientHttpResponse response) {
                // hasError is always false
            }
        };
    }

    @Override
    public TransportResponse post(URI uri, String jsonBody) throws TransportException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri,
                    HttpMethod.POST,
                    new HttpEntity<>(jsonBody, headers),
                    String.class
            );
            return new TransportResponse(response.getStatusCode().value(), response.getBody());
        } catch (ResourceAccessException e) {
            // the exception message repeats the uri, which may embed a webhook secret
            String reason = e.getMostSpecificCause().toString();
            log.debug("Transport failure host={}, reason={}", uri.getHost(), reason);
            throw new TransportException("I/O error talking to " + uri.getHost() + ": " + reason, e);
        }
    }
}
