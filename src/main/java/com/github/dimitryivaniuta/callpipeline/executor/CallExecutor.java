package com.github.dimitryivaniuta.callpipeline.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.callpipeline.auth.SingleflightTokenRefresher;
import com.github.dimitryivaniuta.callpipeline.error.ApiCallException;
import com.github.dimitryivaniuta.callpipeline.error.ApiError;
import com.github.dimitryivaniuta.callpipeline.error.CallResult;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import com.github.dimitryivaniuta.callpipeline.error.ErrorKind;
import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import com.github.dimitryivaniuta.callpipeline.ratelimit.TenantRateLimiter;
import com.github.dimitryivaniuta.callpipeline.support.Sleeper;
import com.github.dimitryivaniuta.callpipeline.tenant.ApiVersion;
import com.github.dimitryivaniuta.callpipeline.tenant.CredentialState;
import com.github.dimitryivaniuta.callpipeline.tenant.TenantIdentity;
import com.github.dimitryivaniuta.callpipeline.transport.ApiTransport;
import com.github.dimitryivaniuta.callpipeline.transport.TransportException;
import com.github.dimitryivaniuta.callpipeline.transport.TransportResponse;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Sends one API call with rate limiting, retries and token refresh.
 *
 * <p>Per attempt: wait for the tenant's rate limiter, inject the access token (OAuth only),
 * POST, classify the outcome. Fatal errors end the call at once. Retryable errors back off
 * and try again until {@code maxAttempts}. An {@code expired_token} error triggers at most one
 * coordinated refresh per call, after which the same attempt is repeated without backoff.
 *
 * <p>Instances are thread-safe; the only shared mutable state is the credential pair, the
 * rate limiter and metrics.
 */
@Slf4j
public class CallExecutor {

    public static final int MAX_BATCH_COMMANDS = 50;

    @Getter
    private final TenantIdentity tenant;
    private final CredentialState credentials;
    private final ApiTransport transport;
    private final TenantRateLimiter rateLimiter;
    private final SingleflightTokenRefresher refresher;
    private final ObjectMapper mapper;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final PipelineMetrics metrics;
    private final int maxAttempts;

    @Builder
    public CallExecutor(TenantIdentity tenant,
                        CredentialState credentials,
                        ApiTransport transport,
                        TenantRateLimiter rateLimiter,
                        SingleflightTokenRefresher refresher,
                        ObjectMapper mapper,
                        BackoffPolicy backoff,
                        Sleeper sleeper,
                        PipelineMetrics metrics,
                        int maxAttempts) {
        this.tenant = tenant;
        this.credentials = (credentials == null) ? CredentialState.empty() : credentials;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.refresher = refresher;
        this.mapper = mapper;
        this.backoff = (backoff == null) ? BackoffPolicy.defaults() : backoff;
        this.sleeper = (sleeper == null) ? Sleeper.SYSTEM : sleeper;
        this.metrics = metrics;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public CallResult execute(String method, Map<String, ?> params) {
        return execute(method, params, ApiVersion.V2);
    }

    public CallResult execute(String method, Map<String, ?> params, ApiVersion version) {
        if (method == null || method.isBlank()) {
            return CallResult.failure(ApiError.schema(ErrorCodes.INVALID_REQUEST_SCHEMA, "method must not be empty"), 0);
        }

        long start = System.nanoTime();
        CallResult result = runAttempts(method, params, version == null ? ApiVersion.V2 : version);
        metrics.recordCallDuration(method, result.isSuccess(), System.nanoTime() - start);

        result.failure().ifPresent(error -> {
            metrics.callAborted(method, error.kind());
            if (error.kind() == ErrorKind.FATAL) {
                log.error("Call aborted on fatal error method={}, code={}, status={}, message={}",
                        method, error.code(), error.status(), error.message());
            } else {
                log.warn("Call failed method={}, kind={}, code={}, status={}, attempts={}",
                        method, error.kind(), error.code(), error.status(), result.attempts());
            }
        });
        return result;
    }

    /**
     * Like {@link #execute} but returns the body or throws {@link ApiCallException}.
     */
    public JsonNode call(String method, Map<String, ?> params) {
        return execute(method, params, ApiVersion.V2).orElseThrow();
    }

    public JsonNode call(String method, Map<String, ?> params, ApiVersion version) {
        return execute(method, params, version).orElseThrow();
    }

    /**
     * Walks a paginated list method, following {@code next} until the server stops returning it.
     * Pages are fetched lazily as the iterator advances.
     */
    public Iterator<JsonNode> iterateList(String method, Map<String, ?> params, ApiVersion version) {
        return new ListPager(method, params, version);
    }

    /**
     * Runs up to {@value #MAX_BATCH_COMMANDS} commands ({@code name -> "method?query"}) in one request.
     */
    public JsonNode batch(Map<String, String> commands, boolean halt, ApiVersion version) {
        if (commands.size() > MAX_BATCH_COMMANDS) {
            throw ApiError.workflow(ErrorCodes.BATCH_TOO_LARGE,
                    "batch is limited to " + MAX_BATCH_COMMANDS + " commands, got " + commands.size()).toException();
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("halt", halt ? 1 : 0);
        params.put("cmd", commands);
        return call("batch", params, version);
    }

    private CallResult runAttempts(String method, Map<String, ?> params, ApiVersion version) {
        URI uri = tenant.methodUri(method, version);
        ObjectNode payload = (params == null) ? mapper.createObjectNode() : mapper.valueToTree(params);
        boolean refreshAttempted = false;

        int attempt = 1;
        while (attempt <= maxAttempts) {
            try {
                rateLimiter.acquire(tenant.rateLimitKey());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return interrupted(attempt - 1);
            }

            if (tenant.isOAuth()) {
                payload.put("auth", credentials.accessToken());
            }

            metrics.callAttempt(method);
            log.debug("Sending method={}, attempt={}/{}", method, attempt, maxAttempts);

            ApiError error;
            try {
                TransportResponse response = transport.post(uri, mapper.writeValueAsString(payload));
                JsonNode body = parseBody(response.body());
                if (body == null) {
                    if (!response.isServerError()) {
                        return CallResult.failure(new ApiError("Invalid JSON response", response.status(),
                                ErrorCodes.INVALID_JSON, null, ErrorKind.SCHEMA), attempt);
                    }
                    error = ApiError.remote("HTTP " + response.status() + " with non-JSON body",
                            response.status(), "HTTP_" + response.status(), null);
                } else {
                    error = ApiErrorMapper.map(response.status(), body);
                    if (error == null) return CallResult.success(body, attempt);
                }
            } catch (TransportException e) {
                error = new ApiError("Network error: " + e.getMessage(), 0, ErrorCodes.NETWORK_ERROR, null, ErrorKind.NETWORK);
            } catch (JsonProcessingException e) {
                return CallResult.failure(ApiError.schema(ErrorCodes.INVALID_REQUEST_SCHEMA,
                        "params are not serializable: " + e.getOriginalMessage()), attempt);
            }

            if (ErrorCodes.EXPIRED_TOKEN.equals(error.code())
                    && tenant.isOAuth()
                    && refresher != null
                    && !refreshAttempted) {
                refreshAttempted = true;
                if (refresher.refresh(tenant, credentials)) {
                    log.info("Access token refreshed, repeating attempt {} for method={}", attempt, method);
                    continue;
                }
            }

            if (error.fatal() || !error.retryable()) {
                return CallResult.failure(error, attempt);
            }

            if (attempt == maxAttempts) {
                if (error.kind() == ErrorKind.NETWORK) return CallResult.failure(error, attempt);
                return CallResult.failure(new ApiError("Retries exhausted: " + error.message(), error.status(),
                        ErrorCodes.RETRIES_EXHAUSTED, error.payload(), ErrorKind.TRANSIENT), attempt);
            }

            Duration delay = backoff.delay(attempt);
            metrics.callRetry(method, error.code());
            log.warn("Retrying method={} after code={}, status={}, attempt={}/{}, delay={}ms",
                    method, error.code(), error.status(), attempt, maxAttempts, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return interrupted(attempt);
            }
            attempt++;
        }

        return CallResult.failure(ApiError.of(ErrorKind.TRANSIENT, ErrorCodes.RETRIES_EXHAUSTED, "Retries exhausted"), maxAttempts);
    }

    /**
     * @return object body, a non-object JSON value wrapped as {@code {"result": value}}, or null when not JSON
     */
    private JsonNode parseBody(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            JsonNode node = mapper.readTree(raw);
            if (node == null || node.isMissingNode()) return null;
            if (node.isObject()) return node;
            ObjectNode wrapped = mapper.createObjectNode();
            wrapped.set("result", node);
            return wrapped;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static CallResult interrupted(int attempts) {
        return CallResult.failure(ApiError.of(ErrorKind.NETWORK, ErrorCodes.INTERRUPTED, "Interrupted"), attempts);
    }

    private final class ListPager implements Iterator<JsonNode> {

        private final String method;
        private final Map<String, Object> baseParams;
        private final ApiVersion version;
        private final Deque<JsonNode> buffer = new ArrayDeque<>();
        private JsonNode nextStart = null;
        private boolean exhausted = false;
        private boolean started = false;

        ListPager(String method, Map<String, ?> params, ApiVersion version) {
            this.method = method;
            this.baseParams = (params == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
            this.version = version;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !exhausted) fetchPage();
            return !buffer.isEmpty();
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) throw new NoSuchElementException();
            return buffer.poll();
        }

        private void fetchPage() {
            Map<String, Object> pageParams = new LinkedHashMap<>(baseParams);
            pageParams.put("start", started ? nextStart : 0);
            started = true;

            JsonNode response = call(method, pageParams, version);
            JsonNode result = response.path("result");
            if (result.isArray()) {
                result.forEach(buffer::add);
            } else if (result.isObject()) {
                result.forEach(item -> {
                    if (item.isObject()) buffer.add(item);
                });
            }

            JsonNode next = response.get("next");
            if (next == null || next.isNull()) {
                exhausted = true;
            } else {
                nextStart = next;
            }
        }
    }
}
