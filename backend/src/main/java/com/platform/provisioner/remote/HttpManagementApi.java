package com.platform.provisioner.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.provisioner.config.ApiProperties;
import com.platform.provisioner.error.ProvisionerException;
import com.platform.provisioner.error.RemoteServiceException;
import com.platform.provisioner.error.RemoteServiceException.ErrorDetail;
import com.platform.provisioner.model.Account;
import com.platform.provisioner.model.AccountSummary;
import com.platform.provisioner.model.CustomDimension;
import com.platform.provisioner.model.CustomMetric;
import com.platform.provisioner.model.Goal;
import com.platform.provisioner.model.ResourcePayloads;
import com.platform.provisioner.model.View;
import com.platform.provisioner.model.WebProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Management API client over the JDK HTTP client.
 * 
 * Failures are delivered as raw {@link RemoteServiceException}s, never wrapped in CompletionException.
 */
@Slf4j
public class HttpManagementApi implements ManagementApi {
    
    private static final String JSON = "application/json";
    
    private final ApiProperties properties;
    private final HttpClient httpClient;
    private final ResourcePayloads payloads;
    private final ObjectMapper objectMapper;
    
    public HttpManagementApi(ApiProperties properties, HttpClient httpClient, ResourcePayloads payloads) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.payloads = payloads;
        this.objectMapper = payloads.getObjectMapper();
    }
    
    // ==================== Read-only ====================
    
    @Override
    public CompletableFuture<RemoteResult<List<AccountSummary>>> listAccountSummaries(ResourcePath path) {
        return list(path, "/accountSummaries", AccountSummary.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<List<Account>>> listAccounts(ResourcePath path) {
        return list(path, "/accounts", Account.class);
    }
    
    // ==================== Web Properties ====================
    
    @Override
    public CompletableFuture<RemoteResult<List<WebProperty>>> listWebProperties(ResourcePath path) {
        return list(path, webProperties(path), WebProperty.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<WebProperty>> getWebProperty(ResourcePath path) {
        return one(path, "GET", webProperties(path) + "/" + path.webPropertyId(), null, WebProperty.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<WebProperty>> insertWebProperty(ResourcePath path, WebProperty webProperty) {
        return one(path, "POST", webProperties(path), webProperty, WebProperty.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<WebProperty>> patchWebProperty(ResourcePath path, WebProperty webProperty) {
        return one(path, "PATCH", webProperties(path) + "/" + path.webPropertyId(), webProperty, WebProperty.class);
    }
    
    // ==================== Custom Dimensions ====================
    
    @Override
    public CompletableFuture<RemoteResult<List<CustomDimension>>> listCustomDimensions(ResourcePath path) {
        return list(path, property(path) + "/customDimensions", CustomDimension.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<CustomDimension>> insertCustomDimension(ResourcePath path, CustomDimension dimension) {
        return one(path, "POST", property(path) + "/customDimensions", dimension, CustomDimension.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<CustomDimension>> patchCustomDimension(ResourcePath path, CustomDimension dimension) {
        return one(path, "PATCH", property(path) + "/customDimensions/" + path.itemId(), dimension, CustomDimension.class);
    }
    
    // ==================== Custom Metrics ====================
    
    @Override
    public CompletableFuture<RemoteResult<List<CustomMetric>>> listCustomMetrics(ResourcePath path) {
        return list(path, property(path) + "/customMetrics", CustomMetric.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<CustomMetric>> insertCustomMetric(ResourcePath path, CustomMetric metric) {
        return one(path, "POST", property(path) + "/customMetrics", metric, CustomMetric.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<CustomMetric>> patchCustomMetric(ResourcePath path, CustomMetric metric) {
        return one(path, "PATCH", property(path) + "/customMetrics/" + path.itemId(), metric, CustomMetric.class);
    }
    
    // ==================== Views ====================
    
    @Override
    public CompletableFuture<RemoteResult<List<View>>> listViews(ResourcePath path) {
        return list(path, property(path) + "/profiles", View.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<View>> getView(ResourcePath path) {
        return one(path, "GET", profile(path), null, View.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<View>> insertView(ResourcePath path, View view) {
        return one(path, "POST", property(path) + "/profiles", view, View.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<View>> patchView(ResourcePath path, View view) {
        return one(path, "PATCH", profile(path), view, View.class);
    }
    
    // ==================== Goals ====================
    
    @Override
    public CompletableFuture<RemoteResult<List<Goal>>> listGoals(ResourcePath path) {
        return list(path, profile(path) + "/goals", Goal.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<Goal>> insertGoal(ResourcePath path, Goal goal) {
        return one(path, "POST", profile(path) + "/goals", goal, Goal.class);
    }
    
    @Override
    public CompletableFuture<RemoteResult<Goal>> patchGoal(ResourcePath path, Goal goal) {
        return one(path, "PATCH", profile(path) + "/goals/" + path.itemId(), goal, Goal.class);
    }
    
    // ==================== Paths ====================
    
    private static String webProperties(ResourcePath path) {
        return "/accounts/" + path.accountId() + "/webproperties";
    }
    
    private static String property(ResourcePath path) {
        return webProperties(path) + "/" + path.webPropertyId();
    }
    
    private static String profile(ResourcePath path) {
        return property(path) + "/profiles/" + path.profileId();
    }
    
    // ==================== Transport ====================
    
    private <T> CompletableFuture<RemoteResult<List<T>>> list(ResourcePath path, String resource, Class<T> type) {
        return send(path, "GET", resource, null, root -> {
            List<T> items = new ArrayList<>();
            for (JsonNode item : root.path("items")) {
                items.add(read(item, type));
            }
            return new RemoteResult<>(path, List.copyOf(items));
        });
    }
    
    private <T> CompletableFuture<RemoteResult<T>> one(ResourcePath path, String method, String resource,
                                                       Object body, Class<T> type) {
        return send(path, method, resource, body, root -> new RemoteResult<>(path, read(root, type)));
    }
    
    private <R> CompletableFuture<R> send(ResourcePath path, String method, String resource, Object body,
                                          Function<JsonNode, R> parser) {
        HttpRequest request;
        try {
            request = buildRequest(path.session(), method, resource, body);
        } catch (ProvisionerException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("{} {}", method, request.uri());
        
        CompletableFuture<R> result = new CompletableFuture<>();
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .whenComplete((response, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                    log.warn("{} {} failed: {}", method, request.uri(), cause.toString());
                    result.completeExceptionally(RemoteServiceException.unreachable(cause));
                    return;
                }
                try {
                    result.complete(parser.apply(readResponse(response)));
                } catch (RemoteServiceException e) {
                    result.completeExceptionally(e);
                } catch (RuntimeException e) {
                    log.warn("{} {} returned an unusable body: {}", method, request.uri(), e.toString());
                    result.completeExceptionally(RemoteServiceException.unreadable(502, e));
                }
            });
        return result;
    }
    
    private HttpRequest buildRequest(Session session, String method, String resource, Object body) {
        StringBuilder uri = new StringBuilder(properties.getBaseUrl()).append(resource);
        if (session.quotaUser() != null) {
            uri.append("?quotaUser=").append(URLEncoder.encode(session.quotaUser(), StandardCharsets.UTF_8));
        }
        
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(payloads.toPayload(body));
        
        return HttpRequest.newBuilder()
            .uri(URI.create(uri.toString()))
            .header("Authorization", session.authorizationHeader())
            .header("Accept", JSON)
            .header("Content-Type", JSON)
            .timeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .method(method, publisher)
            .build();
    }
    
    private JsonNode readResponse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw toRemoteError(status, response.body());
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw RemoteServiceException.unreadable(502, e);
        }
    }
    
    private <T> T read(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw RemoteServiceException.unreadable(502, e);
        }
    }
    
    /**
     * Maps an error body of the form
     * {@code {"error": {"code": 403, "message": "...", "errors": [{"domain", "reason", "message"}]}}}.
     * OAuth failures carry a plain string in {@code error} instead.
     */
    RemoteServiceException toRemoteError(int status, String body) {
        HttpStatus resolved = HttpStatus.resolve(status);
        String statusText = resolved != null ? resolved.getReasonPhrase() : "HTTP " + status;
        
        JsonNode root;
        try {
            root = body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return new RemoteServiceException(status, statusText, body, null, List.of());
        }
        
        JsonNode error = root.path("error");
        if (error.isTextual()) {
            return new RemoteServiceException(status, statusText,
                root.path("error_description").asText(null), error.asText(), List.of());
        }
        
        List<ErrorDetail> details = new ArrayList<>();
        for (JsonNode detail : error.path("errors")) {
            details.add(new ErrorDetail(
                detail.path("domain").asText(null),
                detail.path("reason").asText(null),
                detail.path("message").asText(null)));
        }
        String type = error.path("status").asText(null);
        if (type == null && !details.isEmpty()) {
            type = details.get(0).domain();
        }
        return new RemoteServiceException(status, statusText, error.path("message").asText(null), type, details);
    }
}
