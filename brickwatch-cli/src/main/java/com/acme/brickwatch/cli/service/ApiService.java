package com.acme.brickwatch.cli.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** HTTP client for the brick management API. */
public class ApiService {
    private static final Logger logger = LoggerFactory.getLogger(ApiService.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String AUTH_HEADER = "X-Auth-Key";

    private final OkHttpClient client;
    private final HttpUrl baseUrl;
    private final String authKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ApiService(HttpUrl baseUrl, String authKey, Duration timeout) {
        this.baseUrl = baseUrl;
        this.authKey = authKey;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
        logger.debug("API service initialized with base URL: {}", baseUrl);
    }

    public static ApiService forServer(String host, int port, String authKey, Duration timeout) {
        HttpUrl url = new HttpUrl.Builder().scheme("http").host(host).port(port).build();
        return new ApiService(url, authKey, timeout);
    }

    public ApiResponse create(String name, String periodicity, String description, List<String> emails, boolean paused)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("periodicity", periodicity);
        body.put("description", description);
        body.put("emails", emails);
        body.put("paused", paused);
        return execute(request(bricks()).post(json(body)));
    }

    public ApiResponse get(String ref) throws IOException {
        return execute(request(brick(ref)).get());
    }

    /** Looks a brick up by name; the server resolves the name through its slug. */
    public ApiResponse findByName(String name) throws IOException {
        HttpUrl url = bricks().newBuilder().addPathSegment("lookup").addQueryParameter("name", name).build();
        return execute(request(url).get());
    }

    public ApiResponse list(Boolean paused, Boolean late, String search, boolean verbose) throws IOException {
        HttpUrl.Builder url = bricks().newBuilder();
        if (paused != null) {
            url.addQueryParameter("paused", paused.toString());
        }
        if (late != null) {
            url.addQueryParameter("late", late.toString());
        }
        if (search != null) {
            url.addQueryParameter("search", search);
        }
        if (verbose) {
            url.addQueryParameter("verbose", "true");
        }
        return execute(request(url.build()).get());
    }

    /** Null values are left out of the patch; an emails list of {@code ["-"]} clears recipients. */
    public ApiResponse update(String ref, String name, String periodicity, String description, List<String> emails)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        putIfPresent(body, "name", name);
        putIfPresent(body, "periodicity", periodicity);
        putIfPresent(body, "description", description);
        putIfPresent(body, "emails", emails);
        return execute(request(brick(ref)).patch(json(body)));
    }

    public ApiResponse trigger(String ref, String comment) throws IOException {
        return action(ref, "trigger", comment);
    }

    public ApiResponse pause(String ref, String comment) throws IOException {
        return action(ref, "pause", comment);
    }

    public ApiResponse unpause(String ref, String comment) throws IOException {
        return action(ref, "unpause", comment);
    }

    public ApiResponse delete(String ref) throws IOException {
        return execute(request(brick(ref)).delete());
    }

    private ApiResponse action(String ref, String action, String comment) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        putIfPresent(body, "comment", comment);
        HttpUrl url = brick(ref).newBuilder().addPathSegment(action).build();
        return execute(request(url).post(json(body)));
    }

    private HttpUrl bricks() {
        return baseUrl.newBuilder().addPathSegment("api").addPathSegment("bricks").build();
    }

    private HttpUrl brick(String ref) {
        return bricks().newBuilder().addPathSegment(ref).build();
    }

    private Request.Builder request(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url).header("Accept", "application/json");
        if (authKey != null) {
            builder.header(AUTH_HEADER, authKey);
        }
        return builder;
    }

    private RequestBody json(Map<String, Object> body) throws JsonProcessingException {
        return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
    }

    private ApiResponse execute(Request.Builder builder) throws IOException {
        Request request = builder.build();
        logger.debug("{} {}", request.method(), request.url());
        try (Response response = client.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            return new ApiResponse(response.code(), response.isSuccessful(), responseBody);
        }
    }

    private static void putIfPresent(Map<String, Object> body, String key, Object value) {
        if (value != null) {
            body.put(key, value);
        }
    }

    public static class ApiResponse {
        private final int statusCode;
        private final boolean successful;
        private final String body;

        public ApiResponse(int statusCode, boolean successful, String body) {
            this.statusCode = statusCode;
            this.successful = successful;
            this.body = body;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public boolean isSuccessful() {
            return successful;
        }

        public String getBody() {
            return body;
        }
    }
}
