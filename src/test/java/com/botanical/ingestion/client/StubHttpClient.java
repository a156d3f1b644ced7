package com.botanical.ingestion.client;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked {@link HttpClient} answering by request path. Responses queued for a
 * path are served in order; the last one keeps being served. Unknown paths get 404.
 */
public class StubHttpClient {

    public static final String BASE_URL = "http://provider.test";

    private final HttpClient client = mock(HttpClient.class);
    private final List<HttpRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<Supplier<CompletableFuture<HttpResponse<String>>>>> routes =
            new ConcurrentHashMap<>();

    private final HttpResponse<String> notFound = response(404, "{\"message\":\"Not found\"}");

    public StubHttpClient() {
        doAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            requests.add(request);
            return next(request.uri().getPath()).get();
        }).when(client).sendAsync(any(HttpRequest.class), any());
    }

    public HttpClient client() {
        return client;
    }

    public StubHttpClient respond(String path, int status, String body) {
        HttpResponse<String> response = response(status, body);
        return enqueue(path, () -> CompletableFuture.completedFuture(response));
    }

    public StubHttpClient fail(String path, IOException error) {
        return enqueue(path, () -> CompletableFuture.failedFuture(error));
    }

    /**
     * The request never completes.
     */
    public StubHttpClient hang(String path) {
        return enqueue(path, CompletableFuture::new);
    }

    public List<HttpRequest> requests() {
        return List.copyOf(requests);
    }

    public long requestCount(String path) {
        return requests.stream().filter(r -> r.uri().getPath().equals(path)).count();
    }

    public HttpRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public static Map<String, String> queryParams(HttpRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        String query = request.uri().getRawQuery();
        if (query == null) {
            return params;
        }
        for (String pair : query.split("&")) {
            String[] kv = pair.split("=", 2);
            params.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8),
                    kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "");
        }
        return params;
    }

    private StubHttpClient enqueue(String path, Supplier<CompletableFuture<HttpResponse<String>>> answer) {
        routes.computeIfAbsent(path, p -> new ArrayDeque<>()).add(answer);
        return this;
    }

    private synchronized Supplier<CompletableFuture<HttpResponse<String>>> next(String path) {
        Deque<Supplier<CompletableFuture<HttpResponse<String>>>> queue = routes.get(path);
        if (queue == null || queue.isEmpty()) {
            return () -> CompletableFuture.completedFuture(notFound);
        }
        return queue.size() > 1 ? queue.poll() : queue.peek();
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }
}
