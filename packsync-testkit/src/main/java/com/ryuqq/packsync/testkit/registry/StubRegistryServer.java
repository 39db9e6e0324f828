package com.ryuqq.packsync.testkit.registry;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Stub registry HTTP server for tests.
 *
 * <p>Binds to a random loopback port. Responses are configured per raw request path
 * (query string excluded):</p>
 * <ul>
 *   <li>{@link #enqueue(String, int, String)}: one-shot responses consumed in order</li>
 *   <li>{@link #respond(String, int, String)}: sticky response used once the queue is empty</li>
 *   <li>unconfigured paths answer 404</li>
 * </ul>
 *
 * <p>Every request URI is recorded so tests can assert retry counts and query parameters.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * try (StubRegistryServer registry = StubRegistryServer.start()) {
 *     registry.enqueue("/v0/servers", 500, "boom");
 *     registry.respond("/v0/servers", 200, RegistryJson.page(null, RegistryJson.server("acme/widget", "1.0.0")));
 *     RegistryClient client = new RegistryClient(new RegistryClientConfig().withBaseUrl(registry.baseUrl()));
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StubRegistryServer implements AutoCloseable {

    /**
     * A canned HTTP response.
     *
     * @param status status code
     * @param body response body (JSON)
     */
    public record StubResponse(int status, String body) {
    }

    private final HttpServer server;
    private final ExecutorService executor;
    private final Map<String, Deque<StubResponse>> queued = new ConcurrentHashMap<>();
    private final Map<String, StubResponse> sticky = new ConcurrentHashMap<>();
    private final List<URI> requests = new CopyOnWriteArrayList<>();
    private volatile Duration responseDelay = Duration.ZERO;

    private StubRegistryServer(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    /**
     * Starts a server on a random loopback port.
     *
     * @return running server
     * @throws IllegalStateException if the server cannot bind
     */
    public static StubRegistryServer start() {
        try {
            HttpServer httpServer = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
            ExecutorService executor = Executors.newCachedThreadPool();
            StubRegistryServer stub = new StubRegistryServer(httpServer, executor);
            httpServer.createContext("/", stub::handle);
            httpServer.setExecutor(executor);
            httpServer.start();
            return stub;
        } catch (IOException e) {
            throw new IllegalStateException("failed to start stub registry", e);
        }
    }

    /**
     * Base URL of the running server (no trailing slash).
     *
     * @return base URL, e.g. {@code http://127.0.0.1:54321}
     */
    public String baseUrl() {
        InetSocketAddress address = server.getAddress();
        return "http://" + address.getAddress().getHostAddress() + ":" + address.getPort();
    }

    /**
     * Queues a one-shot response for a path.
     */
    public StubRegistryServer enqueue(String path, int status, String body) {
        Deque<StubResponse> queue = queued.computeIfAbsent(path, p -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addLast(new StubResponse(status, body));
        }
        return this;
    }

    /**
     * Sets the response returned for a path once its queue is empty.
     */
    public StubRegistryServer respond(String path, int status, String body) {
        sticky.put(path, new StubResponse(status, body));
        return this;
    }

    /**
     * Delays every response (used to test cancellation while a request is in flight).
     *
     * @param delay delay before responding
     */
    public void setResponseDelay(Duration delay) {
        this.responseDelay = delay == null ? Duration.ZERO : delay;
    }

    /**
     * All request URIs received so far.
     *
     * @return request URIs in arrival order
     */
    public List<URI> requests() {
        return List.copyOf(requests);
    }

    /**
     * Number of requests received for a raw path.
     *
     * @param path raw request path, e.g. {@code /v0/servers}
     * @return request count
     */
    public int requestCount(String path) {
        return (int) requests.stream().filter(uri -> path.equals(uri.getRawPath())).count();
    }

    /**
     * Total number of requests received.
     */
    public int requestCount() {
        return requests.size();
    }

    private void handle(HttpExchange exchange) throws IOException {
        URI uri = exchange.getRequestURI();
        requests.add(uri);
        try {
            Duration delay = responseDelay;
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        StubResponse response = next(uri.getRawPath());
        byte[] body = response.body() == null ? new byte[0] : response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            if (body.length > 0) {
                out.write(body);
            }
        }
    }

    private StubResponse next(String path) {
        Deque<StubResponse> queue = queued.get(path);
        if (queue != null) {
            synchronized (queue) {
                StubResponse response = queue.pollFirst();
                if (response != null) {
                    return response;
                }
            }
        }
        return sticky.getOrDefault(path, new StubResponse(404, "{\"error\":\"not found\"}"));
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
