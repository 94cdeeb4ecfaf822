package de.entwicklertraining.capi;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Small HTTP server for tests. Answers each path from a queue of canned responses (the last one
 * repeats) or from a handler function, and records every request it receives.
 */
public class MockHttpServer implements AutoCloseable {

    public record Recorded(String method, String path, String query, Map<String, String> headers, String body) {
        public String header(String name) {
            return headers.get(name.toLowerCase(Locale.ROOT));
        }
    }

    public record Reply(int status, Map<String, String> headers, String body) {
        public static Reply json(int status, String body) {
            return new Reply(status, Map.of("Content-Type", "application/json"), body);
        }
    }

    private final HttpServer server;
    private final Map<String, Deque<Reply>> queues = new HashMap<>();
    private final Map<String, Function<Recorded, Reply>> handlers = new HashMap<>();
    private final List<Recorded> requests = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger hits = new AtomicInteger();

    public MockHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/", this::handle);
        server.start();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public synchronized MockHttpServer enqueue(String path, Reply... replies) {
        Deque<Reply> queue = queues.computeIfAbsent(path, p -> new ArrayDeque<>());
        Collections.addAll(queue, replies);
        return this;
    }

    public synchronized MockHttpServer handle(String path, Function<Recorded, Reply> handler) {
        handlers.put(path, handler);
        return this;
    }

    public List<Recorded> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public int hits() {
        return hits.get();
    }

    private void handle(HttpExchange exchange) throws IOException {
        Map<String, String> headers = new HashMap<>();
        exchange.getRequestHeaders().forEach((k, v) -> headers.put(k.toLowerCase(Locale.ROOT), String.join(",", v)));
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String path = exchange.getRequestURI().getPath();
        Recorded recorded = new Recorded(exchange.getRequestMethod(), path,
                exchange.getRequestURI().getRawQuery(), headers, body);
        requests.add(recorded);
        hits.incrementAndGet();

        Reply reply = replyFor(recorded);
        byte[] bytes = reply.body() == null ? new byte[0] : reply.body().getBytes(StandardCharsets.UTF_8);
        reply.headers().forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
        if (bytes.length == 0) {
            exchange.sendResponseHeaders(reply.status(), -1);
        } else {
            exchange.sendResponseHeaders(reply.status(), bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private synchronized Reply replyFor(Recorded recorded) {
        Function<Recorded, Reply> handler = handlers.get(recorded.path());
        if (handler != null) {
            return handler.apply(recorded);
        }
        Deque<Reply> queue = queues.get(recorded.path());
        if (queue == null || queue.isEmpty()) {
            return Reply.json(404, "{\"errors\":[{\"code\":10010,\"title\":\"CF-ResourceNotFound\",\"detail\":\"not found\"}]}");
        }
        return queue.size() > 1 ? queue.poll() : queue.peek();
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
