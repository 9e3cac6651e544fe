package com.len.directory.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 프로브/웹훅 테스트용 로컬 HTTP 서버.
 * path 별로 응답을 정하고, 받은 요청을 기록한다.
 */
public class StubHttpServer implements AutoCloseable {

    private final HttpServer server;
    private final List<Received> received = new CopyOnWriteArrayList<>();
    private final Map<String, Function<HttpExchange, Reply>> routes = new ConcurrentHashMap<>();

    public StubHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public StubHttpServer respond(String path, int status) {
        return respond(path, exchange -> new Reply(status, null));
    }

    public StubHttpServer redirect(String path, String location) {
        return respond(path, exchange -> new Reply(302, location));
    }

    /**
     * delay 만큼 기다렸다가 reply 를 돌려준다 (느린 서버 흉내)
     */
    public StubHttpServer respondAfter(String path, Duration delay, Reply reply) {
        return respond(path, exchange -> {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return reply;
        });
    }

    public StubHttpServer respond(String path, Function<HttpExchange, Reply> reply) {
        routes.put(path, reply);
        return this;
    }

    public String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    public List<Received> received() {
        return received;
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            byte[] body = exchange.getRequestBody().readAllBytes();
            String path = exchange.getRequestURI().getPath();
            received.add(new Received(
                    exchange.getRequestMethod(),
                    path,
                    exchange.getRequestHeaders().getFirst("X-Directory-Signature"),
                    exchange.getRequestHeaders().getFirst("X-Directory-Event"),
                    exchange.getRequestHeaders().getFirst("Content-Type"),
                    body
            ));

            Reply reply = routes.getOrDefault(path, e -> new Reply(404, null)).apply(exchange);
            if (reply.location() != null) {
                exchange.getResponseHeaders().add("Location", reply.location());
            }
            exchange.sendResponseHeaders(reply.status(), -1);
        } finally {
            exchange.close();
        }
    }

    public record Reply(int status, String location) {}

    public record Received(
            String method,
            String path,
            String signature,
            String eventType,
            String contentType,
            byte[] body
    ) {}
}
