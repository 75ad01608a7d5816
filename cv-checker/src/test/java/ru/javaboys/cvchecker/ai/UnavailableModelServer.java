package ru.javaboys.cvchecker.ai;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Local stand-in for the OpenAI endpoint that answers every request with 503.
 */
public final class UnavailableModelServer {

    private static final byte[] BODY = "{\"error\":{\"message\":\"overloaded\",\"type\":\"server_error\"}}"
            .getBytes(StandardCharsets.UTF_8);

    private final HttpServer server;
    private final AtomicInteger requests = new AtomicInteger();

    private UnavailableModelServer(HttpServer server) {
        this.server = server;
    }

    public static UnavailableModelServer start() {
        try {
            HttpServer http = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
            UnavailableModelServer model = new UnavailableModelServer(http);
            http.createContext("/", exchange -> {
                model.requests.incrementAndGet();
                try (InputStream in = exchange.getRequestBody()) {
                    in.readAllBytes();
                }
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(503, BODY.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(BODY);
                }
            });
            http.start();
            return model;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    public int requestCount() {
        return requests.get();
    }

    public void reset() {
        requests.set(0);
    }
}
