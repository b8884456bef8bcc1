// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpRpcTransportTest {

    private HttpServer server;
    private URI baseUri;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void postsJsonWithExtraHeaders() throws IOException {
        AtomicReference<String> method = new AtomicReference<>();
        AtomicReference<String> apiKey = new AtomicReference<>();
        server.createContext("/", exchange -> {
            method.set(exchange.getRequestMethod());
            apiKey.set(exchange.getRequestHeaders().getFirst("X-Api-Key"));
            DefaultRpcClientTest.respond(exchange, 503, "busy");
        });
        HttpRpcTransport transport = HttpRpcTransport.builder().header("X-Api-Key", "k1").build();

        HttpReply reply = transport.post(baseUri, "{}");

        assertEquals("POST", method.get());
        assertEquals("k1", apiKey.get());
        assertEquals(503, reply.statusCode());
        assertEquals("busy", reply.body());
    }

    @Test
    void builderDefaultsAndOverrides() {
        RpcConfig defaults = HttpRpcTransport.builder().build().config();
        assertEquals(Duration.ofSeconds(10), defaults.connectTimeout());
        assertEquals(Duration.ofSeconds(30), defaults.readTimeout());

        RpcConfig custom = HttpRpcTransport.builder()
                .connectTimeout(Duration.ofSeconds(2))
                .readTimeout(Duration.ofSeconds(3))
                .header("a", "b")
                .build()
                .config();
        assertEquals(Duration.ofSeconds(2), custom.connectTimeout());
        assertEquals(Duration.ofSeconds(3), custom.readTimeout());
        assertEquals(Map.of("a", "b"), custom.headers());
    }

    @Test
    void rejectsNonPositiveTimeouts() {
        assertThrows(IllegalArgumentException.class,
                () -> new RpcConfig(Duration.ZERO, Duration.ofSeconds(1), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new RpcConfig(Duration.ofSeconds(1), Duration.ofSeconds(-1), Map.of()));
    }
}
