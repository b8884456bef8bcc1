// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.bubblegum.core.BubblegumDebug;
import sh.bubblegum.core.ConnectionContext;
import sh.bubblegum.core.types.TransactionEnvelope;

class DefaultRpcClientDebugTest {

    private HttpServer server;
    private String baseUrl;
    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("sh.bubblegum.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        BubblegumDebug.setEnabled(false);
        debugLogger.detachAppender(appender);
        server.stop(0);
    }

    @Test
    void logsRpcCallsWithoutSecretOrTransaction() {
        server.createContext("/", exchange -> DefaultRpcClientTest.respond(exchange, 200,
                "{\"jsonrpc\":\"2.0\",\"result\":\"5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW\",\"id\":1}"));
        BubblegumDebug.setEnabled(true);
        ConnectionContext context = new ConnectionContext();
        context.initialize(TestKeys.SECRET_KEY, baseUrl);
        TransactionEnvelope tx = TransactionEnvelope.of(new byte[] {9, 8, 7, 6, 5, 4, 3, 2, 1});

        new DefaultRpcClient(context, HttpRpcTransport.create(RpcConfig.defaults())).submit(tx);

        assertFalse(appender.list.isEmpty());
        String all = String.join("\n", appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList());
        assertTrue(all.contains("[TX-SEND]"));
        assertTrue(all.contains("[RPC]"));
        assertFalse(all.contains(tx.toBase64()));
        assertFalse(all.contains(TestKeys.SECRET_KEY));
    }

    @Test
    void silentWhenDisabled() {
        server.createContext("/", exchange -> DefaultRpcClientTest.respond(exchange, 200,
                "{\"jsonrpc\":\"2.0\",\"id\":\"test\",\"result\":[]}"));
        ConnectionContext context = new ConnectionContext();
        context.initialize(TestKeys.SECRET_KEY, baseUrl);

        new DefaultRpcClient(context, HttpRpcTransport.create(RpcConfig.defaults())).getAssetBatch(List.of("a"));

        assertTrue(appender.list.isEmpty());
    }
}
