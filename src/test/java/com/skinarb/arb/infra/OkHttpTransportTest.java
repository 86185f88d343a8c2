package com.skinarb.arb.infra;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpTransportTest {

    private MockWebServer server;
    private final OkHttpTransport transport = new OkHttpTransport(5);

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void testGetSendsBrowserHeaders() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"items\":[]}"));

        TransportResponse response = transport.send(TransportRequest.builder()
                .url(server.url("/market/search").toString())
                .header("X-Api-Key", "key-1")
                .build(), null, Duration.ofSeconds(5));

        assertTrue(response.isSuccessful());
        assertEquals("{\"items\":[]}", response.getBody());
        RecordedRequest recorded = server.takeRequest();
        assertEquals("GET", recorded.getMethod());
        assertTrue(recorded.getHeader("User-Agent").startsWith("Mozilla/5.0"));
        assertEquals("key-1", recorded.getHeader("X-Api-Key"));
    }

    @Test
    void testPostBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        transport.send(TransportRequest.post(server.url("/buy").toString(), "{\"max_price\":95.0}"), null,
                Duration.ofSeconds(5));

        RecordedRequest recorded = server.takeRequest();
        assertEquals("POST", recorded.getMethod());
        assertEquals("{\"max_price\":95.0}", recorded.getBody().readUtf8());
        assertTrue(recorded.getHeader("Content-Type").startsWith("application/json"));
    }

    @Test
    void testErrorStatusIsAResponse() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        TransportResponse response = transport.send(TransportRequest.get(server.url("/prices").toString()), null,
                Duration.ofSeconds(5));

        assertEquals(429, response.getCode());
        assertEquals("slow down", response.getBody());
    }

    @Test
    void testTimeoutIsAnIOException() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        assertThrows(IOException.class, () -> transport.send(
                TransportRequest.get(server.url("/slow").toString()), null, Duration.ofMillis(200)));
    }

    @Test
    void testProxyAuthentication() throws Exception {
        // the mock server plays the proxy: challenge first, then answer
        server.enqueue(new MockResponse().setResponseCode(407).addHeader("Proxy-Authenticate", "Basic realm=\"pool\""));
        server.enqueue(new MockResponse().setBody("ok"));
        ProxyEndpoint proxy = ProxyEndpoint.parse(server.getHostName() + ":" + server.getPort(), "user", "secret");

        TransportResponse response = transport.send(TransportRequest.get("http://market.example.test/api"), proxy,
                Duration.ofSeconds(5));

        assertEquals("ok", response.getBody());
        RecordedRequest challenged = server.takeRequest();
        assertNull(challenged.getHeader("Proxy-Authorization"));
        RecordedRequest authorized = server.takeRequest();
        assertEquals(okhttp3.Credentials.basic("user", "secret"), authorized.getHeader("Proxy-Authorization"));
        assertEquals("http://market.example.test/api", authorized.getRequestLine().split(" ")[1]);
    }
}
