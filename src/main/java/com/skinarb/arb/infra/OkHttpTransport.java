package com.skinarb.arb.infra;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Authenticator;
import okhttp3.ConnectionSpec;
import okhttp3.Credentials;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class OkHttpTransport implements Transport {

    // Some markets reject requests without a desktop browser agent
    private static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final OkHttpClient baseClient;

    public OkHttpTransport(@Value("${arb.http.connect-timeout-seconds:30}") long connectTimeoutSeconds) {
        // Some marketplaces still negotiate older suites
        ConnectionSpec spec = new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
                .allEnabledTlsVersions()
                .allEnabledCipherSuites()
                .build();

        // Retries are decided by the executor, never silently by OkHttp
        this.baseClient = new OkHttpClient.Builder()
                .connectionSpecs(Arrays.asList(spec, ConnectionSpec.CLEARTEXT))
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public TransportResponse send(TransportRequest request, ProxyEndpoint proxy, Duration timeout)
            throws IOException {
        OkHttpClient.Builder builder = baseClient.newBuilder()
                .callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (proxy != null) {
            builder.proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxy.getHost(), proxy.getPort())));
            if (proxy.hasCredentials()) {
                builder.proxyAuthenticator(proxyAuthenticator(proxy));
            }
        }

        Request.Builder httpRequest = new Request.Builder()
                .url(request.getUrl())
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json");
        request.getHeaders().forEach(httpRequest::header);

        RequestBody body = null;
        boolean bodiless = "GET".equals(request.getMethod()) || "HEAD".equals(request.getMethod());
        if (!bodiless) {
            String payload = request.getBody() != null ? request.getBody() : "";
            body = RequestBody.create(payload, MediaType.parse(request.getContentType()));
        }
        httpRequest.method(request.getMethod(), body);

        try (Response response = builder.build().newCall(httpRequest.build()).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.debug("{} {} answered {} {}", request.getMethod(), request.getUrl(), response.code(),
                        response.message());
            }
            return new TransportResponse(response.code(), response.message(), responseBody);
        }
    }

    private static Authenticator proxyAuthenticator(ProxyEndpoint proxy) {
        String credential = Credentials.basic(proxy.getUsername(), proxy.getPassword());
        return (route, response) -> {
            if (response.request().header("Proxy-Authorization") != null) {
                return null; // already tried, credentials rejected
            }
            return response.request().newBuilder()
                    .header("Proxy-Authorization", credential)
                    .build();
        };
    }
}
