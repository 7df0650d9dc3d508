package com.geotiler.credentialprovider;

import com.azure.core.credential.AccessToken;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

public class StorageAuthFilterTests {
  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private final TestClock clock = TestClock.fixedUtc(T0);
  private final Map<String, String> env = new HashMap<>();
  private final VariableStore store = VariableStore.of(env);

  @Test
  void storageRequest_seesPublishedToken() throws Exception {
    FakeCredentialSource source = new FakeCredentialSource("fake")
        .thenGrant(new AccessGrant("t1", TokenKind.BEARER, T0.plusSeconds(3600)));
    env.put("AZURE_STORAGE_ACCESS_KEY", "secret-key");

    try (TestServer server = new TestServer(filter(source))) {
      HttpResponse<String> first = server.get("/cog/tiles/WebMercatorQuad/3/4/2.png");
      HttpResponse<String> second = server.get("/cog/info");

      assertEquals(200, first.statusCode());
      assertEquals("token=t1 key=false", first.body());
      assertEquals("token=t1 key=false", second.body());
      assertEquals(1, source.calls(), "second request must be served from the cache");
    }
  }

  @Test
  void acquisitionFailure_doesNotChangeResponse() throws Exception {
    FakeCredentialSource source = new FakeCredentialSource("fake")
        .thenFail(TokenAcquisitionException.Reason.DENIED);

    try (TestServer server = new TestServer(filter(source))) {
      HttpResponse<String> response = server.get("/cog/tiles/WebMercatorQuad/3/4/2.png");

      assertEquals(200, response.statusCode());
      assertEquals("token=none key=false", response.body());
      assertEquals(1, source.calls());
    }
  }

  @Test
  void unexpectedSourceFailure_doesNotChangeResponse() throws Exception {
    FakeCredentialSource source = new FakeCredentialSource("fake")
        .then(scope -> {
          throw new IllegalStateException("identity endpoint returned garbage");
        });

    try (TestServer server = new TestServer(filter(source))) {
      HttpResponse<String> response = server.get("/cog/info");

      assertEquals(200, response.statusCode());
      assertEquals("token=none key=false", response.body());
    }
  }

  @Test
  void blankTokenFromIdentity_doesNotChangeResponse() throws Exception {
    OffsetDateTime expiresOn = OffsetDateTime.ofInstant(T0.plusSeconds(3600), ZoneOffset.UTC);
    AzureTokenCredentialSource source = new AzureTokenCredentialSource(
        "managed-identity", request -> Mono.just(new AccessToken("", expiresOn)));

    try (TestServer server = new TestServer(filter(source))) {
      HttpResponse<String> response = server.get("/cog/info");

      assertEquals(200, response.statusCode());
      assertEquals("token=none key=false", response.body());
    }
  }

  @Test
  void healthAndDocsPaths_skipAcquisition() throws Exception {
    FakeCredentialSource source = new FakeCredentialSource("fake");

    try (TestServer server = new TestServer(filter(source))) {
      for (String path : new String[] {"/livez", "/readyz", "/health", "/static/app.css", "/docs", "/api"}) {
        assertEquals(200, server.get(path).statusCode(), path);
      }
      assertEquals(0, source.calls());
    }
  }

  @Test
  void skipsAuth_matchesPrefixesOnly() {
    assertTrue(StorageAuthFilter.skipsAuth("/livez"));
    assertTrue(StorageAuthFilter.skipsAuth("/static/js/map.js"));
    assertTrue(StorageAuthFilter.skipsAuth("/openapi.json"));
    assertFalse(StorageAuthFilter.skipsAuth("/"));
    assertFalse(StorageAuthFilter.skipsAuth("/cog/tiles/1/2/3"));
    assertFalse(StorageAuthFilter.skipsAuth("/mosaic/info"));
    assertFalse(StorageAuthFilter.skipsAuth(null));
  }

  private StorageAuthFilter filter(CredentialSource source) {
    ScopeRegistry registry = ScopeRegistry.defaults();
    TokenAcquirer acquirer = new TokenAcquirer(
        TestChains.of(DeploymentMode.PLATFORM, source),
        clock,
        LoggerFactory.getLogger(TokenAcquirer.class));
    TokenCache cache = new TokenCache(registry, acquirer, clock, LoggerFactory.getLogger(TokenCache.class));
    EnvironmentPublisher publisher = new EnvironmentPublisher(
        store, "tiles", LoggerFactory.getLogger(EnvironmentPublisher.class));
    return new StorageAuthFilter(
        cache,
        publisher,
        registry.require(ScopeRegistry.STORAGE_ACCESS),
        LoggerFactory.getLogger(StorageAuthFilter.class));
  }

  private final class TestServer implements AutoCloseable {
    private final HttpServer server;
    private final HttpClient client = HttpClient.newHttpClient();

    TestServer(StorageAuthFilter filter) throws IOException {
      this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
      this.server.createContext("/", this::describeStorage).getFilters().add(filter);
      this.server.start();
    }

    HttpResponse<String> get(String path) throws IOException, InterruptedException {
      URI uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
      return client.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private void describeStorage(HttpExchange exchange) throws IOException {
      String body;
      synchronized (store) {
        String token = store.get(ScopeRegistry.STORAGE_ACCESS_TOKEN_VARIABLE);
        body = "token=" + (token == null ? "none" : token)
            + " key=" + (store.get("AZURE_STORAGE_ACCESS_KEY") != null);
      }
      byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(200, bytes.length);
      try (OutputStream os = exchange.getResponseBody()) {
        os.write(bytes);
      }
    }

    @Override
    public void close() {
      server.stop(0);
    }
  }
}
