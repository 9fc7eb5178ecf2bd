package com.example.secretsync.core.backend;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.SyncException;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.BackendKind;
import com.example.secretsync.core.model.BackendRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link BackendClient} for a Vault-compatible KV secret engine.
 *
 * <p>The backend's path prefix is the KV mount. Parameters:
 *
 * <ul>
 *   <li>{@code version}: {@code v2} (default) or {@code v1} KV engine
 *   <li>{@code token}: static token; otherwise the environment variable named by {@code tokenEnv}
 *       (default {@code VAULT_TOKEN}), then the {@code vault.token} system property
 * </ul>
 *
 * <p>Status mapping: 404 is NOT_FOUND, 401/403 AUTH_ERROR, 429/5xx and I/O failures UNREACHABLE.
 */
public final class VaultBackendClient implements BackendClient {

  private static final System.Logger LOGGER = System.getLogger(VaultBackendClient.class.getName());

  private static final String TOKEN_HEADER = "X-Vault-Token";
  private static final String NAMESPACE_HEADER = "X-Vault-Namespace";
  private static final Set<Integer> HEALTHY_CODES = Set.of(200, 429, 472, 473);

  private final BackendRef ref;
  private final HttpClient httpClient;
  private final ObjectMapper mapper;
  private final Duration requestTimeout;
  private final Supplier<String> token;
  private final boolean kvV2;
  private final String mount;

  public VaultBackendClient(
      final BackendRef ref,
      final HttpClient httpClient,
      final ObjectMapper mapper,
      final Duration requestTimeout) {
    if (ref.kind() != BackendKind.VAULT_LIKE)
      throw new IllegalArgumentException("not a Vault-like backend: " + ref);
    this.ref = ref;
    this.httpClient = httpClient;
    this.mapper = mapper;
    this.requestTimeout = requestTimeout;
    this.token = () -> resolveToken(ref);
    this.kvV2 = !"v1".equalsIgnoreCase(ref.parameter("version").orElse("v2"));
    this.mount = trimSlashes(ref.pathPrefix().isBlank() ? "secret" : ref.pathPrefix());
  }

  /**
   * Factory producing clients that share one {@link HttpClient}.
   *
   * @param requestTimeout timeout applied to every HTTP request
   * @return factory for Vault-like backends
   */
  public static BackendClientFactory factory(final Duration requestTimeout) {
    final var httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
    final var mapper = new ObjectMapper();
    return ref -> new VaultBackendClient(ref, httpClient, mapper, requestTimeout);
  }

  private static String resolveToken(final BackendRef ref) {
    final var tokenEnv = ref.parameter("tokenEnv").orElse("VAULT_TOKEN");
    return ref.parameter("token")
        .or(() -> Optional.ofNullable(System.getenv(tokenEnv)))
        .or(() -> Optional.ofNullable(System.getProperty("vault.token")))
        .filter(t -> !t.isBlank())
        .orElseThrow(
            () ->
                SyncException.authError("no token configured for backend " + ref.key(), null));
  }

  @Override
  public BackendRef ref() {
    return ref;
  }

  @Override
  public ResolvedSecretValue fetch(final String remoteKey, final String property) {
    final var key = trimSlashes(remoteKey);
    final var path = kvV2 ? mount + "/data/" + key : mount + "/" + key;
    final var response = send(request(path).GET().build(), remoteKey);
    final var root = readJson(response, remoteKey);

    final JsonNode data;
    final String revision;
    if (kvV2) {
      data = root.path("data").path("data");
      final var version = root.path("data").path("metadata").path("version");
      revision = version.isMissingNode() || version.isNull() ? null : version.asText();
    } else {
      data = root.path("data");
      revision = null;
    }
    if (!data.isObject())
      throw SyncException.notFound("key " + remoteKey + " has no data in " + ref.key());

    if (property == null)
      return new ResolvedSecretValue(remoteKey, null, JsonValues.toBytes(data), revision);

    final var selected =
        JsonValues.select(data, property)
            .orElseThrow(
                () ->
                    SyncException.notFound(
                        "property " + property + " not found in key " + remoteKey));
    return new ResolvedSecretValue(remoteKey, property, JsonValues.toBytes(selected), revision);
  }

  @Override
  public List<String> listKeys(final String prefix) {
    final var keys = new ArrayList<String>();
    collectKeys(normalizeFolder(prefix), keys);
    keys.sort(null);
    return keys;
  }

  private void collectKeys(final String folder, final List<String> into) {
    final var path = kvV2 ? mount + "/metadata/" + folder : mount + "/" + folder;
    final var request = request(path).method("LIST", HttpRequest.BodyPublishers.noBody()).build();
    final var response = send(request, folder);
    if (response.statusCode() == 404) {
      wipe(response);
      return;
    }

    for (final var entry : readJson(response, folder).path("data").path("keys")) {
      final var name = entry.asText();
      if (name.endsWith("/")) collectKeys(folder + name, into);
      else into.add(folder + name);
    }
  }

  @Override
  public BackendHealth healthCheck() {
    try {
      final var request =
          HttpRequest.newBuilder(endpoint("sys/health")).timeout(requestTimeout).GET().build();
      final var response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
      return HEALTHY_CODES.contains(response.statusCode())
          ? BackendHealth.HEALTHY
          : BackendHealth.UNREACHABLE;
    } catch (final IOException e) {
      LOGGER.log(DEBUG, "Health check for {0} failed: {1}", ref.key(), e.getMessage());
      return BackendHealth.UNREACHABLE;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return BackendHealth.UNREACHABLE;
    }
  }

  private HttpRequest.Builder request(final String path) {
    final var builder =
        HttpRequest.newBuilder(endpoint(path))
            .timeout(requestTimeout)
            .header(TOKEN_HEADER, token.get())
            .header("Accept", "application/json");
    ref.backendNamespace().ifPresent(ns -> builder.header(NAMESPACE_HEADER, ns));
    return builder;
  }

  private URI endpoint(final String path) {
    final var base = ref.server().orElseThrow().toString();
    return URI.create((base.endsWith("/") ? base : base + "/") + "v1/" + path);
  }

  /** Sends {@code request}, keeping the body as bytes so it can be wiped once parsed. */
  private HttpResponse<byte[]> send(final HttpRequest request, final String remoteKey) {
    final HttpResponse<byte[]> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (final IOException e) {
      throw SyncException.unreachable(
          "backend " + ref.key() + " unreachable reading " + remoteKey + ": " + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw SyncException.cancelled("interrupted reading " + remoteKey);
    }

    final var status = response.statusCode();
    if (status == 401 || status == 403 || status == 429 || status >= 500) wipe(response);
    if (status == 401 || status == 403)
      throw SyncException.authError(
          "backend " + ref.key() + " rejected credentials (HTTP " + status + ")", null);
    if (status == 429 || status >= 500)
      throw SyncException.unreachable(
          "backend " + ref.key() + " answered HTTP " + status + " for " + remoteKey, null);
    return response;
  }

  private JsonNode readJson(final HttpResponse<byte[]> response, final String remoteKey) {
    final var status = response.statusCode();
    try {
      if (status == 404)
        throw SyncException.notFound("key " + remoteKey + " not found in " + ref.key());
      if (status != 200)
        throw new SyncException(
            ErrorReason.INTERNAL,
            "unexpected HTTP " + status + " from " + ref.key() + " for " + remoteKey);
      return mapper.readTree(response.body());
    } catch (final IOException e) {
      throw new SyncException(
          ErrorReason.INTERNAL, "malformed response from " + ref.key() + " for " + remoteKey, e);
    } finally {
      wipe(response);
    }
  }

  private static void wipe(final HttpResponse<byte[]> response) {
    final var body = response.body();
    if (body != null) Arrays.fill(body, (byte) 0);
  }

  private static String normalizeFolder(final String prefix) {
    final var trimmed = prefix == null ? "" : trimSlashes(prefix);
    return trimmed.isEmpty() ? "" : trimmed + "/";
  }

  private static String trimSlashes(final String value) {
    var start = 0;
    var end = value.length();
    while (start < end && value.charAt(start) == '/') start++;
    while (end > start && value.charAt(end - 1) == '/') end--;
    return value.substring(start, end);
  }
}
