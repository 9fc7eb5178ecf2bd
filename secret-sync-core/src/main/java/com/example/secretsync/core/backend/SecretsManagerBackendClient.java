package com.example.secretsync.core.backend;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.SyncException;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.BackendKind;
import com.example.secretsync.core.model.BackendRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.Filter;
import software.amazon.awssdk.services.secretsmanager.model.FilterNameStringType;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.SecretsManagerException;

/**
 * {@link BackendClient} for AWS Secrets Manager.
 *
 * <p>The backend's path prefix is prepended to every secret name. Client configuration is read
 * from the backend parameters first, then system properties or environment variables:
 *
 * <ul>
 *   <li>{@code region} / aws.region / AWS_REGION (default us-east-1)
 *   <li>server URI or {@code endpoint} / aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>{@code accessKeyId} + {@code secretAccessKey} / aws.accessKeyId + aws.secretAccessKey /
 *       AWS_ACCESS_KEY_ID + AWS_SECRET_ACCESS_KEY, else the default provider chain
 * </ul>
 */
public final class SecretsManagerBackendClient implements BackendClient {

  private static final System.Logger LOGGER =
      System.getLogger(SecretsManagerBackendClient.class.getName());

  private static final Set<String> AUTH_ERROR_CODES =
      Set.of(
          "AccessDeniedException",
          "UnrecognizedClientException",
          "InvalidSignatureException",
          "ExpiredTokenException",
          "InvalidClientTokenId");

  private final BackendRef ref;
  private final SecretsManagerClient client;
  private final ObjectMapper mapper;

  public SecretsManagerBackendClient(
      final BackendRef ref, final SecretsManagerClient client, final ObjectMapper mapper) {
    if (ref.kind() != BackendKind.CLOUD_SECRETS_MANAGER)
      throw new IllegalArgumentException("not a Secrets Manager backend: " + ref);
    this.ref = ref;
    this.client = client;
    this.mapper = mapper;
  }

  /**
   * Factory building one SDK client per backend.
   *
   * @param apiCallTimeout timeout applied to every API call, retries included
   * @return factory for Secrets Manager backends
   */
  public static BackendClientFactory factory(final Duration apiCallTimeout) {
    final var mapper = new ObjectMapper();
    return ref -> new SecretsManagerBackendClient(ref, buildClient(ref, apiCallTimeout), mapper);
  }

  /**
   * Builds the {@link SecretsManagerClient} honoring region, endpoint and credentials overrides.
   *
   * @return configured {@link SecretsManagerClient}
   */
  static SecretsManagerClient buildClient(final BackendRef ref, final Duration apiCallTimeout) {
    final var builder = SecretsManagerClient.builder();

    final var region =
        ref.parameter("region")
            .or(() -> Optional.ofNullable(System.getProperty("aws.region")))
            .or(() -> Optional.ofNullable(System.getenv("AWS_REGION")))
            .map(Region::of)
            .orElse(Region.US_EAST_1);
    builder.region(region);

    ref.server()
        .or(() -> ref.parameter("endpoint").map(URI::create))
        .or(() -> Optional.ofNullable(System.getProperty("aws.sm.endpoint")).map(URI::create))
        .or(() -> Optional.ofNullable(System.getenv("AWS_SM_ENDPOINT")).map(URI::create))
        .ifPresent(builder::endpointOverride);

    ref.parameter("accessKeyId")
        .or(() -> Optional.ofNullable(System.getProperty("aws.accessKeyId")))
        .or(() -> Optional.ofNullable(System.getenv("AWS_ACCESS_KEY_ID")))
        .flatMap(
            accessKey ->
                ref.parameter("secretAccessKey")
                    .or(() -> Optional.ofNullable(System.getProperty("aws.secretAccessKey")))
                    .or(() -> Optional.ofNullable(System.getenv("AWS_SECRET_ACCESS_KEY")))
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.create()));

    builder.overrideConfiguration(c -> c.apiCallTimeout(apiCallTimeout));
    return builder.build();
  }

  @Override
  public BackendRef ref() {
    return ref;
  }

  @Override
  public ResolvedSecretValue fetch(final String remoteKey, final String property) {
    final var secretId = ref.pathPrefix() + remoteKey;
    final GetSecretValueResponse response;
    try {
      response =
          client.getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build());
    } catch (final SdkException e) {
      throw translate(e, secretId);
    }

    if (response.secretString() == null) {
      if (response.secretBinary() == null)
        throw SyncException.notFound("secret " + secretId + " has no value");
      if (property != null)
        throw SyncException.notFound(
            "property " + property + " requested from binary secret " + secretId);
      return new ResolvedSecretValue(
          remoteKey, null, response.secretBinary().asByteArray(), response.versionId());
    }

    if (property == null)
      return ResolvedSecretValue.ofString(
          remoteKey, null, response.secretString(), response.versionId());

    try {
      final var root = mapper.readTree(response.secretString());
      final var selected =
          JsonValues.select(root, property)
              .orElseThrow(
                  () ->
                      SyncException.notFound(
                          "property " + property + " not found in secret " + secretId));
      return new ResolvedSecretValue(
          remoteKey, property, JsonValues.toBytes(selected), response.versionId());
    } catch (final JsonProcessingException e) {
      throw SyncException.notFound(
          "secret " + secretId + " is not JSON, cannot read property " + property);
    }
  }

  @Override
  public List<String> listKeys(final String prefix) {
    final var fullPrefix = ref.pathPrefix() + (prefix == null ? "" : prefix);
    final var request = ListSecretsRequest.builder();
    if (!fullPrefix.isEmpty())
      request.filters(Filter.builder().key(FilterNameStringType.NAME).values(fullPrefix).build());
    try {
      return client.listSecretsPaginator(request.build()).stream()
          .flatMap(page -> page.secretList().stream())
          .map(SecretListEntry::name)
          .filter(name -> name.startsWith(fullPrefix))
          .map(name -> name.substring(ref.pathPrefix().length()))
          .sorted()
          .toList();
    } catch (final SdkException e) {
      throw translate(e, fullPrefix);
    }
  }

  @Override
  public BackendHealth healthCheck() {
    try {
      client.listSecrets(ListSecretsRequest.builder().maxResults(1).build());
      return BackendHealth.HEALTHY;
    } catch (final SdkException e) {
      LOGGER.log(DEBUG, "Health check for {0} failed: {1}", ref.key(), e.getMessage());
      return BackendHealth.UNREACHABLE;
    }
  }

  @Override
  public void close() {
    client.close();
  }

  static SyncException translate(final SdkException e, final String secretId) {
    if (e instanceof ResourceNotFoundException)
      return SyncException.notFound("secret " + secretId + " not found");

    if (e instanceof SecretsManagerException sm) {
      final var code = sm.awsErrorDetails() == null ? null : sm.awsErrorDetails().errorCode();
      if (sm.statusCode() == 401 || sm.statusCode() == 403 || AUTH_ERROR_CODES.contains(code))
        return SyncException.authError(
            "access to "
                + secretId
                + " denied ("
                + Optional.ofNullable(code).orElse("HTTP " + sm.statusCode())
                + ")",
            e);
      if (sm.statusCode() >= 500 || sm.statusCode() == 429)
        return SyncException.unreachable(
            "Secrets Manager answered HTTP " + sm.statusCode() + " for " + secretId, e);
      return new SyncException(
          ErrorReason.INTERNAL, "Secrets Manager rejected request for " + secretId, e);
    }

    if (e instanceof SdkClientException)
      return SyncException.unreachable(
          "Secrets Manager unreachable reading " + secretId + ": " + e.getMessage(), e);

    return SyncException.from(e);
  }
}
