package com.example.secretsync.core.backend;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.SyncException;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.BackendKind;
import com.example.secretsync.core.model.BackendRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.SecretsManagerException;
import software.amazon.awssdk.services.secretsmanager.paginators.ListSecretsIterable;

class SecretsManagerBackendClientTest {

  private SecretsManagerClient sdk;
  private SecretsManagerBackendClient client;

  @BeforeEach
  void setup() {
    sdk = mock(SecretsManagerClient.class);
    client = new SecretsManagerBackendClient(ref("prod/"), sdk, new ObjectMapper());
  }

  private static BackendRef ref(final String prefix) {
    return BackendRef.builder()
        .name("aws")
        .namespace("payments")
        .kind(BackendKind.CLOUD_SECRETS_MANAGER)
        .pathPrefix(prefix)
        .build();
  }

  private static GetSecretValueResponse response(final String secretString) {
    return GetSecretValueResponse.builder().secretString(secretString).versionId("v1").build();
  }

  private static SecretsManagerException serviceError(final int status, final String code) {
    return (SecretsManagerException)
        SecretsManagerException.builder()
            .statusCode(status)
            .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).build())
            .message(code)
            .build();
  }

  @Nested
  @DisplayName("fetch")
  class Fetch {

    @Test
    @DisplayName("Should read the whole secret string under the path prefix")
    void shouldReadWholeSecret() {
      when(sdk.getSecretValue(any(GetSecretValueRequest.class))).thenReturn(response("plain"));

      try (final var value = client.fetch("db", null)) {
        assertEquals("plain", value.asString());
        assertEquals("v1", value.revision().orElseThrow());
      }
      final var captor = ArgumentCaptor.forClass(GetSecretValueRequest.class);
      verify(sdk).getSecretValue(captor.capture());
      assertEquals("prod/db", captor.getValue().secretId());
    }

    @Test
    @DisplayName("Should select a JSON property")
    void shouldSelectProperty() {
      when(sdk.getSecretValue(any(GetSecretValueRequest.class)))
          .thenReturn(response("{\"username\":\"admin\",\"port\":5432}"));

      assertEquals("admin", client.fetch("db", "username").asString());
      assertEquals("5432", client.fetch("db", "port").asString());
    }

    @Test
    @DisplayName("Should report a missing property as not found")
    void shouldReportMissingProperty() {
      when(sdk.getSecretValue(any(GetSecretValueRequest.class)))
          .thenReturn(response("{\"username\":\"admin\"}"));

      final var ex = assertThrows(SyncException.class, () -> client.fetch("db", "password"));
      assertEquals(ErrorReason.NOT_FOUND, ex.reason());
      assertFalse(ex.getMessage().contains("admin"));
    }

    @Test
    @DisplayName("Should report a property lookup on a non-JSON secret as not found")
    void shouldRejectPropertyOnPlainSecret() {
      when(sdk.getSecretValue(any(GetSecretValueRequest.class))).thenReturn(response("plain"));

      final var ex = assertThrows(SyncException.class, () -> client.fetch("db", "password"));
      assertEquals(ErrorReason.NOT_FOUND, ex.reason());
    }

    @Test
    @DisplayName("Should return binary secrets as raw bytes")
    void shouldReturnBinarySecret() {
      when(sdk.getSecretValue(any(GetSecretValueRequest.class)))
          .thenReturn(
              GetSecretValueResponse.builder()
                  .secretBinary(SdkBytes.fromUtf8String("raw"))
                  .versionId("v2")
                  .build());

      try (final var value = client.fetch("cert", null)) {
        assertArrayEquals("raw".getBytes(StandardCharsets.UTF_8), value.bytes());
      }
      assertEquals(
          ErrorReason.NOT_FOUND,
          assertThrows(SyncException.class, () -> client.fetch("cert", "field")).reason());
    }
  }

  @Nested
  @DisplayName("Error translation")
  class Translation {

    private ErrorReason reasonFor(final RuntimeException failure) {
      doThrow(failure).when(sdk).getSecretValue(any(GetSecretValueRequest.class));
      return assertThrows(SyncException.class, () -> client.fetch("db", null)).reason();
    }

    @Test
    @DisplayName("Should map a missing secret to NOT_FOUND")
    void shouldMapNotFound() {
      assertEquals(
          ErrorReason.NOT_FOUND,
          reasonFor(ResourceNotFoundException.builder().message("missing").build()));
    }

    @Test
    @DisplayName("Should map denied access to AUTH_ERROR")
    void shouldMapAuthError() {
      assertEquals(ErrorReason.AUTH_ERROR, reasonFor(serviceError(400, "AccessDeniedException")));
      assertEquals(ErrorReason.AUTH_ERROR, reasonFor(serviceError(403, "Forbidden")));
    }

    @Test
    @DisplayName("Should map throttling, server errors and client failures to UNREACHABLE")
    void shouldMapUnreachable() {
      assertEquals(ErrorReason.UNREACHABLE, reasonFor(serviceError(503, "ServiceUnavailable")));
      assertEquals(ErrorReason.UNREACHABLE, reasonFor(serviceError(429, "Throttling")));
      assertEquals(
          ErrorReason.UNREACHABLE, reasonFor(SdkClientException.create("connection refused")));
    }

    @Test
    @DisplayName("Should map other rejections to INTERNAL")
    void shouldMapOtherErrors() {
      assertEquals(
          ErrorReason.INTERNAL, reasonFor(serviceError(400, "InvalidRequestException")));
    }
  }

  @Test
  @DisplayName("listKeys filters by prefix and strips the backend prefix")
  void shouldListKeys() {
    when(sdk.listSecretsPaginator(any(ListSecretsRequest.class)))
        .thenAnswer(inv -> new ListSecretsIterable(sdk, inv.getArgument(0)));
    when(sdk.listSecrets(any(ListSecretsRequest.class)))
        .thenReturn(
            ListSecretsResponse.builder()
                .secretList(
                    SecretListEntry.builder().name("prod/app/b").build(),
                    SecretListEntry.builder().name("prod/app/a").build(),
                    SecretListEntry.builder().name("other/prod/app/c").build())
                .build());

    assertEquals(List.of("app/a", "app/b"), client.listKeys("app/"));

    final var captor = ArgumentCaptor.forClass(ListSecretsRequest.class);
    verify(sdk).listSecrets(captor.capture());
    assertEquals(List.of("prod/app/"), captor.getValue().filters().get(0).values());
  }

  @Test
  @DisplayName("listKeys follows every page of the listing")
  void shouldListKeysAcrossPages() {
    when(sdk.listSecretsPaginator(any(ListSecretsRequest.class)))
        .thenAnswer(inv -> new ListSecretsIterable(sdk, inv.getArgument(0)));
    when(sdk.listSecrets(any(ListSecretsRequest.class)))
        .thenReturn(
            ListSecretsResponse.builder()
                .secretList(SecretListEntry.builder().name("prod/app/b").build())
                .nextToken("page-2")
                .build(),
            ListSecretsResponse.builder()
                .secretList(SecretListEntry.builder().name("prod/app/a").build())
                .build());

    assertEquals(List.of("app/a", "app/b"), client.listKeys("app/"));

    final var captor = ArgumentCaptor.forClass(ListSecretsRequest.class);
    verify(sdk, times(2)).listSecrets(captor.capture());
    assertEquals("page-2", captor.getAllValues().get(1).nextToken());
  }

  @Test
  @DisplayName("healthCheck reports reachability of ListSecrets")
  void shouldCheckHealth() {
    when(sdk.listSecrets(any(ListSecretsRequest.class)))
        .thenReturn(ListSecretsResponse.builder().build())
        .thenThrow(SdkClientException.create("down"));

    assertEquals(BackendHealth.HEALTHY, client.healthCheck());
    assertEquals(BackendHealth.UNREACHABLE, client.healthCheck());
  }

  @Test
  @DisplayName("close closes the SDK client")
  void shouldCloseSdkClient() {
    client.close();
    verify(sdk).close();
  }

  @Test
  @DisplayName("buildClient honors backend parameters")
  void buildClientHonorsParameters() {
    final var ref =
        BackendRef.builder()
            .name("aws")
            .kind(BackendKind.CLOUD_SECRETS_MANAGER)
            .parameter("region", "eu-west-1")
            .parameter("endpoint", "http://localhost:4566")
            .parameter("accessKeyId", "test")
            .parameter("secretAccessKey", "test")
            .build();
    try (final var built = SecretsManagerBackendClient.buildClient(ref, Duration.ofSeconds(2))) {
      assertEquals("eu-west-1", built.serviceClientConfiguration().region().id());
    }
  }
}
