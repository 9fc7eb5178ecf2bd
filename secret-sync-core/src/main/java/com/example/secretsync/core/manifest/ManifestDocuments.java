package com.example.secretsync.core.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/** Jackson bindings for the manifest documents. Unknown fields are ignored. */
final class ManifestDocuments {

  private ManifestDocuments() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Document(String apiVersion, String kind, Metadata metadata, JsonNode spec) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Metadata(String name, String namespace) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record StoreSpec(Provider provider, Map<String, String> parameters) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Provider(VaultProvider vault, AwsProvider aws) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record VaultProvider(
      String server, String path, String version, String namespace, VaultAuth auth) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record VaultAuth(String token, String tokenEnv) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record AwsProvider(
      String service, String region, String endpoint, String prefix, AwsAuth auth) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record AwsAuth(String accessKeyId, String secretAccessKey) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ExternalSecretSpec(
      String refreshInterval,
      StoreRef secretStoreRef,
      Target target,
      List<DataEntry> data,
      List<DataFromEntry> dataFrom) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record StoreRef(String name, String kind) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Target(
      String name, String creationPolicy, String deletionPolicy, TemplateSpec template) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TemplateSpec(String type, Map<String, String> data) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record DataEntry(String secretKey, RemoteRef remoteRef) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RemoteRef(String key, String property) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record DataFromEntry(RemoteRef extract, FindSpec find) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record FindSpec(String path) {}
}
