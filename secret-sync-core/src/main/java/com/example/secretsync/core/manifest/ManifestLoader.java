package com.example.secretsync.core.manifest;

import static java.lang.System.Logger.Level.INFO;

import com.example.secretsync.core.manifest.ManifestDocuments.AwsProvider;
import com.example.secretsync.core.manifest.ManifestDocuments.Document;
import com.example.secretsync.core.manifest.ManifestDocuments.ExternalSecretSpec;
import com.example.secretsync.core.manifest.ManifestDocuments.StoreSpec;
import com.example.secretsync.core.manifest.ManifestDocuments.VaultProvider;
import com.example.secretsync.core.model.BackendKind;
import com.example.secretsync.core.model.BackendRef;
import com.example.secretsync.core.model.BackendSelector;
import com.example.secretsync.core.model.BulkSource;
import com.example.secretsync.core.model.CreationPolicy;
import com.example.secretsync.core.model.SecretDescriptor;
import com.example.secretsync.core.model.SecretIdentity;
import com.example.secretsync.core.model.SecretTemplate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads backends and descriptors from multi-document YAML in the external-secrets format.
 *
 * <p>Supported kinds are {@code SecretStore}, {@code ClusterSecretStore} and {@code
 * ExternalSecret}; documents of any other kind are skipped. For example:
 *
 * <pre>{@code
 * kind: ClusterSecretStore
 * metadata:
 *   name: vault
 * spec:
 *   provider:
 *     vault:
 *       server: http://vault:8200
 *       path: secret
 *       version: v2
 * ---
 * kind: ExternalSecret
 * metadata:
 *   name: db-credentials
 *   namespace: payments
 * spec:
 *   refreshInterval: 15s
 *   secretStoreRef:
 *     name: vault
 *     kind: ClusterSecretStore
 *   target:
 *     creationPolicy: Owner
 *   data:
 *     - secretKey: username
 *       remoteRef: {key: database/postgres, property: username}
 * }</pre>
 *
 * <p>Creation policies are {@code Owner}, {@code Merge}, {@code None} and {@code Orphan}; the
 * latter creates and owns the object but leaves it in place when the descriptor goes away, as does
 * {@code deletionPolicy: Retain}.
 */
public final class ManifestLoader {

  private static final System.Logger LOGGER = System.getLogger(ManifestLoader.class.getName());

  public static final String SECRET_STORE = "SecretStore";
  public static final String CLUSTER_SECRET_STORE = "ClusterSecretStore";
  public static final String EXTERNAL_SECRET = "ExternalSecret";

  private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

  private final String defaultNamespace;

  public ManifestLoader() {
    this("default");
  }

  /**
   * @param defaultNamespace namespace of namespaced documents that do not declare one
   */
  public ManifestLoader(final String defaultNamespace) {
    if (defaultNamespace == null || defaultNamespace.isBlank())
      throw new IllegalArgumentException("defaultNamespace is required");
    this.defaultNamespace = defaultNamespace;
  }

  /**
   * Loads a manifest file.
   *
   * @throws ManifestException if the file cannot be read or a document is invalid
   */
  public Manifests load(final Path path) {
    try (var reader = Files.newBufferedReader(path)) {
      return read(reader, path.toString());
    } catch (final IOException e) {
      throw new ManifestException("cannot read manifests from " + path, e);
    }
  }

  /**
   * Loads manifests from every {@code .yaml}/{@code .yml} file of a directory, in file name order.
   *
   * @throws ManifestException if a file cannot be read or a document is invalid
   */
  public Manifests loadDirectory(final Path directory) {
    final List<Path> files;
    try (var listing = Files.list(directory)) {
      files = listing.filter(ManifestLoader::isYaml).sorted().toList();
    } catch (final IOException e) {
      throw new ManifestException("cannot list manifests in " + directory, e);
    }

    final var backends = new ArrayList<BackendRef>();
    final var descriptors = new ArrayList<SecretDescriptor>();
    for (final var file : files) {
      final var manifests = load(file);
      backends.addAll(manifests.backends());
      descriptors.addAll(manifests.descriptors());
    }
    return validated(new Manifests(backends, descriptors), directory.toString());
  }

  /** Reads manifests from YAML text. */
  public Manifests parse(final String yaml) {
    try (var reader = new StringReader(yaml)) {
      return read(reader, "<inline>");
    } catch (final IOException e) {
      throw new ManifestException("cannot parse manifests", e);
    }
  }

  static boolean isYaml(final Path file) {
    final var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    return Files.isRegularFile(file) && (name.endsWith(".yaml") || name.endsWith(".yml"));
  }

  private Manifests read(final Reader reader, final String source) throws IOException {
    final var backends = new ArrayList<BackendRef>();
    final var descriptors = new ArrayList<SecretDescriptor>();

    try (var documents = MAPPER.readerFor(JsonNode.class).<JsonNode>readValues(reader)) {
      var index = 0;
      while (documents.hasNextValue()) {
        final var node = documents.nextValue();
        index++;
        if (node == null || node.isNull() || node.isMissingNode() || node.isEmpty()) continue;

        final var where = source + " document " + index;
        try {
          final var document = MAPPER.treeToValue(node, Document.class);
          final var kind = Optional.ofNullable(document.kind()).orElse("");
          switch (kind) {
            case SECRET_STORE -> backends.add(backend(document, false));
            case CLUSTER_SECRET_STORE -> backends.add(backend(document, true));
            case EXTERNAL_SECRET -> descriptors.add(descriptor(document));
            default -> LOGGER.log(INFO, "Skipping {0}: unsupported kind ''{1}''", where, kind);
          }
        } catch (final IOException | RuntimeException e) {
          throw new ManifestException(where + ": " + e.getMessage(), e);
        }
      }
    }
    return validated(new Manifests(backends, descriptors), source);
  }

  private static Manifests validated(final Manifests manifests, final String source) {
    final var backendKeys = new HashSet<String>();
    for (final var backend : manifests.backends())
      if (!backendKeys.add(backend.key()))
        throw new ManifestException(source + ": backend " + backend.key() + " declared twice");

    final var identities = new HashSet<SecretIdentity>();
    for (final var descriptor : manifests.descriptors())
      if (!identities.add(descriptor.identity()))
        throw new ManifestException(
            source + ": secret " + descriptor.identity() + " declared twice");
    return manifests;
  }

  private BackendRef backend(final Document document, final boolean clusterScoped)
      throws IOException {
    final var name = metadataName(document);
    final var spec = MAPPER.treeToValue(document.spec(), StoreSpec.class);
    if (spec == null || spec.provider() == null)
      throw new ManifestException("store " + name + " has no spec.provider");

    final var builder = BackendRef.builder().name(name);
    if (!clusterScoped) builder.namespace(namespaceOf(document));

    final var vault = spec.provider().vault();
    final var aws = spec.provider().aws();
    if ((vault == null) == (aws == null))
      throw new ManifestException("store " + name + " must declare exactly one provider");
    if (vault != null) vault(builder, vault);
    else aws(builder, aws, name);

    if (spec.parameters() != null) builder.parameters(spec.parameters());
    return builder.build();
  }

  private static void vault(final BackendRef.Builder builder, final VaultProvider vault) {
    builder
        .kind(BackendKind.VAULT_LIKE)
        .server(URI.create(required(vault.server(), "spec.provider.vault.server")))
        .pathPrefix(Optional.ofNullable(vault.path()).orElse("secret"))
        .backendNamespace(vault.namespace())
        .authMethod(BackendRef.AUTH_TOKEN)
        .parameter("version", vault.version());
    if (vault.auth() != null)
      builder
          .parameter("token", vault.auth().token())
          .parameter("tokenEnv", vault.auth().tokenEnv());
  }

  private static void aws(
      final BackendRef.Builder builder, final AwsProvider aws, final String name) {
    if (aws.service() != null && !aws.service().equals("SecretsManager"))
      throw new ManifestException(
          "store " + name + ": unsupported AWS service '" + aws.service() + "'");
    builder
        .kind(BackendKind.CLOUD_SECRETS_MANAGER)
        .pathPrefix(Optional.ofNullable(aws.prefix()).orElse(""))
        .parameter("region", aws.region())
        .parameter("endpoint", aws.endpoint());
    if (aws.auth() != null)
      builder
          .authMethod("static")
          .parameter("accessKeyId", aws.auth().accessKeyId())
          .parameter("secretAccessKey", aws.auth().secretAccessKey());
  }

  private SecretDescriptor descriptor(final Document document) throws IOException {
    final var metadataName = metadataName(document);
    final var spec = MAPPER.treeToValue(document.spec(), ExternalSecretSpec.class);
    if (spec == null) throw new ManifestException("secret " + metadataName + " has no spec");

    final var storeRef = spec.secretStoreRef();
    if (storeRef == null)
      throw new ManifestException("secret " + metadataName + " has no spec.secretStoreRef");
    final var storeName = required(storeRef.name(), "spec.secretStoreRef.name");
    final var storeKind = Optional.ofNullable(storeRef.kind()).orElse(SECRET_STORE);
    final BackendSelector selector;
    if (storeKind.equals(CLUSTER_SECRET_STORE)) selector = BackendSelector.cluster(storeName);
    else if (storeKind.equals(SECRET_STORE)) selector = BackendSelector.namespaced(storeName);
    else throw new ManifestException("unknown secretStoreRef.kind '" + storeKind + "'");

    final var target = spec.target();
    final var name =
        Optional.ofNullable(target)
            .map(ManifestDocuments.Target::name)
            .filter(n -> !n.isBlank())
            .orElse(metadataName);

    final var builder =
        SecretDescriptor.builder()
            .identity(SecretIdentity.of(namespaceOf(document), name))
            .backend(selector);

    if (spec.refreshInterval() != null)
      builder.refreshInterval(Durations.parse(spec.refreshInterval()));

    if (spec.data() != null)
      for (final var entry : spec.data()) {
        if (entry.remoteRef() == null)
          throw new ManifestException("data entry " + entry.secretKey() + " has no remoteRef");
        builder.mapping(entry.secretKey(), entry.remoteRef().key(), entry.remoteRef().property());
      }

    if (spec.dataFrom() != null)
      for (final var entry : spec.dataFrom()) {
        if ((entry.extract() == null) == (entry.find() == null))
          throw new ManifestException("dataFrom entries need exactly one of extract or find");
        if (entry.extract() != null)
          builder.bulkSource(BulkSource.extract(required(entry.extract().key(), "extract.key")));
        else
          builder.bulkSource(
              BulkSource.find(Optional.ofNullable(entry.find().path()).orElse("")));
      }

    if (target != null) {
      policies(builder, target.creationPolicy(), target.deletionPolicy());
      if (target.template() != null)
        builder.template(new SecretTemplate(target.template().type(), target.template().data()));
    }
    return builder.build();
  }

  private static void policies(
      final SecretDescriptor.Builder builder,
      final String creationPolicy,
      final String deletionPolicy) {
    var deleteOnRemoval = true;
    switch (Optional.ofNullable(creationPolicy).orElse("Owner")) {
      case "Owner" -> builder.creationPolicy(CreationPolicy.OWNER);
      case "Merge" -> builder.creationPolicy(CreationPolicy.MERGE);
      case "None" -> builder.creationPolicy(CreationPolicy.NONE);
      case "Orphan" -> {
        builder.creationPolicy(CreationPolicy.OWNER);
        deleteOnRemoval = false;
      }
      default -> throw new ManifestException("unknown creationPolicy '" + creationPolicy + "'");
    }
    switch (Optional.ofNullable(deletionPolicy).orElse("Delete")) {
      case "Delete" -> {}
      case "Retain" -> deleteOnRemoval = false;
      default -> throw new ManifestException("unknown deletionPolicy '" + deletionPolicy + "'");
    }
    builder.deleteOnRemoval(deleteOnRemoval);
  }

  private static String metadataName(final Document document) {
    return required(
        document.metadata() == null ? null : document.metadata().name(), "metadata.name");
  }

  private String namespaceOf(final Document document) {
    return Optional.ofNullable(document.metadata())
        .map(ManifestDocuments.Metadata::namespace)
        .filter(ns -> !ns.isBlank())
        .orElse(defaultNamespace);
  }

  private static String required(final String value, final String field) {
    if (value == null || value.isBlank()) throw new ManifestException(field + " is required");
    return value;
  }
}
