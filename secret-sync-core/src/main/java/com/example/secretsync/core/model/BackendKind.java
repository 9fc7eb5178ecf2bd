package com.example.secretsync.core.model;

/** Kinds of external secret sources a {@link BackendRef} can point at. */
public enum BackendKind {
  /** KV secret engine reachable over the Vault HTTP API. */
  VAULT_LIKE,
  /** AWS Secrets Manager. */
  CLOUD_SECRETS_MANAGER
}
