/**
 * Root package of the secret-sync library.
 *
 * <p>The library mirrors credentials from external secret backends into a local key-value secret
 * store and keeps them current on a schedule.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.secretsync.core.SecretSyncController}: wires everything below and
 *       applies manifest sets.
 *   <li>{@link com.example.secretsync.core.model}: backends, descriptors and their status.
 *   <li>{@link com.example.secretsync.core.backend}: one client per backend kind (Vault-compatible
 *       KV, AWS Secrets Manager) plus the per-backend concurrency limiter.
 *   <li>{@link com.example.secretsync.core.store}: destination store contract and in-memory store.
 *   <li>{@link com.example.secretsync.core.template.TemplateRenderer}: {@code {{ .field }}}
 *       templates.
 *   <li>{@link com.example.secretsync.core.registry.DescriptorRegistry}: desired state index.
 *   <li>{@link com.example.secretsync.core.reconcile.ReconciliationEngine}: fetch, render, diff and
 *       apply for one descriptor.
 *   <li>{@link com.example.secretsync.core.schedule.ReconcileScheduler}: timers, worker pool and
 *       coalescing.
 *   <li>{@link com.example.secretsync.core.manifest.ManifestLoader}: YAML manifests.
 *   <li>{@link com.example.secretsync.core.metrics.SyncMetrics}: Micrometer meters.
 * </ul>
 */
package com.example.secretsync.core;
