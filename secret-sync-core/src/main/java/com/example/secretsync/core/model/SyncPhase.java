package com.example.secretsync.core.model;

/**
 * Steps of a single reconciliation pass. A pass walks them in declaration order and may drop to
 * {@link #ERROR} from any step.
 */
public enum SyncPhase {
  PENDING,
  FETCHING,
  RENDERING,
  DIFFING,
  APPLYING,
  SYNCED,
  ERROR
}
