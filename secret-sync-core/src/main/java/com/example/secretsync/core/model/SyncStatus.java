package com.example.secretsync.core.model;

public enum SyncStatus {
  PENDING,
  SYNCED,
  ERROR
}
