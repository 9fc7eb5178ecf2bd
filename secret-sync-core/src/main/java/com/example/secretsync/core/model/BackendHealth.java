package com.example.secretsync.core.model;

/** Last known reachability of a backend. */
public enum BackendHealth {
  UNKNOWN,
  HEALTHY,
  UNREACHABLE
}
