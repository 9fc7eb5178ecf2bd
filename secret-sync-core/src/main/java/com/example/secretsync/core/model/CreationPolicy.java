package com.example.secretsync.core.model;

/** Governs whether the controller may create, merge into, or must never create the destination. */
public enum CreationPolicy {
  /** Create the object and claim it; refuse to write into objects owned by someone else. */
  OWNER,
  /** Write only the descriptor's fields into whatever object exists, creating it if absent. */
  MERGE,
  /** Never create; an absent object is an error. */
  NONE
}
