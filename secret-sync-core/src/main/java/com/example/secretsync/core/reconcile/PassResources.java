package com.example.secretsync.core.reconcile;

import com.example.secretsync.core.backend.ResolvedSecretValue;
import com.example.secretsync.core.store.RenderedPayload;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Owns every secret buffer a pass creates and zeroes all of them when the pass ends, whether it
 * succeeded or not.
 *
 * <p>Values tracked after {@link #close()} (a fetch that completes after its pass was abandoned)
 * are released immediately.
 */
final class PassResources implements AutoCloseable {

  private final List<ResolvedSecretValue> values = new ArrayList<>();
  private final List<RenderedPayload> payloads = new ArrayList<>();
  private final List<byte[]> buffers = new ArrayList<>();
  private boolean closed;

  synchronized ResolvedSecretValue track(final ResolvedSecretValue value) {
    if (closed) value.close();
    else values.add(value);
    return value;
  }

  synchronized RenderedPayload track(final RenderedPayload payload) {
    if (closed) payload.close();
    else payloads.add(payload);
    return payload;
  }

  synchronized byte[] track(final byte[] buffer) {
    if (closed) Arrays.fill(buffer, (byte) 0);
    else buffers.add(buffer);
    return buffer;
  }

  @Override
  public synchronized void close() {
    closed = true;
    values.forEach(ResolvedSecretValue::close);
    payloads.forEach(RenderedPayload::close);
    buffers.forEach(buffer -> Arrays.fill(buffer, (byte) 0));
    values.clear();
    payloads.clear();
    buffers.clear();
  }
}
