package com.example.secretsync.app;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsync.core.SecretSyncController;
import com.example.secretsync.core.manifest.ManifestLoader;
import com.example.secretsync.core.metrics.SyncMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;

/** Runs the controller: loads manifests, starts passes and serves metrics and status. */
public final class Main {

  private static final System.Logger LOGGER = System.getLogger(Main.class.getName());

  private Main() {}

  public static void main(final String[] args) throws IOException, InterruptedException {
    configureLogging();
    final var settings = ControllerSettings.load();

    final var prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    final var controller =
        SecretSyncController.builder()
            .metrics(new SyncMetrics(prometheus))
            .workers(settings.workers())
            .backendPermits(settings.backendPermits())
            .callTimeout(settings.callTimeout())
            .passTimeout(settings.passTimeout())
            .minRefreshInterval(settings.minRefreshInterval())
            .healthCheckInterval(settings.healthCheckInterval())
            .build();

    final var loader = new ManifestLoader(settings.defaultNamespace());
    ManifestWatcher watcher = null;
    if (settings.manifests().isPresent()) {
      watcher = new ManifestWatcher(settings.manifests().get(), loader, controller::apply);
      controller.apply(watcher.load());
    } else {
      LOGGER.log(INFO, "No manifests configured, set secretsync.manifests or SECRETSYNC_MANIFESTS");
    }

    controller.start();
    if (watcher != null) watcher.start();
    final var server = new ControllerHttpServer(controller, prometheus, settings.httpPort());
    server.start();

    final var stopped = new CountDownLatch(1);
    final var manifestWatcher = watcher;
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  server.close();
                  closeWatcher(manifestWatcher);
                  controller.shutdown();
                  stopped.countDown();
                },
                "secret-sync-shutdown"));
    stopped.await();
  }

  private static void closeWatcher(final ManifestWatcher watcher) {
    if (watcher == null) return;
    try {
      watcher.close();
    } catch (final IOException e) {
      LOGGER.log(WARNING, "Failed to close manifest watcher", e);
    }
  }

  /** Installs the bundled JUL configuration unless one was given on the command line. */
  static void configureLogging() throws IOException {
    if (System.getProperty("java.util.logging.config.file") != null) return;
    try (var in = Main.class.getResourceAsStream("/logging.properties")) {
      if (in != null) LogManager.getLogManager().readConfiguration(in);
    }
  }
}
