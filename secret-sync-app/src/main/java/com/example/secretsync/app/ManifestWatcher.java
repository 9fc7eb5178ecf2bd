package com.example.secretsync.app;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsync.core.manifest.ManifestException;
import com.example.secretsync.core.manifest.ManifestLoader;
import com.example.secretsync.core.manifest.Manifests;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchService;
import java.util.function.Consumer;

/**
 * Reloads manifests when the watched file, or any YAML file in the watched directory, changes.
 *
 * <p>An invalid manifest set is logged and ignored; the last applied configuration stays active.
 */
public final class ManifestWatcher implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(ManifestWatcher.class.getName());

  private final Path path;
  private final ManifestLoader loader;
  private final Consumer<Manifests> onChange;
  private final WatchService watchService;
  private final Thread thread;

  public ManifestWatcher(
      final Path path, final ManifestLoader loader, final Consumer<Manifests> onChange)
      throws IOException {
    this.path = path.toAbsolutePath();
    this.loader = loader;
    this.onChange = onChange;
    this.watchService = FileSystems.getDefault().newWatchService();
    final var directory = Files.isDirectory(this.path) ? this.path : this.path.getParent();
    directory.register(
        watchService,
        StandardWatchEventKinds.ENTRY_CREATE,
        StandardWatchEventKinds.ENTRY_MODIFY,
        StandardWatchEventKinds.ENTRY_DELETE);
    this.thread = new Thread(this::watch, "secret-sync-manifest-watcher");
    thread.setDaemon(true);
  }

  /** Loads the manifests at the watched path. */
  public Manifests load() {
    return Files.isDirectory(path) ? loader.loadDirectory(path) : loader.load(path);
  }

  public void start() {
    thread.start();
    LOGGER.log(INFO, "Watching {0} for manifest changes", path);
  }

  private void watch() {
    try {
      while (true) {
        final var key = watchService.take();
        var relevant = false;
        for (final var event : key.pollEvents()) {
          if (event.context() instanceof Path changed) relevant |= isRelevant(changed);
        }
        key.reset();
        if (relevant) reload();
      }
    } catch (final ClosedWatchServiceException e) {
      LOGGER.log(DEBUG, "Manifest watcher closed");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private boolean isRelevant(final Path changed) {
    if (Files.isDirectory(path)) {
      final var name = changed.getFileName().toString();
      return name.endsWith(".yaml") || name.endsWith(".yml");
    }
    return changed.getFileName().equals(path.getFileName());
  }

  void reload() {
    try {
      onChange.accept(load());
    } catch (final ManifestException e) {
      LOGGER.log(WARNING, "Ignoring invalid manifests at " + path + ": " + e.getMessage());
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Failed to apply manifests from " + path, e);
    }
  }

  @Override
  public void close() throws IOException {
    watchService.close();
  }
}
