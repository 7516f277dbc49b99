package com.mk.fx.qa.traffic.generator.reload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.traffic.generator.rest.JsonUtil;
import com.mk.fx.qa.traffic.generator.service.TrafficGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Watches a JSON override file and pushes its contents into a running {@link TrafficGenerator}
 * whenever the file's modification time changes. An unreadable or invalid file is logged and the
 * running configuration is kept.
 */
@Slf4j
public class ConfigFileWatcher implements AutoCloseable {

  private final Path file;
  private final Duration pollInterval;
  private final TrafficGenerator generator;
  private ScheduledExecutorService poller;
  private volatile FileTime lastSeen;

  public ConfigFileWatcher(Path file, Duration pollInterval, TrafficGenerator generator) {
    this.file = Objects.requireNonNull(file, "file");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.generator = Objects.requireNonNull(generator, "generator");
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
  }

  /** Applies the file once if it already exists, then polls it in the background. */
  public synchronized void start() {
    if (poller != null) {
      return;
    }
    poll();
    poller =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("traffic-config-watcher");
              t.setDaemon(true);
              return t;
            });
    long millis = pollInterval.toMillis();
    poller.scheduleWithFixedDelay(this::poll, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Watching {} for configuration changes every {}ms", file, millis);
  }

  /** Reloads if the file changed since the last successful check. */
  @VisibleForTesting
  void poll() {
    try {
      var modified = Files.getLastModifiedTime(file);
      if (modified.equals(lastSeen)) {
        return;
      }
      lastSeen = modified;
      reload();
    } catch (NoSuchFileException e) {
      log.debug("Reload file {} does not exist", file);
    } catch (IOException | RuntimeException e) {
      log.warn("Could not check reload file {}: {}", file, e.getMessage());
    }
  }

  /**
   * Reads the file and applies it to the generator.
   *
   * @return true if the configuration was replaced
   */
  public boolean reload() {
    ConfigOverrides overrides;
    try {
      overrides = JsonUtil.mapper().readValue(file.toFile(), ConfigOverrides.class);
    } catch (JsonProcessingException e) {
      log.error("Ignoring reload file {}: not valid JSON ({})", file, e.getOriginalMessage());
      return false;
    } catch (IOException e) {
      log.error("Ignoring reload file {}: {}", file, e.getMessage());
      return false;
    }
    if (overrides == null || overrides.isEmpty()) {
      log.info("Reload file {} contains no overrides", file);
      return false;
    }
    try {
      generator.updateConfig(overrides.applyTo(generator.currentConfig()));
      log.info("Reloaded configuration from {}", file);
      return true;
    } catch (IllegalArgumentException e) {
      log.error("Ignoring reload file {}: {}", file, e.getMessage());
      return false;
    }
  }

  @Override
  public synchronized void close() {
    if (poller != null) {
      poller.shutdownNow();
      poller = null;
    }
  }
}
