package com.mk.fx.qa.traffic.generator.runner;

import com.mk.fx.qa.traffic.generator.cfg.TrafficProperties;
import com.mk.fx.qa.traffic.generator.reload.ConfigFileWatcher;
import com.mk.fx.qa.traffic.generator.service.TrafficGenerator;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the generator on the main thread once the context is up. SIGINT and SIGTERM close the
 * context, which stops the generator and waits for its final summary.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "traffic", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TrafficGeneratorRunner implements ApplicationRunner {

  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(40);

  private final TrafficGenerator generator;
  private final TrafficProperties properties;
  private ConfigFileWatcher watcher;

  public TrafficGeneratorRunner(TrafficGenerator generator, TrafficProperties properties) {
    this.generator = generator;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    var reload = properties.getReload();
    if (reload.getFile() != null) {
      watcher = new ConfigFileWatcher(reload.getFile(), reload.getPollInterval(), generator);
      watcher.start();
    }
    try {
      generator.run(properties.getDuration());
    } finally {
      closeWatcher();
    }
  }

  @PreDestroy
  void shutdown() {
    closeWatcher();
    generator.stop();
    if (!generator.awaitStopped(STOP_TIMEOUT)) {
      log.warn("Traffic generator did not stop within {}s", STOP_TIMEOUT.toSeconds());
    }
  }

  private synchronized void closeWatcher() {
    if (watcher != null) {
      watcher.close();
      watcher = null;
    }
  }
}
