package com.ukulele.core.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Scans the sync components. The embedding node adds the {@code Dispatcher},
 * {@code MessageConsumer} and {@code ConsensusEngine} beans.
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = {
    "com.ukulele.common.overlay",
    "com.ukulele.core.chain",
    "com.ukulele.core.net"})
public class DefaultConfig {

  public DefaultConfig() {
    Thread.setDefaultUncaughtExceptionHandler((t, e) -> logger.error("Uncaught exception", e));
  }
}
