package com.ukulele.core.config;

import com.google.common.base.Strings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Configuration {

  private static Config config;

  private Configuration() {
  }

  /**
   * Get configuration by a given path.
   *
   * @param shellConfFileName config file passed on the command line, takes precedence
   * @param confFileName default config file name
   * @return loaded configuration
   */
  public static Config getByFileName(final String shellConfFileName, final String confFileName) {
    if (!Strings.isNullOrEmpty(shellConfFileName)) {
      resolveConfigFile(shellConfFileName, new File(shellConfFileName));
      return config;
    }
    if (Strings.isNullOrEmpty(confFileName)) {
      throw new IllegalArgumentException("Configuration path is required!");
    }
    resolveConfigFile(confFileName, new File(confFileName));
    return config;
  }

  private static void resolveConfigFile(String fileName, File confFile) {
    if (confFile.exists()) {
      logger.info("Load config from file {}", confFile.getAbsolutePath());
      config = ConfigFactory.parseFile(confFile).resolve();
    } else if (Thread.currentThread().getContextClassLoader().getResource(fileName) != null) {
      logger.info("Load config from classpath {}", fileName);
      config = ConfigFactory.load(fileName);
    } else {
      throw new IllegalArgumentException(
          String.format("Configuration path is required! No Such file %s", fileName));
    }
  }
}
