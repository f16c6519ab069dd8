package io.github.themoah.facetscope.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x options for the launcher.
 * Investigations rely on the verticle's single event loop, so the main verticle always
 * deploys as one event-loop instance.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_PREFER_NATIVE = "VERTX_PREFER_NATIVE_TRANSPORT";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(EnvValues.getBoolean(ENV_PREFER_NATIVE, true));
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    DeploymentOptions options = new DeploymentOptions().setInstances(1);
    log.info("Using event-loop threading model with a single verticle instance");
    return options;
  }
}
