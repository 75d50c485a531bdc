package ca.gc.cra.facet.infrastructure.metrics;

import ca.gc.cra.facet.application.port.MetricsPort;

/**
 * Metrics adapter that discards all updates; selected when {@code --metrics} is off.
 *
 * @since FACET 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
