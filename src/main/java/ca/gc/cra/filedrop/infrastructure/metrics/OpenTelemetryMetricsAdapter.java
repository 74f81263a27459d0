package ca.gc.cra.filedrop.infrastructure.metrics;

import ca.gc.cra.filedrop.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards FILEDROP session counters and transfer histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key and cached. Keys ending in {@code Nanos} get unit {@code ns};
 * keys ending in {@code bytes} get unit {@code By}.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("filedrop.metric.key");
  private static final String NAME_PREFIX = "filedrop.";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Attributes> attributes = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter described by {@code settings}.
   *
   * @param settings exporter selection
   */
  public OpenTelemetryMetricsAdapter(MetricsSettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, attributesFor(key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value, attributesFor(key));
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("FILEDROP counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(unitFor(key))
        .setDescription("FILEDROP observation for " + key)
        .build();
  }

  private Attributes attributesFor(String key) {
    return attributes.computeIfAbsent(key, k -> Attributes.of(METRIC_KEY_ATTRIBUTE, k));
  }

  static String instrumentName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(NAME_PREFIX.length() + lower.length()).append(NAME_PREFIX);
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private static String unitFor(String key) {
    if (key.endsWith("Nanos")) {
      return "ns";
    }
    if (key.endsWith("bytes")) {
      return "By";
    }
    return "1";
  }
}
