package com.gentoro.slotfill.toolkit;

import com.gentoro.slotfill.ExtractorConfig;
import com.gentoro.slotfill.exception.ConfigException;
import com.gentoro.slotfill.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/** Resolves the configured {@link MlToolkitProvider} through {@link ServiceLoader}. */
public final class MlToolkitFactory {
  private static final org.slf4j.Logger log = LoggingService.getLogger(MlToolkitFactory.class);

  private MlToolkitFactory() {}

  public static MlToolkit create(ExtractorConfig config) {
    String provider = config.toolkitProvider();
    List<String> available = new ArrayList<>();
    for (MlToolkitProvider p : ServiceLoader.load(MlToolkitProvider.class)) {
      if (provider.equals(p.providerId())) {
        log.debug("Using ML toolkit provider '{}' ({})", provider, p.getClass().getName());
        return p.create(config);
      }
      available.add(p.providerId());
    }
    throw new ConfigException(
        "Unknown slots.toolkit.provider: %s (available: %s)".formatted(provider, available));
  }
}
