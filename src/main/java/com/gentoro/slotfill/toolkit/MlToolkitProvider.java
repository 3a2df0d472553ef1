package com.gentoro.slotfill.toolkit;

import com.gentoro.slotfill.ExtractorConfig;

/**
 * Service Provider Interface for pluggable {@link MlToolkit} implementations.
 *
 * <p>Providers are discovered via {@link java.util.ServiceLoader}; register them in {@code
 * META-INF/services/com.gentoro.slotfill.toolkit.MlToolkitProvider}. The factory selects the one
 * whose {@link #providerId()} equals {@code slots.toolkit.provider}.
 */
public interface MlToolkitProvider {

  /** A stable, lowercase identifier for this provider (e.g. "native"). */
  String providerId();

  /**
   * Creates a toolkit. Must not load native libraries eagerly; that happens on first use so that
   * selecting a provider never fails on hosts that only run inference elsewhere.
   */
  MlToolkit create(ExtractorConfig config);
}
