package com.scholary.songgen.lyrics;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the configured lyrics backends and which one is active.
 *
 * <p>The active backend can be switched at runtime. A job picks up the backend that is active when
 * its lyrics stage starts.
 */
public class LyricsProviderRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(LyricsProviderRegistry.class);

  private final Map<String, LyricsProvider> providers = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private LyricsProvider active;

  public LyricsProviderRegistry(Collection<LyricsProvider> configured, String preferred) {
    configured.forEach(provider -> providers.put(provider.name(), provider));
    String wanted = preferred == null ? "" : preferred.toLowerCase(Locale.ROOT);
    if (providers.containsKey(wanted)) {
      active = providers.get(wanted);
    } else if (!providers.isEmpty()) {
      active = providers.values().iterator().next();
      LOGGER.warn(
          "Preferred lyrics provider '{}' is not configured, using '{}'", preferred, active.name());
    } else {
      LOGGER.warn("No lyrics provider configured; prompt-only requests will fail");
    }
    if (active != null) {
      LOGGER.info("Active lyrics provider: {} (model={})", active.name(), active.model());
    }
  }

  public Optional<LyricsProvider> active() {
    lock.lock();
    try {
      return Optional.ofNullable(active);
    } finally {
      lock.unlock();
    }
  }

  /**
   * @throws LyricsProviderException if no backend is configured
   */
  public LyricsProvider requireActive() {
    return active()
        .orElseThrow(() -> new LyricsProviderException("No lyrics provider is configured"));
  }

  /**
   * Makes {@code name} the active backend.
   *
   * @throws UnknownProviderException if no backend with that name is configured
   */
  public LyricsProvider switchTo(String name) {
    String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    lock.lock();
    try {
      LyricsProvider provider = providers.get(key);
      if (provider == null) {
        throw new UnknownProviderException(name, providers.keySet());
      }
      String previous = active == null ? "none" : active.name();
      active = provider;
      LOGGER.info("Switched lyrics provider: {} -> {}", previous, provider.name());
      return provider;
    } finally {
      lock.unlock();
    }
  }

  public Set<String> available() {
    return Set.copyOf(providers.keySet());
  }
}
