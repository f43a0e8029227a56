package com.flamingo.inboundmail.service.ingest.provider;

import com.flamingo.inboundmail.exception.ProviderNotFoundException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Routes a provider id from the webhook path to its {@link ProviderAdapter}. */
@Service
@Slf4j
public class ProviderAdapterRegistry {

  private final Map<String, ProviderAdapter> adapters;

  public ProviderAdapterRegistry(List<ProviderAdapter> adapters) {
    this.adapters =
        adapters.stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    adapter -> adapter.providerId().toLowerCase(Locale.ROOT),
                    Function.identity()));
    log.info("Registered webhook providers: {}", this.adapters.keySet());
  }

  /**
   * Returns the adapter registered for the provider id.
   *
   * @throws ProviderNotFoundException if no adapter handles the id
   */
  public ProviderAdapter route(String providerId) {
    ProviderAdapter adapter =
        providerId == null ? null : adapters.get(providerId.toLowerCase(Locale.ROOT));
    if (adapter == null) {
      throw new ProviderNotFoundException(providerId);
    }
    return adapter;
  }

  public Set<String> providerIds() {
    return adapters.keySet();
  }
}
