package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.exception.InvalidConfigurationException;
import com.indiaforecast.common.model.SourceId;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Lookup table {@code SourceId -> SourceFetcher}, built once from every fetcher bean. */
public class SourceFetchers {

    private final Map<SourceId, SourceFetcher> bySource;

    public SourceFetchers(Collection<? extends SourceFetcher> fetchers) {
        Map<SourceId, SourceFetcher> map = new EnumMap<>(SourceId.class);
        for (SourceFetcher fetcher : fetchers) {
            SourceFetcher previous = map.putIfAbsent(fetcher.source(), fetcher);
            if (previous != null) {
                throw new InvalidConfigurationException("sources." + fetcher.source(),
                    "two fetchers registered: " + previous.getClass().getSimpleName()
                        + " and " + fetcher.getClass().getSimpleName());
            }
        }
        this.bySource = Collections.unmodifiableMap(map);
    }

    public Optional<SourceFetcher> forSource(SourceId source) {
        return Optional.ofNullable(bySource.get(source));
    }

    public Set<SourceId> sources() {
        return bySource.keySet();
    }
}
