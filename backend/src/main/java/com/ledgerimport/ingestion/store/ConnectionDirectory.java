package com.ledgerimport.ingestion.store;

import com.ledgerimport.config.CaffeineConfig;
import com.ledgerimport.domain.AggregatorConnection;
import com.ledgerimport.domain.AggregatorConnectionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Cached lookup of aggregator connections (written by the account-linking flow).
 */
@Component
@RequiredArgsConstructor
public class ConnectionDirectory {

    private final AggregatorConnectionRepository aggregatorConnectionRepository;

    @Cacheable(cacheNames = CaffeineConfig.CONNECTION_CACHE, key = "#connectionId")
    public Optional<AggregatorConnection> findConnection(String connectionId) {
        return aggregatorConnectionRepository.findById(connectionId);
    }
}
