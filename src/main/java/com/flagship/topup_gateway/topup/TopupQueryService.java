package com.flagship.topup_gateway.topup;

import com.flagship.topup_gateway.observability.TopupMetrics;
import com.flagship.topup_gateway.topup.dto.TopupResponse;
import com.flagship.topup_gateway.topup.exception.TopupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Single-topup reads with a cache-aside fast path.
 *
 * Cache first, database on a miss, then the cache is populated. Redis being
 * down only costs the fast path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopupQueryService {

    private final TopupLedgerGateway topupGateway;
    private final TopupCache topupCache;
    private final TopupMetrics metrics;

    public TopupResponse findById(long topupId) {
        Optional<TopupResponse> cached = topupCache.getCachedTopup(topupId);
        metrics.recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            log.debug("Cache hit for topup {}", topupId);
            return cached.get();
        }

        Optional<Topup> topup;
        try {
            topup = topupGateway.findById(topupId);
        } catch (DataAccessException e) {
            throw TopupException.persistence("FAILED_FIND_TOPUP_BY_ID", "Failed to look up topup " + topupId, e);
        }

        TopupResponse response = topup
            .map(TopupResponse::from)
            .orElseThrow(() -> TopupException.notFound("FAILED_FIND_TOPUP_BY_ID", "Topup not found: " + topupId));
        topupCache.setCachedTopup(response);
        return response;
    }
}
