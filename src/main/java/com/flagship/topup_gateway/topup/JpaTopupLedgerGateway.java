package com.flagship.topup_gateway.topup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Topup gateway backed by {@link TopupRepository}.
 *
 * Bridges the domain {@link Topup} and the {@link TopupEntity}. Each public
 * method commits on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaTopupLedgerGateway implements TopupLedgerGateway {

    private final TopupRepository topupRepository;

    @Override
    @Transactional
    public Topup createTopup(String cardNumber, long topupAmount, String topupMethod, String idempotencyKey) {
        TopupEntity saved = topupRepository.save(
            TopupEntity.pending(cardNumber, topupAmount, topupMethod, idempotencyKey));
        log.debug("Created topup {} for card {}", saved.getId(), cardNumber);
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Topup> findById(long topupId) {
        return topupRepository.findById(topupId)
            .map(TopupEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Topup> findByIdempotencyKey(String idempotencyKey) {
        return topupRepository.findByIdempotencyKey(idempotencyKey)
            .map(TopupEntity::toDomain);
    }

    @Override
    @Transactional
    public Topup updateTopup(long topupId, String cardNumber, long topupAmount, String topupMethod) {
        TopupEntity existing = load(topupId);
        existing.updateDetails(cardNumber, topupAmount, topupMethod);
        TopupEntity updated = topupRepository.saveAndFlush(existing);
        log.debug("Updated topup {}: amount={}, method={}", topupId, topupAmount, topupMethod);
        return updated.toDomain();
    }

    @Override
    @Transactional
    public Topup updateTopupAmount(long topupId, long topupAmount) {
        TopupEntity existing = load(topupId);
        existing.changeAmount(topupAmount);
        TopupEntity updated = topupRepository.saveAndFlush(existing);
        log.debug("Corrected topup {} amount to {}", topupId, topupAmount);
        return updated.toDomain();
    }

    @Override
    @Transactional
    public Topup updateTopupStatus(long topupId, TopupStatus status) {
        TopupEntity existing = load(topupId);
        existing.changeStatus(status);
        TopupEntity updated = topupRepository.saveAndFlush(existing);
        log.debug("Topup {} status -> {}", topupId, status.getValue());
        return updated.toDomain();
    }

    @Override
    @Transactional
    public Topup trashedTopup(long topupId) {
        TopupEntity existing = load(topupId);
        if (existing.getDeletedAt() != null) {
            throw new EmptyResultDataAccessException("No live topup with id " + topupId, 1);
        }
        existing.trash();
        return topupRepository.saveAndFlush(existing).toDomain();
    }

    @Override
    @Transactional
    public Topup restoreTopup(long topupId) {
        TopupEntity existing = loadTrashed(topupId);
        existing.restore();
        return topupRepository.saveAndFlush(existing).toDomain();
    }

    @Override
    @Transactional
    public void deleteTopupPermanent(long topupId) {
        TopupEntity existing = loadTrashed(topupId);
        topupRepository.delete(existing);
        log.debug("Permanently deleted topup {}", topupId);
    }

    @Override
    @Transactional
    public int restoreAllTopup() {
        return topupRepository.restoreAllTrashed(Instant.now());
    }

    @Override
    @Transactional
    public int deleteAllTopupPermanent() {
        return topupRepository.deleteAllTrashed();
    }

    private TopupEntity load(long topupId) {
        return topupRepository.findById(topupId)
            .orElseThrow(() -> new EmptyResultDataAccessException("Topup not found: " + topupId, 1));
    }

    private TopupEntity loadTrashed(long topupId) {
        TopupEntity existing = load(topupId);
        if (existing.getDeletedAt() == null) {
            throw new EmptyResultDataAccessException("No trashed topup with id " + topupId, 1);
        }
        return existing;
    }
}
