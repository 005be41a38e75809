package com.flagship.topup_gateway.topup;

import com.flagship.topup_gateway.card.Card;
import com.flagship.topup_gateway.card.CardLedgerGateway;
import com.flagship.topup_gateway.card.UpdateCardRequest;
import com.flagship.topup_gateway.notification.EmailTemplateRenderer;
import com.flagship.topup_gateway.notification.NotificationPublishException;
import com.flagship.topup_gateway.notification.NotificationPublisher;
import com.flagship.topup_gateway.notification.TopupNotification;
import com.flagship.topup_gateway.observability.CorrelationContext;
import com.flagship.topup_gateway.observability.TopupMetrics;
import com.flagship.topup_gateway.saldo.Saldo;
import com.flagship.topup_gateway.saldo.SaldoLedgerGateway;
import com.flagship.topup_gateway.topup.dto.CreateTopupRequest;
import com.flagship.topup_gateway.topup.dto.TopupResponse;
import com.flagship.topup_gateway.topup.dto.UpdateTopupRequest;
import com.flagship.topup_gateway.topup.exception.TopupException;
import com.flagship.topup_gateway.topup.exception.TopupRollbackException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Orchestrates topup creation and correction across the card, saldo and
 * topup ledgers.
 *
 * There is no transaction spanning the three ledgers. Each operation is a
 * sequence of independent writes; once a topup row exists, any failed step
 * ends with a compensating FAILED status write before the typed error is
 * thrown, so no topup is left PENDING by a finished call.
 *
 * Not @Transactional: every gateway call commits on its own.
 *
 * Known gap: when the saldo was already credited and a later step (card
 * refresh, status write, re-read) fails, the saldo is not reverted. The topup
 * ends FAILED while the balance includes its amount.
 */
@Service
@Slf4j
public class TopupCommandService {

    static final String NOTIFICATION_TITLE = "Topup Successful";
    static final String NOTIFICATION_BUTTON = "View History";

    private final CardLedgerGateway cardGateway;
    private final SaldoLedgerGateway saldoGateway;
    private final TopupLedgerGateway topupGateway;
    private final NotificationPublisher notificationPublisher;
    private final EmailTemplateRenderer emailTemplateRenderer;
    private final TopupCache topupCache;
    private final CardLockRegistry cardLocks;
    private final TopupMetrics metrics;
    private final String notificationTopic;
    private final String notificationSubject;
    private final String historyLink;

    public TopupCommandService(CardLedgerGateway cardGateway,
                               SaldoLedgerGateway saldoGateway,
                               TopupLedgerGateway topupGateway,
                               NotificationPublisher notificationPublisher,
                               EmailTemplateRenderer emailTemplateRenderer,
                               TopupCache topupCache,
                               CardLockRegistry cardLocks,
                               TopupMetrics metrics,
                               @Value("${topup.notification.topic:email-service-topic-topup-create}") String notificationTopic,
                               @Value("${topup.notification.subject:Topup Successful - SanEdge}") String notificationSubject,
                               @Value("${topup.notification.history-link:https://sanedge.example.com/topup/history}") String historyLink) {
        this.cardGateway = cardGateway;
        this.saldoGateway = saldoGateway;
        this.topupGateway = topupGateway;
        this.notificationPublisher = notificationPublisher;
        this.emailTemplateRenderer = emailTemplateRenderer;
        this.topupCache = topupCache;
        this.cardLocks = cardLocks;
        this.metrics = metrics;
        this.notificationTopic = notificationTopic;
        this.notificationSubject = notificationSubject;
        this.historyLink = historyLink;
    }

    // ==================== Create ====================

    /**
     * Credits {@code topupAmount} to the card's saldo and records the topup.
     *
     * Steps: card lookup, topup row (PENDING), saldo read + write, card
     * refresh, status SUCCESS, e-mail event. A publish failure is reported as
     * {@code PUBLISH_FAILURE} but the topup stays SUCCESS.
     *
     * @param idempotencyKey optional; a repeated key returns the stored topup without running any step again
     */
    public TopupResponse createTopup(CreateTopupRequest request, String idempotencyKey) {
        validateAmount(request.getTopupAmount(), request.getTopupMethod());
        return instrumented("CreateTopup", request.getCardNumber(), () -> doCreateTopup(request, idempotencyKey));
    }

    private TopupResponse doCreateTopup(CreateTopupRequest request, String idempotencyKey) {
        String cardNumber = request.getCardNumber();
        long amount = request.getTopupAmount();

        log.debug("Starting CreateTopup: amount={}, method={}", amount, request.getTopupMethod());

        // Card must exist before anything is written; its owner's email is needed for the notification
        Card card = findCard(() -> cardGateway.findUserCardByCardNumber(cardNumber), cardNumber);

        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed) {
            Optional<Topup> previous = findByIdempotencyKey(idempotencyKey);
            if (previous.isPresent()) {
                return replay(previous.get(), cardNumber);
            }
        }

        // Topup row in PENDING status; from here on every failure ends in a FAILED mark
        Topup topup;
        try {
            topup = topupGateway.createTopup(cardNumber, amount, request.getTopupMethod(), idempotencyKey);
        } catch (DataIntegrityViolationException e) {
            if (!keyed) {
                throw TopupException.persistence("FAILED_CREATE_TOPUP",
                    "Failed to create topup for card " + cardNumber, e);
            }
            // A concurrent request with the same key inserted first
            return replayAfterConflict(idempotencyKey, cardNumber, e);
        } catch (DataAccessException e) {
            throw TopupException.persistence("FAILED_CREATE_TOPUP",
                "Failed to create topup for card " + cardNumber, e);
        }
        long topupId = topup.getId();
        MDC.put(CorrelationContext.TOPUP_ID_MDC_KEY, String.valueOf(topupId));

        // Read-modify-write of the saldo, serialized per card
        long newBalance = cardLocks.withCardLock(cardNumber, () -> {
            Saldo saldo = findSaldo(topupId, cardNumber);
            long balance = addToBalance(topupId, saldo.getTotalBalance(), amount);
            try {
                saldoGateway.updateSaldoBalance(cardNumber, balance);
            } catch (DataAccessException e) {
                throw failTopup(topupId, TopupException.persistence("FAILED_UPDATE_SALDO_BALANCE",
                    "Failed to update saldo of card " + cardNumber, e));
            }
            return balance;
        });

        refreshCard(topupId, card, amount);

        Topup completed = markSuccess(topupId);
        topupCache.deleteCachedTopup(topupId);

        // Status stays SUCCESS even if the event cannot be published
        publishNotification(topupId, card, amount);

        log.info("Topup completed: amount={}, newBalance={}", amount, newBalance);

        return TopupResponse.from(completed);
    }

    private TopupResponse replay(Topup previous, String cardNumber) {
        if (!previous.getCardNumber().equals(cardNumber)) {
            throw TopupException.validation("IDEMPOTENCY_KEY_REUSED",
                "Idempotency key already used for topup " + previous.getId() + " on another card", null);
        }
        MDC.put(CorrelationContext.TOPUP_ID_MDC_KEY, String.valueOf(previous.getId()));
        log.info("Idempotency key already used, returning existing topup: status={}",
            previous.getStatus().getValue());
        return TopupResponse.from(previous);
    }

    private TopupResponse replayAfterConflict(String idempotencyKey, String cardNumber,
                                              DataIntegrityViolationException conflict) {
        Optional<Topup> winner = findByIdempotencyKey(idempotencyKey);
        if (winner.isEmpty()) {
            throw TopupException.persistence("FAILED_CREATE_TOPUP",
                "Failed to create topup for card " + cardNumber, conflict);
        }
        log.info("Idempotency key inserted concurrently by another request");
        return replay(winner.get(), cardNumber);
    }

    /**
     * Re-saves the card with its current values. The expire date is parsed
     * first so a malformed stored date is reported as a validation failure.
     */
    private void refreshCard(long topupId, Card card, long creditedAmount) {
        LocalDate expireDate;
        try {
            if (card.getExpireDate() == null) {
                throw new DateTimeParseException("Expire date is missing", "", 0);
            }
            expireDate = LocalDate.parse(card.getExpireDate());
        } catch (DateTimeParseException e) {
            log.warn("Saldo already credited with {} and is not reverted", creditedAmount);
            throw failTopup(topupId, TopupException.validation("FAILED_PARSE_EXPIRE_DATE",
                "Invalid expire date '" + card.getExpireDate() + "' on card " + card.getCardNumber(), e));
        }

        try {
            cardGateway.updateCard(UpdateCardRequest.refreshOf(card, expireDate));
        } catch (DataAccessException e) {
            log.warn("Saldo already credited with {} and is not reverted", creditedAmount);
            throw failTopup(topupId, TopupException.persistence("FAILED_UPDATE_CARD",
                "Failed to update card " + card.getCardNumber(), e));
        }
    }

    private void publishNotification(long topupId, Card card, long amount) {
        String body = emailTemplateRenderer.render(
            NOTIFICATION_TITLE,
            String.format("Your topup of %d has been processed successfully.", amount),
            NOTIFICATION_BUTTON,
            historyLink);
        TopupNotification notification = new TopupNotification(card.getEmail(), notificationSubject, body);

        try {
            notificationPublisher.send(notificationTopic, String.valueOf(topupId), notification);
        } catch (NotificationPublishException e) {
            throw TopupException.publish("FAILED_KAFKA_SEND",
                "Topup " + topupId + " succeeded but its notification was not published", e);
        }
    }

    // ==================== Update ====================

    /**
     * Changes an existing topup's amount and applies the difference to the
     * saldo.
     *
     * If the saldo cannot be read or written, the stored amount is restored
     * with a compensating write; a failure of that write is reported as
     * {@code ROLLBACK_FAILURE} on top of the original cause.
     */
    public TopupResponse updateTopup(UpdateTopupRequest request) {
        if (request.getTopupId() == null) {
            throw TopupException.validation("INVALID_TOPUP_REQUEST", "Topup id is required", null);
        }
        validateAmount(request.getTopupAmount(), request.getTopupMethod());
        return instrumented("UpdateTopup", request.getCardNumber(), () -> doUpdateTopup(request));
    }

    private TopupResponse doUpdateTopup(UpdateTopupRequest request) {
        long topupId = request.getTopupId();
        String cardNumber = request.getCardNumber();
        long newAmount = request.getTopupAmount();
        MDC.put(CorrelationContext.TOPUP_ID_MDC_KEY, String.valueOf(topupId));

        log.debug("Starting UpdateTopup: newAmount={}, method={}", newAmount, request.getTopupMethod());

        try {
            findCard(() -> cardGateway.findCardByCardNumber(cardNumber), cardNumber);
        } catch (TopupException e) {
            throw failTopup(topupId, e);
        }

        // Current amount is the base for the saldo difference
        Topup existing = findTopup(topupId);
        if (!existing.getCardNumber().equals(cardNumber)) {
            throw failTopup(topupId, TopupException.validation("TOPUP_CARD_MISMATCH",
                "Topup " + topupId + " belongs to another card", null));
        }

        long difference = newAmount - existing.getTopupAmount();

        try {
            topupGateway.updateTopup(topupId, cardNumber, newAmount, request.getTopupMethod());
        } catch (DataAccessException e) {
            throw failTopup(topupId, TopupException.persistence("FAILED_UPDATE_TOPUP",
                "Failed to update topup " + topupId, e));
        }

        // From here a saldo failure must also undo the amount change above
        long newBalance = cardLocks.withCardLock(cardNumber, () -> {
            Saldo saldo;
            try {
                saldo = findSaldo(cardNumber);
            } catch (TopupException e) {
                throw failTopup(topupId, rollbackAmount(topupId, existing.getTopupAmount(), e));
            }

            long balance = addToBalance(topupId, saldo.getTotalBalance(), difference);
            try {
                saldoGateway.updateSaldoBalance(cardNumber, balance);
            } catch (DataAccessException e) {
                TopupException failure = TopupException.persistence("FAILED_UPDATE_SALDO_BALANCE",
                    "Failed to update saldo of card " + cardNumber, e);
                throw failTopup(topupId, rollbackAmount(topupId, existing.getTopupAmount(), failure));
            }
            return balance;
        });

        // The saldo write above is not reverted if anything below fails
        findTopup(topupId);
        Topup completed = markSuccess(topupId);
        topupCache.deleteCachedTopup(topupId);

        log.info("Topup updated: difference={}, newBalance={}", difference, newBalance);

        return TopupResponse.from(completed);
    }

    /**
     * Restores the topup amount changed by {@code updateTopup}.
     *
     * @return the original failure, or a rollback failure wrapping it
     */
    private TopupException rollbackAmount(long topupId, long originalAmount, TopupException failure) {
        try {
            topupGateway.updateTopupAmount(topupId, originalAmount);
            metrics.recordCompensation("rollback_amount", true);
            log.warn("Rolled back topup amount to {} after {}", originalAmount, failure.getCode());
            return failure;
        } catch (DataAccessException e) {
            metrics.recordCompensation("rollback_amount", false);
            log.error("Failed to roll back topup amount to {} after {}: {}",
                originalAmount, failure.getCode(), e.getMessage());
            return new TopupRollbackException("FAILED_ROLLBACK_TOPUP_AMOUNT", failure, e);
        } finally {
            topupCache.deleteCachedTopup(topupId);
        }
    }

    // ==================== Trash / restore / delete ====================

    public TopupResponse trashTopup(long topupId) {
        return instrumented("TrashedTopup", null, () -> {
            Topup trashed = lifecycleWrite(topupId, "FAILED_TRASH_TOPUP",
                () -> topupGateway.trashedTopup(topupId));
            topupCache.deleteCachedTopup(topupId);
            log.info("Trashed topup {}", topupId);
            return TopupResponse.from(trashed);
        });
    }

    public TopupResponse restoreTopup(long topupId) {
        return instrumented("RestoreTopup", null, () -> {
            Topup restored = lifecycleWrite(topupId, "FAILED_RESTORE_TOPUP",
                () -> topupGateway.restoreTopup(topupId));
            topupCache.deleteCachedTopup(topupId);
            log.info("Restored topup {}", topupId);
            return TopupResponse.from(restored);
        });
    }

    public void deleteTopupPermanent(long topupId) {
        instrumented("DeleteTopupPermanent", null, () -> {
            lifecycleWrite(topupId, "FAILED_DELETE_TOPUP_PERMANENT", () -> {
                topupGateway.deleteTopupPermanent(topupId);
                return null;
            });
            topupCache.deleteCachedTopup(topupId);
            log.info("Permanently deleted topup {}", topupId);
            return null;
        });
    }

    /**
     * @return number of topups restored
     */
    public int restoreAllTopup() {
        return instrumented("RestoreAllTopup", null, () -> {
            try {
                int restored = topupGateway.restoreAllTopup();
                log.info("Restored {} trashed topups", restored);
                return restored;
            } catch (DataAccessException e) {
                throw TopupException.persistence("FAILED_RESTORE_ALL_TOPUP", "Failed to restore trashed topups", e);
            }
        });
    }

    /**
     * @return number of topups removed
     */
    public int deleteAllTopupPermanent() {
        return instrumented("DeleteAllTopupPermanent", null, () -> {
            try {
                int deleted = topupGateway.deleteAllTopupPermanent();
                log.info("Permanently deleted {} trashed topups", deleted);
                return deleted;
            } catch (DataAccessException e) {
                throw TopupException.persistence("FAILED_DELETE_ALL_TOPUP_PERMANENT",
                    "Failed to delete trashed topups", e);
            }
        });
    }

    private <T> T lifecycleWrite(long topupId, String code, Supplier<T> write) {
        try {
            return write.get();
        } catch (EmptyResultDataAccessException e) {
            throw TopupException.notFound(code, e.getMessage());
        } catch (DataAccessException e) {
            throw TopupException.persistence(code, "Storage failure on topup " + topupId, e);
        }
    }

    // ==================== Shared steps ====================

    private Card findCard(Supplier<Optional<Card>> lookup, String cardNumber) {
        Optional<Card> card;
        try {
            card = lookup.get();
        } catch (DataAccessException e) {
            throw TopupException.persistence("FAILED_FIND_CARD_BY_CARD_NUMBER",
                "Failed to look up card " + cardNumber, e);
        }
        return card.orElseThrow(() -> TopupException.notFound("FAILED_FIND_CARD_BY_CARD_NUMBER",
            "Card not found: " + cardNumber));
    }

    private Optional<Topup> findByIdempotencyKey(String idempotencyKey) {
        try {
            return topupGateway.findByIdempotencyKey(idempotencyKey);
        } catch (DataAccessException e) {
            throw TopupException.persistence("FAILED_FIND_TOPUP_BY_IDEMPOTENCY_KEY",
                "Failed to check idempotency key", e);
        }
    }

    private Topup findTopup(long topupId) {
        Optional<Topup> topup;
        try {
            topup = topupGateway.findById(topupId);
        } catch (DataAccessException e) {
            throw failTopup(topupId, TopupException.persistence("FAILED_FIND_TOPUP_BY_ID",
                "Failed to look up topup " + topupId, e));
        }
        return topup.orElseThrow(() -> failTopup(topupId, TopupException.notFound("FAILED_FIND_TOPUP_BY_ID",
            "Topup not found: " + topupId)));
    }

    private Saldo findSaldo(long topupId, String cardNumber) {
        try {
            return findSaldo(cardNumber);
        } catch (TopupException e) {
            throw failTopup(topupId, e);
        }
    }

    private Saldo findSaldo(String cardNumber) {
        Optional<Saldo> saldo;
        try {
            saldo = saldoGateway.findByCardNumber(cardNumber);
        } catch (DataAccessException e) {
            throw TopupException.persistence("FAILED_FIND_SALDO_BY_CARD_NUMBER",
                "Failed to look up saldo of card " + cardNumber, e);
        }
        return saldo.orElseThrow(() -> TopupException.notFound("FAILED_FIND_SALDO_BY_CARD_NUMBER",
            "Saldo not found for card " + cardNumber));
    }

    private long addToBalance(long topupId, long balance, long delta) {
        try {
            return Math.addExact(balance, delta);
        } catch (ArithmeticException e) {
            throw failTopup(topupId, TopupException.validation("BALANCE_OVERFLOW",
                "Saldo " + balance + " cannot absorb " + delta, e));
        }
    }

    private Topup markSuccess(long topupId) {
        try {
            return topupGateway.updateTopupStatus(topupId, TopupStatus.SUCCESS);
        } catch (DataAccessException e) {
            throw failTopup(topupId, TopupException.persistence("FAILED_UPDATE_TOPUP_STATUS",
                "Failed to mark topup " + topupId + " successful", e));
        }
    }

    /**
     * Best-effort FAILED status write. Its own failure is logged and attached
     * to {@code error}, never replacing it. The cache entry is evicted on both
     * outcomes.
     *
     * @return {@code error}, for throwing
     */
    private TopupException failTopup(long topupId, TopupException error) {
        try {
            topupGateway.updateTopupStatus(topupId, TopupStatus.FAILED);
            metrics.recordCompensation("mark_failed", true);
            log.warn("Marked topup {} failed: code={}", topupId, error.getCode());
        } catch (DataAccessException e) {
            metrics.recordCompensation("mark_failed", false);
            log.error("Could not mark topup {} failed after {}: {}", topupId, error.getCode(), e.getMessage());
            error.addSuppressed(e);
        }
        topupCache.deleteCachedTopup(topupId);
        return error;
    }

    private void validateAmount(Long amount, String method) {
        if (amount == null || amount <= 0) {
            throw TopupException.validation("INVALID_TOPUP_REQUEST", "Topup amount must be positive", null);
        }
        if (method == null || method.isBlank()) {
            throw TopupException.validation("INVALID_TOPUP_REQUEST", "Topup method is required", null);
        }
    }

    private <T> T instrumented(String method, String cardNumber, Supplier<T> operation) {
        long startTime = System.nanoTime();
        String status = TopupMetrics.STATUS_SUCCESS;
        if (cardNumber != null) {
            MDC.put(CorrelationContext.CARD_NUMBER_MDC_KEY, cardNumber);
        }

        try {
            return operation.get();
        } catch (TopupException e) {
            status = TopupMetrics.STATUS_ERROR;
            log.error("{} failed: kind={}, code={}, error={}", method, e.getKind(), e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            status = TopupMetrics.STATUS_ERROR;
            log.error("{} failed unexpectedly", method, e);
            throw e;
        } finally {
            metrics.recordRequest(method, status, System.nanoTime() - startTime);
            MDC.remove(CorrelationContext.TOPUP_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CARD_NUMBER_MDC_KEY);
        }
    }
}
