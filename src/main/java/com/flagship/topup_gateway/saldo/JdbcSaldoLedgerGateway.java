package com.flagship.topup_gateway.saldo;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed saldo gateway.
 */
@Repository
@Slf4j
public class JdbcSaldoLedgerGateway implements SaldoLedgerGateway {

    private final JdbcTemplate jdbcTemplate;

    public JdbcSaldoLedgerGateway(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Saldo> findByCardNumber(String cardNumber) {
        List<Saldo> saldos = jdbcTemplate.query(
            "SELECT saldo_id, card_number, total_balance FROM saldos " +
            "WHERE card_number = ? AND deleted_at IS NULL",
            saldoRowMapper(),
            cardNumber
        );
        return saldos.stream().findFirst();
    }

    @Override
    @Transactional
    public Saldo updateSaldoBalance(String cardNumber, long totalBalance) {
        int updated = jdbcTemplate.update(
            "UPDATE saldos SET total_balance = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE card_number = ? AND deleted_at IS NULL",
            totalBalance,
            cardNumber
        );
        if (updated == 0) {
            throw new EmptyResultDataAccessException("Saldo not found for card: " + cardNumber, 1);
        }

        log.debug("Updated saldo balance: cardNumber={}, totalBalance={}", cardNumber, totalBalance);

        return findByCardNumber(cardNumber)
            .orElseThrow(() -> new EmptyResultDataAccessException("Saldo not found for card: " + cardNumber, 1));
    }

    private RowMapper<Saldo> saldoRowMapper() {
        return (rs, rowNum) -> new Saldo(
            rs.getLong("saldo_id"),
            rs.getString("card_number"),
            rs.getLong("total_balance")
        );
    }
}
