package com.flagship.topup_gateway.card;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed card gateway.
 *
 * Card rows are owned by the card service; this service only reads them and
 * re-saves their metadata after a balance change.
 */
@Repository
@Slf4j
public class JdbcCardLedgerGateway implements CardLedgerGateway {

    private static final String CARD_COLUMNS =
        "c.card_id, c.user_id, c.card_number, c.card_type, " +
        "TO_CHAR(c.expire_date, 'YYYY-MM-DD') AS expire_date, c.cvv, c.card_provider";

    private final JdbcTemplate jdbcTemplate;

    public JdbcCardLedgerGateway(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Card> findUserCardByCardNumber(String cardNumber) {
        List<Card> cards = jdbcTemplate.query(
            "SELECT " + CARD_COLUMNS + ", u.email " +
            "FROM cards c JOIN users u ON u.user_id = c.user_id " +
            "WHERE c.card_number = ? AND c.deleted_at IS NULL AND u.deleted_at IS NULL",
            cardRowMapper(true),
            cardNumber
        );
        return cards.stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Card> findCardByCardNumber(String cardNumber) {
        List<Card> cards = jdbcTemplate.query(
            "SELECT " + CARD_COLUMNS + " FROM cards c WHERE c.card_number = ? AND c.deleted_at IS NULL",
            cardRowMapper(false),
            cardNumber
        );
        return cards.stream().findFirst();
    }

    @Override
    @Transactional
    public Card updateCard(UpdateCardRequest request) {
        int updated = jdbcTemplate.update(
            "UPDATE cards SET user_id = ?, card_type = ?, expire_date = ?, cvv = ?, card_provider = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE card_id = ? AND deleted_at IS NULL",
            request.getUserId(),
            request.getCardType(),
            Date.valueOf(request.getExpireDate()),
            request.getCvv(),
            request.getCardProvider(),
            request.getCardId()
        );
        if (updated == 0) {
            throw new EmptyResultDataAccessException("Card not found: " + request.getCardId(), 1);
        }

        log.debug("Updated card {}", request.getCardId());

        return jdbcTemplate.queryForObject(
            "SELECT " + CARD_COLUMNS + " FROM cards c WHERE c.card_id = ?",
            cardRowMapper(false),
            request.getCardId()
        );
    }

    private RowMapper<Card> cardRowMapper(boolean withEmail) {
        return (rs, rowNum) -> new Card(
            rs.getLong("card_id"),
            rs.getLong("user_id"),
            rs.getString("card_number"),
            rs.getString("card_type"),
            rs.getString("expire_date"),
            rs.getString("cvv"),
            rs.getString("card_provider"),
            withEmail ? rs.getString("email") : null
        );
    }
}
