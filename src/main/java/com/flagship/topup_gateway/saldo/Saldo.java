package com.flagship.topup_gateway.saldo;

import lombok.Value;

/**
 * Stored balance of a single card. One row per card number.
 */
@Value
public class Saldo {
    long id;
    String cardNumber;
    long totalBalance;
}
