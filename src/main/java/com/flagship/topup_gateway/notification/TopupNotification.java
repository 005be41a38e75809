package com.flagship.topup_gateway.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * E-mail request consumed by the notification service.
 *
 * The JSON shape {@code {email, subject, body}} is a contract with that
 * consumer; {@code body} is pre-rendered HTML.
 */
@Value
public class TopupNotification {

    @JsonProperty("email")
    String email;

    @JsonProperty("subject")
    String subject;

    @JsonProperty("body")
    String body;
}
