package com.hyperhook.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Webhook payload sent by the alerting platform.
 * {@code amountPercent} is kept as text because alert templates often quote numbers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSignal {

    private String action;

    private String ticker;

    private String amountPercent;

    @ToString.Exclude
    private String password;
}
