package com.hyperhook.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FillDetails(
        String size,
        @JsonProperty("average_price") String averagePrice,
        @JsonProperty("order_id") String orderId
) {
}
