package com.hyperhook.backend.model;

/**
 * Decoded outcome of an order submission. Fill fields are optional even on success.
 */
public record OrderResult(
        Status status,
        String filledSize,
        String avgPrice,
        String orderId,
        String errorDetail,
        String rawResponse
) {

    public enum Status {
        OK,
        ERROR
    }

    public static OrderResult ok(String filledSize, String avgPrice, String orderId, String rawResponse) {
        return new OrderResult(Status.OK, filledSize, avgPrice, orderId, null, rawResponse);
    }

    public static OrderResult error(String errorDetail, String rawResponse) {
        return new OrderResult(Status.ERROR, null, null, null, errorDetail, rawResponse);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean hasFill() {
        return filledSize != null && avgPrice != null;
    }
}
