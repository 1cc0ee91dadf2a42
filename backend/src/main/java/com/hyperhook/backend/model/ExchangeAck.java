package com.hyperhook.backend.model;

public record ExchangeAck(boolean ok, String detail) {

    public static ExchangeAck success(String detail) {
        return new ExchangeAck(true, detail);
    }

    public static ExchangeAck failure(String detail) {
        return new ExchangeAck(false, detail);
    }
}
