package com.hyperhook.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PositionItem(String asset, String size, String side, String error) {

    public static PositionItem closed(String asset, String size, String side) {
        return new PositionItem(asset, size, side, null);
    }

    public static PositionItem failed(String asset, String size, String side, String error) {
        return new PositionItem(asset, size, side, error);
    }
}
