package com.hyperhook.backend.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public record AccountState(String address, BigDecimal withdrawableBalance, List<Position> positions) {

    public AccountState {
        withdrawableBalance = withdrawableBalance == null ? BigDecimal.ZERO : withdrawableBalance;
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public List<Position> openPositions() {
        return positions.stream().filter(Position::isOpen).toList();
    }

    public Optional<Position> openPosition(String asset) {
        return positions.stream()
                .filter(Position::isOpen)
                .filter(position -> position.asset().equals(asset))
                .findFirst();
    }
}
