package org.arcanabar.model;

import java.util.Objects;

public record BasicReading(Card card, Drink drink, String interpretation) {
    public BasicReading {
        Objects.requireNonNull(card, "card");
        Objects.requireNonNull(drink, "drink");
        Objects.requireNonNull(interpretation, "interpretation");
    }
}
