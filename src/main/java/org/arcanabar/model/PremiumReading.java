package org.arcanabar.model;

import java.util.List;
import java.util.Objects;

/**
 * Расклад на три карты: прошлое, настоящее, будущее. Напитков ровно столько же, сколько карт, по одному на карту.
 *
 * @param context то, что ввёл пользователь (дата рождения), как есть
 */
public record PremiumReading(String context, List<Card> cards, String interpretation, List<Drink> drinks) {

    public PremiumReading {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(interpretation, "interpretation");
        cards = List.copyOf(cards);
        drinks = List.copyOf(drinks);
        if (cards.size() != SpreadPosition.values().length) {
            throw new IllegalArgumentException("Premium reading needs exactly "
                    + SpreadPosition.values().length + " cards, got " + cards.size());
        }
        if (drinks.size() != cards.size()) {
            throw new IllegalArgumentException("Expected one drink per card, got "
                    + drinks.size() + " drinks for " + cards.size() + " cards");
        }
    }

    public Card cardAt(SpreadPosition position) {
        return cards.get(position.ordinal());
    }

    public Drink drinkFor(SpreadPosition position) {
        return drinks.get(position.ordinal());
    }
}
