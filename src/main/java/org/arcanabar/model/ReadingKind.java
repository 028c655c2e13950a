package org.arcanabar.model;

public enum ReadingKind {
    BASIC(1),
    PREMIUM(3);

    private final int cardCount;

    ReadingKind(int cardCount) {
        this.cardCount = cardCount;
    }

    /** Сколько карт обязана вернуть модель. Ни больше, ни меньше. */
    public int cardCount() {
        return cardCount;
    }
}
