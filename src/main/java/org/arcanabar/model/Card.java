package org.arcanabar.model;

import java.util.Objects;

public record Card(String name, Orientation orientation, String meaning) {
    public Card {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(meaning, "meaning");
    }
}
