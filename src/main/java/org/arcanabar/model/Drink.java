package org.arcanabar.model;

import java.util.Objects;

/**
 * @param rationale почему этот напиток подходит к карте
 */
public record Drink(String name, String rationale) {
    public Drink {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rationale, "rationale");
    }
}
