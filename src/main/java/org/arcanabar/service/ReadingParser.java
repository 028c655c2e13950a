package org.arcanabar.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.arcanabar.exception.SchemaViolationException;
import org.arcanabar.model.BasicReading;
import org.arcanabar.model.Card;
import org.arcanabar.model.Drink;
import org.arcanabar.model.Orientation;
import org.arcanabar.model.PremiumReading;
import org.arcanabar.model.ReadingKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверяет JSON от модели и собирает из него гадание.
 * Ничего не чинит: не та структура, не тот тип, не то число карт = {@link SchemaViolationException}.
 */
@Component
public class ReadingParser {

    private final ObjectMapper om;

    public ReadingParser(ObjectMapper om) {
        this.om = om;
    }

    public BasicReading parseBasic(String content) {
        Parsed p = parse(content, ReadingKind.BASIC);
        return new BasicReading(p.cards().get(0), p.drinks().get(0), p.interpretation());
    }

    public PremiumReading parsePremium(String content, String context) {
        Parsed p = parse(content, ReadingKind.PREMIUM);
        return new PremiumReading(context, p.cards(), p.interpretation(), p.drinks());
    }

    private record Parsed(List<Card> cards, String interpretation, List<Drink> drinks) {}

    private Parsed parse(String content, ReadingKind kind) {
        JsonNode root;
        try {
            root = om.readTree(content);
        } catch (JsonProcessingException e) {
            throw violation("content is not valid JSON: " + e.getOriginalMessage(), content, e);
        }
        if (root == null || !root.isObject()) {
            throw violation("content is not a JSON object", content, null);
        }

        JsonNode cardsNode = requireArray(root, "cards", kind.cardCount(), content);
        List<Card> cards = new ArrayList<>(cardsNode.size());
        for (int i = 0; i < cardsNode.size(); i++) {
            JsonNode c = requireObject(cardsNode.get(i), "cards[" + i + "]", content);
            String orientationText = requireText(c, "orientation", "cards[" + i + "]", content);
            Orientation orientation = Orientation.parse(orientationText)
                    .orElseThrow(() -> violation("unknown orientation '" + orientationText + "'", content, null));
            cards.add(new Card(
                    requireText(c, "name", "cards[" + i + "]", content),
                    orientation,
                    requireText(c, "meaning", "cards[" + i + "]", content)));
        }

        String interpretation = requireText(root, "interpretation", "reading", content);

        JsonNode drinksNode = requireArray(root, "drinks", kind.cardCount(), content);
        List<Drink> drinks = new ArrayList<>(drinksNode.size());
        for (int i = 0; i < drinksNode.size(); i++) {
            JsonNode d = requireObject(drinksNode.get(i), "drinks[" + i + "]", content);
            drinks.add(new Drink(
                    requireText(d, "name", "drinks[" + i + "]", content),
                    requireText(d, "rationale", "drinks[" + i + "]", content)));
        }

        return new Parsed(cards, interpretation, drinks);
    }

    private static JsonNode requireArray(JsonNode parent, String field, int expectedSize, String content) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            throw violation("'" + field + "' is missing or not an array", content, null);
        }
        if (node.size() != expectedSize) {
            throw violation("expected " + expectedSize + " " + field + ", got " + node.size(), content, null);
        }
        return node;
    }

    private static JsonNode requireObject(JsonNode node, String where, String content) {
        if (node == null || !node.isObject()) {
            throw violation(where + " is not an object", content, null);
        }
        return node;
    }

    private static String requireText(JsonNode parent, String field, String where, String content) {
        JsonNode v = parent.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            throw violation(where + "." + field + " is missing, blank or not a string", content, null);
        }
        return v.asText().trim();
    }

    private static SchemaViolationException violation(String message, String content, Throwable cause) {
        return new SchemaViolationException(message, OpenAiClient.trunc(content, 2000), cause);
    }
}
