package com.gsm.fraud.engine.features;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Location categories seen at fit time, in one-hot order. Matching is trimmed and
 * case-insensitive.
 */
public final class LocationVocabulary {

    private final List<String> categories;
    private final Map<String, LocationCategory> byKey;

    public LocationVocabulary(List<String> categories) {
        this.categories = List.copyOf(categories);
        this.byKey = new HashMap<>();
        for (int i = 0; i < this.categories.size(); i++) {
            String key = normalize(this.categories.get(i));
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Blank location category at position " + i);
            }
            if (byKey.putIfAbsent(key, LocationCategory.known(i, this.categories.get(i))) != null) {
                throw new IllegalArgumentException("Duplicate location category: " + this.categories.get(i));
            }
        }
    }

    public LocationCategory resolve(String rawValue) {
        if (rawValue == null) {
            return LocationCategory.UNKNOWN;
        }
        return byKey.getOrDefault(normalize(rawValue), LocationCategory.UNKNOWN);
    }

    public int size() {
        return categories.size();
    }

    public List<String> getCategories() {
        return categories;
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
