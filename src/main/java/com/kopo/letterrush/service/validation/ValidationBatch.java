package com.kopo.letterrush.service.validation;

import java.util.List;
import java.util.Locale;

/**
 * Input of one judge call: the distinct lower-cased (category, word) pairs of a round.
 */
public record ValidationBatch(String letter, List<String> categories, List<Candidate> candidates) {

    public ValidationBatch {
        categories = List.copyOf(categories);
        candidates = List.copyOf(candidates);
    }

    public List<String> keys() {
        return candidates.stream().map(Candidate::key).toList();
    }

    public static String key(String category, String word) {
        return normalize(category) + ":" + normalize(word);
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public record Candidate(String category, String word) {

        public Candidate {
            category = normalize(category);
            word = normalize(word);
        }

        public String key() {
            return category + ":" + word;
        }
    }
}
