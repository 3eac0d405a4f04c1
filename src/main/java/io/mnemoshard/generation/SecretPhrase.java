package io.mnemoshard.generation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Word-level checks on the secret before it is split.
 */
public final class SecretPhrase {
    private SecretPhrase() {
    }

    public static List<String> words(String secretText) {
        List<String> out = new ArrayList<>();
        if (secretText == null || secretText.isBlank()) {
            return out;
        }
        for (String word : secretText.trim().split("\\s+")) {
            if (!word.isEmpty()) {
                out.add(word);
            }
        }
        return out;
    }

    public static String normalize(String secretText) {
        return String.join(" ", words(secretText));
    }

    public static List<String> duplicateWords(List<String> words) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String word : words) {
            String key = word.toLowerCase(Locale.ROOT);
            if (!seen.add(key)) {
                duplicates.add(key);
            }
        }
        return List.copyOf(duplicates);
    }

    /**
     * @param vocabulary membership check, or {@code null} to skip it
     * @return the normalized phrase
     */
    public static String validate(String secretText, Predicate<String> vocabulary) {
        List<String> words = words(secretText);
        if (words.isEmpty()) {
            throw new GenerationException("Secret is empty");
        }
        List<String> duplicates = duplicateWords(words);
        if (!duplicates.isEmpty()) {
            throw new GenerationException("Duplicate words found: " + String.join(", ", duplicates)
                    + ". Each word should be unique.");
        }
        if (vocabulary != null) {
            for (int i = 0; i < words.size(); i++) {
                if (!vocabulary.test(words.get(i).toLowerCase(Locale.ROOT))) {
                    throw new GenerationException("Word " + (i + 1) + " is not in the word list");
                }
            }
        }
        return String.join(" ", words);
    }
}
