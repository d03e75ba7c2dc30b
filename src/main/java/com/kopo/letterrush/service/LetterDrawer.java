package com.kopo.letterrush.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import java.security.SecureRandom;
import java.util.*;

/**
 * Draws round letters uniformly from the configured alphabet, skipping letters already used in the game.
 */
@Component
public class LetterDrawer {

    private final List<String> alphabet;
    private final Random random;

    @Autowired
    public LetterDrawer(@Value("${game.letters.alphabet:ABCDEFGHIJKLMNOPRSTUWZ}") String alphabet) {
        this(alphabet, new SecureRandom());
    }

    LetterDrawer(String alphabet, Random random) {
        Set<String> letters = new LinkedHashSet<>();
        for (char c : alphabet.toUpperCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetter(c)) {
                letters.add(String.valueOf(c));
            }
        }
        if (letters.isEmpty()) {
            throw new IllegalArgumentException("game.letters.alphabet must contain at least one letter");
        }
        this.alphabet = List.copyOf(letters);
        this.random = random;
    }

    public Optional<String> draw(Collection<String> usedLetters) {
        List<String> available = remaining(usedLetters);
        if (available.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(available.get(random.nextInt(available.size())));
    }

    public List<String> remaining(Collection<String> usedLetters) {
        Set<String> used = new HashSet<>(usedLetters);
        return alphabet.stream().filter(l -> !used.contains(l)).toList();
    }

    public List<String> getAlphabet() {
        return alphabet;
    }
}
