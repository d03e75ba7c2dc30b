package com.kopo.letterrush.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class LetterDrawerTest {

    @Test
    @DisplayName("Every letter is drawn exactly once before the alphabet runs dry")
    void drawsEachLetterOnce() {
        LetterDrawer drawer = new LetterDrawer("ABCDE", new Random(42));
        List<String> used = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            Optional<String> letter = drawer.draw(used);
            assertTrue(letter.isPresent());
            assertFalse(used.contains(letter.get()), "letter repeated: " + letter.get());
            used.add(letter.get());
        }

        assertTrue(drawer.draw(used).isEmpty());
        assertEquals(Set.of("A", "B", "C", "D", "E"), new HashSet<>(used));
    }

    @Test
    void alphabetIsUpperCasedAndDeduplicated() {
        LetterDrawer drawer = new LetterDrawer("abca-b", new Random(1));

        assertEquals(List.of("A", "B", "C"), drawer.getAlphabet());
        assertEquals(List.of("C"), drawer.remaining(List.of("A", "B")));
    }

    @Test
    void defaultAlphabetSkipsQvxy() {
        LetterDrawer drawer = new LetterDrawer("ABCDEFGHIJKLMNOPRSTUWZ");

        assertEquals(22, drawer.getAlphabet().size());
        assertFalse(drawer.getAlphabet().contains("Q"));
        assertFalse(drawer.getAlphabet().contains("V"));
    }

    @Test
    void rejectsAlphabetWithoutLetters() {
        assertThrows(IllegalArgumentException.class, () -> new LetterDrawer("123", new Random()));
    }
}
