package com.example.dodge.service;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoomCodeGeneratorTest {

    @Test
    void next_usesUnambiguousAlphabet() {
        RoomCodeGenerator gen = new RoomCodeGenerator(new Random(1), 10);
        for (int i = 0; i < 500; i++) {
            String code = gen.next();
            assertEquals(4, code.length());
            assertTrue(code.chars().allMatch(c -> RoomCodeGenerator.ALPHABET.indexOf(c) >= 0), code);
            assertFalse(code.matches(".*[0O1I].*"), code);
        }
    }

    @Test
    void generate_retriesUntilFree() {
        RoomCodeGenerator gen = new RoomCodeGenerator(new Random(3), 10);
        Set<String> seen = new HashSet<>();

        // first two draws count as taken
        String code = gen.generate(c -> seen.add(c) && seen.size() <= 2);

        assertEquals(3, seen.size());
        assertTrue(seen.contains(code));
    }

    @Test
    void generate_failsLoudlyWhenExhausted() {
        RoomCodeGenerator gen = new RoomCodeGenerator(new Random(5), 25);

        RoomCodeExhaustedException ex =
                assertThrows(RoomCodeExhaustedException.class, () -> gen.generate(c -> true));
        assertTrue(ex.getMessage().contains("25"));
    }
}
