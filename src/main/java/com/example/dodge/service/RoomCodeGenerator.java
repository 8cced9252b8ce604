package com.example.dodge.service;

import com.example.dodge.config.GameProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Predicate;

/** Draws 4-character room codes without the look-alike characters 0/O and 1/I. */
@Component
public class RoomCodeGenerator {

    public static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    public static final int CODE_LENGTH = 4;

    private final Random random;
    private final int maxAttempts;

    @Autowired
    public RoomCodeGenerator(GameProperties props) {
        this(new SecureRandom(), props.getCodeMaxAttempts());
    }

    public RoomCodeGenerator(Random random, int maxAttempts) {
        this.random = random;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /** A random code, not checked against anything. */
    public String next() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * Draws codes until {@code inUse} rejects none of them.
     *
     * @throws RoomCodeExhaustedException if every attempt collided
     */
    public String generate(Predicate<String> inUse) {
        for (int i = 0; i < maxAttempts; i++) {
            String code = next();
            if (!inUse.test(code)) return code;
        }
        throw new RoomCodeExhaustedException(maxAttempts);
    }
}
