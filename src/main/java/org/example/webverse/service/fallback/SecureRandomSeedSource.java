package org.example.webverse.service.fallback;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class SecureRandomSeedSource implements SeedSource {

    private final SecureRandom random = new SecureRandom();

    @Override
    public long nextSeed() {
        return random.nextInt() & 0xFFFFFFFFL;
    }
}
