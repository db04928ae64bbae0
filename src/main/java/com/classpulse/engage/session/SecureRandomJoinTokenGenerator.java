package com.classpulse.engage.session;

import com.classpulse.engage.config.EngageProperties;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/** URL-safe random tokens of the configured length. */
@Component
public class SecureRandomJoinTokenGenerator implements JoinTokenGenerator {
    private final SecureRandom random = new SecureRandom();
    private final int length;

    public SecureRandomJoinTokenGenerator(EngageProperties properties) {
        this.length = properties.session().joinTokenLength();
    }

    @Override
    public String next() {
        // 3 bytes encode to 4 characters
        byte[] bytes = new byte[(length * 3 + 3) / 4];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes).substring(0, length);
    }
}
