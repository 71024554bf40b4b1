package com.invoicedesk.backend.seed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import com.invoicedesk.backend.entities.User;
import com.invoicedesk.backend.repositories.UserRepository;

/**
 * Garante um usuário para o login local. Lê APP_SEED_USER_EMAIL, APP_SEED_USER_PASSWORD e APP_SEED_USER_NAME.
 */
@Component
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true")
public class UserSeedRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(UserSeedRunner.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public UserSeedRunner(UserRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public void run(ApplicationArguments args) {
        String email = requiredEnv("APP_SEED_USER_EMAIL").toLowerCase();

        if (userRepository.existsByEmail(email)) {
            logger.info("[Seed] User {} already exists. Skipping.", email);
            return;
        }

        User user = new User();
        user.setEmail(email);
        user.setName(requiredEnv("APP_SEED_USER_NAME"));
        user.setPassword(passwordEncoder.encode(requiredEnv("APP_SEED_USER_PASSWORD")));

        userRepository.save(user);
        logger.info("[Seed] User ensured: {}", email);
    }

    private String requiredEnv(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required environment variable: " + key);
        }
        return value.trim();
    }
}
