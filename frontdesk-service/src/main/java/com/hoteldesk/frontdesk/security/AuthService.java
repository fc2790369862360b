package com.hoteldesk.frontdesk.security;

import com.hoteldesk.common.exception.UnauthorizedException;
import com.hoteldesk.frontdesk.domain.model.User;
import com.hoteldesk.frontdesk.domain.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Verifies desk user credentials against stored BCrypt hashes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String BAD_CREDENTIALS = "Invalid username or password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional(readOnly = true)
    public DeskPrincipal authenticate(String username, String password) {
        User user = userRepository.findByUsername(username)
                .filter(u -> passwordEncoder.matches(password, u.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Failed login attempt for username: {}", username);
                    return new UnauthorizedException(BAD_CREDENTIALS);
                });
        return DeskPrincipal.from(user);
    }

    /**
     * Creates the user unless the username is already taken. Returns true when a user was created.
     */
    @Transactional
    public boolean registerIfAbsent(String username, String rawPassword, User.Role role) {
        if (userRepository.existsByUsername(username)) {
            return false;
        }
        userRepository.save(User.builder()
                .username(username)
                .passwordHash(passwordEncoder.encode(rawPassword))
                .role(role)
                .build());
        log.info("Created {} user {}", role, username);
        return true;
    }
}
