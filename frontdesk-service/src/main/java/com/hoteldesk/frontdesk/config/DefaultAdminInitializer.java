package com.hoteldesk.frontdesk.config;

import com.hoteldesk.frontdesk.domain.model.User;
import com.hoteldesk.frontdesk.security.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the administrator account on startup when it does not exist yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultAdminInitializer implements ApplicationRunner {

    private final AuthService authService;

    @Value("${frontdesk.security.default-admin.username:admin}")
    private String username;

    @Value("${frontdesk.security.default-admin.password:admin123}")
    private String password;

    @Override
    public void run(ApplicationArguments args) {
        if (!authService.registerIfAbsent(username, password, User.Role.ADMIN)) {
            log.debug("Default admin {} already present", username);
        }
    }
}
