package com.hoteldesk.frontdesk.api.controller;

import com.hoteldesk.common.dto.BaseResponse;
import com.hoteldesk.frontdesk.api.dto.LoginRequest;
import com.hoteldesk.frontdesk.security.AccessGate;
import com.hoteldesk.frontdesk.security.AuthService;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Session login/logout for desk users.
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final AccessGate accessGate;

    @PostMapping("/login")
    public ResponseEntity<BaseResponse<DeskPrincipal>> login(
            @Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        DeskPrincipal principal = authService.authenticate(request.username(), request.password());
        accessGate.signIn(httpRequest, principal);
        return ResponseEntity.ok(BaseResponse.success("Signed in", principal));
    }

    @PostMapping("/logout")
    public ResponseEntity<BaseResponse<Void>> logout(HttpServletRequest httpRequest) {
        accessGate.currentPrincipal(httpRequest);
        accessGate.signOut(httpRequest);
        return ResponseEntity.ok(BaseResponse.success("Signed out", null));
    }

    @GetMapping("/me")
    public ResponseEntity<BaseResponse<DeskPrincipal>> me(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(BaseResponse.success(accessGate.currentPrincipal(httpRequest)));
    }
}
