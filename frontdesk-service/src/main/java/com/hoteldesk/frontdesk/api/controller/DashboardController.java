package com.hoteldesk.frontdesk.api.controller;

import com.hoteldesk.common.dto.BaseResponse;
import com.hoteldesk.frontdesk.api.dto.DashboardResponse;
import com.hoteldesk.frontdesk.domain.service.DashboardService;
import com.hoteldesk.frontdesk.security.AccessGate;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;
    private final AccessGate accessGate;

    @GetMapping
    public ResponseEntity<BaseResponse<DashboardResponse>> summary(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(BaseResponse.success(
                dashboardService.summary(accessGate.currentPrincipal(httpRequest))));
    }
}
