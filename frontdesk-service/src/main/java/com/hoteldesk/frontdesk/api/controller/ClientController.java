package com.hoteldesk.frontdesk.api.controller;

import com.hoteldesk.common.dto.BaseResponse;
import com.hoteldesk.frontdesk.api.dto.ClientResponse;
import com.hoteldesk.frontdesk.api.dto.CreateClientRequest;
import com.hoteldesk.frontdesk.domain.service.ClientService;
import com.hoteldesk.frontdesk.security.AccessGate;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/clients")
@RequiredArgsConstructor
public class ClientController {

    private final ClientService clientService;
    private final AccessGate accessGate;

    @PostMapping
    public ResponseEntity<BaseResponse<ClientResponse>> addClient(
            @Valid @RequestBody CreateClientRequest request, HttpServletRequest httpRequest) {
        ClientResponse response = clientService.addClient(accessGate.currentPrincipal(httpRequest), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Client added", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<ClientResponse>>> listClients(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(BaseResponse.success(
                clientService.listClients(accessGate.currentPrincipal(httpRequest))));
    }
}
