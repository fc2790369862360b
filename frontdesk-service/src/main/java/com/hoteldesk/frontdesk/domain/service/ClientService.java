package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.frontdesk.api.dto.ClientResponse;
import com.hoteldesk.frontdesk.api.dto.CreateClientRequest;
import com.hoteldesk.frontdesk.domain.model.Client;
import com.hoteldesk.frontdesk.domain.repository.ClientRepository;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClientService {

    private final ClientRepository clientRepository;

    @Transactional
    public ClientResponse addClient(DeskPrincipal principal, CreateClientRequest request) {
        DeskPrincipal.require(principal);
        Client client = clientRepository.save(Client.builder()
                .name(RequestFields.requireText(request.name(), "Client name"))
                .phone(RequestFields.requireText(request.phone(), "Client phone"))
                .build());
        log.info("Client {} registered by {}", client.getId(), principal.username());
        return ClientResponse.from(client);
    }

    @Transactional(readOnly = true)
    public List<ClientResponse> listClients(DeskPrincipal principal) {
        DeskPrincipal.require(principal);
        return clientRepository.findAllByOrderByIdAsc().stream()
                .map(ClientResponse::from)
                .collect(Collectors.toList());
    }
}
