package com.hoteldesk.frontdesk.api.dto;

import com.hoteldesk.frontdesk.domain.model.Client;

public record ClientResponse(
        Long id,
        String name,
        String phone
) {
    public static ClientResponse from(Client client) {
        return new ClientResponse(client.getId(), client.getName(), client.getPhone());
    }
}
