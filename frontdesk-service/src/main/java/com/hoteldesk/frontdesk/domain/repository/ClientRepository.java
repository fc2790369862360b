package com.hoteldesk.frontdesk.domain.repository;

import com.hoteldesk.frontdesk.domain.model.Client;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ClientRepository extends JpaRepository<Client, Long> {
    List<Client> findAllByOrderByIdAsc();
}
