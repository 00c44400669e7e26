package com.example.toolgateway.repository;

import com.example.toolgateway.domain.Connection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConnectionRepository extends JpaRepository<Connection, String> {

    List<Connection> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    List<Connection> findByOwnerIdAndEnabledOrderByCreatedAtDesc(String ownerId, boolean enabled);

    List<Connection> findByEnabled(boolean enabled);

    Optional<Connection> findByIdAndOwnerId(String id, String ownerId);

    boolean existsByOwnerIdAndName(String ownerId, String name);
}
