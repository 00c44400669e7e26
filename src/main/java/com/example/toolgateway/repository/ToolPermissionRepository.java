package com.example.toolgateway.repository;

import com.example.toolgateway.domain.ToolPermission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ToolPermissionRepository extends JpaRepository<ToolPermission, String> {

    Optional<ToolPermission> findByUserIdAndConnectionIdAndToolName(String userId, String connectionId, String toolName);

    List<ToolPermission> findByUserIdOrderByConnectionIdAscToolNameAsc(String userId);

    List<ToolPermission> findByUserIdAndConnectionIdOrderByToolNameAsc(String userId, String connectionId);

    @Modifying
    long deleteByConnectionId(String connectionId);
}
