package com.example.toolgateway.repository;

import com.example.toolgateway.domain.AuditLog;
import com.example.toolgateway.domain.AuditStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    List<AuditLog> findByUserIdOrderByTimestampDesc(String userId);

    List<AuditLog> findBySessionIdOrderByTimestampDesc(String sessionId);

    @Query("SELECT a FROM AuditLog a WHERE " +
           "(:userId IS NULL OR a.userId = :userId) AND " +
           "(:toolName IS NULL OR a.toolName = :toolName) AND " +
           "(:status IS NULL OR a.status = :status) AND " +
           "(:keyword IS NULL OR LOWER(a.response) LIKE LOWER(CONCAT('%', :keyword, '%'))) AND " +
           "(:start IS NULL OR a.timestamp >= :start) AND " +
           "(:end IS NULL OR a.timestamp <= :end) " +
           "ORDER BY a.timestamp DESC")
    List<AuditLog> findFiltered(@Param("userId") String userId,
                                @Param("toolName") String toolName,
                                @Param("status") AuditStatus status,
                                @Param("keyword") String keyword,
                                @Param("start") Instant start,
                                @Param("end") Instant end,
                                Pageable pageable);

    @Query("SELECT a.status, COUNT(a) FROM AuditLog a WHERE " +
           "(:start IS NULL OR a.timestamp >= :start) AND " +
           "(:end IS NULL OR a.timestamp <= :end) " +
           "GROUP BY a.status")
    List<Object[]> countByStatus(@Param("start") Instant start, @Param("end") Instant end);

    @Query("SELECT a.toolName, COUNT(a) FROM AuditLog a WHERE " +
           "(:start IS NULL OR a.timestamp >= :start) AND " +
           "(:end IS NULL OR a.timestamp <= :end) " +
           "GROUP BY a.toolName")
    List<Object[]> countByTool(@Param("start") Instant start, @Param("end") Instant end);

    long countByUserId(String userId);
}
