package com.storefront.authservice.repository;

import com.storefront.authservice.entity.LoginRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface LoginRecordRepository extends JpaRepository<LoginRecord, Long> {

    @Query("SELECT r FROM LoginRecord r WHERE r.user.id = :userId ORDER BY r.loginAt DESC, r.id DESC")
    List<LoginRecord> findRecent(@Param("userId") UUID userId, Pageable pageable);

    long countByUserId(UUID userId);

    @Query("SELECT r FROM LoginRecord r WHERE r.user.id = :userId ORDER BY r.loginAt ASC, r.id ASC")
    List<LoginRecord> findOldest(@Param("userId") UUID userId, Pageable pageable);
}
