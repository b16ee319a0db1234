package com.storefront.authservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One successful login. At most ten are kept per identity; the oldest is dropped first.
 */
@Entity
@Table(name = "login_history", indexes = @Index(name = "idx_login_history_user", columnList = "user_id, login_at"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "login_at", nullable = false)
    private Instant loginAt;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 255)
    private String userAgent;
}
