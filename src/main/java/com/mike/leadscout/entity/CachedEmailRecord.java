package com.mike.leadscout.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "cached_emails")
@Getter
@Setter
public class CachedEmailRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "domain", nullable = false, unique = true, length = 255)
    private String domain;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "source", length = 64)
    private String source;

    @Column(name = "catch_all", nullable = false)
    private boolean catchAll;

    @Column(name = "cached_at", nullable = false)
    private Instant cachedAt;
}
