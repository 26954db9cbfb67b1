package com.mike.leadscout.repository;

import com.mike.leadscout.entity.CachedEmailRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CachedEmailRecordRepository extends JpaRepository<CachedEmailRecord, Long> {

    Optional<CachedEmailRecord> findByDomain(String domain);

    void deleteByDomain(String domain);
}
