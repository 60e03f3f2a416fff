package com.portsyncro.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PortfolioSnapshotRepository extends MongoRepository<PortfolioSnapshot, String> {

    List<PortfolioSnapshot> findByUserIdOrderByDateDesc(String userId);

    Optional<PortfolioSnapshot> findByUserIdAndDate(String userId, LocalDate date);

    long countByUserId(String userId);
}
