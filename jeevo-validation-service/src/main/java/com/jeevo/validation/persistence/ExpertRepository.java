package com.jeevo.validation.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ExpertRepository extends JpaRepository<Expert, Long> {

    /** Deterministic pick: lowest id among active, available experts. */
    Optional<Expert> findFirstByActiveTrueAndAvailableTrueOrderByIdAsc();

    List<Expert> findAllByOrderByIdAsc();
}
