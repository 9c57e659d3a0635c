package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.Classification;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ClassificationRepository extends JpaRepository<Classification, Long> {
    Optional<Classification> findByName(String name);
}
