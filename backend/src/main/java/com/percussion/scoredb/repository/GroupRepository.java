package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.Group;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface GroupRepository extends JpaRepository<Group, Long> {
    Optional<Group> findByNameAndHomeCity(String name, String homeCity);
}
