package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.ImportRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImportRunRepository extends JpaRepository<ImportRun, Long> {
    Page<ImportRun> findAllByOrderByStartedAtDesc(Pageable pageable);

    List<ImportRun> findByFilenameOrderByStartedAtDesc(String filename);
}
