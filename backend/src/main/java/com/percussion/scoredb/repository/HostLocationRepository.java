package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.HostLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface HostLocationRepository extends JpaRepository<HostLocation, Long> {

    // Exact natural key match; null city/state only match null
    @Query("select h from HostLocation h where h.name = :name " +
            "and ((:city is null and h.city is null) or h.city = :city) " +
            "and ((:state is null and h.state is null) or h.state = :state) order by h.id asc")
    List<HostLocation> findByNaturalKey(@Param("name") String name,
                                        @Param("city") String city,
                                        @Param("state") String state);
}
