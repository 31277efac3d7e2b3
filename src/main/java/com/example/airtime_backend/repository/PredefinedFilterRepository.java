package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.PredefinedFilter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface PredefinedFilterRepository extends JpaRepository<PredefinedFilter, UUID> {
    @Query("select distinct f from PredefinedFilter f left join fetch f.schedules where f.id = :id")
    Optional<PredefinedFilter> findWithSchedules(@Param("id") UUID id);
}
