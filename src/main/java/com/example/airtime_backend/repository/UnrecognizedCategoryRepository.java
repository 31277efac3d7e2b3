package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.UnrecognizedCategory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface UnrecognizedCategoryRepository extends JpaRepository<UnrecognizedCategory, UUID> {
}
