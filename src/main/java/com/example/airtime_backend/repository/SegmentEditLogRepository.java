package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.SegmentEditLog;
import com.example.airtime_backend.util.EditAction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SegmentEditLogRepository extends JpaRepository<SegmentEditLog, UUID> {
    boolean existsByAudioSegmentIdAndActionAndSourceSegmentIds(UUID audioSegmentId, EditAction action, String sourceSegmentIds);

    List<SegmentEditLog> findByAudioSegmentIdOrderByCreatedAtAsc(UUID audioSegmentId);
}
