package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.Shift;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ShiftRepository extends JpaRepository<Shift, UUID> {
    @Query("select s from Shift s where s.channel.id = :channelId and s.active = true order by s.startTime")
    List<Shift> findActiveByChannel(@Param("channelId") UUID channelId);

    @Query("select s from Shift s where s.channel.id in :channelIds and s.active = true")
    List<Shift> findActiveByChannelIn(@Param("channelIds") Iterable<UUID> channelIds);
}
