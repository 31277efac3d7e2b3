package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.Channel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ChannelRepository extends JpaRepository<Channel, UUID> {
    List<Channel> findByActiveTrueAndDeletedFalse();
}
