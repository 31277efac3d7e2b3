package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.TitleMappingRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface TitleMappingRuleRepository extends JpaRepository<TitleMappingRule, UUID> {
    @Query("""
       select r from TitleMappingRule r
       join fetch r.category c
       where c.channel.id in :channelIds
         and r.active = true
         and c.active = true
    """)
    List<TitleMappingRule> findActiveByChannelIn(@Param("channelIds") Iterable<UUID> channelIds);
}
