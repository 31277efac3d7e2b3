package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.AudioSegment;
import jakarta.transaction.Transactional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AudioSegmentRepository extends JpaRepository<AudioSegment, UUID>, JpaSpecificationExecutor<AudioSegment> {
    Optional<AudioSegment> findByFilePath(String filePath);

    boolean existsByFilePath(String filePath);

    @Query("""
       select s from AudioSegment s
       where s.channel.id = :channelId
         and s.startTime = :start
         and s.endTime = :end
       order by s.createdAt asc
    """)
    List<AudioSegment> findExact(@Param("channelId") UUID channelId,
                                 @Param("start") Instant start,
                                 @Param("end") Instant end);

    /**
     * Active segments of a channel that overlap {@code [windowStart, windowEnd)} and were created
     * before {@code createdBefore}; the exact {@code [start, end]} match is excluded.
     */
    @Query("""
       select s from AudioSegment s
       where s.channel.id = :channelId
         and s.active = true
         and s.startTime < :windowEnd
         and s.endTime > :windowStart
         and s.createdAt < :createdBefore
         and not (s.startTime = :start and s.endTime = :end)
    """)
    List<AudioSegment> findStaleOverlaps(@Param("channelId") UUID channelId,
                                         @Param("windowStart") Instant windowStart,
                                         @Param("windowEnd") Instant windowEnd,
                                         @Param("createdBefore") Instant createdBefore,
                                         @Param("start") Instant start,
                                         @Param("end") Instant end);

    @Query("""
       select s from AudioSegment s
       where s.channel.id = :channelId
         and s.active = true
         and s.deleted = false
         and s.startTime >= :from
         and s.startTime < :to
       order by s.startTime asc
    """)
    List<AudioSegment> findActiveInRange(@Param("channelId") UUID channelId,
                                         @Param("from") Instant from,
                                         @Param("to") Instant to);

    @Query("""
       select count(s) from AudioSegment s
       where s.channel.id = :channelId
         and s.active = true
         and s.deleted = false
         and s.startTime >= :from
         and s.startTime < :to
    """)
    long countActiveInRange(@Param("channelId") UUID channelId,
                            @Param("from") Instant from,
                            @Param("to") Instant to);

    @Modifying @Transactional
    @Query("update AudioSegment s set s.active = false where s.id in :ids and s.active = true")
    int deactivateByIdIn(@Param("ids") Collection<UUID> ids);

    @Modifying @Transactional
    @Query("update AudioSegment s set s.requiresAnalysis = :value where s.id in :ids")
    int updateRequiresAnalysis(@Param("ids") Collection<UUID> ids, @Param("value") boolean value);

    @Modifying @Transactional
    @Query("update AudioSegment s set s.title = :title where s.id in :ids and s.recognized = false")
    int renameUnrecognized(@Param("ids") Collection<UUID> ids, @Param("title") String title);
}
