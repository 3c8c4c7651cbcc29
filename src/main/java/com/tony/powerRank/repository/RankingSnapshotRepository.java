package com.tony.powerRank.repository;

import com.tony.powerRank.model.RankingSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface RankingSnapshotRepository extends JpaRepository<RankingSnapshot, Long> {

    List<RankingSnapshot> findBySnapshotDateAndTeamIdIn(LocalDate snapshotDate, Collection<String> teamIds);

    List<RankingSnapshot> findByTeamIdInAndSnapshotDateBetween(Collection<String> teamIds, LocalDate from, LocalDate to);

    List<RankingSnapshot> findByTeamIdOrderBySnapshotDateDesc(String teamId);

    @Modifying
    @Transactional
    @Query("DELETE FROM RankingSnapshot s WHERE s.snapshotDate < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);
}
