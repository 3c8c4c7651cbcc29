package com.tony.powerRank.repository;

import com.tony.powerRank.model.TeamRanking;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TeamRankingRepository extends JpaRepository<TeamRanking, Long> {

    Optional<TeamRanking> findByTeamId(String teamId);

    List<TeamRanking> findByTeamIdIn(Collection<String> teamIds);

    // Classement affiché d'une cohorte (équipes classées uniquement)
    List<TeamRanking> findByAgeAndGenderIgnoreCaseAndRankInCohortIsNotNullOrderByRankInCohortAsc(Integer age, String gender);
}
