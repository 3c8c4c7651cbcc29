package com.tony.powerRank.repository;

import com.tony.powerRank.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface GameRepository extends JpaRepository<Game, Long> {

    List<Game> findByGameUidIn(Collection<String> gameUids);

    // Matchs de la fenêtre, équipes chargées en une requête
    @Query("SELECT g FROM Game g LEFT JOIN FETCH g.homeTeam LEFT JOIN FETCH g.awayTeam " +
            "WHERE g.gameDate BETWEEN :from AND :to ORDER BY g.gameDate ASC, g.gameUid ASC")
    List<Game> findInWindow(@Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("SELECT g FROM Game g LEFT JOIN FETCH g.homeTeam LEFT JOIN FETCH g.awayTeam " +
            "WHERE g.gameDate BETWEEN :from AND :to AND g.provider = :provider " +
            "ORDER BY g.gameDate ASC, g.gameUid ASC")
    List<Game> findInWindowByProvider(@Param("from") LocalDate from,
                                      @Param("to") LocalDate to,
                                      @Param("provider") String provider);

    // Matchs sans date : remontés à part pour le rapport d'ingestion
    @Query("SELECT g FROM Game g LEFT JOIN FETCH g.homeTeam LEFT JOIN FETCH g.awayTeam WHERE g.gameDate IS NULL")
    List<Game> findUndated();
}
