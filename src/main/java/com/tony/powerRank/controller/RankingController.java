package com.tony.powerRank.controller;

import com.tony.powerRank.model.RankingSnapshot;
import com.tony.powerRank.model.TeamRanking;
import com.tony.powerRank.repository.RankingSnapshotRepository;
import com.tony.powerRank.repository.TeamRankingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rankings")
@RequiredArgsConstructor
public class RankingController {

    private final TeamRankingRepository rankingRepository;
    private final RankingSnapshotRepository snapshotRepository;

    // Classement d'une cohorte, ex : GET /api/v1/rankings/14/male
    @GetMapping("/{age}/{gender}")
    public ResponseEntity<List<TeamRanking>> getCohortRanking(@PathVariable Integer age, @PathVariable String gender) {
        return ResponseEntity.ok(rankingRepository
                .findByAgeAndGenderIgnoreCaseAndRankInCohortIsNotNullOrderByRankInCohortAsc(age, gender));
    }

    @GetMapping("/teams/{teamId}")
    public ResponseEntity<TeamRanking> getTeamRanking(@PathVariable String teamId) {
        return rankingRepository.findByTeamId(teamId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/teams/{teamId}/history")
    public ResponseEntity<List<RankingSnapshot>> getTeamHistory(@PathVariable String teamId) {
        List<RankingSnapshot> history = snapshotRepository.findByTeamIdOrderBySnapshotDateDesc(teamId);
        if (history.isEmpty() && rankingRepository.findByTeamId(teamId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(history);
    }
}
