package com.tony.powerRank.controller;

import com.tony.powerRank.config.RankingProperties;
import com.tony.powerRank.model.dto.RecalculationReport;
import com.tony.powerRank.service.GameImportService;
import com.tony.powerRank.service.RankHistoryService;
import com.tony.powerRank.service.RankingService;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/admin")
@Validated
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final RankingService rankingService;
    private final GameImportService importService;
    private final RankHistoryService historyService;
    private final RankingProperties props;

    /**
     * Recalcul manuel. Exemple : POST /api/v1/admin/rankings/recalculate?forceRebuild=true
     */
    @PostMapping("/rankings/recalculate")
    public ResponseEntity<RecalculationReport> recalculate(
            @RequestParam(defaultValue = "false") boolean forceRebuild,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate today = date != null ? date : LocalDate.now();
        return ResponseEntity.ok(rankingService.recalculate(today, provider, forceRebuild));
    }

    // Import CSV de matchs résolus (multipart, champ "file")
    @PostMapping("/import")
    public ResponseEntity<String> importGames(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body("❌ Fichier vide.");
        }
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(importService.importGames(reader));
        } catch (IOException e) {
            log.error("Erreur lecture du fichier {}", file.getOriginalFilename(), e);
            return ResponseEntity.internalServerError().body("Erreur : " + e.getMessage());
        }
    }

    @PostMapping("/history/cleanup")
    public ResponseEntity<String> cleanupHistory(@RequestParam(required = false) @Min(1) Integer daysToKeep) {
        int days = daysToKeep != null ? daysToKeep : props.getHistory().getRetentionDays();
        int deleted = historyService.cleanupOldSnapshots(days, LocalDate.now());
        return ResponseEntity.ok(String.format("✅ %d photos supprimées (rétention %d jours).", deleted, days));
    }
}
