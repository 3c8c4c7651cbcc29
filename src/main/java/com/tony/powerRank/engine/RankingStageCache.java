package com.tony.powerRank.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.model.GameRecord;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Cache des étapes déterministes (agrégation → PowerScore) d'un passage.
 * Clé : SHA-256 de (matchs, fenêtre, provider, today, config).
 */
@Slf4j
public class RankingStageCache {

    private static final Comparator<GameRecord> RECORD_ORDER = Comparator
            .comparing(GameRecord::getGameId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(GameRecord::getTeamId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final boolean enabled;
    private final Cache<String, StageOutput> cache;

    public RankingStageCache(boolean enabled, int maxEntries) {
        this.enabled = enabled;
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxEntries))
                .build();
    }

    public Optional<StageOutput> get(String key) {
        if (!enabled) return Optional.empty();
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(String key, StageOutput output) {
        if (enabled) cache.put(key, output);
    }

    public String keyFor(RankingInput input, RankingConfig config) {
        MessageDigest digest = sha256();
        List<GameRecord> sorted = input.games().stream().sorted(RECORD_ORDER).toList();
        for (GameRecord r : sorted) {
            update(digest, r.getGameId() + ":" + r.getTeamId() + ":" + r.getDate() + ":"
                    + r.getGoalsFor() + ":" + r.getGoalsAgainst() + ";");
        }
        update(digest, "|window=" + config.getWindowDays());
        update(digest, "|provider=" + input.providerFilter());
        update(digest, "|today=" + input.today());
        update(digest, "|config=" + config.hashCode());
        update(digest, "|states=" + new TreeMap<>(input.teamStates()));
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponible", e);
        }
    }
}
