package com.tony.powerRank.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Ligne de la table équipe × cohorte. Chaque étape du moteur en renvoie
 * une copie enrichie (toBuilder), jamais une mutation.
 * Tous les champs normalisés (*Norm, sos, powerscore*) sont dans [0,1].
 */
@Value
@Builder(toBuilder = true)
public class TeamCohortStat {
    String teamId;
    CohortKey cohort;

    // --- Échantillon ---
    int gamesPlayed;
    int gamesLast180Days;
    LocalDate lastGameDate;

    // --- Attaque / Défense (sad = buts encaissés pondérés) ---
    double offRaw;
    double sadRaw;
    double defRaw;
    double offShrunk;
    double sadShrunk;
    double defShrunk;
    double offNorm;
    double defNorm;

    // --- Force ---
    double powerPresos;
    double anchor;
    double absStrength;

    // --- SOS ---
    double sosRaw;
    double sos;
    double sosNorm;
    Integer sosRank;
    @Builder.Default double scf = 1.0;
    int bridgeGames;
    int uniqueOpponentStates;
    boolean isolated;
    int componentId;
    int componentSize;
    @Builder.Default SampleFlag sampleFlag = SampleFlag.OK;

    // --- Performance ---
    double perfRaw;
    double perfCentered;

    // --- PowerScore ---
    double powerscoreCore;
    @Builder.Default double provisionalMult = 1.0;
    double powerscoreAdj;
    double powerScoreFinal;
    @Builder.Default TeamStatus status = TeamStatus.ACTIVE;
    Integer rankInCohort;

    // --- Couche ML ---
    double mlOverperf;
    double mlNorm;
    double powerscoreMl;
    Integer rankInCohortMl;

    // --- Historique ---
    Integer rankChange7d;
    Integer rankChange30d;

    public int age() {
        return cohort.age();
    }

    public String gender() {
        return cohort.gender();
    }

    /**
     * Rang courant de référence : ML si disponible, sinon cohorte.
     */
    public Integer effectiveRank() {
        return rankInCohortMl != null ? rankInCohortMl : rankInCohort;
    }
}
