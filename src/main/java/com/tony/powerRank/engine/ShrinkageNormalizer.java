package com.tony.powerRank.engine;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.model.TeamCohortStat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Étape 2 : shrinkage bayésien vers la moyenne de cohorte puis normalisation [0,1].
 * Toutes les méthodes travaillent sur UNE cohorte.
 */
@Service
public class ShrinkageNormalizer {

    /**
     * Shrinkage + normalisation + force absolue (ancrée par âge).
     */
    public List<TeamCohortStat> normalize(List<TeamCohortStat> cohort, RankingConfig config) {
        return estimateStrength(shrink(cohort, config), config);
    }

    /**
     * shrunk = raw·w + moyenne·(1-w) avec w = gp / (gp + tau).
     * Le shrinkage porte sur les buts encaissés (sad) ; la défense est recalculée ensuite,
     * plus haute = meilleure.
     */
    public List<TeamCohortStat> shrink(List<TeamCohortStat> cohort, RankingConfig config) {
        int n = cohort.size();
        if (n == 0) return List.of();

        double[] offRaw = new double[n];
        double[] sadRaw = new double[n];
        for (int i = 0; i < n; i++) {
            offRaw[i] = cohort.get(i).getOffRaw();
            sadRaw[i] = cohort.get(i).getSadRaw();
        }
        double muOff = StatMath.mean(offRaw);
        double muSad = StatMath.mean(sadRaw);

        double[] offShrunk = new double[n];
        double[] sadShrunk = new double[n];
        double[] defShrunk = new double[n];
        for (int i = 0; i < n; i++) {
            int gp = cohort.get(i).getGamesPlayed();
            double w = gp / (gp + config.getShrinkTau());
            offShrunk[i] = offRaw[i] * w + muOff * (1 - w);
            sadShrunk[i] = sadRaw[i] * w + muSad * (1 - w);
            defShrunk[i] = 1.0 / (sadShrunk[i] + config.getRidgeGa());
        }

        // Garde-fou outliers au niveau équipe
        offShrunk = StatMath.clipToZ(offShrunk, config.getTeamOutlierGuardZscore());
        defShrunk = StatMath.clipToZ(defShrunk, config.getTeamOutlierGuardZscore());

        double[] offNorm = StatMath.normalize(offShrunk, config.getNormMode());
        double[] defNorm = StatMath.normalize(defShrunk, config.getNormMode());

        List<TeamCohortStat> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(cohort.get(i).toBuilder()
                    .offShrunk(offShrunk[i])
                    .sadShrunk(sadShrunk[i])
                    .defShrunk(defShrunk[i])
                    .offNorm(offNorm[i])
                    .defNorm(defNorm[i])
                    .build());
        }
        return out;
    }

    /**
     * power_presos = moyenne off/def normalisés ; abs_strength = power_presos × ancrage d'âge.
     * C'est la force utilisée pour noter les adversaires dans le SOS.
     */
    public List<TeamCohortStat> estimateStrength(List<TeamCohortStat> cohort, RankingConfig config) {
        List<TeamCohortStat> out = new ArrayList<>(cohort.size());
        for (TeamCohortStat t : cohort) {
            double presos = 0.5 * t.getOffNorm() + 0.5 * t.getDefNorm();
            double anchor = config.anchorFor(t.age());
            out.add(t.toBuilder()
                    .powerPresos(presos)
                    .anchor(anchor)
                    .absStrength(StatMath.clipUnit(presos * anchor))
                    .build());
        }
        return out;
    }
}
