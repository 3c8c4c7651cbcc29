package com.tony.powerRank.model;

import java.util.Comparator;

/**
 * Cohorte de classement : tranche d'âge × genre.
 */
public record CohortKey(int age, String gender) implements Comparable<CohortKey> {

    private static final Comparator<CohortKey> ORDER = Comparator
            .comparingInt(CohortKey::age)
            .thenComparing(CohortKey::gender);

    public CohortKey {
        gender = gender == null ? "" : gender.trim().toLowerCase();
    }

    @Override
    public int compareTo(CohortKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "U" + age + " " + gender;
    }
}
