package com.tony.powerRank.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Équipe résolue en amont (identifiant maître stable).
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "team", indexes = {
        @Index(name = "idx_team_cohort", columnList = "age, gender")
})
public class Team {
    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(nullable = false)
    private String name;

    private String club;

    // Code état US (2 lettres), sert au calcul du SCF
    @Column(name = "state_code", length = 4)
    private String stateCode;

    private Integer age;

    @Column(length = 16)
    private String gender;

    public Team(String id, String name, Integer age, String gender) {
        this.id = id;
        this.name = name;
        this.age = age;
        this.gender = gender;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
