package com.tony.powerRank.model;

public enum TeamStatus {
    ACTIVE,
    // Aucun match sur la fenêtre d'inactivité
    INACTIVE,
    NOT_ENOUGH_RANKED_GAMES
}
