package com.tony.powerRank.config;

/**
 * Levée quand la configuration de classement est incohérente
 * (poids qui ne somment pas à 1, fenêtre négative, etc.).
 */
public class InvalidRankingConfigException extends RuntimeException {

    public InvalidRankingConfigException(String message) {
        super(message);
    }
}
