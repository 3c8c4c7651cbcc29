package com.tony.powerRank.engine;

/**
 * Échec du calcul d'une cohorte (exception remontée par un worker).
 */
public class RankingComputationException extends RuntimeException {

    public RankingComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
