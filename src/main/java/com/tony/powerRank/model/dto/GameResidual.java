package com.tony.powerRank.model.dto;

/**
 * Résidu (buts réels - buts prédits) du point de vue de l'équipe à domicile.
 */
public record GameResidual(String gameId, double residual) {
}
