package com.tony.powerRank.engine;

/**
 * Connectivité du calendrier d'une équipe (détection de bulles régionales).
 *
 * @param scf         Schedule Connectivity Factor dans [scfFloor, 1]
 * @param bridgeGames matchs contre un adversaire d'un autre état
 * @param isolated    trop peu de matchs "pont" ou d'états différents
 */
public record ConnectivityProfile(double scf,
                                  int uniqueStates,
                                  int uniqueRegions,
                                  int bridgeGames,
                                  boolean isolated) {

    public static ConnectivityProfile neutral() {
        return new ConnectivityProfile(1.0, 0, 0, 0, false);
    }
}
