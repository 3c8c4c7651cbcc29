package com.tony.powerRank.engine;

import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composantes connexes du graphe équipe-adversaire (union-find sur indices entiers).
 */
@Service
public class ComponentFinder {

    /**
     * Composante de chaque équipe de la cohorte.
     *
     * @param teamIds équipes de la cohorte, dans un ordre déterministe
     * @param games   arêtes (équipe, adversaire) ; un adversaire hors cohorte peut relier deux équipes
     */
    public Components find(List<String> teamIds, List<WeightedGame> games) {
        Map<String, Integer> index = new HashMap<>();
        for (String t : teamIds) {
            index.putIfAbsent(t, index.size());
        }
        for (WeightedGame g : games) {
            index.putIfAbsent(g.getTeamId(), index.size());
            index.putIfAbsent(g.getOpponentId(), index.size());
        }

        UnionFind uf = new UnionFind(index.size());
        for (WeightedGame g : games) {
            uf.union(index.get(g.getTeamId()), index.get(g.getOpponentId()));
        }

        // Numérotation stable : ordre de première apparition dans teamIds
        Map<Integer, Integer> rootToComponent = new HashMap<>();
        Map<String, Integer> componentOf = new LinkedHashMap<>();
        Map<Integer, Integer> sizes = new HashMap<>();
        for (String t : teamIds) {
            int root = uf.find(index.get(t));
            int component = rootToComponent.computeIfAbsent(root, r -> rootToComponent.size());
            componentOf.put(t, component);
            sizes.merge(component, 1, Integer::sum);
        }
        return new Components(componentOf, sizes);
    }

    /**
     * @param componentOf équipe → id de composante (0..k-1)
     * @param sizes       id → nombre d'équipes de la cohorte dans la composante
     */
    public record Components(Map<String, Integer> componentOf, Map<Integer, Integer> sizes) {

        public int count() {
            return sizes.size();
        }

        public int sizeOf(String teamId) {
            Integer c = componentOf.get(teamId);
            return c == null ? 0 : sizes.get(c);
        }
    }

    static final class UnionFind {
        private final int[] parent;
        private final int[] rank;

        UnionFind(int n) {
            parent = new int[n];
            rank = new int[n];
            for (int i = 0; i < n; i++) parent[i] = i;
        }

        int find(int x) {
            while (parent[x] != x) {
                parent[x] = parent[parent[x]];
                x = parent[x];
            }
            return x;
        }

        void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra == rb) return;
            if (rank[ra] < rank[rb]) {
                parent[ra] = rb;
            } else if (rank[ra] > rank[rb]) {
                parent[rb] = ra;
            } else {
                parent[rb] = ra;
                rank[ra]++;
            }
        }
    }
}
