package com.tony.powerRank.engine.ml;

/**
 * Arbre de régression (moindres carrés) à profondeur bornée, splits sur seuils discrétisés.
 */
final class RegressionTree {

    private static final double MIN_GAIN = 1e-12;

    private final int maxDepth;
    private final int minSamplesLeaf;
    private Node root;

    private static final class Node {
        int feature = -1;
        double threshold;
        Node left;
        Node right;
        double value;

        boolean isLeaf() {
            return feature < 0;
        }
    }

    RegressionTree(int maxDepth, int minSamplesLeaf) {
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = Math.max(1, minSamplesLeaf);
    }

    void fit(double[] target, int[] rows, FeatureBins bins) {
        root = build(target, rows, bins, 0);
    }

    double predict(double[] x) {
        Node node = root;
        while (!node.isLeaf()) {
            node = x[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    private Node build(double[] target, int[] rows, FeatureBins bins, int depth) {
        Node node = new Node();
        double total = 0;
        for (int r : rows) total += target[r];
        node.value = rows.length == 0 ? 0.0 : total / rows.length;
        if (depth >= maxDepth || rows.length < 2 * minSamplesLeaf) return node;

        int bestFeature = -1;
        int bestBin = -1;
        double bestGain = MIN_GAIN;
        double parentScore = total * total / rows.length;

        for (int f = 0; f < bins.features(); f++) {
            int nb = bins.cuts[f].length;
            if (nb < 2) continue;
            double[] sums = new double[nb];
            int[] counts = new int[nb];
            for (int r : rows) {
                int b = bins.bin[r][f];
                sums[b] += target[r];
                counts[b]++;
            }
            double leftSum = 0;
            int leftCount = 0;
            for (int k = 0; k < nb - 1; k++) {
                leftSum += sums[k];
                leftCount += counts[k];
                int rightCount = rows.length - leftCount;
                if (leftCount < minSamplesLeaf) continue;
                if (rightCount < minSamplesLeaf) break;
                double rightSum = total - leftSum;
                double gain = leftSum * leftSum / leftCount + rightSum * rightSum / rightCount - parentScore;
                if (gain > bestGain) {
                    bestGain = gain;
                    bestFeature = f;
                    bestBin = k;
                }
            }
        }
        if (bestFeature < 0) return node;

        int leftSize = 0;
        for (int r : rows) {
            if (bins.bin[r][bestFeature] <= bestBin) leftSize++;
        }
        int[] left = new int[leftSize];
        int[] right = new int[rows.length - leftSize];
        int li = 0;
        int ri = 0;
        for (int r : rows) {
            if (bins.bin[r][bestFeature] <= bestBin) left[li++] = r;
            else right[ri++] = r;
        }

        node.feature = bestFeature;
        node.threshold = bins.cuts[bestFeature][bestBin];
        node.left = build(target, left, bins, depth + 1);
        node.right = build(target, right, bins, depth + 1);
        return node;
    }
}
