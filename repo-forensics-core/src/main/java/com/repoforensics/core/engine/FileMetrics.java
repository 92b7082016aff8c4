package com.repoforensics.core.engine;

/**
 * Mutable per-file metrics accumulated during one analysis run.
 *
 * <p>Values are only added to, never reset. A value that no source reported stays absent
 * ({@code has...()} returns false) rather than zero.
 */
public class FileMetrics {

    private final String key;
    private final String path;

    private boolean hasRevisions;
    private int revisions;

    private long complexitySum;
    private int functionCount;
    private int maxComplexity;
    private long totalLinesOfCode;

    private boolean hasCoupling;
    private long sumOfCoupling;

    private boolean hasFragmentation;
    private double fragmentation;

    FileMetrics(String key, String path) {
        this.key = key;
        this.path = path;
    }

    void addRevisions(int count) {
        hasRevisions = true;
        revisions += count;
    }

    void addFunction(int cyclomaticComplexity, int linesOfCode) {
        if (functionCount == 0 || cyclomaticComplexity > maxComplexity) {
            maxComplexity = cyclomaticComplexity;
        }
        complexitySum += cyclomaticComplexity;
        functionCount++;
        totalLinesOfCode += linesOfCode;
    }

    void addCoupling(int value) {
        hasCoupling = true;
        sumOfCoupling += value;
    }

    void addFragmentation(double value) {
        hasFragmentation = true;
        fragmentation += value;
    }

    public String key() {
        return key;
    }

    public String path() {
        return path;
    }

    public boolean hasRevisions() {
        return hasRevisions;
    }

    public int revisions() {
        return revisions;
    }

    public boolean hasComplexity() {
        return functionCount > 0;
    }

    /**
     * Returns the mean cyclomatic complexity over all measured functions.
     *
     * @return average complexity, 0 if no function was measured
     */
    public double avgComplexity() {
        return functionCount == 0 ? 0.0 : (double) complexitySum / functionCount;
    }

    public int maxComplexity() {
        return maxComplexity;
    }

    public int functionCount() {
        return functionCount;
    }

    public long totalLinesOfCode() {
        return totalLinesOfCode;
    }

    public boolean hasCoupling() {
        return hasCoupling;
    }

    public long sumOfCoupling() {
        return sumOfCoupling;
    }

    public boolean hasFragmentation() {
        return hasFragmentation;
    }

    public double fragmentation() {
        return fragmentation;
    }
}
