package com.entity.linkage.embedding;

import com.entity.linkage.core.exception.ConfigurationException;

/**
 * Random-walk and factorization parameters.
 *
 * @param dimensions  requested embedding dimension (clamped to the node count)
 * @param walkLength  nodes per walk, including the start node
 * @param numWalks    walks started from every node
 * @param windowSize  co-occurrence window on each side of a walk position
 * @param seed        seed of the walk generator
 * @param returnParam node2vec p; higher values make returning to the previous node less likely
 * @param inOutParam  node2vec q; higher values keep walks closer to the previous node
 * @param directed    treat edges as directed instead of undirected
 */
public record Node2VecParams(int dimensions, int walkLength, int numWalks, int windowSize, long seed,
                             double returnParam, double inOutParam, boolean directed) {

    public static final int DEFAULT_DIMENSIONS = 64;
    public static final int DEFAULT_WALK_LENGTH = 10;
    public static final int DEFAULT_NUM_WALKS = 10;
    public static final int DEFAULT_WINDOW_SIZE = 5;
    public static final long DEFAULT_SEED = 42L;

    public Node2VecParams {
        requirePositive("dimensions", dimensions);
        requirePositive("walkLength", walkLength);
        requirePositive("numWalks", numWalks);
        requirePositive("windowSize", windowSize);
        if (!(returnParam > 0.0) || !(inOutParam > 0.0)) {
            throw new ConfigurationException("returnParam and inOutParam must be > 0");
        }
    }

    public static Node2VecParams defaults() {
        return new Node2VecParams(DEFAULT_DIMENSIONS, DEFAULT_WALK_LENGTH, DEFAULT_NUM_WALKS,
                DEFAULT_WINDOW_SIZE, DEFAULT_SEED, 1.0, 1.0, false);
    }

    public Node2VecParams withSeed(long newSeed) {
        return new Node2VecParams(dimensions, walkLength, numWalks, windowSize, newSeed,
                returnParam, inOutParam, directed);
    }

    public Node2VecParams withDimensions(int newDimensions) {
        return new Node2VecParams(newDimensions, walkLength, numWalks, windowSize, seed,
                returnParam, inOutParam, directed);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be > 0, got " + value);
        }
    }
}
