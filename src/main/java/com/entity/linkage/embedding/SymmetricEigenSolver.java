package com.entity.linkage.embedding;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

/**
 * Eigen-decomposition of real symmetric matrices.
 *
 * <p>For a symmetric matrix the singular values are the absolute eigenvalues
 * and the left singular vectors are the eigenvectors, so this doubles as the
 * SVD used by the embedding factorization. Small matrices are solved exactly
 * with cyclic Jacobi rotations; large ones use seeded orthogonal (subspace)
 * iteration followed by a Jacobi solve of the projected matrix.</p>
 *
 * <p>Results are deterministic: eigenpairs are ordered by decreasing absolute
 * eigenvalue and each eigenvector is signed so that its largest-magnitude
 * component is positive.</p>
 */
final class SymmetricEigenSolver {

    static final int FULL_SOLVE_MAX_SIZE = 200;
    private static final int MAX_SWEEPS = 100;
    private static final int SUBSPACE_ITERATIONS = 30;
    private static final int OVERSAMPLING = 10;
    private static final double EPSILON = 1e-22;

    private SymmetricEigenSolver() {
    }

    /**
     * Eigenpairs sorted by decreasing |value|. {@code vectors[k]} is the k-th eigenvector.
     */
    record Decomposition(double[] values, double[][] vectors) {
    }

    /**
     * Returns the {@code k} eigenpairs with the largest absolute eigenvalues.
     */
    static Decomposition top(double[][] matrix, int k, long seed) {
        int n = matrix.length;
        if (k < 1 || k > n) {
            throw new IllegalArgumentException("k must be in [1, " + n + "], got " + k);
        }
        Decomposition full = n <= FULL_SOLVE_MAX_SIZE ? jacobi(matrix) : subspace(matrix, k, seed);
        return truncate(full, k);
    }

    /**
     * Full decomposition by cyclic Jacobi rotations.
     */
    static Decomposition jacobi(double[][] matrix) {
        int n = matrix.length;
        double[][] a = new double[n][];
        double[][] v = new double[n][n];
        double norm = 0.0;
        for (int i = 0; i < n; i++) {
            a[i] = matrix[i].clone();
            v[i][i] = 1.0;
            for (int j = 0; j < n; j++) {
                norm += a[i][j] * a[i][j];
            }
        }

        for (int sweep = 0; sweep < MAX_SWEEPS; sweep++) {
            double off = 0.0;
            for (int p = 0; p < n - 1; p++) {
                for (int q = p + 1; q < n; q++) {
                    off += a[p][q] * a[p][q];
                }
            }
            if (off <= EPSILON * norm || off == 0.0) {
                break;
            }
            for (int p = 0; p < n - 1; p++) {
                for (int q = p + 1; q < n; q++) {
                    if (a[p][q] != 0.0) {
                        rotate(a, v, p, q);
                    }
                }
            }
        }

        double[] values = new double[n];
        double[][] vectors = new double[n][n];
        for (int k = 0; k < n; k++) {
            values[k] = a[k][k];
            for (int i = 0; i < n; i++) {
                vectors[k][i] = v[i][k];
            }
        }
        return sorted(values, vectors);
    }

    private static void rotate(double[][] a, double[][] v, int p, int q) {
        int n = a.length;
        double theta = (a[q][q] - a[p][p]) / (2.0 * a[p][q]);
        double t = (theta >= 0 ? 1.0 : -1.0) / (Math.abs(theta) + Math.sqrt(theta * theta + 1.0));
        double c = 1.0 / Math.sqrt(t * t + 1.0);
        double s = t * c;

        for (int k = 0; k < n; k++) {
            double akp = a[k][p];
            double akq = a[k][q];
            a[k][p] = c * akp - s * akq;
            a[k][q] = s * akp + c * akq;
        }
        for (int k = 0; k < n; k++) {
            double apk = a[p][k];
            double aqk = a[q][k];
            a[p][k] = c * apk - s * aqk;
            a[q][k] = s * apk + c * aqk;
        }
        for (int k = 0; k < n; k++) {
            double vkp = v[k][p];
            double vkq = v[k][q];
            v[k][p] = c * vkp - s * vkq;
            v[k][q] = s * vkp + c * vkq;
        }
    }

    private static Decomposition subspace(double[][] matrix, int k, long seed) {
        int n = matrix.length;
        int width = Math.min(n, k + OVERSAMPLING);
        Random random = new Random(seed);

        // columns stored as rows: basis[j] is the j-th basis vector
        double[][] basis = new double[width][n];
        for (int j = 0; j < width; j++) {
            for (int i = 0; i < n; i++) {
                basis[j][i] = random.nextGaussian();
            }
        }
        orthonormalize(basis);

        for (int iteration = 0; iteration < SUBSPACE_ITERATIONS; iteration++) {
            double[][] next = new double[width][];
            for (int j = 0; j < width; j++) {
                next[j] = multiply(matrix, basis[j]);
            }
            orthonormalize(next);
            basis = next;
        }

        // Rayleigh-Ritz: solve the projected problem exactly
        double[][] projected = new double[width][width];
        double[][] mq = new double[width][];
        for (int j = 0; j < width; j++) {
            mq[j] = multiply(matrix, basis[j]);
        }
        for (int i = 0; i < width; i++) {
            for (int j = 0; j < width; j++) {
                projected[i][j] = dot(basis[i], mq[j]);
            }
        }
        for (int i = 0; i < width; i++) {
            for (int j = i + 1; j < width; j++) {
                double mean = 0.5 * (projected[i][j] + projected[j][i]);
                projected[i][j] = mean;
                projected[j][i] = mean;
            }
        }
        Decomposition small = jacobi(projected);

        double[][] vectors = new double[width][n];
        for (int r = 0; r < width; r++) {
            for (int j = 0; j < width; j++) {
                double w = small.vectors()[r][j];
                for (int i = 0; i < n; i++) {
                    vectors[r][i] += w * basis[j][i];
                }
            }
        }
        return sorted(small.values(), vectors);
    }

    private static void orthonormalize(double[][] columns) {
        for (int j = 0; j < columns.length; j++) {
            for (int prev = 0; prev < j; prev++) {
                double projection = dot(columns[j], columns[prev]);
                for (int i = 0; i < columns[j].length; i++) {
                    columns[j][i] -= projection * columns[prev][i];
                }
            }
            double norm = Math.sqrt(dot(columns[j], columns[j]));
            if (norm < 1e-12) {
                Arrays.fill(columns[j], 0.0);
                continue;
            }
            for (int i = 0; i < columns[j].length; i++) {
                columns[j][i] /= norm;
            }
        }
    }

    private static double[] multiply(double[][] matrix, double[] vector) {
        double[] result = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = dot(matrix[i], vector);
        }
        return result;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static Decomposition sorted(double[] values, double[][] vectors) {
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> -Math.abs(values[i]))
                .thenComparingInt(i -> i));

        double[] sortedValues = new double[values.length];
        double[][] sortedVectors = new double[values.length][];
        for (int r = 0; r < order.length; r++) {
            sortedValues[r] = values[order[r]];
            sortedVectors[r] = fixSign(vectors[order[r]].clone());
        }
        return new Decomposition(sortedValues, sortedVectors);
    }

    private static double[] fixSign(double[] vector) {
        int largest = 0;
        for (int i = 1; i < vector.length; i++) {
            if (Math.abs(vector[i]) > Math.abs(vector[largest])) {
                largest = i;
            }
        }
        if (vector[largest] < 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = -vector[i];
            }
        }
        return vector;
    }

    private static Decomposition truncate(Decomposition full, int k) {
        return new Decomposition(Arrays.copyOf(full.values(), k), Arrays.copyOf(full.vectors(), k));
    }
}
