package com.entity.linkage.embedding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SymmetricEigenSolverTest {

    @Test
    @DisplayName("eigenpairs of a small matrix, largest first")
    void small() {
        double[][] m = {{2, 1}, {1, 2}};

        SymmetricEigenSolver.Decomposition d = SymmetricEigenSolver.top(m, 2, 42L);

        assertEquals(3.0, d.values()[0], 1e-10);
        assertEquals(1.0, d.values()[1], 1e-10);
        double s = Math.sqrt(0.5);
        assertArrayEquals(new double[]{s, s}, d.vectors()[0], 1e-10);
    }

    @Test
    @DisplayName("ordering uses absolute eigenvalues")
    void negativeEigenvalues() {
        double[][] m = {{0, 3, 0}, {3, 0, 0}, {0, 0, 1}};

        SymmetricEigenSolver.Decomposition d = SymmetricEigenSolver.top(m, 3, 42L);

        assertEquals(3.0, Math.abs(d.values()[0]), 1e-10);
        assertEquals(3.0, Math.abs(d.values()[1]), 1e-10);
        assertEquals(1.0, d.values()[2], 1e-10);
    }

    @Test
    @DisplayName("subspace iteration agrees with the exact solve on a large matrix")
    void largeMatrix() {
        int n = SymmetricEigenSolver.FULL_SOLVE_MAX_SIZE + 20;
        double[][] m = new double[n][n];
        Random random = new Random(3);
        // dominant eigenvalues 100, 50 and 25, plus small symmetric noise
        double[][] basis = new double[3][n];
        for (int k = 0; k < 3; k++) {
            basis[k][k * 7] = 1.0;
        }
        double[] values = {100, 50, 25};
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double x = 0.01 * random.nextGaussian();
                for (int k = 0; k < 3; k++) {
                    x += values[k] * basis[k][i] * basis[k][j];
                }
                m[i][j] = x;
                m[j][i] = x;
            }
        }

        SymmetricEigenSolver.Decomposition d = SymmetricEigenSolver.top(m, 3, 42L);

        assertEquals(100.0, d.values()[0], 0.5);
        assertEquals(50.0, d.values()[1], 0.5);
        assertEquals(25.0, d.values()[2], 0.5);
        assertEquals(1.0, Math.abs(d.vectors()[0][0]), 1e-3);
    }

    @Test
    @DisplayName("a rank outside the matrix size is rejected")
    void invalidRank() {
        assertThrows(IllegalArgumentException.class, () -> SymmetricEigenSolver.top(new double[][]{{1}}, 2, 1L));
    }
}
