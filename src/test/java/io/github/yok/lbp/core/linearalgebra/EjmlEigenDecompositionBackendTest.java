package io.github.yok.lbp.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.lbp.core.linearalgebra.EigenDecompositionBackend.EigenDecompositionResult;
import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class EjmlEigenDecompositionBackendTest {

    private final EjmlEigenDecompositionBackend backend = new EjmlEigenDecompositionBackend();

    @Test
    void eigenpairsSatisfyDefiningEquation() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{2, 1}, {1, 2}});
        EigenDecompositionResult r = backend.decompose(a);

        double[] sorted = r.getEigenvalues().clone();
        Arrays.sort(sorted);
        assertArrayEquals(new double[] {1.0, 3.0}, sorted, 1e-9);

        DMatrixRMaj v = r.getEigenvectors();
        for (int k = 0; k < 2; k++) {
            double lambda = r.getEigenvalues()[k];
            double x = v.get(0, k);
            double y = v.get(1, k);
            assertEquals(1.0, Math.hypot(x, y), 1e-9);
            assertEquals(lambda * x, 2 * x + y, 1e-9);
            assertEquals(lambda * y, x + 2 * y, 1e-9);
        }
    }

    @Test
    void nonSymmetricMatrixWithRealSpectrum() {
        // 上三角なので固有値は対角成分
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{4, 1}, {0, 2}});
        double[] values = backend.decompose(a).getEigenvalues().clone();
        Arrays.sort(values);

        assertArrayEquals(new double[] {2.0, 4.0}, values, 1e-9);
    }

    @Test
    void complexPairsKeepRealPartAndZeroVectors() {
        // 90 度回転の固有値は ±i
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{0, -1}, {1, 0}});
        EigenDecompositionResult r = backend.decompose(a);

        assertArrayEquals(new double[] {0.0, 0.0}, r.getEigenvalues(), 1e-9);
        assertEquals(0.0, r.getEigenvectors().get(0, 0));
        assertEquals(0.0, r.getEigenvectors().get(1, 1));
    }

    @Test
    void inputIsNotModified() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{3, 1}, {2, 5}});
        DMatrixRMaj copy = a.copy();
        backend.decompose(a);

        assertArrayEquals(copy.data, a.data);
    }

    @Test
    void nonSquareOrNullIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> backend.decompose(new DMatrixRMaj(2, 3)));
        assertThrows(IllegalArgumentException.class, () -> backend.decompose(null));
    }
}
