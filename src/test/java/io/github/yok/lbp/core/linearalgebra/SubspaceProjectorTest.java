package io.github.yok.lbp.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class SubspaceProjectorTest {

    private static final double EPS = 1e-12;

    /**
     * 45 度回転の正規直交基底（列が基底）です。
     */
    private static DMatrixRMaj rotation() {
        double h = Math.sqrt(0.5);
        return new DMatrixRMaj(new double[][] {{h, -h}, {h, h}});
    }

    @Test
    void projectSubtractsMeanThenMultiplies() {
        DMatrixRMaj mean = new DMatrixRMaj(new double[][] {{1.0, 2.0}});
        DMatrixRMaj data = new DMatrixRMaj(new double[][] {{2.0, 3.0}, {1.0, 2.0}});

        DMatrixRMaj y = SubspaceProjector.project(rotation(), mean, data);

        assertEquals(2, y.numRows);
        assertEquals(2, y.numCols);
        assertEquals(Math.sqrt(2.0), y.get(0, 0), EPS);
        assertEquals(0.0, y.get(0, 1), EPS);
        assertEquals(0.0, y.get(1, 0), EPS);
    }

    @Test
    void reconstructInvertsProjectionForOrthonormalBasis() {
        DMatrixRMaj mean = new DMatrixRMaj(new double[][] {{-0.5, 4.0}});
        DMatrixRMaj data = new DMatrixRMaj(new double[][] {{3.0, -1.0}, {0.25, 7.0}, {0, 0}});

        DMatrixRMaj back = SubspaceProjector.reconstruct(rotation(), mean,
                SubspaceProjector.project(rotation(), mean, data));

        for (int i = 0; i < data.numRows; i++) {
            for (int j = 0; j < data.numCols; j++) {
                assertEquals(data.get(i, j), back.get(i, j), EPS);
            }
        }
    }

    @Test
    void meanOfWrongLengthIsIgnored() {
        DMatrixRMaj basis = new DMatrixRMaj(new double[][] {{1.0}, {0.0}});
        DMatrixRMaj data = new DMatrixRMaj(new double[][] {{5.0, 9.0}});
        DMatrixRMaj badMean = new DMatrixRMaj(new double[][] {{1.0, 1.0, 1.0}});

        assertEquals(5.0, SubspaceProjector.project(basis, badMean, data).get(0, 0), EPS);
        assertEquals(5.0, SubspaceProjector.project(basis, null, data).get(0, 0), EPS);

        DMatrixRMaj back = SubspaceProjector.reconstruct(basis, badMean,
                new DMatrixRMaj(new double[][] {{5.0}}));
        assertEquals(5.0, back.get(0, 0), EPS);
        assertEquals(0.0, back.get(0, 1), EPS);
    }

    @Test
    void mismatchedDimensionsAreRejected() {
        DMatrixRMaj basis = new DMatrixRMaj(3, 2);

        assertThrows(IllegalArgumentException.class,
                () -> SubspaceProjector.project(basis, null, new DMatrixRMaj(1, 2)));
        assertThrows(IllegalArgumentException.class,
                () -> SubspaceProjector.reconstruct(basis, null, new DMatrixRMaj(1, 3)));
        assertThrows(IllegalArgumentException.class,
                () -> SubspaceProjector.project(null, null, new DMatrixRMaj(1, 3)));
    }
}
