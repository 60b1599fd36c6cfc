package roadwatch.detection.predictor;

/**
 * Mínimos cuadrados ordinarios por ecuaciones normales para sistemas pequeños
 * (unas pocas columnas). Devuelve {@code null} si el sistema es singular.
 */
final class LeastSquares {

    private static final double SINGULARITY_TOLERANCE = 1e-9;

    private LeastSquares() {}

    /**
     * Resuelve min ||X·b - y||².
     *
     * @param x Matriz de diseño [filas][columnas].
     * @param y Vector objetivo [filas].
     * @return coeficientes b, o {@code null} si X'X es (casi) singular.
     */
    static double[] solve(double[][] x, double[] y) {
        int rows = x.length;
        if (rows == 0) {
            return null;
        }
        int cols = x[0].length;
        if (rows < cols) {
            return null;
        }

        // Ecuaciones normales: (X'X) b = X'y
        double[][] a = new double[cols][cols + 1];
        for (int r = 0; r < rows; r++) {
            for (int i = 0; i < cols; i++) {
                for (int j = 0; j < cols; j++) {
                    a[i][j] += x[r][i] * x[r][j];
                }
                a[i][cols] += x[r][i] * y[r];
            }
        }
        return gaussianElimination(a, cols);
    }

    private static double[] gaussianElimination(double[][] a, int n) {
        double scale = 0.0;
        for (int i = 0; i < n; i++) {
            scale = Math.max(scale, Math.abs(a[i][i]));
        }
        if (scale == 0.0) {
            return null;
        }
        double tolerance = SINGULARITY_TOLERANCE * scale;

        for (int col = 0; col < n; col++) {
            // Pivoteo parcial
            int pivot = col;
            for (int r = col + 1; r < n; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) {
                    pivot = r;
                }
            }
            if (Math.abs(a[pivot][col]) < tolerance) {
                return null;
            }
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;

            for (int r = col + 1; r < n; r++) {
                double factor = a[r][col] / a[col][col];
                for (int c = col; c <= n; c++) {
                    a[r][c] -= factor * a[col][c];
                }
            }
        }

        double[] solution = new double[n];
        for (int r = n - 1; r >= 0; r--) {
            double sum = a[r][n];
            for (int c = r + 1; c < n; c++) {
                sum -= a[r][c] * solution[c];
            }
            solution[r] = sum / a[r][r];
        }
        for (double v : solution) {
            if (!Double.isFinite(v)) {
                return null;
            }
        }
        return solution;
    }
}
