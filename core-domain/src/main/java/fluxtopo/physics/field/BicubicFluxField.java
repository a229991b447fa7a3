package fluxtopo.physics.field;

import fluxtopo.domain.grid.FluxGrid;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Interpolante bicúbico de Hermite por tramos sobre una {@link FluxGrid}.
 * <p>
 * En cada nodo se estiman ∂F/∂R, ∂F/∂Z y ∂²F/∂R∂Z con diferencias finitas de segundo orden
 * (Lagrange de 3 puntos, laterales en los bordes), válidas en mallas no uniformes. Dentro de
 * cada celda el campo es un polinomio bicúbico, por lo que reproduce exactamente cualquier
 * campo cuadrático. Las consultas fuera de la caja se proyectan sobre su borde.
 * <p>
 * Stateless tras la construcción y Thread-Safe.
 */
public class BicubicFluxField implements FluxField {

    private final double[] rAxis;
    private final double[] zAxis;
    private final double[][] f;
    private final double[][] fr;
    private final double[][] fz;
    private final double[][] frz;
    @Getter
    private final int nr;
    @Getter
    private final int nz;

    public BicubicFluxField(FluxGrid grid) {
        Objects.requireNonNull(grid, "La malla no puede ser nula.");
        this.rAxis = grid.cloneRAxis();
        this.zAxis = grid.cloneZAxis();
        this.f = grid.clonePsi();
        this.nr = rAxis.length;
        this.nz = zAxis.length;

        this.fr = new double[nr][nz];
        this.fz = new double[nr][nz];
        this.frz = new double[nr][nz];

        // 1. Derivadas en Z (a lo largo de cada fila i)
        for (int j = 0; j < nz; j++) {
            int[] idx = stencil(j, nz);
            double[] w = derivativeWeights(zAxis, idx, j);
            for (int i = 0; i < nr; i++) {
                fz[i][j] = w[0] * f[i][idx[0]] + w[1] * f[i][idx[1]] + w[2] * f[i][idx[2]];
            }
        }

        // 2. Derivadas en R y derivada cruzada (aplicando el mismo operador a fz)
        for (int i = 0; i < nr; i++) {
            int[] idx = stencil(i, nr);
            double[] w = derivativeWeights(rAxis, idx, i);
            for (int j = 0; j < nz; j++) {
                fr[i][j] = w[0] * f[idx[0]][j] + w[1] * f[idx[1]][j] + w[2] * f[idx[2]][j];
                frz[i][j] = w[0] * fz[idx[0]][j] + w[1] * fz[idx[1]][j] + w[2] * fz[idx[2]][j];
            }
        }
    }

    @Override
    public double value(double r, double z) {
        return evaluate(r, z, 0, 0);
    }

    @Override
    public double derivative(double r, double z, int orderR, int orderZ) {
        FluxField.checkOrders(orderR, orderZ);
        return evaluate(r, z, orderR, orderZ);
    }

    private double evaluate(double r, double z, int orderR, int orderZ) {
        // Proyección sobre la caja de la malla
        double rc = Math.max(rAxis[0], Math.min(rAxis[nr - 1], r));
        double zc = Math.max(zAxis[0], Math.min(zAxis[nz - 1], z));

        int i = cellIndex(rAxis, rc);
        int j = cellIndex(zAxis, zc);

        double hr = rAxis[i + 1] - rAxis[i];
        double hz = zAxis[j + 1] - zAxis[j];
        double t = (rc - rAxis[i]) / hr;
        double u = (zc - zAxis[j]) / hz;

        // Bases de Hermite (valor A, pendiente B) y sus derivadas respecto a la coordenada local
        double[] aT = valueBasis(t, orderR);
        double[] bT = slopeBasis(t, orderR);
        double[] aU = valueBasis(u, orderZ);
        double[] bU = slopeBasis(u, orderZ);

        double sum = 0.0;
        for (int a = 0; a < 2; a++) {
            for (int b = 0; b < 2; b++) {
                int ii = i + a;
                int jj = j + b;
                sum += f[ii][jj] * aT[a] * aU[b]
                        + hr * fr[ii][jj] * bT[a] * aU[b]
                        + hz * fz[ii][jj] * aT[a] * bU[b]
                        + hr * hz * frz[ii][jj] * bT[a] * bU[b];
            }
        }

        // Regla de la cadena: d/dR = (1/hr) d/dt
        return sum / (Math.pow(hr, orderR) * Math.pow(hz, orderZ));
    }

    // --- Helpers Matemáticos Internos ---

    private static double[] valueBasis(double t, int order) {
        return switch (order) {
            case 0 -> new double[]{2 * t * t * t - 3 * t * t + 1, -2 * t * t * t + 3 * t * t};
            case 1 -> new double[]{6 * t * t - 6 * t, -6 * t * t + 6 * t};
            default -> new double[]{12 * t - 6, -12 * t + 6};
        };
    }

    private static double[] slopeBasis(double t, int order) {
        return switch (order) {
            case 0 -> new double[]{t * t * t - 2 * t * t + t, t * t * t - t * t};
            case 1 -> new double[]{3 * t * t - 4 * t + 1, 3 * t * t - 2 * t};
            default -> new double[]{6 * t - 4, 6 * t - 2};
        };
    }

    /**
     * Celda [k, k+1] que contiene x (x ya proyectado en el eje).
     */
    private static int cellIndex(double[] axis, double x) {
        int pos = Arrays.binarySearch(axis, x);
        int k = pos >= 0 ? pos : -pos - 2;
        return Math.max(0, Math.min(axis.length - 2, k));
    }

    /**
     * Tres nodos para la derivada en el nodo k: centrados en el interior, laterales en los bordes.
     */
    private static int[] stencil(int k, int n) {
        if (k == 0) return new int[]{0, 1, 2};
        if (k == n - 1) return new int[]{n - 3, n - 2, n - 1};
        return new int[]{k - 1, k, k + 1};
    }

    /**
     * Pesos de la derivada del polinomio de Lagrange de 3 puntos evaluada en axis[k].
     */
    private static double[] derivativeWeights(double[] axis, int[] idx, int k) {
        double x = axis[k];
        double x0 = axis[idx[0]];
        double x1 = axis[idx[1]];
        double x2 = axis[idx[2]];
        return new double[]{
                ((x - x1) + (x - x2)) / ((x0 - x1) * (x0 - x2)),
                ((x - x0) + (x - x2)) / ((x1 - x0) * (x1 - x2)),
                ((x - x0) + (x - x1)) / ((x2 - x0) * (x2 - x1))
        };
    }
}
