package fluxtopo.factory;

import fluxtopo.domain.grid.FluxGrid;

import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/**
 * Fábrica de instancias de {@link FluxGrid} a partir de ejes rectilíneos y una función psi(R, Z).
 * <p>
 * Pensada para equilibrios sintéticos (validación de algoritmos) y para adaptar modelos externos
 * que exponen el flujo como función en lugar de como array.
 */
public final class FluxGridFactory {

    private FluxGridFactory() {}

    /**
     * Muestrea psi en una malla uniforme de nr × nz nodos sobre [rMin, rMax] × [zMin, zMax].
     */
    public static FluxGrid createUniform(double rMin, double rMax, int nr,
                                         double zMin, double zMax, int nz,
                                         DoubleBinaryOperator psiFunction) {
        return createFromAxes(linspace(rMin, rMax, nr), linspace(zMin, zMax, nz), psiFunction);
    }

    /**
     * Muestrea psi en la malla producto de los ejes dados (no necesariamente uniformes).
     */
    public static FluxGrid createFromAxes(double[] rAxis, double[] zAxis, DoubleBinaryOperator psiFunction) {
        Objects.requireNonNull(rAxis, "El eje R no puede ser nulo.");
        Objects.requireNonNull(zAxis, "El eje Z no puede ser nulo.");
        Objects.requireNonNull(psiFunction, "La función psi no puede ser nula.");

        final int nr = rAxis.length;
        final int nz = zAxis.length;
        double[][] r = new double[nr][nz];
        double[][] z = new double[nr][nz];
        double[][] psi = new double[nr][nz];

        for (int i = 0; i < nr; i++) {
            for (int j = 0; j < nz; j++) {
                r[i][j] = rAxis[i];
                z[i][j] = zAxis[j];
                psi[i][j] = psiFunction.applyAsDouble(rAxis[i], zAxis[j]);
            }
        }
        return new FluxGrid(r, z, psi);
    }

    /**
     * n valores equiespaciados en [start, end], ambos extremos incluidos.
     */
    public static double[] linspace(double start, double end, int n) {
        if (n < 2) {
            throw new IllegalArgumentException("linspace necesita al menos 2 puntos.");
        }
        double[] values = new double[n];
        double step = (end - start) / (n - 1);
        for (int k = 0; k < n; k++) {
            values[k] = start + k * step;
        }
        // Extremo exacto, sin error de redondeo acumulado
        values[n - 1] = end;
        return values;
    }
}
