package fluxtopo.domain.grid;

import lombok.Getter;

import java.util.Objects;

/**
 * Malla rectilínea inmutable (R, Z) con el flujo poloidal psi muestreado en sus nodos.
 * <p>
 * El índice {@code i} recorre el radio mayor R y el índice {@code j} la altura Z:
 * {@code R[i][j]} depende solo de {@code i} y {@code Z[i][j]} solo de {@code j}.
 * Ambos ejes son estrictamente crecientes. La malla pertenece al modelo de equilibrio
 * externo; esta clase solo la valida y la expone en modo lectura.
 */
public final class FluxGrid {

    /**
     * Margen mínimo de nodos que necesita el estencil de segundas derivadas (2 celdas por lado).
     */
    public static final int MIN_NODES_PER_AXIS = 5;

    @Getter
    private final int nr;
    @Getter
    private final int nz;
    private final double[][] r;
    private final double[][] z;
    private final double[][] psi;
    private final double[] rAxis;
    private final double[] zAxis;

    /**
     * @param r   Radios mayores R[nr][nz].
     * @param z   Alturas Z[nr][nz].
     * @param psi Flujo poloidal psi[nr][nz], co-indexado con la malla.
     */
    public FluxGrid(double[][] r, double[][] z, double[][] psi) {
        Objects.requireNonNull(r, "La malla R no puede ser nula.");
        Objects.requireNonNull(z, "La malla Z no puede ser nula.");
        Objects.requireNonNull(psi, "El campo psi no puede ser nulo.");

        final int nr = r.length;
        if (nr < MIN_NODES_PER_AXIS || z.length != nr || psi.length != nr) {
            throw new IllegalArgumentException(String.format(
                    "La malla necesita al menos %d nodos en R y arrays de igual tamaño (R=%d, Z=%d, psi=%d).",
                    MIN_NODES_PER_AXIS, nr, z.length, psi.length));
        }
        final int nz = r[0].length;
        if (nz < MIN_NODES_PER_AXIS) {
            throw new IllegalArgumentException(String.format(
                    "La malla necesita al menos %d nodos en Z (recibidos %d).", MIN_NODES_PER_AXIS, nz));
        }

        // Clonamos fila a fila para garantizar inmutabilidad completa
        this.r = new double[nr][];
        this.z = new double[nr][];
        this.psi = new double[nr][];
        for (int i = 0; i < nr; i++) {
            if (r[i].length != nz || z[i].length != nz || psi[i].length != nz) {
                throw new IllegalArgumentException("Todas las filas de R, Z y psi deben tener " + nz + " columnas (fila " + i + ").");
            }
            for (int j = 0; j < nz; j++) {
                if (Double.isNaN(psi[i][j]) || Double.isNaN(r[i][j]) || Double.isNaN(z[i][j])) {
                    throw new IllegalArgumentException(String.format("Valor NaN en la malla en el nodo (%d, %d).", i, j));
                }
            }
            this.r[i] = r[i].clone();
            this.z[i] = z[i].clone();
            this.psi[i] = psi[i].clone();
        }

        this.nr = nr;
        this.nz = nz;
        this.rAxis = new double[nr];
        this.zAxis = new double[nz];
        for (int i = 0; i < nr; i++) {
            rAxis[i] = this.r[i][0];
        }
        for (int j = 0; j < nz; j++) {
            zAxis[j] = this.z[0][j];
        }

        for (int i = 0; i < nr - 1; i++) {
            if (rAxis[i + 1] <= rAxis[i]) {
                throw new IllegalArgumentException(String.format(
                        "El eje R debe ser estrictamente creciente: R[%d]=%.6f, R[%d]=%.6f.", i, rAxis[i], i + 1, rAxis[i + 1]));
            }
        }
        for (int j = 0; j < nz - 1; j++) {
            if (zAxis[j + 1] <= zAxis[j]) {
                throw new IllegalArgumentException(String.format(
                        "El eje Z debe ser estrictamente creciente: Z[%d]=%.6f, Z[%d]=%.6f.", j, zAxis[j], j + 1, zAxis[j + 1]));
            }
        }
    }

    // --- Acceso por nodo ---

    public double getR(int i, int j) {
        return r[i][j];
    }

    public double getZ(int i, int j) {
        return z[i][j];
    }

    public double getPsi(int i, int j) {
        return psi[i][j];
    }

    public double getRAxisAt(int i) {
        return rAxis[i];
    }

    public double getZAxisAt(int j) {
        return zAxis[j];
    }

    // --- Geometría de la malla ---

    public double getRMin() {
        return rAxis[0];
    }

    public double getRMax() {
        return rAxis[nr - 1];
    }

    public double getZMin() {
        return zAxis[0];
    }

    public double getZMax() {
        return zAxis[nz - 1];
    }

    /**
     * Ancho de celda en R, tomado de la primera celda (se asume malla casi uniforme).
     */
    public double getCellWidth() {
        return rAxis[1] - rAxis[0];
    }

    /**
     * Alto de celda en Z, tomado de la primera celda.
     */
    public double getCellHeight() {
        return zAxis[1] - zAxis[0];
    }

    public double getMidR() {
        return 0.5 * (getRMin() + getRMax());
    }

    public double getMidZ() {
        return 0.5 * (getZMin() + getZMax());
    }

    /**
     * Índice del nodo cuyo R está más cerca de {@code rValue} (argmin |R - r|).
     */
    public int nearestRIndex(double rValue) {
        return nearestIndex(rAxis, rValue);
    }

    /**
     * Índice del nodo cuyo Z está más cerca de {@code zValue}.
     */
    public int nearestZIndex(double zValue) {
        return nearestIndex(zAxis, zValue);
    }

    public double clampR(double rValue) {
        return Math.max(getRMin(), Math.min(getRMax(), rValue));
    }

    public double clampZ(double zValue) {
        return Math.max(getZMin(), Math.min(getZMax(), zValue));
    }

    // --- Copias defensivas ---

    public double[] cloneRAxis() {
        return rAxis.clone();
    }

    public double[] cloneZAxis() {
        return zAxis.clone();
    }

    public double[][] clonePsi() {
        double[][] copy = new double[nr][];
        for (int i = 0; i < nr; i++) {
            copy[i] = psi[i].clone();
        }
        return copy;
    }

    private static int nearestIndex(double[] axis, double value) {
        int best = 0;
        double bestDistance = Math.abs(axis[0] - value);
        for (int k = 1; k < axis.length; k++) {
            double distance = Math.abs(axis[k] - value);
            // Estrictamente menor: ante empate gana el primer índice, como argmin
            if (distance < bestDistance) {
                bestDistance = distance;
                best = k;
            }
        }
        return best;
    }
}
