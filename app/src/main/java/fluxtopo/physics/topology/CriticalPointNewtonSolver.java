package fluxtopo.physics.topology;

import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.physics.field.FluxField;

import java.util.Optional;

/**
 * Biblioteca estática para refinar y clasificar puntos críticos del flujo poloidal.
 * <p>
 * El refinamiento es un Newton-Raphson 2D que anula el campo poloidal
 * {@code (Br, Bz) = (-∂F/∂Z / R, ∂F/∂R / R)} usando el jacobiano analítico construido con
 * las segundas derivadas del interpolante. La clasificación usa diferencias finitas
 * sobre el array crudo de psi.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class CriticalPointNewtonSolver {

    private CriticalPointNewtonSolver() {}

    /**
     * Punto (R, Z) al que converge Newton.
     */
    public record Root(double r, double z) {}

    /**
     * Lleva la semilla (r0, z0) hasta un cero de (Br, Bz).
     *
     * @param field         Interpolante del flujo.
     * @param r0            R de la semilla.
     * @param z0            Z de la semilla.
     * @param tolerance     Criterio de éxito sobre Br² + Bz².
     * @param maxIterations Pasos máximos antes de descartar.
     * @param radiusSq      Distancia² máxima permitida desde la semilla.
     * @return El punto convergido, o vacío si Newton diverge, se aleja o el jacobiano es singular.
     */
    public static Optional<Root> refine(FluxField field, double r0, double z0,
                                        double tolerance, int maxIterations, double radiusSq) {
        double r1 = r0;
        double z1 = z0;
        int count = 0;

        while (true) {
            // 1. Campo poloidal en el punto actual
            double dFdR = field.derivative(r1, z1, 1, 0);
            double dFdZ = field.derivative(r1, z1, 0, 1);
            double br = -dFdZ / r1;
            double bz = dFdR / r1;

            if (br * br + bz * bz < tolerance) {
                return Optional.of(new Root(r1, z1));
            }

            // 2. Jacobiano J = [[dBr/dR, dBr/dZ], [dBz/dR, dBz/dZ]]
            double d2FdRdZ = field.derivative(r1, z1, 1, 1);
            double j00 = -br / r1 - d2FdRdZ / r1;
            double j01 = -field.derivative(r1, z1, 0, 2) / r1;
            double j10 = -bz / r1 + field.derivative(r1, z1, 2, 0) / r1;
            double j11 = d2FdRdZ / r1;

            double det = j00 * j11 - j01 * j10;
            if (det == 0.0 || !Double.isFinite(det)) {
                return Optional.empty(); // Jacobiano singular
            }

            // 3. Paso Newton: resolver J·Δ = (Br, Bz) por Cramer y restar Δ
            double deltaR = (j11 * br - j01 * bz) / det;
            double deltaZ = (j00 * bz - j10 * br) / det;
            r1 -= deltaR;
            z1 -= deltaZ;
            count++;

            double driftSq = (r1 - r0) * (r1 - r0) + (z1 - z0) * (z1 - z0);
            if (driftSq > radiusSq || count > maxIterations || Double.isNaN(driftSq)) {
                return Optional.empty();
            }
        }
    }

    /**
     * Determinante hessiano {@code D = ψ_rr·ψ_zz − ψ_rz²} en el nodo (i, j) con un estencil
     * centrado de 2 celdas sobre el array crudo. Requiere 2 ≤ i ≤ nr-3 y 2 ≤ j ≤ nz-3.
     */
    public static double hessianDiscriminant(FluxGrid grid, int i, int j) {
        double dR = grid.getCellWidth();
        double dZ = grid.getCellHeight();

        double d2dr2 = (grid.getPsi(i + 2, j) - 2.0 * grid.getPsi(i, j) + grid.getPsi(i - 2, j)) / ((2.0 * dR) * (2.0 * dR));
        double d2dz2 = (grid.getPsi(i, j + 2) - 2.0 * grid.getPsi(i, j) + grid.getPsi(i, j - 2)) / ((2.0 * dZ) * (2.0 * dZ));

        double d2drdz = ((grid.getPsi(i + 2, j + 2) - grid.getPsi(i + 2, j - 2)) / (4.0 * dZ)
                - (grid.getPsi(i - 2, j + 2) - grid.getPsi(i - 2, j - 2)) / (4.0 * dZ)) / (4.0 * dR);

        return d2dr2 * d2dz2 - d2drdz * d2drdz;
    }
}
