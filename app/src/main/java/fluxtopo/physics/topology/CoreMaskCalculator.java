package fluxtopo.physics.topology;

import fluxtopo.domain.exception.BoundaryUndefinedException;
import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.domain.topology.CoreMask;
import fluxtopo.domain.topology.CriticalPoint;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Marca las celdas de la malla encerradas por la superficie de flujo de frontera.
 * <p>
 * Relleno por líneas (scanline) desde el nodo más cercano al O-point, con pila explícita.
 * Antes del relleno, los 3×3 nodos alrededor de cada X-point se bloquean para que el relleno
 * no se escape por la silla; al terminar, esos nodos se resuelven uno a uno según psin.
 */
@Slf4j
public class CoreMaskCalculator {

    /**
     * Marca transitoria de silla bloqueada. Nunca aparece en la máscara devuelta.
     */
    static final int BLOCKED = 2;

    private static final double BOUNDARY_LEVEL = 1.0;

    /**
     * Máscara con la frontera en el flujo del primer X-point.
     */
    public CoreMask calculate(FluxGrid grid, CriticalPoint opoint, List<CriticalPoint> xpoints) {
        return calculate(grid, opoint, xpoints, OptionalDouble.empty());
    }

    /**
     * @param grid        Malla y flujo crudo.
     * @param opoint      O-point primario (semilla del relleno y psi del eje).
     * @param xpoints     X-points ordenados (puede estar vacía si se da psiBoundary).
     * @param psiBoundary Flujo de frontera explícito; si falta se usa el del primer X-point.
     * @throws BoundaryUndefinedException si no hay ni frontera explícita ni X-points.
     */
    public CoreMask calculate(FluxGrid grid, CriticalPoint opoint, List<CriticalPoint> xpoints, OptionalDouble psiBoundary) {
        Objects.requireNonNull(grid, "La malla no puede ser nula.");
        Objects.requireNonNull(opoint, "El O-point no puede ser nulo.");
        Objects.requireNonNull(xpoints, "La lista de X-points no puede ser nula.");

        // 1. Flujo de frontera
        final double psiBndry;
        if (psiBoundary.isPresent()) {
            psiBndry = psiBoundary.getAsDouble();
        } else if (!xpoints.isEmpty()) {
            psiBndry = xpoints.get(0).psi();
        } else {
            throw new BoundaryUndefinedException("Máscara del núcleo: no hay flujo de frontera explícito ni X-points.");
        }

        final int nr = grid.getNr();
        final int nz = grid.getNz();
        final double psiAxis = opoint.psi();

        // 2. Flujo normalizado (el llamador garantiza psiBndry != psiAxis)
        double[][] psin = new double[nr][nz];
        for (int i = 0; i < nr; i++) {
            for (int j = 0; j < nz; j++) {
                psin[i][j] = (grid.getPsi(i, j) - psiAxis) / (psiBndry - psiAxis);
            }
        }

        int[][] mask = new int[nr][nz];

        // 3. Bloqueo de las sillas
        List<int[]> xpointIndices = new ArrayList<>(xpoints.size());
        for (CriticalPoint xpt : xpoints) {
            int ix = grid.nearestRIndex(xpt.r());
            int jx = grid.nearestZIndex(xpt.z());
            xpointIndices.add(new int[]{ix, jx});
            for (int i = Math.max(0, ix - 1); i <= Math.min(nr - 1, ix + 1); i++) {
                for (int j = Math.max(0, jx - 1); j <= Math.min(nz - 1, jx + 1); j++) {
                    mask[i][j] = BLOCKED;
                }
            }
        }

        // 4. Relleno por líneas desde el eje
        int rind = grid.nearestRIndex(opoint.r());
        int zind = grid.nearestZIndex(opoint.z());
        int filled = scanlineFill(psin, mask, rind, zind);
        log.debug("Relleno del núcleo: {} celdas visitadas desde ({}, {}).", filled, rind, zind);

        // 5. Resolución de las sillas bloqueadas
        for (int[] idx : xpointIndices) {
            int ix = idx[0];
            int jx = idx[1];
            for (int i = Math.max(0, ix - 1); i <= Math.min(nr - 1, ix + 1); i++) {
                for (int j = Math.max(0, jx - 1); j <= Math.min(nz - 1, jx + 1); j++) {
                    mask[i][j] = psin[i][j] < BOUNDARY_LEVEL ? CoreMask.INSIDE : CoreMask.OUTSIDE;
                }
            }
        }

        return new CoreMask(mask);
    }

    /**
     * Relleno scanline: cada elemento de la pila arranca una fila que avanza en +j mientras
     * psin < 1 y la celda esté libre; las celdas vecinas en i±1 que cumplen la condición se apilan.
     * Las celdas bloqueadas (2) detienen el avance igual que las ya marcadas.
     *
     * @return Número de celdas marcadas como dentro.
     */
    static int scanlineFill(double[][] psin, int[][] mask, int startI, int startJ) {
        final int nr = psin.length;
        final int nz = psin[0].length;
        int marked = 0;

        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{startI, startJ});

        while (!stack.isEmpty()) {
            int[] cell = stack.pop();
            int i = cell[0];
            int j = cell[1];

            // Celda a la izquierda de la fila (i, j-1)
            if (j > 0 && psin[i][j - 1] < BOUNDARY_LEVEL && mask[i][j - 1] == CoreMask.OUTSIDE) {
                stack.push(new int[]{i, j - 1});
            }

            // Barrido de la fila hacia la derecha
            while (true) {
                if (mask[i][j] != CoreMask.INSIDE) {
                    marked++;
                }
                mask[i][j] = CoreMask.INSIDE;

                if (i < nr - 1 && psin[i + 1][j] < BOUNDARY_LEVEL && mask[i + 1][j] == CoreMask.OUTSIDE) {
                    stack.push(new int[]{i + 1, j});
                }
                if (i > 0 && psin[i - 1][j] < BOUNDARY_LEVEL && mask[i - 1][j] == CoreMask.OUTSIDE) {
                    stack.push(new int[]{i - 1, j});
                }

                if (j == nz - 1) {
                    break; // Fin de la fila
                }
                if (psin[i][j + 1] >= BOUNDARY_LEVEL || mask[i][j + 1] != CoreMask.OUTSIDE) {
                    break; // Frontera o celda ya visitada/bloqueada
                }
                j++;
            }
        }
        return marked;
    }
}
