package fluxtopo.physics.topology;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Tarea que busca mínimos locales estrictos (8-conectados) de Bp² en una banda de filas
 * [rowStart, rowEnd). Solo lee el array, por lo que varias tareas pueden correr en paralelo.
 */
@Getter
@RequiredArgsConstructor
public class SeedScanTask implements Callable<SeedScanTask> {

    /**
     * Margen de nodos desde cada borde que exige el estencil de segundas derivadas.
     */
    public static final int MARGIN = 2;

    // --- Entradas ---
    private final double[][] bp2;
    private final int rowStart;
    private final int rowEnd;

    // --- Resultado: pares {i, j} en orden de barrido ---
    private final List<int[]> seeds = new ArrayList<>();

    @Override
    public SeedScanTask call() {
        final int nz = bp2[0].length;
        for (int i = rowStart; i < rowEnd; i++) {
            for (int j = MARGIN; j < nz - MARGIN; j++) {
                if (isStrictLocalMinimum(bp2, i, j)) {
                    seeds.add(new int[]{i, j});
                }
            }
        }
        return this;
    }

    static boolean isStrictLocalMinimum(double[][] bp2, int i, int j) {
        double centre = bp2[i][j];
        for (int di = -1; di <= 1; di++) {
            for (int dj = -1; dj <= 1; dj++) {
                if ((di != 0 || dj != 0) && !(centre < bp2[i + di][j + dj])) {
                    return false;
                }
            }
        }
        return true;
    }
}
