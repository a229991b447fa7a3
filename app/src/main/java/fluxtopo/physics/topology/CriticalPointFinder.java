package fluxtopo.physics.topology;

import fluxtopo.config.TopologyConfig;
import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.domain.topology.CriticalPoint;
import fluxtopo.domain.topology.CriticalPoints;
import fluxtopo.physics.field.FluxField;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Localiza los puntos críticos del flujo poloidal: ejes magnéticos (O-points) y sillas (X-points).
 * <p>
 * Proceso en cascada:
 * <ol>
 * <li>Bp² = (∂F/∂R² + ∂F/∂Z²) / R² en cada nodo, con las derivadas del interpolante.</li>
 * <li>Semillas: mínimos locales estrictos de Bp² (8 vecinos), a 2 celdas de los bordes.</li>
 * <li>Refinamiento Newton de cada semilla ({@link CriticalPointNewtonSolver}).</li>
 * <li>Clasificación por el determinante hessiano y eliminación de duplicados.</li>
 * <li>Orden de O-points por cercanía al centro del dominio; filtrado y orden de X-points.</li>
 * </ol>
 * Los fallos numéricos locales (no convergencia, duplicados) se absorben aquí y nunca se propagan.
 */
@Slf4j
public class CriticalPointFinder {

    @Getter
    private final TopologyConfig config;

    public CriticalPointFinder() {
        this(TopologyConfig.defaults());
    }

    public CriticalPointFinder(TopologyConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
    }

    /**
     * Busca puntos críticos aplicando el filtro de X-points según la configuración.
     */
    public CriticalPoints find(FluxGrid grid, FluxField field) {
        return find(grid, field, config.discardXpoints());
    }

    /**
     * @param grid           Malla y flujo crudo (para el estencil de clasificación).
     * @param field          Interpolante continuo del flujo.
     * @param discardXpoints Si es true, descarta X-points no conectados al O-point primario.
     * @return O-points y X-points ordenados; ambas listas pueden estar vacías.
     */
    public CriticalPoints find(FluxGrid grid, FluxField field, boolean discardXpoints) {
        Objects.requireNonNull(grid, "La malla no puede ser nula.");
        Objects.requireNonNull(field, "El campo no puede ser nulo.");

        // 1. Superficie de búsqueda continua
        double[][] bp2 = poloidalFieldSquared(grid, field);

        // 2. Semillas
        List<int[]> seeds = scanSeeds(bp2);
        log.debug("Barrido de Bp²: {} semillas candidatas.", seeds.size());

        // 3. Refinamiento y clasificación (siempre secuencial, en orden de barrido)
        final double dR = grid.getCellWidth();
        final double dZ = grid.getCellHeight();
        final double radiusSq = config.searchRadiusFactor() * (dR * dR + dZ * dZ);

        List<CriticalPoint> opoints = new ArrayList<>();
        List<CriticalPoint> xpoints = new ArrayList<>();

        for (int[] seed : seeds) {
            final int i = seed[0];
            final int j = seed[1];
            Optional<CriticalPointNewtonSolver.Root> root = CriticalPointNewtonSolver.refine(
                    field, grid.getR(i, j), grid.getZ(i, j),
                    config.newtonTolerance(), config.maxNewtonIterations(), radiusSq);

            if (root.isEmpty()) {
                log.debug("Semilla ({}, {}) descartada: Newton no converge dentro del radio.", i, j);
                continue;
            }

            double r = root.get().r();
            double z = root.get().z();
            double psi = field.value(r, z);

            if (CriticalPointNewtonSolver.hessianDiscriminant(grid, i, j) < 0) {
                xpoints.add(CriticalPoint.xpoint(r, z, psi));
            } else {
                opoints.add(CriticalPoint.opoint(r, z, psi));
            }
        }

        // 4. Duplicados
        opoints = removeDuplicates(opoints);
        xpoints = removeDuplicates(xpoints);

        if (opoints.isEmpty()) {
            log.warn("No se ha encontrado ningún O-point ({} X-points).", xpoints.size());
            return new CriticalPoints(opoints, xpoints);
        }

        // 5. O-point primario: el más cercano al centro del dominio
        final double midR = grid.getMidR();
        final double midZ = grid.getMidZ();
        opoints.sort(Comparator.comparingDouble(p -> p.distanceSquaredTo(midR, midZ)));
        CriticalPoint primary = opoints.get(0);

        // 6. Filtrado de X-points no conectados
        if (discardXpoints) {
            xpoints = filterConnectedXpoints(field, primary, xpoints);
        }

        // 7. Separatriz más interna primero
        final double psiAxis = primary.psi();
        xpoints.sort(Comparator.comparingDouble(p -> (p.psi() - psiAxis) * (p.psi() - psiAxis)));

        log.debug("Puntos críticos: {} O-points, {} X-points.", opoints.size(), xpoints.size());
        return new CriticalPoints(opoints, xpoints);
    }

    /**
     * Bp² en cada nodo a partir de las primeras derivadas del interpolante.
     */
    static double[][] poloidalFieldSquared(FluxGrid grid, FluxField field) {
        final int nr = grid.getNr();
        final int nz = grid.getNz();
        double[][] bp2 = new double[nr][nz];
        for (int i = 0; i < nr; i++) {
            for (int j = 0; j < nz; j++) {
                double r = grid.getR(i, j);
                double z = grid.getZ(i, j);
                double dFdR = field.derivative(r, z, 1, 0);
                double dFdZ = field.derivative(r, z, 0, 1);
                bp2[i][j] = (dFdR * dFdR + dFdZ * dFdZ) / (r * r);
            }
        }
        return bp2;
    }

    private List<int[]> scanSeeds(double[][] bp2) {
        final int rowStart = SeedScanTask.MARGIN;
        final int rowEnd = bp2.length - SeedScanTask.MARGIN;
        final int threads = Math.min(config.seedScanThreads(), Math.max(1, rowEnd - rowStart));

        if (threads <= 1) {
            return new SeedScanTask(bp2, rowStart, rowEnd).call().getSeeds();
        }

        // Bandas de filas contiguas; se concatenan en orden para reproducir el barrido secuencial
        List<SeedScanTask> tasks = new ArrayList<>(threads);
        int rows = rowEnd - rowStart;
        for (int t = 0; t < threads; t++) {
            int start = rowStart + (rows * t) / threads;
            int end = rowStart + (rows * (t + 1)) / threads;
            tasks.add(new SeedScanTask(bp2, start, end));
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<SeedScanTask>> futures = pool.invokeAll(tasks);
            List<int[]> seeds = new ArrayList<>();
            for (Future<SeedScanTask> future : futures) {
                seeds.addAll(future.get().getSeeds());
            }
            return seeds;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Barrido de semillas interrumpido.", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Fallo en el barrido paralelo de semillas.", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Conserva el primer punto de cada grupo a distancia² menor que la tolerancia.
     */
    List<CriticalPoint> removeDuplicates(List<CriticalPoint> points) {
        List<CriticalPoint> result = new ArrayList<>();
        for (CriticalPoint p : points) {
            boolean duplicate = false;
            for (CriticalPoint kept : result) {
                if (p.distanceSquaredTo(kept) < config.duplicateTolerance()) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                result.add(p);
            }
        }
        return result;
    }

    /**
     * Descarta los X-points cuya recta desde el O-point primario no es monótona: el flujo
     * sobrepasa el del X-point antes de llegar a él, o el mínimo de la recta no está en el O-point.
     * Si no sobrevive ninguno, devuelve la lista original.
     */
    List<CriticalPoint> filterConnectedXpoints(FluxField field, CriticalPoint opoint, List<CriticalPoint> xpoints) {
        final int n = config.xpointLineSamples();
        List<CriticalPoint> kept = new ArrayList<>();

        for (CriticalPoint xpt : xpoints) {
            double[] rLine = new double[n];
            double[] zLine = new double[n];
            for (int k = 0; k < n; k++) {
                double s = (double) k / (n - 1);
                rLine[k] = opoint.r() + s * (xpt.r() - opoint.r());
                zLine[k] = opoint.z() + s * (xpt.z() - opoint.z());
            }
            double[] pLine = field.values(rLine, zLine);

            // Orientación: el O-point debe ser el mínimo de la recta
            if (xpt.psi() < opoint.psi()) {
                for (int k = 0; k < n; k++) {
                    pLine[k] = -pLine[k];
                }
            }

            int maxIndex = 0;
            int minIndex = 0;
            for (int k = 1; k < n; k++) {
                if (pLine[k] > pLine[maxIndex]) maxIndex = k;
                if (pLine[k] < pLine[minIndex]) minIndex = k;
            }
            double maxP = pLine[maxIndex];

            // NaN (recta plana) no supera el umbral y el punto se conserva
            if ((maxP - pLine[n - 1]) / (maxP - pLine[0]) > config.xpointOvershootFraction()) {
                log.debug("X-point ({}, {}) descartado: el flujo sobrepasa su valor antes de alcanzarlo.", xpt.r(), xpt.z());
                continue;
            }

            double dr = rLine[minIndex] - opoint.r();
            double dz = zLine[minIndex] - opoint.z();
            if (dr * dr + dz * dz > config.opointProximityTolerance()) {
                log.debug("X-point ({}, {}) descartado: el mínimo de la recta no está en el O-point.", xpt.r(), xpt.z());
                continue;
            }

            kept.add(xpt);
        }

        if (kept.isEmpty()) {
            if (!xpoints.isEmpty()) {
                log.warn("El filtro descartó los {} X-points; se conserva la lista sin filtrar.", xpoints.size());
            }
            return new ArrayList<>(xpoints);
        }
        return kept;
    }
}
