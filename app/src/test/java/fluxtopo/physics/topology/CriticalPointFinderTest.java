package fluxtopo.physics.topology;

import fluxtopo.config.TopologyConfig;
import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.domain.topology.CriticalPoint;
import fluxtopo.domain.topology.CriticalPoints;
import fluxtopo.physics.SyntheticEquilibria;
import fluxtopo.physics.field.BicubicFluxField;
import fluxtopo.physics.field.FluxField;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Búsqueda de puntos críticos sobre campos sintéticos con topología conocida.
 */
@Slf4j
class CriticalPointFinderTest {

    private static final double LOCATION_TOL = 1e-2;

    private final CriticalPointFinder finder = new CriticalPointFinder();

    private static CriticalPoints findIn(CriticalPointFinder finder, FluxGrid grid) {
        return finder.find(grid, new BicubicFluxField(grid));
    }

    // --------------------------------------------------------------------------
    // Escenarios topológicos
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Paraboloide: un único O-point en el eje y ningún X-point")
    void find_paraboloid_shouldReturnSingleOPoint() {
        // ACT
        CriticalPoints result = findIn(finder, SyntheticEquilibria.paraboloid());

        // ASSERT
        assertEquals(1, result.opoints().size());
        assertTrue(result.xpoints().isEmpty());
        CriticalPoint axis = result.opoints().get(0);
        assertEquals(SyntheticEquilibria.R0, axis.r(), LOCATION_TOL);
        assertEquals(0.0, axis.z(), LOCATION_TOL);
        assertEquals(0.0, axis.psi(), 1e-6);
        assertFalse(result.hasSeparatrix());
    }

    @Test
    @DisplayName("Silla: un único X-point con determinante hessiano negativo y sin O-points")
    void find_saddle_shouldReturnSingleXPoint() {
        // ARRANGE
        FluxGrid grid = SyntheticEquilibria.saddle();

        // ACT
        CriticalPoints result = findIn(finder, grid);

        // ASSERT
        assertTrue(result.opoints().isEmpty());
        assertEquals(1, result.xpoints().size());
        CriticalPoint xpoint = result.xpoints().get(0);
        assertEquals(SyntheticEquilibria.R0, xpoint.r(), LOCATION_TOL);
        assertEquals(0.0, xpoint.z(), LOCATION_TOL);

        int i = grid.nearestRIndex(xpoint.r());
        int j = grid.nearestZIndex(xpoint.z());
        assertTrue(CriticalPointNewtonSolver.hessianDiscriminant(grid, i, j) < 0);
    }

    @Test
    @DisplayName("Single-null: eje en (R0, 0) y X-point en (R0, 1) con psi = 1/3")
    void find_singleNull_shouldReturnAxisAndXPoint() {
        CriticalPoints result = findIn(finder, SyntheticEquilibria.singleNull());

        assertEquals(1, result.opoints().size());
        assertEquals(1, result.xpoints().size());
        CriticalPoint axis = result.primaryOPoint().orElseThrow();
        CriticalPoint xpoint = result.primaryXPoint().orElseThrow();
        assertEquals(0.0, axis.z(), LOCATION_TOL);
        assertEquals(1.0, xpoint.z(), LOCATION_TOL);
        assertEquals(SyntheticEquilibria.R0, xpoint.r(), LOCATION_TOL);
        assertEquals(1.0 / 3.0, xpoint.psi(), 1e-3);
        log.info("Single-null: eje ({}, {}), X-point ({}, {}) psi={}",
                axis.r(), axis.z(), xpoint.r(), xpoint.z(), xpoint.psi());
    }

    @Test
    @DisplayName("Doble pozo: el O-point primario es el más cercano al centro del dominio")
    void find_doubleWell_shouldSortOPointsByDistanceToMidpoint() {
        // ARRANGE: dominio Z en [-2, 2.5], punto medio Z = 0.25
        FluxGrid grid = SyntheticEquilibria.doubleWell();

        // ACT
        CriticalPoints result = findIn(finder, grid);

        // ASSERT
        assertEquals(2, result.opoints().size());
        assertEquals(1.0, result.opoints().get(0).z(), LOCATION_TOL, "El eje superior está más cerca del centro.");
        assertEquals(-1.0, result.opoints().get(1).z(), LOCATION_TOL);
        assertEquals(1, result.xpoints().size());
        assertEquals(0.0, result.xpoints().get(0).z(), LOCATION_TOL);
        assertEquals(1.0, result.xpoints().get(0).psi(), 1e-2);
    }

    // --------------------------------------------------------------------------
    // Propiedades
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("La búsqueda es idempotente: dos ejecuciones devuelven listas idénticas")
    void find_shouldBeIdempotent() {
        FluxGrid grid = SyntheticEquilibria.doubleWell();
        FluxField field = new BicubicFluxField(grid);

        assertEquals(finder.find(grid, field), finder.find(grid, field));
    }

    @Test
    @DisplayName("El barrido paralelo de semillas produce el mismo resultado que el secuencial")
    void find_parallelScan_shouldMatchSerial() {
        FluxGrid grid = SyntheticEquilibria.doubleWell();
        FluxField field = new BicubicFluxField(grid);
        CriticalPointFinder parallel = new CriticalPointFinder(TopologyConfig.defaults().withSeedScanThreads(4));

        assertEquals(finder.find(grid, field), parallel.find(grid, field));
    }

    @Test
    @DisplayName("Ningún par de puntos del mismo tipo está más cerca que la tolerancia de duplicados")
    void find_shouldNotReturnDuplicates() {
        CriticalPoints result = findIn(finder, SyntheticEquilibria.doubleWell());
        double tol = finder.getConfig().duplicateTolerance();

        for (List<CriticalPoint> points : List.of(result.opoints(), result.xpoints())) {
            for (int a = 0; a < points.size(); a++) {
                for (int b = a + 1; b < points.size(); b++) {
                    assertTrue(points.get(a).distanceSquaredTo(points.get(b)) >= tol);
                }
            }
        }
    }

    @Test
    @DisplayName("removeDuplicates conserva el primero de cada grupo cercano")
    void removeDuplicates_shouldKeepFirstOfEachCluster() {
        CriticalPoint first = CriticalPoint.opoint(10.0, 0.0, 0.0);
        CriticalPoint near = CriticalPoint.opoint(10.001, 0.0, 0.0);
        CriticalPoint far = CriticalPoint.opoint(10.1, 0.0, 0.0);

        List<CriticalPoint> result = finder.removeDuplicates(List.of(first, near, far));

        assertEquals(List.of(first, far), result);
    }

    // --------------------------------------------------------------------------
    // Filtro de X-points
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("El filtro descarta X-points tras un sobrepaso del flujo o con el mínimo lejos del eje")
    void filterConnectedXpoints_shouldDiscardDisconnectedCandidates() {
        // ARRANGE
        FluxField field = new BicubicFluxField(SyntheticEquilibria.singleNull());
        CriticalPoint axis = CriticalPoint.opoint(10.0, 0.0, 0.0);
        CriticalPoint real = CriticalPoint.xpoint(10.0, 1.0, 1.0 / 3.0);
        // Más allá de la silla: la recta sube hasta 1/3 y baja a 0.288
        CriticalPoint overshoot = CriticalPoint.xpoint(10.0, 1.2, SyntheticEquilibria.singleNullPsi(10.0, 1.2));
        // Psi por debajo del eje: tras invertir, el mínimo de la recta cae en Z = 1
        CriticalPoint farMinimum = CriticalPoint.xpoint(10.0, 1.8, SyntheticEquilibria.singleNullPsi(10.0, 1.8));

        // ACT
        List<CriticalPoint> kept = finder.filterConnectedXpoints(field, axis, List.of(overshoot, real, farMinimum));

        // ASSERT
        assertEquals(List.of(real), kept);
    }

    @Test
    @DisplayName("Si el filtro descarta todos los X-points se devuelve la lista sin filtrar")
    void filterConnectedXpoints_shouldFallBackToUnfilteredList() {
        FluxField field = new BicubicFluxField(SyntheticEquilibria.singleNull());
        CriticalPoint axis = CriticalPoint.opoint(10.0, 0.0, 0.0);
        CriticalPoint overshoot = CriticalPoint.xpoint(10.0, 1.2, SyntheticEquilibria.singleNullPsi(10.0, 1.2));

        List<CriticalPoint> kept = finder.filterConnectedXpoints(field, axis, List.of(overshoot));

        assertEquals(List.of(overshoot), kept);
    }
}
