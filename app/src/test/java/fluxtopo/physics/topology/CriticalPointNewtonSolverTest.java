package fluxtopo.physics.topology;

import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.factory.FluxGridFactory;
import fluxtopo.physics.SyntheticEquilibria;
import fluxtopo.physics.field.BicubicFluxField;
import fluxtopo.physics.field.FluxField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario para CriticalPointNewtonSolver: convergencia del Newton 2D sobre (Br, Bz)
 * y clasificación por el determinante hessiano.
 */
class CriticalPointNewtonSolverTest {

    private static final double TOLERANCE = 1e-6;
    private static final int MAX_ITER = 128;
    private static final double RADIUS_SQ = 0.05;

    @Test
    @DisplayName("El constructor debe ser privado para prohibir la instanciación")
    void constructorIsPrivate() throws NoSuchMethodException {
        Constructor<CriticalPointNewtonSolver> constructor = CriticalPointNewtonSolver.class.getDeclaredConstructor();
        assertTrue(Modifier.isPrivate(constructor.getModifiers()), "El constructor debe ser privado.");
    }

    @Test
    @DisplayName("Converge al eje del paraboloide desde una semilla desplazada")
    void refine_shouldConvergeToParaboloidAxis() {
        // ARRANGE
        FluxField field = new BicubicFluxField(SyntheticEquilibria.paraboloid());

        // ACT
        Optional<CriticalPointNewtonSolver.Root> root =
                CriticalPointNewtonSolver.refine(field, 10.1, 0.05, TOLERANCE, MAX_ITER, RADIUS_SQ);

        // ASSERT
        assertTrue(root.isPresent(), "Newton debe converger en un cuadrático.");
        assertEquals(10.0, root.get().r(), 1e-3);
        assertEquals(0.0, root.get().z(), 1e-3);
    }

    @Test
    @DisplayName("Converge también a una silla, no solo a mínimos")
    void refine_shouldConvergeToSaddle() {
        FluxField field = new BicubicFluxField(SyntheticEquilibria.saddle());

        Optional<CriticalPointNewtonSolver.Root> root =
                CriticalPointNewtonSolver.refine(field, 9.93, -0.08, TOLERANCE, MAX_ITER, RADIUS_SQ);

        assertTrue(root.isPresent());
        assertEquals(10.0, root.get().r(), 1e-3);
        assertEquals(0.0, root.get().z(), 1e-3);
    }

    @Test
    @DisplayName("Descarta la semilla si el paso la aleja más que el radio de búsqueda")
    void refine_shouldRejectDriftBeyondRadius() {
        FluxField field = new BicubicFluxField(SyntheticEquilibria.paraboloid());

        Optional<CriticalPointNewtonSolver.Root> root =
                CriticalPointNewtonSolver.refine(field, 10.5, 0.5, TOLERANCE, MAX_ITER, 1e-4);

        assertTrue(root.isEmpty());
    }

    @Test
    @DisplayName("Un jacobiano singular (campo lineal) no produce raíz")
    void refine_shouldRejectSingularJacobian() {
        FluxGrid grid = FluxGridFactory.createUniform(1, 2, 11, -1, 1, 11, (r, z) -> r);
        FluxField field = new BicubicFluxField(grid);

        assertTrue(CriticalPointNewtonSolver.refine(field, 1.5, 0.0, TOLERANCE, MAX_ITER, RADIUS_SQ).isEmpty());
    }

    @Test
    @DisplayName("El determinante hessiano es positivo en un mínimo y negativo en una silla")
    void hessianDiscriminant_shouldClassifyExtremaAndSaddles() {
        FluxGrid paraboloid = SyntheticEquilibria.paraboloid();
        FluxGrid saddle = SyntheticEquilibria.saddle();

        // F_rr = 2, F_zz = ±2, F_rz = 0 en el nodo central
        assertEquals(4.0, CriticalPointNewtonSolver.hessianDiscriminant(paraboloid, 40, 40), 1e-6);
        assertEquals(-4.0, CriticalPointNewtonSolver.hessianDiscriminant(saddle, 40, 40), 1e-6);
    }
}
