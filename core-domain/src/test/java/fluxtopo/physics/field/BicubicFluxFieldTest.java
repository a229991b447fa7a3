package fluxtopo.physics.field;

import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.factory.FluxGridFactory;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * El interpolante reproduce exactamente cualquier polinomio cuadrático, también en mallas
 * no uniformes, porque las derivadas nodales de tres puntos son exactas para ese grado.
 */
@Slf4j
class BicubicFluxFieldTest {

    private static final double TOL = 1e-9;

    private FluxField field;

    private static double quadratic(double r, double z) {
        return 2 * r * r - 3 * r * z + 0.5 * z * z + r - 4 * z + 7;
    }

    @BeforeEach
    void setUp() {
        double[] rAxis = {1.0, 1.2, 1.5, 1.7, 2.0, 2.4, 2.5, 3.0};
        double[] zAxis = {-1.0, -0.6, -0.1, 0.0, 0.3, 0.9, 1.0};
        FluxGrid grid = FluxGridFactory.createFromAxes(rAxis, zAxis, BicubicFluxFieldTest::quadratic);
        field = new BicubicFluxField(grid);
    }

    @Test
    @DisplayName("Reproduce el valor de un cuadrático dentro de las celdas")
    void value_shouldReproduceQuadratic() {
        double[][] probes = {{1.1, -0.8}, {1.63, 0.05}, {2.47, 0.71}, {2.9, -0.33}, {1.0, 1.0}};
        for (double[] p : probes) {
            assertEquals(quadratic(p[0], p[1]), field.value(p[0], p[1]), TOL,
                    "Valor incorrecto en (" + p[0] + ", " + p[1] + ")");
        }
    }

    @Test
    @DisplayName("Reproduce las derivadas primeras, segundas y cruzada de un cuadrático")
    void derivative_shouldReproduceQuadraticDerivatives() {
        // ARRANGE
        final double r = 1.83;
        final double z = 0.41;

        // ACT & ASSERT
        assertEquals(4 * r - 3 * z + 1, field.derivative(r, z, 1, 0), TOL, "dF/dR");
        assertEquals(-3 * r + z - 4, field.derivative(r, z, 0, 1), TOL, "dF/dZ");
        assertEquals(4.0, field.derivative(r, z, 2, 0), 1e-7, "d²F/dR²");
        assertEquals(1.0, field.derivative(r, z, 0, 2), 1e-7, "d²F/dZ²");
        assertEquals(-3.0, field.derivative(r, z, 1, 1), 1e-7, "d²F/dRdZ");
        assertEquals(field.value(r, z), field.derivative(r, z, 0, 0), 0.0);
        log.info("Derivadas del interpolante verificadas en ({}, {}).", r, z);
    }

    @Test
    @DisplayName("Órdenes de derivación fuera de rango son rechazados")
    void derivative_shouldRejectUnsupportedOrder() {
        assertThrows(IllegalArgumentException.class, () -> field.derivative(1.5, 0.0, 3, 0));
        assertThrows(IllegalArgumentException.class, () -> field.derivative(1.5, 0.0, 0, -1));
    }

    @Test
    @DisplayName("Fuera de la caja se evalúa en el punto proyectado sobre el borde")
    void value_shouldClampOutsideBox() {
        assertEquals(field.value(3.0, 0.3), field.value(5.0, 0.3), 0.0);
        assertEquals(field.value(1.0, -1.0), field.value(0.0, -9.0), 0.0);
    }

    @Test
    @DisplayName("La versión vectorizada coincide con la evaluación punto a punto")
    void values_shouldMatchPointwiseEvaluation() {
        double[] r = {1.1, 2.2, 2.8};
        double[] z = {0.5, -0.5, 0.0};

        double[] values = field.values(r, z);
        double[] dr = field.derivatives(r, z, 1, 0);

        for (int k = 0; k < r.length; k++) {
            assertEquals(field.value(r[k], z[k]), values[k], 0.0);
            assertEquals(field.derivative(r[k], z[k], 1, 0), dr[k], 0.0);
        }
        assertThrows(IllegalArgumentException.class, () -> field.values(new double[2], new double[3]));
    }
}
