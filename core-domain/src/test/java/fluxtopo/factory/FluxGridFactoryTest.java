package fluxtopo.factory;

import fluxtopo.domain.grid.FluxGrid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

class FluxGridFactoryTest {

    @Test
    @DisplayName("El constructor debe ser privado para prohibir la instanciación")
    void constructorIsPrivate() throws NoSuchMethodException {
        Constructor<FluxGridFactory> constructor = FluxGridFactory.class.getDeclaredConstructor();
        assertTrue(Modifier.isPrivate(constructor.getModifiers()), "El constructor debe ser privado.");
    }

    @Test
    @DisplayName("linspace incluye ambos extremos exactamente")
    void linspace_shouldIncludeEndpoints() {
        double[] values = FluxGridFactory.linspace(0.3, 1.7, 15);

        assertEquals(15, values.length);
        assertEquals(0.3, values[0]);
        assertEquals(1.7, values[14], "El último valor debe ser exactamente el extremo.");
        assertEquals(0.1, values[1] - values[0], 1e-12);
    }

    @Test
    @DisplayName("linspace con menos de 2 puntos es rechazado")
    void linspace_shouldRejectSinglePoint() {
        assertThrows(IllegalArgumentException.class, () -> FluxGridFactory.linspace(0.0, 1.0, 1));
    }

    @Test
    @DisplayName("createFromAxes muestrea la función en la malla producto, admitiendo ejes no uniformes")
    void createFromAxes_shouldSampleOnProductMesh() {
        double[] rAxis = {1.0, 1.1, 1.3, 1.6, 2.0, 2.5};
        double[] zAxis = {-1.0, -0.2, 0.0, 0.5, 0.7};

        FluxGrid grid = FluxGridFactory.createFromAxes(rAxis, zAxis, (r, z) -> r * r - 3 * z);

        assertEquals(6, grid.getNr());
        assertEquals(5, grid.getNz());
        for (int i = 0; i < rAxis.length; i++) {
            for (int j = 0; j < zAxis.length; j++) {
                assertEquals(rAxis[i], grid.getR(i, j));
                assertEquals(zAxis[j], grid.getZ(i, j));
                assertEquals(rAxis[i] * rAxis[i] - 3 * zAxis[j], grid.getPsi(i, j), 1e-12);
            }
        }
    }
}
