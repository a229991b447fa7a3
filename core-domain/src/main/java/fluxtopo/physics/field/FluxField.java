package fluxtopo.physics.field;

/**
 * Capacidad de campo continuo: evalúa el flujo poloidal F(R, Z) y sus derivadas parciales
 * (órdenes 0 a 2 en cada dirección) en coordenadas arbitrarias dentro de la caja de la malla.
 * <p>
 * Los algoritmos topológicos dependen solo de este contrato, nunca de un tipo concreto de spline.
 */
public interface FluxField {

    int MAX_DERIVATIVE_ORDER = 2;

    /**
     * Valor del campo en (r, z).
     */
    double value(double r, double z);

    /**
     * Derivada parcial ∂^(orderR+orderZ) F / ∂R^orderR ∂Z^orderZ en (r, z).
     *
     * @param orderR Orden de derivación en R (0-2).
     * @param orderZ Orden de derivación en Z (0-2).
     */
    double derivative(double r, double z, int orderR, int orderZ);

    /**
     * Versión vectorizada de {@link #value(double, double)} sobre pares (r[k], z[k]).
     */
    default double[] values(double[] r, double[] z) {
        checkSameLength(r, z);
        double[] result = new double[r.length];
        for (int k = 0; k < r.length; k++) {
            result[k] = value(r[k], z[k]);
        }
        return result;
    }

    /**
     * Versión vectorizada de {@link #derivative(double, double, int, int)}.
     */
    default double[] derivatives(double[] r, double[] z, int orderR, int orderZ) {
        checkSameLength(r, z);
        double[] result = new double[r.length];
        for (int k = 0; k < r.length; k++) {
            result[k] = derivative(r[k], z[k], orderR, orderZ);
        }
        return result;
    }

    static void checkOrders(int orderR, int orderZ) {
        if (orderR < 0 || orderZ < 0 || orderR > MAX_DERIVATIVE_ORDER || orderZ > MAX_DERIVATIVE_ORDER) {
            throw new IllegalArgumentException(String.format(
                    "Orden de derivación no soportado (%d, %d). Rango válido: 0-%d.", orderR, orderZ, MAX_DERIVATIVE_ORDER));
        }
    }

    private static void checkSameLength(double[] r, double[] z) {
        if (r.length != z.length) {
            throw new IllegalArgumentException("Los arrays de R y Z deben tener la misma longitud.");
        }
    }
}
