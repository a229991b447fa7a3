package fluxtopo.physics.safety;

/**
 * Constructores de familias de niveles de flujo normalizado.
 */
public final class FluxLevels {

    private FluxLevels() {}

    /**
     * n niveles {@code k/(n+1)}, k = 1..n: estrictamente entre el eje (0) y la separatriz (1).
     */
    public static double[] uniform(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Se necesita al menos un nivel de flujo.");
        }
        double[] levels = new double[n];
        for (int k = 0; k < n; k++) {
            levels[k] = (k + 1.0) / (n + 1.0);
        }
        return levels;
    }
}
