package fluxtopo.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con todos los parámetros numéricos del análisis topológico
 * del flujo poloidal.
 * <p>
 * Agrupa las tolerancias y tamaños de muestreo que usan la búsqueda de puntos críticos,
 * la máscara del núcleo, el trazado de superficies de flujo y el cálculo del factor de seguridad.
 *
 * @param newtonTolerance          Criterio de convergencia de Newton sobre Br² + Bz².
 * @param maxNewtonIterations      Número máximo de pasos de Newton por semilla.
 * @param searchRadiusFactor       Factor sobre (dR² + dZ²) que define el radio² máximo de deriva desde la semilla.
 * @param duplicateTolerance       Distancia² por debajo de la cual dos puntos críticos del mismo tipo se fusionan.
 * @param discardXpoints           Si es true, descarta X-points que no están conectados al O-point primario.
 * @param xpointLineSamples        Muestras de la recta O-point → X-point usada por el filtro.
 * @param xpointOvershootFraction  Fracción máxima de sobrepaso permitida antes de alcanzar el X-point (0.001 = 0.1%).
 * @param opointProximityTolerance Distancia² máxima entre el mínimo de la recta y el O-point.
 * @param raySamples               Muestras por rayo en la intersección rayo/superficie.
 * @param thetaSamples             Número de ángulos poloidales por contorno.
 * @param angleTolerance           Distancia angular (rad) al X-point que fuerza el desplazamiento de media celda.
 * @param separatrixRayLength      Longitud del rayo al trazar la separatriz.
 * @param safetyRayLength          Longitud del rayo al trazar superficies para el factor de seguridad.
 * @param separatrixLevel          Valor de flujo normalizado de la separatriz.
 * @param seedScanThreads          Hilos para el barrido de semillas. 1 = secuencial.
 */
@Builder
@With
public record TopologyConfig(
        // --- Búsqueda de puntos críticos ---
        double newtonTolerance,
        int maxNewtonIterations,
        double searchRadiusFactor,
        double duplicateTolerance,

        // --- Filtro de X-points ---
        boolean discardXpoints,
        int xpointLineSamples,
        double xpointOvershootFraction,
        double opointProximityTolerance,

        // --- Trazado de contornos ---
        int raySamples,
        int thetaSamples,
        double angleTolerance,
        double separatrixRayLength,
        double safetyRayLength,
        double separatrixLevel,

        // --- Ejecución ---
        int seedScanThreads
) {

    public TopologyConfig {
        if (newtonTolerance <= 0 || duplicateTolerance <= 0 || opointProximityTolerance <= 0 || angleTolerance <= 0) {
            throw new IllegalArgumentException("Las tolerancias deben ser positivas.");
        }
        if (maxNewtonIterations < 1) {
            throw new IllegalArgumentException("El número máximo de iteraciones de Newton debe ser al menos 1.");
        }
        if (searchRadiusFactor <= 0) {
            throw new IllegalArgumentException("El factor de radio de búsqueda debe ser positivo.");
        }
        if (xpointOvershootFraction < 0) {
            throw new IllegalArgumentException("La fracción de sobrepaso no puede ser negativa.");
        }
        // Se necesitan al menos dos muestras para interpolar un cruce
        if (xpointLineSamples < 2 || raySamples < 2 || thetaSamples < 2) {
            throw new IllegalArgumentException("Los muestreos de rayos, rectas y ángulos necesitan al menos 2 puntos.");
        }
        if (separatrixRayLength <= 0 || safetyRayLength <= 0) {
            throw new IllegalArgumentException("La longitud de los rayos debe ser positiva.");
        }
        if (seedScanThreads < 1) {
            throw new IllegalArgumentException("El barrido de semillas necesita al menos un hilo.");
        }
    }

    /**
     * Valores por defecto del análisis (los de un equilibrio típico de tokamak).
     */
    public static TopologyConfig defaults() {
        return TopologyConfig.builder()
                .newtonTolerance(1e-6)
                .maxNewtonIterations(128)
                .searchRadiusFactor(9.0)
                .duplicateTolerance(1e-5)
                .discardXpoints(true)
                .xpointLineSamples(64)
                .xpointOvershootFraction(0.001)
                .opointProximityTolerance(1e-4)
                .raySamples(128)
                .thetaSamples(128)
                .angleTolerance(1e-3)
                .separatrixRayLength(10.0)
                .safetyRayLength(8.0)
                .separatrixLevel(1.0)
                .seedScanThreads(1)
                .build();
    }
}
