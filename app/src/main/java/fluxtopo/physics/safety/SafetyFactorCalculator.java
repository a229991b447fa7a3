package fluxtopo.physics.safety;

import fluxtopo.config.TopologyConfig;
import fluxtopo.domain.exception.SeparatrixNotFoundException;
import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.domain.topology.CriticalPoint;
import fluxtopo.domain.topology.CriticalPoints;
import fluxtopo.domain.topology.FluxSurfacePoint;
import fluxtopo.domain.topology.SafetyFactorProfile;
import fluxtopo.physics.contour.ContourTracer;
import fluxtopo.physics.contour.PoloidalAngleGrid;
import fluxtopo.physics.equilibrium.Equilibrium;
import fluxtopo.physics.field.FluxField;
import fluxtopo.physics.field.NormalizedFluxField;
import fluxtopo.physics.topology.CriticalPointFinder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Calcula el perfil del factor de seguridad q sobre una familia de superficies de flujo.
 * <p>
 * Para cada nivel se traza un contorno cerrado con rayos desde el O-point y se integra
 * {@code q = Σθ fpol / (R²·Bθ) · dl / (2·2π)}, donde dl es la diferencia centrada entre los
 * vecinos angulares (índices circulares), que abarca dos segmentos; de ahí el factor 2.
 */
@Slf4j
public class SafetyFactorCalculator {

    private static final double TWO_PI = 2.0 * Math.PI;

    @Getter
    private final TopologyConfig config;
    private final ContourTracer contourTracer;

    public SafetyFactorCalculator() {
        this(TopologyConfig.defaults());
    }

    public SafetyFactorCalculator(TopologyConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.contourTracer = new ContourTracer(config);
    }

    /**
     * Perfil de q buscando antes los puntos críticos del equilibrio.
     *
     * @param levels Niveles de flujo normalizado, en el orden deseado. Sin niveles se usa ψN = 0.5.
     */
    public SafetyFactorProfile calculate(Equilibrium equilibrium, double... levels) {
        CriticalPoints criticalPoints = new CriticalPointFinder(config).find(equilibrium.grid(), equilibrium.flux());
        return calculate(equilibrium, criticalPoints, levels);
    }

    /**
     * Perfil de q con puntos críticos ya calculados.
     *
     * @throws SeparatrixNotFoundException si no hay O-point o X-point (sin separatriz q no está definido).
     */
    public SafetyFactorProfile calculate(Equilibrium equilibrium, CriticalPoints criticalPoints, double... levels) {
        Objects.requireNonNull(equilibrium, "El equilibrio no puede ser nulo.");
        Objects.requireNonNull(criticalPoints, "Los puntos críticos no pueden ser nulos.");
        Objects.requireNonNull(levels, "Los niveles no pueden ser nulos.");
        if (levels.length == 0) {
            levels = FluxLevels.uniform(1);
        }

        CriticalPoint opoint = criticalPoints.primaryOPoint()
                .orElseThrow(() -> new SeparatrixNotFoundException("Factor de seguridad: no hay O-point."));
        CriticalPoint xpoint = criticalPoints.primaryXPoint()
                .orElseThrow(() -> new SeparatrixNotFoundException("Factor de seguridad: no hay X-point, no existe separatriz."));

        final FluxGrid grid = equilibrium.grid();
        final FluxField psiNorm = new NormalizedFluxField(equilibrium.flux(), opoint.psi(), xpoint.psi());
        final int nTheta = config.thetaSamples();
        final double[] theta = PoloidalAngleGrid.create(nTheta, opoint, xpoint, config.angleTolerance());

        double[] q = new double[levels.length];
        for (int k = 0; k < levels.length; k++) {
            // 1. Contorno del nivel
            List<FluxSurfacePoint> surface = contourTracer.traceSurface(
                    grid, psiNorm, opoint, xpoint, theta, levels[k], config.safetyRayLength());

            double[] r = new double[nTheta];
            double[] z = new double[nTheta];
            for (int t = 0; t < nTheta; t++) {
                r[t] = surface.get(t).r();
                z[t] = surface.get(t).z();
            }

            // 2. Integral de línea
            q[k] = integrate(equilibrium, equilibrium.fpol(levels[k]), r, z);
        }

        log.debug("Perfil de q calculado en {} niveles con {} ángulos.", levels.length, nTheta);
        return new SafetyFactorProfile(levels, q);
    }

    /**
     * {@code Σ fpol/(R²·Bθ) · dl / (2·2π)} sobre un contorno cerrado.
     */
    static double integrate(Equilibrium equilibrium, double fpol, double[] r, double[] z) {
        final int n = r.length;
        double sum = 0.0;
        for (int t = 0; t < n; t++) {
            int prev = (t - 1 + n) % n;
            int next = (t + 1) % n;

            double dr = r[prev] - r[next];
            double dz = z[prev] - z[next];
            double dl = Math.sqrt(dr * dr + dz * dz);

            double br = equilibrium.br(r[t], z[t]);
            double bz = equilibrium.bz(r[t], z[t]);
            double bThe = Math.sqrt(br * br + bz * bz);

            sum += fpol / (r[t] * r[t] * bThe) * dl;
        }
        return sum / (2.0 * TWO_PI);
    }
}
