package fluxtopo.physics.contour;

import fluxtopo.config.TopologyConfig;
import fluxtopo.domain.exception.SeparatrixNotFoundException;
import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.domain.topology.CriticalPoint;
import fluxtopo.domain.topology.CriticalPoints;
import fluxtopo.domain.topology.FluxSurfacePoint;
import fluxtopo.physics.equilibrium.Equilibrium;
import fluxtopo.physics.field.FluxField;
import fluxtopo.physics.field.NormalizedFluxField;
import fluxtopo.physics.topology.CriticalPointFinder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Traza superficies de flujo normalizado lanzando rayos desde el eje magnético.
 * <p>
 * La primitiva es {@link #surfaceRayIntersect}: muestrea un rayo y localiza por interpolación
 * lineal el primer cruce con el nivel pedido. Componiendo rayos sobre una
 * {@link PoloidalAngleGrid} se obtiene un contorno cerrado (la separatriz para el nivel 1.0).
 */
@Slf4j
public class ContourTracer {

    private static final double MIN_RAY_EXTENT = 1e-6;

    @Getter
    private final TopologyConfig config;

    public ContourTracer() {
        this(TopologyConfig.defaults());
    }

    public ContourTracer(TopologyConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
    }

    /**
     * Primer cruce del rayo (r0, z0) → (r1, z1) con el nivel {@code psival}, con el número de
     * muestras de la configuración.
     */
    public RayCrossing surfaceRayIntersect(FluxGrid grid, FluxField psiNorm,
                                           double r0, double z0, double r1, double z1, double psival) {
        return surfaceRayIntersect(grid, psiNorm, r0, z0, r1, z1, psival, config.raySamples());
    }

    /**
     * @param grid    Caja de la malla, usada para recortar el extremo del rayo.
     * @param psiNorm Flujo normalizado continuo.
     * @param r0      Origen del rayo (dentro de la superficie).
     * @param z0      Origen del rayo.
     * @param r1      Extremo del rayo (fuera de la superficie); se recorta a la caja conservando la dirección.
     * @param z1      Extremo del rayo.
     * @param psival  Nivel normalizado buscado.
     * @param n       Muestras a lo largo del rayo.
     * @return El cruce; si el rayo nunca supera el nivel, el origen con {@code crossed = false}.
     */
    public RayCrossing surfaceRayIntersect(FluxGrid grid, FluxField psiNorm,
                                           double r0, double z0, double r1, double z1,
                                           double psival, int n) {
        if (n < 2) {
            throw new IllegalArgumentException("El rayo necesita al menos 2 muestras.");
        }

        // 1. Recorte a la caja, eje por eje, acortando el rayo sin cambiar su dirección
        if (Math.abs(r1 - r0) > MIN_RAY_EXTENT) {
            double rClip = grid.clampR(r1);
            z1 = z0 + (z1 - z0) * Math.abs((rClip - r0) / (r1 - r0));
            r1 = rClip;
        }
        if (Math.abs(z1 - z0) > MIN_RAY_EXTENT) {
            double zClip = grid.clampZ(z1);
            r1 = r0 + (r1 - r0) * Math.abs((zClip - z0) / (z1 - z0));
            z1 = zClip;
        }

        // 2. Muestreo del rayo
        double[] r = new double[n];
        double[] z = new double[n];
        for (int k = 0; k < n; k++) {
            double s = (double) k / (n - 1);
            r[k] = r0 + s * (r1 - r0);
            z[k] = z0 + s * (z1 - z0);
        }
        double[] pnorm = psiNorm.values(r, z);

        // 3. Primera muestra por encima del nivel
        int idx = 0;
        for (int k = 0; k < n; k++) {
            if (pnorm[k] > psival) {
                idx = k;
                break;
            }
        }

        if (idx == 0) {
            log.warn("El rayo desde ({}, {}) no cruza el nivel {}; se devuelve el origen.", r0, z0, psival);
            return new RayCrossing(r0, z0, false);
        }

        // 4. Interpolación lineal entre idx-1 e idx
        double f = (pnorm[idx] - psival) / (pnorm[idx] - pnorm[idx - 1]);
        return new RayCrossing(
                (1.0 - f) * r[idx] + f * r[idx - 1],
                (1.0 - f) * z[idx] + f * z[idx - 1],
                true);
    }

    /**
     * Separatriz de un equilibrio: busca los puntos críticos y traza el nivel de separatriz.
     *
     * @throws SeparatrixNotFoundException si no hay O-point o X-point.
     */
    public List<FluxSurfacePoint> traceSeparatrix(Equilibrium equilibrium) {
        CriticalPoints criticalPoints = new CriticalPointFinder(config).find(equilibrium.grid(), equilibrium.flux());
        return traceSeparatrix(equilibrium, criticalPoints);
    }

    /**
     * Separatriz con puntos críticos ya calculados.
     */
    public List<FluxSurfacePoint> traceSeparatrix(Equilibrium equilibrium, CriticalPoints criticalPoints) {
        CriticalPoint opoint = criticalPoints.primaryOPoint()
                .orElseThrow(() -> new SeparatrixNotFoundException("No hay O-point: no se puede trazar la separatriz."));
        CriticalPoint xpoint = criticalPoints.primaryXPoint()
                .orElseThrow(() -> new SeparatrixNotFoundException("No hay X-point: no existe separatriz."));

        FluxField psiNorm = new NormalizedFluxField(equilibrium.flux(), opoint.psi(), xpoint.psi());
        return traceSeparatrix(equilibrium.grid(), psiNorm, opoint, xpoint,
                config.thetaSamples(), config.separatrixLevel());
    }

    /**
     * Contorno cerrado del nivel {@code psival} con rayos de longitud fija desde el O-point.
     *
     * @param grid    Caja de la malla.
     * @param psiNorm Flujo normalizado con el eje en 0 y la separatriz en 1.
     * @param opoint  O-point primario.
     * @param xpoint  X-point primario, referencia angular y geométrica.
     * @param nTheta  Ángulos poloidales.
     * @param psival  Nivel normalizado.
     * @return Exactamente {@code nTheta} muestras, en orden angular.
     */
    public List<FluxSurfacePoint> traceSeparatrix(FluxGrid grid, FluxField psiNorm,
                                                  CriticalPoint opoint, CriticalPoint xpoint,
                                                  int nTheta, double psival) {
        double[] theta = PoloidalAngleGrid.create(nTheta, opoint, xpoint, config.angleTolerance());
        return traceSurface(grid, psiNorm, opoint, xpoint, theta, psival, config.separatrixRayLength());
    }

    /**
     * Traza un contorno sobre una rejilla angular ya construida.
     */
    public List<FluxSurfacePoint> traceSurface(FluxGrid grid, FluxField psiNorm,
                                               CriticalPoint opoint, CriticalPoint xpoint,
                                               double[] theta, double psival, double rayLength) {
        final double r0 = opoint.r();
        final double z0 = opoint.z();
        List<FluxSurfacePoint> isoflux = new ArrayList<>(theta.length);

        for (double t : theta) {
            RayCrossing crossing = surfaceRayIntersect(grid, psiNorm,
                    r0, z0,
                    r0 + rayLength * Math.sin(t),
                    z0 + rayLength * Math.cos(t),
                    psival);
            isoflux.add(new FluxSurfacePoint(crossing.r(), crossing.z(), xpoint.r(), xpoint.z()));
        }
        return isoflux;
    }
}
