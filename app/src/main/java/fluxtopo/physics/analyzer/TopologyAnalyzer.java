package fluxtopo.physics.analyzer;

import fluxtopo.config.TopologyConfig;
import fluxtopo.domain.exception.BoundaryUndefinedException;
import fluxtopo.domain.topology.CoreMask;
import fluxtopo.domain.topology.CriticalPoint;
import fluxtopo.domain.topology.CriticalPoints;
import fluxtopo.domain.topology.FluxSurfacePoint;
import fluxtopo.domain.topology.SafetyFactorProfile;
import fluxtopo.physics.contour.ContourTracer;
import fluxtopo.physics.equilibrium.Equilibrium;
import fluxtopo.physics.safety.SafetyFactorCalculator;
import fluxtopo.physics.topology.CoreMaskCalculator;
import fluxtopo.physics.topology.CriticalPointFinder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Orquestador del análisis topológico de un equilibrio.
 * <p>
 * Responsabilidades:
 * 1. Buscar los puntos críticos una sola vez y compartirlos con las etapas siguientes.
 * 2. Máscara del núcleo, separatriz y perfil de q, solo si existe separatriz.
 * 3. Validar que eje y frontera tienen flujos distintos antes de normalizar.
 */
@Slf4j
public class TopologyAnalyzer {

    @Getter
    private final TopologyConfig config;
    private final CriticalPointFinder criticalPointFinder;
    private final CoreMaskCalculator coreMaskCalculator;
    private final ContourTracer contourTracer;
    private final SafetyFactorCalculator safetyFactorCalculator;

    public TopologyAnalyzer() {
        this(TopologyConfig.defaults());
    }

    public TopologyAnalyzer(TopologyConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.criticalPointFinder = new CriticalPointFinder(config);
        this.coreMaskCalculator = new CoreMaskCalculator();
        this.contourTracer = new ContourTracer(config);
        this.safetyFactorCalculator = new SafetyFactorCalculator(config);
    }

    /**
     * @param equilibrium Equilibrio a analizar.
     * @param levels      Niveles de flujo normalizado para q; sin niveles no se calcula q.
     */
    public TopologyReport analyze(Equilibrium equilibrium, double... levels) {
        Objects.requireNonNull(equilibrium, "El equilibrio no puede ser nulo.");
        long startTime = System.currentTimeMillis();

        CriticalPoints criticalPoints = criticalPointFinder.find(equilibrium.grid(), equilibrium.flux());
        TopologyReport.TopologyReportBuilder report = TopologyReport.builder().criticalPoints(criticalPoints);

        if (!criticalPoints.hasSeparatrix()) {
            log.warn("Sin separatriz ({} O-points, {} X-points): se omiten máscara, contorno y q.",
                    criticalPoints.opoints().size(), criticalPoints.xpoints().size());
            return report.build();
        }

        CriticalPoint opoint = criticalPoints.primaryOPoint().orElseThrow();
        CriticalPoint xpoint = criticalPoints.primaryXPoint().orElseThrow();
        if (opoint.psi() == xpoint.psi()) {
            throw new BoundaryUndefinedException(String.format(
                    "El eje y el X-point primario tienen el mismo flujo (%.6g); la normalización no está definida.", opoint.psi()));
        }

        CoreMask mask = coreMaskCalculator.calculate(equilibrium.grid(), opoint, criticalPoints.xpoints());
        List<FluxSurfacePoint> separatrix = contourTracer.traceSeparatrix(equilibrium, criticalPoints);
        report.coreMask(mask).separatrix(separatrix);

        if (levels != null && levels.length > 0) {
            SafetyFactorProfile profile = safetyFactorCalculator.calculate(equilibrium, criticalPoints, levels);
            report.safetyFactor(profile);
        }

        log.info("Análisis topológico en {} ms: eje en ({}, {}), X-point en ({}, {}), {} celdas en el núcleo.",
                System.currentTimeMillis() - startTime,
                opoint.r(), opoint.z(), xpoint.r(), xpoint.z(), mask.getInsideCount());
        return report.build();
    }
}
