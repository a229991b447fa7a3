package fluxtopo.physics.analyzer;

import fluxtopo.domain.topology.CoreMask;
import fluxtopo.domain.topology.CriticalPoints;
import fluxtopo.domain.topology.FluxSurfacePoint;
import fluxtopo.domain.topology.SafetyFactorProfile;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Resultado inmutable de un análisis topológico completo.
 * Sin separatriz solo se rellenan los puntos críticos.
 */
@Value
@Builder
public class TopologyReport {

    CriticalPoints criticalPoints;

    /**
     * Máscara del núcleo. Nula si no hay O-point o X-point.
     */
    CoreMask coreMask;

    /**
     * Separatriz trazada, vacía si no existe.
     */
    @Builder.Default
    List<FluxSurfacePoint> separatrix = List.of();

    /**
     * Perfil de q. Nulo si no hay separatriz o no se pidieron niveles.
     */
    SafetyFactorProfile safetyFactor;

    public Optional<CoreMask> findCoreMask() {
        return Optional.ofNullable(coreMask);
    }

    public Optional<SafetyFactorProfile> findSafetyFactor() {
        return Optional.ofNullable(safetyFactor);
    }

    public boolean hasSeparatrix() {
        return !separatrix.isEmpty();
    }
}
