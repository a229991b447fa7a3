package fluxtopo.physics.field;

import fluxtopo.domain.exception.BoundaryUndefinedException;
import lombok.Getter;

import java.util.Objects;

/**
 * Decorador de Normalización.
 * <p>
 * Reescala el flujo para que el eje magnético valga 0 y la frontera elegida valga 1:
 * {@code psin = (F - psiAxis) / (psiBoundary - psiAxis)}. Como el interpolante es lineal
 * en sus datos, esto equivale a interpolar el array ya normalizado.
 */
public class NormalizedFluxField implements FluxField {

    private final FluxField wrappedField;
    @Getter
    private final double psiAxis;
    @Getter
    private final double psiBoundary;
    private final double scale;

    /**
     * @param wrappedField El campo físico a normalizar.
     * @param psiAxis      Flujo en el eje magnético (O-point).
     * @param psiBoundary  Flujo en la frontera (X-point o valor explícito).
     */
    public NormalizedFluxField(FluxField wrappedField, double psiAxis, double psiBoundary) {
        this.wrappedField = Objects.requireNonNull(wrappedField, "El campo a normalizar no puede ser nulo.");
        if (psiBoundary == psiAxis || Double.isNaN(psiBoundary) || Double.isNaN(psiAxis)) {
            throw new BoundaryUndefinedException(String.format(
                    "No se puede normalizar: psi del eje (%.6g) y de la frontera (%.6g) deben ser distintos.", psiAxis, psiBoundary));
        }
        this.psiAxis = psiAxis;
        this.psiBoundary = psiBoundary;
        this.scale = 1.0 / (psiBoundary - psiAxis);
    }

    @Override
    public double value(double r, double z) {
        return (wrappedField.value(r, z) - psiAxis) * scale;
    }

    @Override
    public double derivative(double r, double z, int orderR, int orderZ) {
        if (orderR == 0 && orderZ == 0) {
            return value(r, z);
        }
        // El desplazamiento psiAxis desaparece al derivar
        return wrappedField.derivative(r, z, orderR, orderZ) * scale;
    }

    /**
     * Normaliza un valor de flujo suelto con la misma transformación.
     */
    public double normalize(double psi) {
        return (psi - psiAxis) * scale;
    }
}
