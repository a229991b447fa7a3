package fluxtopo.domain.topology;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Objects;

/**
 * Máscara del núcleo co-indexada con la malla: 1 dentro de la superficie de frontera, 0 fuera.
 * <p>
 * Se produce una vez por cálculo y no se actualiza de forma incremental. El array interno
 * se copia al construir y al exportar.
 */
@JsonIgnoreProperties(value = {"nr", "nz", "insideCount"}, allowGetters = true)
public final class CoreMask {

    public static final int OUTSIDE = 0;
    public static final int INSIDE = 1;

    @Getter
    private final int nr;
    @Getter
    private final int nz;
    @Getter
    private final int insideCount;
    private final int[][] cells;

    @JsonCreator
    public CoreMask(@JsonProperty("cells") int[][] cells) {
        Objects.requireNonNull(cells, "El array de la máscara no puede ser nulo.");
        this.nr = cells.length;
        this.nz = nr > 0 ? cells[0].length : 0;
        this.cells = new int[nr][];
        int count = 0;
        for (int i = 0; i < nr; i++) {
            this.cells[i] = cells[i].clone();
            for (int j = 0; j < nz; j++) {
                if (cells[i][j] != OUTSIDE && cells[i][j] != INSIDE) {
                    throw new IllegalArgumentException(String.format(
                            "Valor de máscara %d inválido en (%d, %d); solo se admiten 0 y 1.", cells[i][j], i, j));
                }
                count += cells[i][j];
            }
        }
        this.insideCount = count;
    }

    public boolean isInside(int i, int j) {
        return cells[i][j] == INSIDE;
    }

    public int valueAt(int i, int j) {
        return cells[i][j];
    }

    @JsonProperty("cells")
    public int[][] toArray() {
        int[][] copy = new int[nr][];
        for (int i = 0; i < nr; i++) {
            copy[i] = cells[i].clone();
        }
        return copy;
    }
}
