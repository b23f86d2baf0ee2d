package space.ketterling.waterstress.grid;

import java.util.List;

/**
 * The slices of one grid variable in time order.
 */
public record GridDataset(String variable, String units, List<GridSlice> slices) {

    public GridDataset {
        slices = List.copyOf(slices);
    }

    public int size() {
        return slices.size();
    }
}
