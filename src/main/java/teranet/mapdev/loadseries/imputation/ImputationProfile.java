package teranet.mapdev.loadseries.imputation;

import java.util.List;

/**
 * Named strategy cascades. Both end with the column median so every cell gets a value.
 */
public enum ImputationProfile {

    /**
     * Day x slot matrices: fix each day from its own readings first, then borrow from
     * neighbouring days, then fall back to column statistics.
     */
    DAY_SLOT_MATRIX {
        @Override
        public List<ImputationStrategy> strategies() {
            return List.of(
                    new LateralShapePreservingStrategy(),
                    new TailFlatFillStrategy(),
                    new VerticalTrendStrategy(),
                    new BoundaryFillStrategy(),
                    new ColumnMedianStrategy());
        }
    },

    /**
     * Plain tables whose columns are not a time axis: interpolate down the rows only.
     */
    FLAT_TABLE {
        @Override
        public List<ImputationStrategy> strategies() {
            return List.of(
                    new VerticalTrendStrategy(),
                    new BoundaryFillStrategy(),
                    new ColumnMedianStrategy());
        }
    };

    public abstract List<ImputationStrategy> strategies();
}
