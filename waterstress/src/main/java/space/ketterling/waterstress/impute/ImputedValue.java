package space.ketterling.waterstress.impute;

/**
 * A possibly filled value with its provenance; value is null only for
 * {@link FillMethod#UNFILLED}.
 */
public record ImputedValue(Double value, FillMethod method) {

    public static final ImputedValue UNFILLED = new ImputedValue(null, FillMethod.UNFILLED);

    public ImputedValue {
        if ((value == null) != (method == FillMethod.UNFILLED)) {
            throw new IllegalArgumentException("value must be null exactly when method is UNFILLED");
        }
    }

    public boolean imputed() {
        return method.imputed();
    }
}
