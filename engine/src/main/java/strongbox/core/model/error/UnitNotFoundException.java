package strongbox.core.model.error;

public class UnitNotFoundException extends SecretDomainException {

    public UnitNotFoundException(String unit) {
        super("unit not found: " + unit);
    }
}
