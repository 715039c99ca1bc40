package strongbox.core.model.error;

public class RelationNotFoundException extends SecretDomainException {

    public RelationNotFoundException(String relation) {
        super("relation not found: " + relation);
    }
}
