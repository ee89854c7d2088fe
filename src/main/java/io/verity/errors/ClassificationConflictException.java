package io.verity.errors;

public final class ClassificationConflictException extends VerityException {
    private final String itemId;
    private final String automatability;

    public ClassificationConflictException(String itemId, String automatability) {
        super(ErrorKind.CLASSIFICATION_CONFLICT,
                "Item " + itemId + " is classified " + automatability
                        + " and cannot hold a verified machine state");
        this.itemId = itemId;
        this.automatability = automatability;
    }

    public String itemId() {
        return itemId;
    }

    public String automatability() {
        return automatability;
    }
}
