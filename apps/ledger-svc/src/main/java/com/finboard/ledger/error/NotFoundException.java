package com.finboard.ledger.error;

/**
 * A referenced account, transaction, budget or investment does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String resource) {
        return new NotFoundException(resource + " not found");
    }
}
