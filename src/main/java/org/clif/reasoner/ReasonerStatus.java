package org.clif.reasoner;

/**
 * Esito di un ragionatore esterno ricavato dal suo output testuale.
 */
public enum ReasonerStatus {
    PROOF,
    INCONSISTENT,
    COUNTEREXAMPLE,
    CONSISTENT,
    UNKNOWN,
    ERROR;

    /**
     * @return true se il ragionatore è terminato con un risultato definito
     */
    public boolean isSuccessful() {
        return switch (this) {
            case PROOF, INCONSISTENT, COUNTEREXAMPLE, CONSISTENT -> true;
            case UNKNOWN, ERROR -> false;
        };
    }
}
