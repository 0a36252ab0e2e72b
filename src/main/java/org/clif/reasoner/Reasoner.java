package org.clif.reasoner;

import java.util.Locale;

/**
 * Ragionatori esterni di cui si sa interpretare l'output.
 */
public enum Reasoner {
    PROVER9,
    VAMPIRE,
    PARADOX,
    MACE4;

    /**
     * @param name nome del ragionatore, senza distinzione fra maiuscole e minuscole
     * @throws IllegalArgumentException se il ragionatore non è supportato
     */
    public static Reasoner fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome ragionatore non può essere null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Ragionatore non supportato: " + name, e);
        }
    }
}
