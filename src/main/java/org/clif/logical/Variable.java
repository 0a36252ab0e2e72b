package org.clif.logical;

/**
 * Nome non logico in posizione di argomento. È una variabile se legato da un
 * quantificatore che lo racchiude, altrimenti una costante dell'ontologia.
 */
public record Variable(String name) implements Term {

    public Variable {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
    }

    @Override
    public Variable copy() {
        return new Variable(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
