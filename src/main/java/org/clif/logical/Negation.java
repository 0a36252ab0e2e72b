package org.clif.logical;

import java.util.List;

/**
 * Negazione ~A con esattamente un figlio.
 *
 * @param term formula negata
 */
public record Negation(Logical term) implements Logical {

    public Negation {
        if (term == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
    }

    @Override
    public Type type() {
        return Type.NEGATION;
    }

    @Override
    public List<Logical> terms() {
        return List.of(term);
    }

    @Override
    public Negation withTerms(List<Logical> terms) {
        if (terms.size() != 1) {
            throw new IllegalArgumentException("La negazione richiede esattamente un operando, ricevuti: " + terms.size());
        }
        return new Negation(terms.get(0));
    }

    @Override
    public Negation copy() {
        return new Negation(term.copy());
    }

    @Override
    public String toString() {
        return "~" + term;
    }
}
