package org.clif.logical;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Applicazione funzionale f(t1, ..., tn) annidata come argomento di un predicato
 * o di un'altra funzione. Nessuna funzione sopravvive alla forma FF-PCNF.
 *
 * @param name nome della funzione
 * @param args argomenti (almeno uno)
 */
public record Function(String name, List<Term> args) implements Logical, Term {

    public Function {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome funzione non può essere null o vuoto");
        }
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("La funzione " + name + " richiede almeno un argomento");
        }
        if (args.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Argomenti della funzione " + name + " non possono contenere null");
        }
        args = List.copyOf(args);
    }

    @Override
    public Type type() {
        return Type.FUNCTION;
    }

    @Override
    public List<Logical> terms() {
        return List.of();
    }

    @Override
    public Function withTerms(List<Logical> terms) {
        if (!terms.isEmpty()) {
            throw new IllegalArgumentException("Una funzione non ha figli in posizione di formula");
        }
        return this;
    }

    @Override
    public Function copy() {
        return new Function(name, args.stream().map(Term::copy).toList());
    }

    @Override
    public String toString() {
        return name + "(" + args.stream().map(Object::toString).collect(Collectors.joining(",")) + ")";
    }
}
