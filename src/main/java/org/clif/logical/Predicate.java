package org.clif.logical;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Atomo P(t1, ..., tn). Il predicato di nome "=" con due argomenti rappresenta
 * l'uguaglianza, resa in forma infissa dai serializzatori.
 *
 * @param name nome del predicato (non null, non vuoto)
 * @param args argomenti: variabili o funzioni annidate (almeno uno)
 */
public record Predicate(String name, List<Term> args) implements Logical {

    /** Nome riservato del predicato di uguaglianza */
    public static final String EQUALITY = "=";

    public Predicate {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome predicato non può essere null o vuoto");
        }
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("Il predicato " + name + " richiede almeno un argomento");
        }
        if (args.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Argomenti del predicato " + name + " non possono contenere null");
        }
        args = List.copyOf(args);
    }

    /**
     * @return true se l'atomo è un'uguaglianza binaria
     */
    public boolean isEquality() {
        return EQUALITY.equals(name) && args.size() == 2;
    }

    /**
     * @return true se almeno un argomento è un'applicazione funzionale
     */
    public boolean hasFunctions() {
        return args.stream().anyMatch(arg -> arg instanceof Function);
    }

    @Override
    public Type type() {
        return Type.PREDICATE;
    }

    @Override
    public List<Logical> terms() {
        return List.of();
    }

    @Override
    public Predicate withTerms(List<Logical> terms) {
        if (!terms.isEmpty()) {
            throw new IllegalArgumentException("Un atomo non ha figli in posizione di formula");
        }
        return this;
    }

    @Override
    public Predicate copy() {
        return new Predicate(name, args.stream().map(Term::copy).toList());
    }

    @Override
    public String toString() {
        return name + "(" + args.stream().map(Object::toString).collect(Collectors.joining(",")) + ")";
    }
}
