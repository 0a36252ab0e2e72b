package org.clif.logical;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Congiunzione (A & B & ...).
 *
 * @param terms operandi (almeno uno)
 */
public record Conjunction(List<Logical> terms) implements Connective {

    public Conjunction {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("Lista operandi non può essere null o vuota");
        }
        if (terms.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista operandi non può contenere elementi null");
        }
        terms = List.copyOf(terms);
    }

    @Override
    public Type type() {
        return Type.CONJUNCTION;
    }

    @Override
    public String symbol() {
        return "&";
    }

    @Override
    public Conjunction withTerms(List<Logical> terms) {
        return new Conjunction(terms);
    }

    @Override
    public Conjunction copy() {
        return new Conjunction(terms.stream().map(Logical::copy).toList());
    }

    @Override
    public Logical distributeOverDisjunction() {
        List<Logical> distributed = new ArrayList<>();
        for (Logical operand : terms) {
            distributed.add(Connective.distribute(operand));
        }
        return new Conjunction(distributed).flatten();
    }

    @Override
    public String toString() {
        return terms.stream().map(Object::toString).collect(Collectors.joining(" & ", "(", ")"));
    }
}
