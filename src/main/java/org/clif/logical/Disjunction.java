package org.clif.logical;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Disgiunzione (A | B | ...).
 *
 * @param terms operandi (almeno uno)
 */
public record Disjunction(List<Logical> terms) implements Connective {

    public Disjunction {
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
        return Type.DISJUNCTION;
    }

    @Override
    public String symbol() {
        return "|";
    }

    @Override
    public Disjunction withTerms(List<Logical> terms) {
        return new Disjunction(terms);
    }

    @Override
    public Disjunction copy() {
        return new Disjunction(terms.stream().map(Logical::copy).toList());
    }

    /**
     * Distribuisce la disgiunzione sulla prima congiunzione trovata fra gli operandi:
     * (A | B | (C & D)) -> (A | B | C) & (A | B | D), ricorsivamente per le congiunzioni annidate.
     */
    @Override
    public Logical distributeOverDisjunction() {
        // Prima distribuisce ricorsivamente su tutti gli operandi
        List<Logical> processed = new ArrayList<>();
        for (Logical operand : terms) {
            processed.add(Connective.distribute(operand));
        }

        int andIndex = -1;
        for (int i = 0; i < processed.size(); i++) {
            if (processed.get(i).type() == Type.CONJUNCTION) {
                andIndex = i;
                break;
            }
        }

        // Nessuna congiunzione: già una clausola
        if (andIndex < 0) {
            return new Disjunction(processed).flatten();
        }

        List<Logical> otherTerms = new ArrayList<>(processed);
        Logical andOperand = otherTerms.remove(andIndex);

        List<Logical> clauses = new ArrayList<>();
        for (Logical andTerm : andOperand.terms()) {
            List<Logical> clauseTerms = new ArrayList<>(otherTerms);
            clauseTerms.add(andTerm);
            clauses.add(new Disjunction(clauseTerms).distributeOverDisjunction());
        }

        return new Conjunction(clauses).flatten();
    }

    @Override
    public String toString() {
        return terms.stream().map(Object::toString).collect(Collectors.joining(" | ", "(", ")"));
    }
}
