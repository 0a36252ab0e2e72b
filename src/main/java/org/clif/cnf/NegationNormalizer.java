package org.clif.cnf;

import org.clif.logical.Conjunction;
import org.clif.logical.Connective;
import org.clif.logical.Disjunction;
import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Quantifier;

import java.util.ArrayList;
import java.util.List;

/**
 * NORMALIZZAZIONE DELLE NEGAZIONI - Terza fase della pipeline FF-PCNF
 *
 * Spinge le negazioni verso le foglie con le leggi di De Morgan e la dualità dei
 * quantificatori, finché ogni negazione si trova immediatamente sopra un atomo.
 *
 * TRASFORMAZIONI APPLICATE:
 * • ~(A & B) -> ~A | ~B
 * • ~(A | B) -> ~A & ~B
 * • ~∀x[A] -> ∃x[~A]
 * • ~∃x[A] -> ∀x[~A]
 * • ~~A -> A
 */
final class NegationNormalizer {

    Logical apply(Logical sentence) {
        return normalize(sentence);
    }

    private Logical normalize(Logical node) {
        return switch (node.type()) {
            case PREDICATE, FUNCTION -> node; // Caso base: atomi invariati

            case NEGATION -> negate(((Negation) node).term());

            case CONJUNCTION, DISJUNCTION -> {
                Connective connective = (Connective) node;
                List<Logical> operands = new ArrayList<>();
                for (Logical operand : connective.terms()) {
                    operands.add(normalize(operand));
                }
                yield connective.withTerms(operands);
            }

            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = (Quantifier) node;
                yield quantifier.with(quantifier.variables(), normalize(quantifier.term()));
            }
        };
    }

    /**
     * Costruisce la forma normale della negazione di node.
     */
    private Logical negate(Logical node) {
        return switch (node.type()) {
            // ~P rimane ~P (letterale)
            case PREDICATE, FUNCTION -> new Negation(node);

            // ~~A -> A
            case NEGATION -> normalize(((Negation) node).term());

            case CONJUNCTION -> new Disjunction(negateAll(node.terms()));

            case DISJUNCTION -> new Conjunction(negateAll(node.terms()));

            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = (Quantifier) node;
                yield quantifier.dual(negate(quantifier.term()));
            }
        };
    }

    private List<Logical> negateAll(List<Logical> operands) {
        List<Logical> negated = new ArrayList<>();
        for (Logical operand : operands) {
            negated.add(negate(operand));
        }
        return negated;
    }
}
