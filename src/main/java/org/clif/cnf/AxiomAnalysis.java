package org.clif.cnf;

import org.clif.logical.Function;
import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Predicate;
import org.clif.logical.Quantifier;
import org.clif.logical.Term;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Riepilogo strutturale di un assioma: quantificatori, variabili, predicati per arità
 * e polarità, costanti. Le liste sono nell'ordine di una visita in profondità.
 *
 * @param universalQuantifiers quantificatori universali
 * @param existentialQuantifiers quantificatori esistenziali
 * @param universalVariables variabili legate da universali, senza ripetizioni
 * @param existentialVariables variabili legate da esistenziali, senza ripetizioni
 * @param unaryPredicates atomi con un argomento
 * @param binaryPredicates atomi con due argomenti
 * @param naryPredicates atomi con tre o più argomenti
 * @param negatedPredicates atomi sotto una negazione
 * @param positivePredicates atomi non negati
 * @param constants nomi liberi (non legati da alcun quantificatore nel punto in cui compaiono)
 */
public record AxiomAnalysis(List<Quantifier> universalQuantifiers,
                            List<Quantifier> existentialQuantifiers,
                            List<String> universalVariables,
                            List<String> existentialVariables,
                            List<Predicate> unaryPredicates,
                            List<Predicate> binaryPredicates,
                            List<Predicate> naryPredicates,
                            List<Predicate> negatedPredicates,
                            List<Predicate> positivePredicates,
                            List<String> constants) {

    public AxiomAnalysis {
        universalQuantifiers = List.copyOf(universalQuantifiers);
        existentialQuantifiers = List.copyOf(existentialQuantifiers);
        universalVariables = List.copyOf(universalVariables);
        existentialVariables = List.copyOf(existentialVariables);
        unaryPredicates = List.copyOf(unaryPredicates);
        binaryPredicates = List.copyOf(binaryPredicates);
        naryPredicates = List.copyOf(naryPredicates);
        negatedPredicates = List.copyOf(negatedPredicates);
        positivePredicates = List.copyOf(positivePredicates);
        constants = List.copyOf(constants);
    }

    /**
     * @param sentence formula da analizzare
     * @return analisi della formula
     */
    public static AxiomAnalysis of(Logical sentence) {
        Collector collector = new Collector();
        collector.visit(sentence, Set.of(), false);
        return collector.build();
    }

    private static final class Collector {
        private final List<Quantifier> universals = new ArrayList<>();
        private final List<Quantifier> existentials = new ArrayList<>();
        private final Set<String> universalVariables = new LinkedHashSet<>();
        private final Set<String> existentialVariables = new LinkedHashSet<>();
        private final List<Predicate> unary = new ArrayList<>();
        private final List<Predicate> binary = new ArrayList<>();
        private final List<Predicate> nary = new ArrayList<>();
        private final List<Predicate> negated = new ArrayList<>();
        private final List<Predicate> positive = new ArrayList<>();
        private final Set<String> constants = new LinkedHashSet<>();

        void visit(Logical node, Set<String> bound, boolean underNegation) {
            switch (node.type()) {
                case PREDICATE -> {
                    Predicate predicate = (Predicate) node;
                    switch (predicate.args().size()) {
                        case 1 -> unary.add(predicate);
                        case 2 -> binary.add(predicate);
                        default -> nary.add(predicate);
                    }
                    (underNegation ? negated : positive).add(predicate);
                    collectConstants(predicate.args(), bound);
                }
                case FUNCTION -> collectConstants(((Function) node).args(), bound);
                case NEGATION -> visit(((Negation) node).term(), bound, true);
                case CONJUNCTION, DISJUNCTION -> {
                    for (Logical operand : node.terms()) {
                        visit(operand, bound, false);
                    }
                }
                case UNIVERSAL, EXISTENTIAL -> {
                    Quantifier quantifier = (Quantifier) node;
                    if (node.type() == Logical.Type.UNIVERSAL) {
                        universals.add(quantifier);
                        universalVariables.addAll(quantifier.variables());
                    } else {
                        existentials.add(quantifier);
                        existentialVariables.addAll(quantifier.variables());
                    }
                    Set<String> scope = new HashSet<>(bound);
                    scope.addAll(quantifier.variables());
                    visit(quantifier.term(), scope, false);
                }
            }
        }

        private void collectConstants(List<Term> arguments, Set<String> bound) {
            for (Term argument : arguments) {
                if (argument instanceof Function function) {
                    collectConstants(function.args(), bound);
                } else if (!bound.contains(argument.name())) {
                    constants.add(argument.name());
                }
            }
        }

        AxiomAnalysis build() {
            return new AxiomAnalysis(universals, existentials,
                    new ArrayList<>(universalVariables), new ArrayList<>(existentialVariables),
                    unary, binary, nary, negated, positive, new ArrayList<>(constants));
        }
    }
}
