package org.clif.cnf;

import org.clif.logical.Connective;
import org.clif.logical.Function;
import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Predicate;
import org.clif.logical.Quantifier;
import org.clif.logical.Term;
import org.clif.logical.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * STANDARDIZZAZIONE DELLE VARIABILI - Seconda fase della pipeline FF-PCNF
 *
 * Rinomina ogni variabile legata con un nome fresco, in modo che nessuna coppia di
 * quantificatori dello stesso assioma leghi lo stesso nome. La visita è in profondità,
 * dal quantificatore più esterno, e i nomi provengono da {@link ReverseAlphabetNames}:
 *
 *   ∀(x,y)[B(y,x)]  ->  ∀(z,y)[B(y,z)]
 *
 * La rinomina di un quantificatore è simultanea e rispetta lo scope: un quantificatore
 * interno che rilega lo stesso nome lo oscura solo nel proprio corpo. I nomi liberi
 * (costanti) non vengono toccati e non sono mai scelti come nomi freschi.
 */
final class VariableStandardizer {

    /**
     * @param sentence formula da standardizzare
     * @return formula con variabili legate tutte distinte
     */
    Logical apply(Logical sentence) {
        Iterator<String> names = new ReverseAlphabetNames(new HashSet<>(AxiomAnalysis.of(sentence).constants()));
        return standardize(sentence, Map.of(), names);
    }

    private Logical standardize(Logical node, Map<String, String> renaming, Iterator<String> names) {
        return switch (node.type()) {
            case PREDICATE -> {
                Predicate predicate = (Predicate) node;
                yield new Predicate(predicate.name(), rename(predicate.args(), renaming));
            }

            case FUNCTION -> {
                Function function = (Function) node;
                yield new Function(function.name(), rename(function.args(), renaming));
            }

            case NEGATION -> new Negation(standardize(((Negation) node).term(), renaming, names));

            case CONJUNCTION, DISJUNCTION -> {
                Connective connective = (Connective) node;
                List<Logical> operands = new ArrayList<>();
                for (Logical operand : connective.terms()) {
                    operands.add(standardize(operand, renaming, names));
                }
                yield connective.withTerms(operands);
            }

            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = (Quantifier) node;
                Map<String, String> scope = new HashMap<>(renaming);
                List<String> fresh = new ArrayList<>();
                for (String variable : quantifier.variables()) {
                    String name = names.next();
                    scope.put(variable, name);
                    fresh.add(name);
                }
                yield quantifier.with(fresh, standardize(quantifier.term(), scope, names));
            }
        };
    }

    private List<Term> rename(List<Term> arguments, Map<String, String> renaming) {
        List<Term> renamed = new ArrayList<>();
        for (Term argument : arguments) {
            if (argument instanceof Function function) {
                renamed.add(new Function(function.name(), rename(function.args(), renaming)));
            } else {
                renamed.add(new Variable(renaming.getOrDefault(argument.name(), argument.name())));
            }
        }
        return renamed;
    }
}
