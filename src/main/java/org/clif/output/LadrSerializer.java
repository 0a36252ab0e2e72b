package org.clif.output;

import org.clif.cnf.Axiom;
import org.clif.logical.Function;
import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Predicate;
import org.clif.logical.Quantifier;
import org.clif.logical.Term;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializzazione LADR (Prover9/Mace4): una riga {@code <corpo>.} per assioma, nomi invariati,
 * {@code -} per la negazione e quantificatori {@code (all x all y corpo)}.
 */
public final class LadrSerializer {

    private LadrSerializer() {
    }

    /**
     * @throws SerializationException se l'albero contiene un nodo non ammesso in posizione di formula
     */
    public static String serialize(Axiom axiom) {
        return formula(axiom.getSentence()) + ".";
    }

    private static String formula(Logical node) {
        if (node == null) {
            throw new SerializationException("Nodo null non valido per l'output LADR");
        }

        return switch (node.type()) {
            case PREDICATE -> {
                Predicate predicate = (Predicate) node;
                if (predicate.isEquality()) {
                    yield term(predicate.args().get(0)) + " = " + term(predicate.args().get(1));
                }
                yield predicate.name() + "(" + terms(predicate.args()) + ")";
            }

            case FUNCTION -> throw new SerializationException("Funzione in posizione di formula non valida per l'output LADR: " + node);

            case NEGATION -> {
                Logical inner = ((Negation) node).term();
                if (inner instanceof Negation doubled) {
                    yield formula(doubled.term());
                }
                if (inner instanceof Predicate) {
                    yield "-(" + formula(inner) + ")";
                }
                yield "-" + formula(inner);
            }

            case CONJUNCTION -> join(node.terms(), " & ");

            case DISJUNCTION -> join(node.terms(), " | ");

            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = (Quantifier) node;
                String keyword = node.type() == Logical.Type.UNIVERSAL ? "all " : "exists ";
                String prefix = quantifier.variables().stream()
                        .map(variable -> keyword + variable)
                        .collect(Collectors.joining(" "));
                yield "(" + prefix + " " + formula(quantifier.term()) + ")";
            }
        };
    }

    private static String join(List<Logical> operands, String separator) {
        return operands.stream().map(LadrSerializer::formula).collect(Collectors.joining(separator, "(", ")"));
    }

    private static String terms(List<Term> arguments) {
        return arguments.stream().map(LadrSerializer::term).collect(Collectors.joining(","));
    }

    private static String term(Term argument) {
        if (argument instanceof Function function) {
            return function.name() + "(" + terms(function.args()) + ")";
        }
        return argument.name();
    }
}
