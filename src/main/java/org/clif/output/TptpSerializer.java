package org.clif.output;

import org.clif.cnf.Axiom;
import org.clif.cnf.AxiomAnalysis;
import org.clif.logical.Function;
import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Predicate;
import org.clif.logical.Quantifier;
import org.clif.logical.Term;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SERIALIZZAZIONE TPTP/FOF
 *
 * Ogni assioma diventa una riga {@code fof(axiom<id*10>, axiom, <corpo>).}
 *
 * CONVENZIONI:
 * • Variabili legate in maiuscolo, nomi di predicati, funzioni e costanti in minuscolo
 * • Due costanti che differiscono solo per le maiuscole sono rifiutate
 * • Uguaglianza infissa: X=Y
 * • Negazione di un atomo fra parentesi: ~(p(X)), per non confonderla con i predicati simbolici
 * • Doppia negazione eliminata in fase di resa
 * • Quantificatori: (! [X,Y] : (corpo)) e (? [X,Y] : (corpo))
 */
public final class TptpSerializer {

    private TptpSerializer() {
    }

    /**
     * @param axiom assioma da serializzare
     * @return riga TPTP dell'assioma
     * @throws SerializationException se l'albero contiene un nodo non ammesso in posizione di formula
     *         o due costanti distinte che in minuscolo coincidono
     */
    public static String serialize(Axiom axiom) {
        String body = formula(axiom.getSentence(), Set.of());
        checkConstants(AxiomAnalysis.of(axiom.getSentence()).constants());
        return "fof(axiom" + axiom.getId() * 10 + ", axiom, " + body + ").";
    }

    private static void checkConstants(List<String> constants) {
        Map<String, String> rendered = new HashMap<>();
        for (String constant : constants) {
            String previous = rendered.putIfAbsent(constant.toLowerCase(Locale.ROOT), constant);
            if (previous != null && !previous.equals(constant)) {
                throw new SerializationException("Le costanti '" + previous + "' e '" + constant
                        + "' coincidono nell'output TPTP");
            }
        }
    }

    private static String formula(Logical node, Set<String> bound) {
        if (node == null) {
            throw new SerializationException("Nodo null non valido per l'output TPTP");
        }

        return switch (node.type()) {
            case PREDICATE -> {
                Predicate predicate = (Predicate) node;
                if (predicate.isEquality()) {
                    yield term(predicate.args().get(0), bound) + "=" + term(predicate.args().get(1), bound);
                }
                yield predicate.name().toLowerCase(Locale.ROOT) + "(" + terms(predicate.args(), bound) + ")";
            }

            case FUNCTION -> throw new SerializationException("Funzione in posizione di formula non valida per l'output TPTP: " + node);

            case NEGATION -> {
                Logical inner = ((Negation) node).term();
                if (inner instanceof Negation doubled) {
                    yield formula(doubled.term(), bound);
                }
                if (inner instanceof Predicate) {
                    yield "~(" + formula(inner, bound) + ")";
                }
                yield "~" + formula(inner, bound);
            }

            case CONJUNCTION -> join(node.terms(), " & ", bound);

            case DISJUNCTION -> join(node.terms(), " | ", bound);

            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = (Quantifier) node;
                Set<String> scope = new HashSet<>(bound);
                scope.addAll(quantifier.variables());

                String symbol = node.type() == Logical.Type.UNIVERSAL ? "!" : "?";
                String variables = quantifier.variables().stream()
                        .map(variable -> variable.toUpperCase(Locale.ROOT))
                        .collect(Collectors.joining(","));
                yield "(" + symbol + " [" + variables + "] : (" + formula(quantifier.term(), scope) + "))";
            }
        };
    }

    private static String join(List<Logical> operands, String separator, Set<String> bound) {
        return operands.stream()
                .map(operand -> formula(operand, bound))
                .collect(Collectors.joining(separator, "(", ")"));
    }

    private static String terms(List<Term> arguments, Set<String> bound) {
        return arguments.stream().map(argument -> term(argument, bound)).collect(Collectors.joining(","));
    }

    private static String term(Term argument, Set<String> bound) {
        if (argument instanceof Function function) {
            return function.name().toLowerCase(Locale.ROOT) + "(" + terms(function.args(), bound) + ")";
        }
        // Costanti in minuscolo: in TPTP un nome maiuscolo è una variabile
        return bound.contains(argument.name())
                ? argument.name().toUpperCase(Locale.ROOT)
                : argument.name().toLowerCase(Locale.ROOT);
    }
}
