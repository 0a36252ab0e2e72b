package org.clif.cnf;

import org.clif.logical.Conjunction;
import org.clif.logical.Connective;
import org.clif.logical.Disjunction;
import org.clif.logical.Function;
import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Predicate;
import org.clif.logical.Quantifier;
import org.clif.logical.Term;
import org.clif.logical.Universal;
import org.clif.logical.Variable;
import org.clif.support.ConversionContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * SOSTITUZIONE DELLE FUNZIONI - Prima fase della pipeline FF-PCNF
 *
 * Ogni atomo con argomenti funzionali viene riscritto introducendo una variabile
 * fresca per ciascuna applicazione funzionale e una relazione che la definisce:
 *
 *   C(z, F(z))  ->  ∀(z,F1)[(~C(z,F1) | F(z,F1))]
 *   A(f(g(x)))  ->  ∀(f2,g3)[(~A(f2) | (g(x,g3) & f(g3,f2)))]
 *
 * REGOLE:
 * • I nomi freschi sono nome-funzione + suffisso tratto dal contesto, assegnati
 *   prima alla funzione esterna e poi a quelle annidate
 * • Le relazioni sono elencate dalla più interna alla più esterna
 * • Il quantificatore introdotto lega, nell'ordine degli argomenti, le variabili
 *   semplici dell'atomo già legate da un quantificatore esterno e i nomi freschi
 * • Le relazioni sono predicati: dopo questa fase non resta alcun nodo Function
 * • Un nome fresco non coincide mai con un nome già presente nella formula, libero o
 *   legato: i suffissi che lo produrrebbero vengono scartati
 */
final class FunctionSubstitution {

    private static final Logger LOGGER = Logger.getLogger(FunctionSubstitution.class.getName());

    private final ConversionContext context;
    private final Set<String> reserved = new HashSet<>();

    FunctionSubstitution(ConversionContext context) {
        this.context = context;
    }

    /**
     * @param sentence formula da riscrivere
     * @return formula equivalente priva di funzioni annidate
     */
    Logical apply(Logical sentence) {
        AxiomAnalysis analysis = AxiomAnalysis.of(sentence);
        reserved.clear();
        reserved.addAll(analysis.constants());
        reserved.addAll(analysis.universalVariables());
        reserved.addAll(analysis.existentialVariables());

        return substitute(sentence, Set.of());
    }

    private Logical substitute(Logical node, Set<String> bound) {
        return switch (node.type()) {
            case PREDICATE -> replacePredicate((Predicate) node, bound);

            case FUNCTION -> node;

            case NEGATION -> new Negation(substitute(((Negation) node).term(), bound));

            case CONJUNCTION, DISJUNCTION -> {
                Connective connective = (Connective) node;
                List<Logical> operands = new ArrayList<>();
                for (Logical operand : connective.terms()) {
                    operands.add(substitute(operand, bound));
                }
                yield connective.withTerms(operands);
            }

            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = (Quantifier) node;
                Set<String> scope = new HashSet<>(bound);
                scope.addAll(quantifier.variables());
                yield quantifier.with(quantifier.variables(), substitute(quantifier.term(), scope));
            }
        };
    }

    private Logical replacePredicate(Predicate predicate, Set<String> bound) {
        if (!predicate.hasFunctions()) {
            return predicate;
        }

        Set<String> quantified = new LinkedHashSet<>();
        List<Logical> relations = new ArrayList<>();
        List<Term> arguments = new ArrayList<>();

        for (Term argument : predicate.args()) {
            if (argument instanceof Function function) {
                arguments.add(new Variable(replaceFunction(function, quantified, relations)));
            } else {
                arguments.add(argument);
                if (bound.contains(argument.name())) {
                    quantified.add(argument.name());
                }
            }
        }

        Logical definition = relations.size() == 1 ? relations.get(0) : new Conjunction(relations);
        Logical rewritten = new Universal(new ArrayList<>(quantified),
                new Disjunction(List.of(new Negation(new Predicate(predicate.name(), arguments)), definition)));

        LOGGER.finest("Funzioni sostituite in " + predicate + ": " + rewritten);
        return rewritten;
    }

    /**
     * Sostituisce una funzione con un nome fresco, registrando la relazione che lo definisce.
     *
     * @return nome fresco che prende il posto dell'applicazione funzionale
     */
    private String replaceFunction(Function function, Set<String> quantified, List<Logical> relations) {
        String fresh = freshName(function.name());
        quantified.add(fresh);

        List<Term> arguments = new ArrayList<>();
        for (Term argument : function.args()) {
            if (argument instanceof Function nested) {
                arguments.add(new Variable(replaceFunction(nested, quantified, relations)));
            } else {
                arguments.add(argument);
            }
        }
        arguments.add(new Variable(fresh));

        relations.add(new Predicate(function.name(), arguments));
        return fresh;
    }

    private String freshName(String functionName) {
        String fresh = functionName + context.nextFunctionSuffix();
        while (reserved.contains(fresh)) {
            LOGGER.finest("Nome fresco " + fresh + " già presente nella formula, scartato");
            fresh = functionName + context.nextFunctionSuffix();
        }
        reserved.add(fresh);
        return fresh;
    }
}
