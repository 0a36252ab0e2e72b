package org.clif.logical;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * CONNETTIVO N-ARIO - Congiunzione o disgiunzione di almeno un operando
 *
 * L'ordine degli operandi non ha significato logico ma viene preservato per
 * ottenere un output deterministico.
 */
public sealed interface Connective extends Logical permits Conjunction, Disjunction {

    @Override
    Connective withTerms(List<Logical> terms);

    /**
     * @return simbolo infisso usato nella rappresentazione testuale
     */
    String symbol();

    /**
     * Distribuisce le disgiunzioni sulle congiunzioni fino a ottenere la forma congiuntiva.
     *
     * PROPRIETÀ DISTRIBUTIVA APPLICATA:
     * • A | (B & C) -> (A | B) & (A | C)
     * • (A & B) | C -> (C | A) & (C | B)
     * • Applicazione ricorsiva finché nessuna disgiunzione ha una congiunzione come argomento
     *
     * @return formula equivalente in forma normale congiuntiva
     */
    Logical distributeOverDisjunction();

    /**
     * Semplifica la struttura del connettivo.
     *
     * OTTIMIZZAZIONI APPLICATE:
     * • Appiattimento operatori nidificati: (A & (B & C)) -> (A & B & C)
     * • Eliminazione duplicati preservando l'ordine: (A | A | B) -> (A | B)
     * • Estrazione dell'operando singolo: (A) -> A
     *
     * @return formula semplificata
     */
    default Logical flatten() {
        List<Logical> flattened = new ArrayList<>();

        for (Logical operand : terms()) {
            if (operand.type() == type()) {
                flattened.addAll(operand.terms());
            } else {
                flattened.add(operand);
            }
        }

        List<Logical> unique = new ArrayList<>(new LinkedHashSet<>(flattened));
        return unique.size() == 1 ? unique.get(0) : withTerms(unique);
    }

    /**
     * Applica la distribuzione a un nodo qualsiasi, attraversando l'eventuale prefisso
     * di quantificatori. Letterali e atomi restano invariati.
     *
     * @param node nodo da portare in forma congiuntiva
     * @return nodo trasformato
     */
    static Logical distribute(Logical node) {
        return switch (node.type()) {
            case CONJUNCTION, DISJUNCTION -> ((Connective) node).distributeOverDisjunction();
            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = (Quantifier) node;
                yield quantifier.with(quantifier.variables(), distribute(quantifier.term()));
            }
            case PREDICATE, FUNCTION, NEGATION -> node;
        };
    }
}
