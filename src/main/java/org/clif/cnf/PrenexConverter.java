package org.clif.cnf;

import org.clif.logical.Connective;
import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Quantifier;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * FORMA PRENESSA - Quarta fase della pipeline FF-PCNF
 *
 * Porta tutti i quantificatori in testa alla formula. I figli vengono risolti prima
 * dei genitori, per cui ogni sottoalbero è già prenesso quando il connettivo che lo
 * contiene ne sposta all'esterno i quantificatori:
 *
 *   A(z) | (B(y) & ∀(w,v)[D])  ->  ∀(w,v)[((D & B(y)) | A(z))]
 *
 * PASSI SU OGNI CONNETTIVO:
 * 1. Risoluzione ricorsiva degli operandi
 * 2. Gli operandi che erano connettivi vengono accodati dopo gli altri
 * 3. Fusione dei quantificatori annidati dello stesso tipo (coalesce)
 * 4. Spostamento all'esterno, uno alla volta, dei quantificatori operandi secondo la loro
 *    posizione nel connettivo originale
 *
 * Al termine il prefisso viene semplificato fondendo i quantificatori adiacenti dello
 * stesso tipo. Richiede nomi legati unici (standardizzazione) e negazioni solo sugli atomi.
 */
final class PrenexConverter {

    private static final Logger LOGGER = Logger.getLogger(PrenexConverter.class.getName());

    Logical apply(Logical sentence) {
        Logical prenex = prenex(sentence);

        if (prenex instanceof Quantifier quantifier) {
            LOGGER.finest("Prefisso prima della semplificazione: " + quantifier);
            return quantifier.simplify();
        }
        return prenex;
    }

    private Logical prenex(Logical node) {
        return switch (node.type()) {
            case PREDICATE, FUNCTION -> node;

            case NEGATION -> new Negation(prenex(((Negation) node).term()));

            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = (Quantifier) node;
                yield quantifier.with(quantifier.variables(), prenex(quantifier.term()));
            }

            case CONJUNCTION, DISJUNCTION -> prenexConnective((Connective) node);
        };
    }

    private Logical prenexConnective(Connective connective) {
        List<Logical> leading = new ArrayList<>();
        List<Logical> trailing = new ArrayList<>();
        Map<Logical, Integer> positions = new IdentityHashMap<>();

        List<Logical> operands = connective.terms();
        for (int i = 0; i < operands.size(); i++) {
            Logical operand = operands.get(i);
            Logical resolved = prenex(operand);
            positions.put(resolved, i);
            if (operand instanceof Connective) {
                trailing.add(resolved);
            } else {
                leading.add(resolved);
            }
        }
        leading.addAll(trailing);

        return pullQuantifiers(connective.withTerms(leading), positions);
    }

    /**
     * Sposta all'esterno del connettivo il quantificatore operando che occupava la
     * posizione più a sinistra nel connettivo originale e ripete sul connettivo
     * ricostruito finché non ne rimangono. Il corpo spostato eredita la posizione
     * del suo quantificatore, per cui l'intero prefisso di un operando precede quelli
     * degli operandi successivi.
     *
     * @param positions posizione originale di ciascun operando, per identità
     */
    private Logical pullQuantifiers(Connective connective, Map<Logical, Integer> positions) {
        List<Logical> coalesced = new ArrayList<>();
        for (Logical operand : connective.terms()) {
            if (operand instanceof Quantifier quantifier) {
                Quantifier merged = quantifier.coalesce();
                positions.put(merged, positions.getOrDefault(quantifier, Integer.MAX_VALUE));
                coalesced.add(merged);
            } else {
                coalesced.add(operand);
            }
        }
        Connective current = connective.withTerms(coalesced);

        Quantifier first = null;
        for (Logical operand : current.terms()) {
            if (operand instanceof Quantifier quantifier
                    && (first == null || position(quantifier, positions) < position(first, positions))) {
                first = quantifier;
            }
        }
        if (first == null) {
            return current;
        }

        Quantifier lifted = first.rescope(current);
        Connective body = (Connective) lifted.term();
        positions.put(body.terms().get(0), position(first, positions));
        LOGGER.finest("Quantificatore spostato: " + lifted);
        return lifted.with(lifted.variables(), pullQuantifiers(body, positions));
    }

    private static int position(Logical operand, Map<Logical, Integer> positions) {
        return positions.getOrDefault(operand, Integer.MAX_VALUE);
    }
}
