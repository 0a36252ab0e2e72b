package org.clif.logical;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * QUANTIFICATORE - Universale o esistenziale su una lista ordinata di variabili distinte
 *
 * Oltre alle operazioni comuni dei nodi offre le primitive usate dalla costruzione
 * della forma prenessa: fusione di quantificatori annidati dello stesso tipo,
 * spostamento all'esterno del connettivo che li contiene e semplificazione finale
 * del prefisso.
 */
public sealed interface Quantifier extends Logical permits Universal, Existential {

    /**
     * @return variabili legate, nell'ordine di dichiarazione
     */
    List<String> variables();

    /**
     * @return corpo quantificato
     */
    Logical term();

    /**
     * Costruisce un quantificatore dello stesso tipo.
     */
    Quantifier with(List<String> variables, Logical term);

    /**
     * Costruisce il quantificatore duale (∀ <-> ∃) sulle stesse variabili.
     */
    Quantifier dual(Logical term);

    @Override
    default List<Logical> terms() {
        return List.of(term());
    }

    @Override
    default Quantifier withTerms(List<Logical> terms) {
        if (terms.size() != 1) {
            throw new IllegalArgumentException("Un quantificatore richiede esattamente un corpo, ricevuti: " + terms.size());
        }
        return with(variables(), terms.get(0));
    }

    /**
     * Fonde il quantificatore con quelli immediatamente annidati dello stesso tipo:
     * ∀x[∀y[P]] -> ∀x,y[P].
     *
     * La fusione si arresta se il quantificatore interno rilega uno stesso nome,
     * situazione che dopo la standardizzazione delle variabili non si presenta.
     *
     * @return quantificatore fuso (this se nulla da fondere)
     */
    default Quantifier coalesce() {
        if (term() instanceof Quantifier inner && inner.type() == type()) {
            Quantifier merged = inner.coalesce();
            if (!Collections.disjoint(variables(), merged.variables())) {
                return this;
            }

            List<String> variables = new ArrayList<>(variables());
            variables.addAll(merged.variables());
            return with(variables, merged.term());
        }
        return this;
    }

    /**
     * Sposta il quantificatore all'esterno del connettivo che lo contiene.
     * Il corpo del quantificatore diventa il primo operando del connettivo ricostruito,
     * seguito dagli altri operandi nell'ordine originale:
     * (B & ∀x[A]) -> ∀x[(A & B)].
     *
     * Valido solo se i nomi legati sono unici nell'assioma, altrimenti il connettivo
     * potrebbe contenere occorrenze libere dello stesso nome che verrebbero catturate.
     *
     * @param parent connettivo di cui il quantificatore è operando
     * @return quantificatore con il connettivo come corpo
     * @throws IllegalArgumentException se il quantificatore non è operando di parent
     */
    default Quantifier rescope(Connective parent) {
        List<Logical> operands = parent.terms();

        int index = -1;
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i) == this) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new IllegalArgumentException("Quantificatore non presente fra gli operandi di " + parent);
        }

        List<Logical> rescoped = new ArrayList<>();
        rescoped.add(term());
        for (int i = 0; i < operands.size(); i++) {
            if (i != index) {
                rescoped.add(operands.get(i));
            }
        }

        return with(variables(), parent.withTerms(rescoped));
    }

    /**
     * Fonde lungo tutto il prefisso i quantificatori adiacenti dello stesso tipo
     * rimasti dopo lo spostamento: ∀(x)[∀(y)[∃(z)[∃(w)[M]]]] -> ∀(x,y)[∃(z,w)[M]].
     *
     * @return prefisso semplificato
     */
    default Quantifier simplify() {
        Quantifier coalesced = coalesce();
        if (coalesced.term() instanceof Quantifier inner) {
            return coalesced.with(coalesced.variables(), inner.simplify());
        }
        return coalesced;
    }

    /**
     * Valida la lista di variabili di un quantificatore e ne restituisce una copia immutabile.
     */
    static List<String> checkVariables(List<String> variables) {
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("Un quantificatore richiede almeno una variabile");
        }
        if (variables.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Variabili quantificate non possono contenere null");
        }
        if (new HashSet<>(variables).size() != variables.size()) {
            throw new IllegalArgumentException("Variabili quantificate duplicate: " + variables);
        }
        return List.copyOf(variables);
    }
}
