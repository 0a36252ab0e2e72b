package org.clif.logical;

import java.util.List;

/**
 * NODO LOGICO - Insieme chiuso delle varianti dell'albero sintattico di una formula CLIF
 *
 * Ogni nodo è immutabile: le trasformazioni costruiscono un nuovo albero dal basso verso
 * l'alto senza mai modificare quello ricevuto, per cui due fasi della pipeline non
 * osservano mai un albero condiviso in corso di modifica.
 *
 * VARIANTI SUPPORTATE:
 * • Predicate: atomo P(t1, ..., tn), uguaglianza se il nome è "="
 * • Function: applicazione funzionale f(t1, ..., tn), solo in posizione di argomento
 * • Negation: ~A
 * • Conjunction / Disjunction: (A & B & ...) / (A | B | ...)
 * • Universal / Existential: ∀(x,y)[A] / ∃(x,y)[A]
 *
 * Ogni attraversamento ricorsivo effettua uno switch sul {@link Type} del nodo: essendo
 * un'enumerazione chiusa, il compilatore verifica che ogni variante sia gestita.
 */
public sealed interface Logical permits Predicate, Function, Negation, Connective, Quantifier {

    /**
     * Tipi di nodo dell'albero logico.
     */
    enum Type {
        PREDICATE,      // Atomo: P(x, y)
        FUNCTION,       // Funzione annidata: f(x)
        NEGATION,       // Negazione: ~A
        CONJUNCTION,    // Congiunzione: A & B
        DISJUNCTION,    // Disgiunzione: A | B
        UNIVERSAL,      // Quantificatore universale: ∀(x)[A]
        EXISTENTIAL     // Quantificatore esistenziale: ∃(x)[A]
    }

    /**
     * @return tipo della variante
     */
    Type type();

    /**
     * Figli immediati in posizione di formula, nell'ordine in cui compaiono.
     * Atomi e funzioni non hanno figli di questo genere: i loro argomenti sono termini.
     *
     * @return lista immutabile dei figli
     */
    List<Logical> terms();

    /**
     * Costruisce un nodo dello stesso tipo con i figli sostituiti.
     *
     * @param terms nuovi figli (stessa arità richiesta dalla variante)
     * @return nuovo nodo
     * @throws IllegalArgumentException se il numero di figli non è compatibile con la variante
     */
    Logical withTerms(List<Logical> terms);

    /**
     * Copia strutturale profonda dell'albero radicato in questo nodo.
     */
    Logical copy();
}
