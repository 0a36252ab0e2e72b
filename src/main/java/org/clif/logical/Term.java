package org.clif.logical;

/**
 * Argomento di un predicato o di una funzione: una variabile (o costante) oppure
 * un'applicazione funzionale annidata.
 */
public sealed interface Term permits Variable, Function {

    String name();

    Term copy();
}
