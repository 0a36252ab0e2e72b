package org.clif.output;

/**
 * Albero che non può essere reso nel formato di output: un nodo non ammesso in posizione
 * di formula oppure nomi distinti che il formato renderebbe uguali.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message) {
        super(message);
    }
}
