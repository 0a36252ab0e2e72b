package org.clif.support;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generatore monotono di interi condivisibile fra thread.
 *
 * Unico punto di sincronizzazione per gli identificatori degli assiomi e per i suffissi
 * dei nomi freschi: pipeline eseguite in parallelo sullo stesso contesto non possono
 * ottenere due volte lo stesso valore.
 */
public final class Sequence {

    private final AtomicInteger next;

    /**
     * @param start primo valore restituito da {@link #next()}
     */
    public Sequence(int start) {
        this.next = new AtomicInteger(start);
    }

    /**
     * @return valore corrente, poi incrementato
     */
    public int next() {
        return next.getAndIncrement();
    }
}
