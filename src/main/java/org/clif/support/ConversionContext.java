package org.clif.support;

/**
 * CONTESTO DI CONVERSIONE - Sorgenti di numerazione condivise da una esecuzione
 *
 * Raggruppa i due generatori che nella pipeline FF-PCNF devono essere unici per
 * tutta l'esecuzione:
 * • identificatori degli assiomi, assegnati a ogni costruzione di un Axiom
 * • suffissi dei nomi freschi introdotti dalla sostituzione delle funzioni
 *
 * Ogni ontologia letta riceve un contesto nuovo, che parte da 1 per entrambe le sequenze.
 */
public final class ConversionContext {

    private final Sequence axiomIds;
    private final Sequence functionSuffixes;

    public ConversionContext() {
        this(1, 1);
    }

    /**
     * @param firstAxiomId primo identificatore di assioma
     * @param firstFunctionSuffix primo suffisso per i nomi freschi
     */
    public ConversionContext(int firstAxiomId, int firstFunctionSuffix) {
        this.axiomIds = new Sequence(firstAxiomId);
        this.functionSuffixes = new Sequence(firstFunctionSuffix);
    }

    public int nextAxiomId() {
        return axiomIds.next();
    }

    public int nextFunctionSuffix() {
        return functionSuffixes.next();
    }
}
