package org.clif.cnf;

import org.clif.logical.Connective;
import org.clif.logical.Logical;
import org.clif.logical.Predicate;
import org.clif.logical.Quantifier;
import org.clif.output.LadrSerializer;
import org.clif.output.TptpSerializer;
import org.clif.support.ConversionContext;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ASSIOMA - Formula di primo livello di un'ontologia e pipeline di conversione FF-PCNF
 *
 * Un assioma possiede la radice del proprio albero logico e un identificatore numerico
 * assegnato alla costruzione dal {@link ConversionContext}. Ogni fase della pipeline
 * restituisce un nuovo assioma, costruito a partire da una copia profonda della formula,
 * e riceve quindi un nuovo identificatore: gli identificatori servono solo a distinguere
 * gli assiomi nell'output serializzato.
 *
 * PIPELINE FF-PCNF (ordine fisso):
 * 1. substituteFunctions: funzioni annidate sostituite da variabili fresche
 * 2. standardizeVariables: nomi legati tutti distinti
 * 3. pushNegation: negazioni solo sugli atomi
 * 4. createPrenex: quantificatori in testa
 * 5. distributeDisjunctions: matrice in forma normale congiuntiva
 *
 * La pipeline va applicata una sola volta per assioma: rieseguita sul proprio output
 * produce la stessa forma ma nomi diversi.
 */
public final class Axiom {

    private static final Logger LOGGER = Logger.getLogger(Axiom.class.getName());

    private final Logical sentence;
    private final ConversionContext context;
    private final int id;

    /**
     * @param sentence radice della formula
     * @param context contesto da cui trarre identificatori e nomi freschi
     * @throws IllegalArgumentException se uno dei parametri è null
     */
    public Axiom(Logical sentence, ConversionContext context) {
        if (sentence == null) {
            throw new IllegalArgumentException("La formula dell'assioma non può essere null");
        }
        if (context == null) {
            throw new IllegalArgumentException("Il contesto di conversione non può essere null");
        }
        this.sentence = sentence;
        this.context = context;
        this.id = context.nextAxiomId();
    }

    //region PIPELINE

    /**
     * Sostituisce le applicazioni funzionali annidate con variabili fresche.
     */
    public Axiom substituteFunctions() {
        return new Axiom(new FunctionSubstitution(context).apply(sentence.copy()), context);
    }

    /**
     * Rinomina le variabili legate in modo che nessuna coppia di quantificatori condivida un nome.
     */
    public Axiom standardizeVariables() {
        return new Axiom(new VariableStandardizer().apply(sentence.copy()), context);
    }

    /**
     * Porta le negazioni immediatamente sopra gli atomi.
     */
    public Axiom pushNegation() {
        return new Axiom(new NegationNormalizer().apply(sentence.copy()), context);
    }

    /**
     * Sposta tutti i quantificatori in testa. Richiede variabili standardizzate e negazioni
     * già spinte sugli atomi.
     */
    public Axiom createPrenex() {
        return new Axiom(new PrenexConverter().apply(sentence.copy()), context);
    }

    /**
     * Distribuisce le disgiunzioni sulle congiunzioni della matrice.
     */
    public Axiom distributeDisjunctions() {
        return new Axiom(Connective.distribute(sentence.copy()), context);
    }

    /**
     * Applica le cinque fasi nell'ordine previsto.
     *
     * @return assioma in forma FF-PCNF
     * @throws IllegalStateException se una fase fallisce in modo inatteso
     */
    public Axiom ffPcnf() {
        try {
            LOGGER.fine("Conversione FF-PCNF dell'assioma " + id + ": " + sentence);

            Axiom substituted = substituteFunctions();
            LOGGER.finest("Dopo sostituzione funzioni: " + substituted);

            Axiom standardized = substituted.standardizeVariables();
            LOGGER.finest("Dopo standardizzazione: " + standardized);

            Axiom normalized = standardized.pushNegation();
            LOGGER.finest("Dopo normalizzazione negazioni: " + normalized);

            Axiom prenex = normalized.createPrenex();
            LOGGER.finest("Dopo forma prenessa: " + prenex);

            Axiom result = prenex.distributeDisjunctions();
            LOGGER.fine("Forma FF-PCNF: " + result);

            if (!result.isFfPcnf()) {
                LOGGER.warning("Risultato non in forma FF-PCNF per l'assioma " + id + ": " + result);
            }
            return result;

        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore durante la conversione FF-PCNF dell'assioma: " + sentence, e);
            throw new IllegalStateException("Conversione FF-PCNF fallita per l'assioma: " + sentence, e);
        }
    }

    //endregion

    //region VERIFICA FORMA

    /**
     * Verifica la forma FF-PCNF: prefisso di quantificatori seguito da una congiunzione di
     * disgiunzioni di letterali, senza funzioni né quantificatori nella matrice.
     */
    public boolean isFfPcnf() {
        Logical matrix = sentence;
        while (matrix instanceof Quantifier quantifier) {
            matrix = quantifier.term();
        }

        if (matrix.type() == Logical.Type.CONJUNCTION) {
            return matrix.terms().stream().allMatch(Axiom::isClause);
        }
        return isClause(matrix);
    }

    private static boolean isClause(Logical node) {
        if (node.type() == Logical.Type.DISJUNCTION) {
            return node.terms().stream().allMatch(Axiom::isLiteral);
        }
        return isLiteral(node);
    }

    private static boolean isLiteral(Logical node) {
        return switch (node.type()) {
            case PREDICATE -> !((Predicate) node).hasFunctions();
            case NEGATION -> node.terms().get(0).type() == Logical.Type.PREDICATE
                    && isLiteral(node.terms().get(0));
            case FUNCTION, CONJUNCTION, DISJUNCTION, UNIVERSAL, EXISTENTIAL -> false;
        };
    }

    //endregion

    //region ANALISI E SERIALIZZAZIONE

    public AxiomAnalysis analyze() {
        return AxiomAnalysis.of(sentence);
    }

    /**
     * @return riga {@code fof(axiom<id*10>, axiom, <corpo>).}
     */
    public String toTptp() {
        return TptpSerializer.serialize(this);
    }

    /**
     * @return riga {@code <corpo>.} in sintassi LADR
     */
    public String toLadr() {
        return LadrSerializer.serialize(this);
    }

    //endregion

    public Logical getSentence() {
        return sentence;
    }

    public int getId() {
        return id;
    }

    public ConversionContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return sentence.toString();
    }
}
