package org.clif.support;

import org.clif.cnf.Axiom;
import org.clif.logical.Logical;
import org.clif.parsing.LexicalDiagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * ONTOLOGIA - Insieme ordinato di assiomi letto da un testo CLIF
 *
 * Contiene, nell'ordine in cui compaiono nel sorgente, gli assiomi e gli URI importati.
 * I commenti del sorgente non vengono conservati. Le diagnostiche lessicali raccolte
 * durante la lettura restano associate all'ontologia.
 *
 * Tutti gli assiomi traggono gli identificatori dallo stesso {@link ConversionContext}.
 */
public class Ontology {

    private static final Logger LOGGER = Logger.getLogger(Ontology.class.getName());

    private final String name;
    private final ConversionContext context;
    private final List<Axiom> axioms = new ArrayList<>();
    private final List<String> imports = new ArrayList<>();
    private final List<LexicalDiagnostic> diagnostics = new ArrayList<>();

    public Ontology(String name) {
        this(name, new ConversionContext());
    }

    /**
     * @param name nome dell'ontologia (URI cl-text o nome del file)
     * @param context contesto condiviso dagli assiomi
     */
    public Ontology(String name, ConversionContext context) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Il nome dell'ontologia non può essere null o vuoto");
        }
        if (context == null) {
            throw new IllegalArgumentException("Il contesto di conversione non può essere null");
        }
        this.name = name;
        this.context = context;
    }

    //region COSTRUZIONE

    /**
     * Crea un assioma nel contesto dell'ontologia e lo accoda.
     *
     * @return assioma creato
     */
    public Axiom addAxiom(Logical sentence) {
        Axiom axiom = new Axiom(sentence, context);
        axioms.add(axiom);
        return axiom;
    }

    public void addImport(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("URI di import non può essere null o vuoto");
        }
        imports.add(uri);
    }

    public void addDiagnostic(LexicalDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    //endregion

    //region CONVERSIONE

    /**
     * Converte ogni assioma in forma FF-PCNF.
     *
     * @return nuova ontologia con gli stessi import e gli assiomi convertiti
     */
    public Ontology toFfPcnf() {
        LOGGER.fine("Conversione FF-PCNF dell'ontologia " + name + " (" + axioms.size() + " assiomi)");

        Ontology converted = new Ontology(name, context);
        for (Axiom axiom : axioms) {
            converted.axioms.add(axiom.ffPcnf());
        }
        converted.imports.addAll(imports);
        converted.diagnostics.addAll(diagnostics);
        return converted;
    }

    /**
     * @return una riga TPTP per assioma
     */
    public String toTptp() {
        return axioms.stream().map(Axiom::toTptp).collect(Collectors.joining("\n"));
    }

    /**
     * @return una riga LADR per assioma
     */
    public String toLadr() {
        return axioms.stream().map(Axiom::toLadr).collect(Collectors.joining("\n"));
    }

    //endregion

    public String getName() {
        return name;
    }

    public ConversionContext getContext() {
        return context;
    }

    public List<Axiom> getAxioms() {
        return Collections.unmodifiableList(axioms);
    }

    public List<String> getImports() {
        return Collections.unmodifiableList(imports);
    }

    public List<LexicalDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    @Override
    public String toString() {
        return "Ontology{" + name + ", assiomi=" + axioms.size() + ", import=" + imports.size() + "}";
    }
}
