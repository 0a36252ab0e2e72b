package org.clif.parsing;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.clif.antlr.ClifLexer;
import org.clif.antlr.ClifParser;
import org.clif.support.Ontology;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * LETTORE CLIF - Dal testo sorgente all'{@link Ontology}
 *
 * FLUSSO:
 * 1. Lexer ANTLR: i caratteri non riconosciuti vengono saltati e registrati come diagnostiche
 * 2. Parser ANTLR: il primo errore sintattico interrompe la lettura con {@link GrammarException}
 * 3. {@link ClifAstBuilder}: un assioma per ogni formula di primo livello, import accodati,
 *    commenti scartati
 *
 * Un testo vuoto o di soli spazi non produce alcuna ontologia e non è un errore. Ogni
 * lettura usa lexer, parser e contesto nuovi: un errore su un file non influisce sugli altri.
 */
public final class ClifReader {

    private static final Logger LOGGER = Logger.getLogger(ClifReader.class.getName());

    static final String DEFAULT_NAME = "ontologia";

    private ClifReader() {
    }

    public static Optional<Ontology> parse(String text) {
        return parse(text, DEFAULT_NAME);
    }

    /**
     * @param text sorgente CLIF
     * @param name nome dell'ontologia se il testo non dichiara un URI cl-text
     * @return ontologia letta, vuota se il testo è vuoto
     * @throws GrammarException se il testo contiene un costrutto malformato
     */
    public static Optional<Ontology> parse(String text, String name) {
        if (text == null || text.isBlank()) {
            LOGGER.fine("Testo vuoto, nessuna ontologia prodotta: " + name);
            return Optional.empty();
        }

        CharStream input = CharStreams.fromString(text, name);
        ClifLexer lexer = new ClifLexer(input);
        LexicalErrorListener lexicalErrors = new LexicalErrorListener();
        lexer.removeErrorListeners();
        lexer.addErrorListener(lexicalErrors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        ClifParser parser = new ClifParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new GrammarErrorListener());

        try {
            ClifParser.OntologyContext tree = parser.starter().ontology();
            Ontology ontology = buildOntology(tree, name);
            lexicalErrors.getDiagnostics().forEach(ontology::addDiagnostic);

            LOGGER.fine("Letta " + ontology);
            return Optional.of(ontology);

        } catch (GrammarException e) {
            LOGGER.warning("Lettura di " + name + " interrotta: " + e.getMessage());
            throw e;
        }
    }

    /**
     * Legge un file CLIF codificato in UTF-8. Il nome del file senza estensione diventa
     * il nome dell'ontologia, salvo URI cl-text.
     *
     * @throws IOException se il file non è leggibile
     */
    public static Optional<Ontology> parseFile(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        return parse(text, baseName(path));
    }

    private static Ontology buildOntology(ClifParser.OntologyContext tree, String name) {
        String ontologyName = tree.URI() != null ? tree.URI().getText() : name;
        Ontology ontology = new Ontology(ontologyName);
        ClifAstBuilder builder = new ClifAstBuilder();

        for (ParseTree child : tree.statement().children) {
            if (child instanceof ClifParser.AxiomContext axiom) {
                ontology.addAxiom(builder.visit(axiom));
            } else if (child instanceof ClifParser.ImportDeclContext importDecl) {
                ontology.addImport(importDecl.URI().getText());
            }
            // cl-comment: scartato
        }
        return ontology;
    }

    static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
