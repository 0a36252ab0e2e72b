package org.clif;

import org.clif.parsing.ClifReader;
import org.clif.parsing.GrammarException;
import org.clif.parsing.LexicalDiagnostic;
import org.clif.reasoner.Reasoner;
import org.clif.reasoner.ReasonerOutputClassifier;
import org.clif.reasoner.ReasonerStatus;
import org.clif.support.Ontology;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * TRADUTTORE CLIF -> FF-PCNF / TPTP / LADR
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file .clif singolo o tutti i file .clif di una directory
 * 2. PARSING: testo CLIF -> albero sintattico (ANTLR) -> ontologia di assiomi
 * 3. CONVERSIONE (opzionale, -p): ogni assioma in forma FF-PCNF
 * 4. OUTPUT: serializzazione TPTP e/o LADR, a schermo e su file con -o
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f)
 * - Directory batch (-d): gli errori su un file non interrompono gli altri
 * - Classificazione dell'output di un ragionatore (-status=<ragionatore> <file>)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - TPTP/: <nome>.tptp
 * - LADR/: <nome>.in
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String PCNF_PARAM = "-p";
    private static final String FORMAT_PARAM = "-fmt=";
    private static final String STATUS_PARAM = "-status=";

    /**
     * Formati di output disponibili
     * */
    private static final String FORMAT_TPTP = "tptp";
    private static final String FORMAT_LADR = "ladr";
    private static final String FORMAT_ALL = "all";

    private static final String CLIF_EXTENSION = ".clif";
    private static final String TPTP_DIR = "TPTP";
    private static final String LADR_DIR = "LADR";
    private static final String TPTP_EXTENSION = ".tptp";
    private static final String LADR_EXTENSION = ".in";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del traduttore.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Scelta della modalità (file singolo, directory, classificazione)
     * 3. Gestione errori globali
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO TRADUTTORE CLIF <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            TranslatorConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE TRADUTTORE CLIF <---");
        }
    }

    private static void executeMainPipeline(TranslatorConfiguration config) {
        if (config.reasoner != null) {
            System.out.println("[I] Modalità: Classificazione output " + config.reasoner);
            processReasonerOutput(config);
        } else if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            try {
                processSingleFile(config, Paths.get(config.inputPath));
            } catch (GrammarException e) {
                System.out.println("[E] Errore di sintassi: " + e.getMessage());
            }
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            processDirectoryBatch(config);
        }
    }

    private static void handleGlobalError(Exception e) {
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static TranslatorConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri:: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(TranslatorConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE TRADUTTORE CLIF <<--");

        if (config.reasoner != null) {
            System.out.println("Modalità: Classificazione output ragionatore");
            System.out.println("Ragionatore: " + config.reasoner);
            System.out.println("Input: " + config.inputPath);
        } else {
            System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
            System.out.println("Input: " + config.inputPath);
            System.out.println("Conversione FF-PCNF: " + (config.convertToPcnf ? "Sì" : "No"));
            System.out.println("Formati: " + String.join(", ", activeFormats(config)));
            System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Solo a schermo"));
        }
        System.out.println("====================================\n");
    }

    private static List<String> activeFormats(TranslatorConfiguration config) {
        List<String> formats = new ArrayList<>();
        if (config.writeTptp) formats.add("TPTP");
        if (config.writeLadr) formats.add("LADR");
        return formats;
    }

    //endregion

    //region ELABORAZIONE DEL FILE SINGOLO

    /**
     * Elabora un file CLIF: lettura, conversione opzionale, serializzazione e salvataggio.
     *
     * @throws GrammarException se il file contiene un costrutto malformato
     * @throws IllegalStateException se il file non è leggibile o l'output non è scrivibile
     */
    private static void processSingleFile(TranslatorConfiguration config, Path file) {
        System.out.println("[I] Lettura: " + file);

        Optional<Ontology> parsed;
        try {
            parsed = ClifReader.parseFile(file);
        } catch (IOException e) {
            throw new IllegalStateException("File non leggibile: " + file, e);
        }

        if (parsed.isEmpty()) {
            System.out.println("[W] File vuoto, nessuna ontologia prodotta: " + file.getFileName());
            return;
        }

        Ontology ontology = parsed.get();
        for (LexicalDiagnostic diagnostic : ontology.getDiagnostics()) {
            System.out.println("[W] " + diagnostic);
        }
        System.out.println("[I] Ontologia " + ontology.getName() + ": " + ontology.getAxioms().size()
                + " assiomi, " + ontology.getImports().size() + " import");

        if (config.convertToPcnf) {
            ontology = ontology.toFfPcnf();
            System.out.println("[I] Conversione FF-PCNF completata");
        }

        String baseName = baseName(file);
        try {
            if (config.writeTptp) {
                String tptp = ontology.toTptp();
                System.out.println("\n" + tptp + "\n");
                saveOutput(tptp, config, baseName, TPTP_DIR, TPTP_EXTENSION);
            }
            if (config.writeLadr) {
                String ladr = ontology.toLadr();
                System.out.println("\n" + ladr + "\n");
                saveOutput(ladr, config, baseName, LADR_DIR, LADR_EXTENSION);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Impossibile salvare l'output di " + file, e);
        }
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Elabora tutti i file .clif di una directory in ordine di nome.
     */
    private static void processDirectoryBatch(TranslatorConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        try {
            List<Path> clifFiles = findAllClifFiles(config.inputPath);
            if (clifFiles.isEmpty()) {
                System.out.println("[W] Nessun file .clif trovato nella directory specificata.");
                return;
            }

            BatchResult batchResult = executeBatchProcessing(clifFiles, config);
            displayBatchSummary(batchResult);

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    private static List<Path> findAllClifFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .clif nella directory...");

        List<Path> clifFiles;
        try (Stream<Path> entries = Files.list(Paths.get(dirPath))) {
            clifFiles = entries
                    .filter(path -> path.toString().toLowerCase(Locale.ROOT).endsWith(CLIF_EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }

        System.out.println("Trovati " + clifFiles.size() + " file .clif da elaborare.");
        return clifFiles;
    }

    /**
     * Gli errori su singoli file non interrompono l'elaborazione degli altri.
     */
    private static BatchResult executeBatchProcessing(List<Path> files, TranslatorConfiguration config) {
        BatchResult result = new BatchResult(files.size());

        for (Path file : files) {
            try {
                System.out.println("Elaborazione: " + file.getFileName());
                processSingleFile(config, file);
                result.incrementSuccess();

            } catch (GrammarException e) {
                System.out.println("[E] Errore di sintassi nel file " + file.getFileName() + ": " + e.getMessage());
                result.incrementError();
            } catch (Exception e) {
                System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e);
                result.incrementError();
            }
            System.out.println(); // Separatore visivo
        }

        return result;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File elaborati trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%\n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region CLASSIFICAZIONE OUTPUT RAGIONATORE

    private static void processReasonerOutput(TranslatorConfiguration config) {
        try {
            ReasonerStatus status = ReasonerOutputClassifier.classify(config.reasoner, Paths.get(config.inputPath));
            System.out.println("[I] Esito " + config.reasoner + ": " + status
                    + (status.isSuccessful() ? " (terminato con successo)" : ""));
        } catch (IOException e) {
            System.out.println("[E] Impossibile leggere l'output del ragionatore: " + e.getMessage());
        }
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    /**
     * Salva il contenuto in outputPath/dirName/baseName+extension. Senza -o non salva nulla.
     */
    private static void saveOutput(String content, TranslatorConfiguration config, String baseName,
                                   String dirName, String extension) throws IOException {
        if (config.outputPath == null) {
            return;
        }

        Path outputDir = Paths.get(config.outputPath, dirName);
        Files.createDirectories(outputDir);
        Path outputFilePath = outputDir.resolve(baseName + extension);

        try (FileWriter writer = new FileWriter(outputFilePath.toFile(), StandardCharsets.UTF_8)) {
            writer.write(content);
            writer.write(System.lineSeparator());
        }

        System.out.println("[I] Output " + dirName + " salvato: " + outputFilePath);
    }

    private static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    //endregion

    //region HELP

    private static void printApplicationHelp() {
        System.out.println("\n-->> TRADUTTORE CLIF - GUIDA <<--\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar clif-translator.jar [-f <file> | -d <directory>] [-o <directory>] [-p] [-fmt=tptp|ladr|all]");
        System.out.println("  java -jar clif-translator.jar -status=<ragionatore> <file output>\n");

        System.out.println("PARAMETRI:");
        System.out.println("  -h                  Mostra questa guida");
        System.out.println("  -f <file>           Elabora un singolo file .clif");
        System.out.println("  -d <directory>      Elabora tutti i file .clif della directory");
        System.out.println("  -o <directory>      Salva l'output in TPTP/ e LADR/ sotto la directory");
        System.out.println("  -p                  Converte gli assiomi in FF-PCNF prima della serializzazione");
        System.out.println("  -fmt=<formato>      tptp (predefinito), ladr oppure all");
        System.out.println("  -status=<nome>      Classifica l'output di prover9, vampire, paradox o mace4\n");

        System.out.println("ESEMPI:");
        System.out.println("  java -jar clif-translator.jar -f ontologia.clif -p");
        System.out.println("  java -jar clif-translator.jar -d ./clif/ -o ./output/ -p -fmt=all");
        System.out.println("  java -jar clif-translator.jar -status=vampire ./output/vampire.out\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class TranslatorConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final boolean convertToPcnf;
        final boolean writeTptp;
        final boolean writeLadr;
        final Reasoner reasoner;

        TranslatorConfiguration(String inputPath, String outputPath, boolean isFileMode, boolean convertToPcnf,
                                boolean writeTptp, boolean writeLadr, Reasoner reasoner) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.convertToPcnf = convertToPcnf;
            this.writeTptp = writeTptp;
            this.writeLadr = writeLadr;
            this.reasoner = reasoner;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    private static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -f <file>: Input file singolo (esclusivo con -d e -status)
         * -d <dir>: Input directory per batch (esclusivo con -f e -status)
         * -o <dir>: Directory output
         * -p: Conversione FF-PCNF
         * -fmt=<formato>: tptp, ladr, all
         * -status=<ragionatore> <file>: Classificazione output ragionatore
         *
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        public TranslatorConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean convertToPcnf = false;
            boolean writeTptp = true;
            boolean writeLadr = false;
            Reasoner reasoner = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        requireNoOtherMode(isDirectoryMode, reasoner != null, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        requireReadable(inputPath, false);
                        isFileMode = true;
                    }

                    case DIR_PARAM -> {
                        requireNoOtherMode(isFileMode, reasoner != null, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        requireReadable(inputPath, true);
                        isDirectoryMode = true;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        requireOutputDirectory(outputPath);
                    }

                    case PCNF_PARAM -> convertToPcnf = true;

                    default -> {
                        if (args[i].startsWith(FORMAT_PARAM)) {
                            String format = args[i].substring(FORMAT_PARAM.length()).toLowerCase(Locale.ROOT);
                            switch (format) {
                                case FORMAT_TPTP -> { writeTptp = true; writeLadr = false; }
                                case FORMAT_LADR -> { writeTptp = false; writeLadr = true; }
                                case FORMAT_ALL -> { writeTptp = true; writeLadr = true; }
                                default -> throw new IllegalArgumentException("Formato non supportato: " + format
                                        + ". Supportati: " + FORMAT_TPTP + ", " + FORMAT_LADR + ", " + FORMAT_ALL);
                            }
                        } else if (args[i].startsWith(STATUS_PARAM)) {
                            requireNoOtherMode(isFileMode, isDirectoryMode, "classificazione");
                            reasoner = Reasoner.fromName(args[i].substring(STATUS_PARAM.length()));
                            inputPath = getNextArgument(args, ++i, "file di output del ragionatore");
                            requireReadable(inputPath, false);
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }

            return new TranslatorConfiguration(inputPath, outputPath, isFileMode, convertToPcnf,
                    writeTptp, writeLadr, reasoner);
        }

        private void requireNoOtherMode(boolean otherModeSet, boolean anotherModeSet, String mode) {
            if (otherModeSet || anotherModeSet) {
                throw new IllegalArgumentException("Le modalità file, directory e classificazione sono esclusive: "
                        + mode + " richiesta insieme a un'altra");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        /**
         * Un percorso di input deve esistere, essere del tipo atteso e leggibile.
         */
        private void requireReadable(String path, boolean directory) {
            Path input = Paths.get(path);
            boolean matchesKind = directory ? Files.isDirectory(input) : Files.isRegularFile(input);
            if (!matchesKind || !Files.isReadable(input)) {
                throw new IllegalArgumentException((directory ? "Directory" : "File")
                        + " inesistente o non leggibile: " + path);
            }
        }

        /**
         * La directory di output viene creata al salvataggio; qui si esclude solo
         * un percorso già occupato da un file.
         */
        private void requireOutputDirectory(String path) {
            if (Files.exists(Paths.get(path)) && !Files.isDirectory(Paths.get(path))) {
                throw new IllegalArgumentException("Il percorso di output non è una directory: " + path);
            }
        }
    }

    /**
     * Risultato elaborazione batch con statistiche.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
