package org.clif.reasoner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * CLASSIFICAZIONE DELL'OUTPUT DEI RAGIONATORI
 *
 * Ricava un {@link ReasonerStatus} dalle righe prodotte da un ragionatore esterno.
 * L'invocazione dei ragionatori non fa parte di questa classe.
 *
 * MARCATORI RICONOSCIUTI:
 * • Prover9: una riga che inizia con "THEOREM PROVED"
 * • Vampire: l'ultima riga "Termination reason:"; se l'esito è ignoto, una riga
 *   "Parser exception:" lo trasforma in errore
 * • Paradox: un'unica riga "+++ RESULT:"; in sua assenza "*** Unexpected:" indica un errore
 * • Mace4: la riga "Exiting with 1 model."
 */
public final class ReasonerOutputClassifier {

    private static final Logger LOGGER = Logger.getLogger(ReasonerOutputClassifier.class.getName());

    static final String PROVER9_PROOF = "THEOREM PROVED";
    static final String VAMPIRE_TERMINATION = "Termination reason:";
    static final String VAMPIRE_PARSER_EXCEPTION = "Parser exception:";
    static final String PARADOX_RESULT = "+++ RESULT:";
    static final String PARADOX_UNEXPECTED = "*** Unexpected:";
    static final String MACE4_MODEL = "Exiting with 1 model.";

    private ReasonerOutputClassifier() {
    }

    /**
     * @throws IOException se il file di output non è leggibile
     */
    public static ReasonerStatus classify(Reasoner reasoner, Path outputFile) throws IOException {
        return classify(reasoner, Files.readAllLines(outputFile, StandardCharsets.UTF_8));
    }

    public static ReasonerStatus classify(Reasoner reasoner, String output) {
        return classify(reasoner, output.lines().toList());
    }

    public static ReasonerStatus classify(Reasoner reasoner, List<String> lines) {
        ReasonerStatus status = switch (reasoner) {
            case PROVER9 -> prover9(lines);
            case VAMPIRE -> vampire(lines);
            case PARADOX -> paradox(lines);
            case MACE4 -> mace4(lines);
        };

        LOGGER.fine("Esito " + reasoner + ": " + status);
        return status;
    }

    //region GRAMMATICHE PER RAGIONATORE

    private static ReasonerStatus prover9(List<String> lines) {
        return lines.stream().anyMatch(line -> line.startsWith(PROVER9_PROOF))
                ? ReasonerStatus.PROOF
                : ReasonerStatus.UNKNOWN;
    }

    /**
     * Vampire in modalità competizione può ripartire più volte: conta solo l'ultima
     * riga di terminazione.
     */
    private static ReasonerStatus vampire(List<String> lines) {
        List<String> terminations = linesStartingWith(lines, VAMPIRE_TERMINATION);
        if (terminations.isEmpty()) {
            return ReasonerStatus.UNKNOWN;
        }

        String last = terminations.get(terminations.size() - 1);
        ReasonerStatus status;
        if (last.contains("Refutation not found")) {
            status = ReasonerStatus.UNKNOWN;
        } else if (last.contains("Refutation")) {
            status = ReasonerStatus.PROOF;
        } else {
            status = satisfiability(last);
        }

        if (status == ReasonerStatus.UNKNOWN && !linesStartingWith(lines, VAMPIRE_PARSER_EXCEPTION).isEmpty()) {
            return ReasonerStatus.ERROR;
        }
        return status;
    }

    private static ReasonerStatus paradox(List<String> lines) {
        List<String> results = linesStartingWith(lines, PARADOX_RESULT);
        if (results.size() != 1) {
            return linesStartingWith(lines, PARADOX_UNEXPECTED).isEmpty()
                    ? ReasonerStatus.UNKNOWN
                    : ReasonerStatus.ERROR;
        }

        String result = results.get(0);
        return result.contains("Theorem") ? ReasonerStatus.PROOF : satisfiability(result);
    }

    private static ReasonerStatus mace4(List<String> lines) {
        return lines.stream().anyMatch(line -> line.startsWith(MACE4_MODEL))
                ? ReasonerStatus.CONSISTENT
                : ReasonerStatus.UNKNOWN;
    }

    //endregion

    /**
     * Parole chiave SZS comuni a Vampire e Paradox. Timeout e GaveUp restano ignoti.
     */
    private static ReasonerStatus satisfiability(String line) {
        if (line.contains("Unsatisfiable")) {
            return ReasonerStatus.INCONSISTENT;
        } else if (line.contains("CounterSatisfiable")) {
            return ReasonerStatus.COUNTEREXAMPLE;
        } else if (line.contains("Satisfiable")) {
            return ReasonerStatus.CONSISTENT;
        }
        return ReasonerStatus.UNKNOWN;
    }

    private static List<String> linesStartingWith(List<String> lines, String prefix) {
        return lines.stream().filter(line -> line.startsWith(prefix)).toList();
    }
}
