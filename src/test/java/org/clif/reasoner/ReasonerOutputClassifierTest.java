package org.clif.reasoner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ReasonerOutputClassifierTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testProver9() {
        Assert.assertEquals(ReasonerStatus.PROOF, ReasonerOutputClassifier.classify(Reasoner.PROVER9,
                "============================== PROOF\nTHEOREM PROVED\nExiting with 1 proof."));
        Assert.assertEquals(ReasonerStatus.UNKNOWN, ReasonerOutputClassifier.classify(Reasoner.PROVER9,
                "SEARCH FAILED\nExiting with failure."));
    }

    @Test
    public void testVampireUsesLastTermination() {
        final String output = "% Termination reason: Time limit\n"
                + "% restarting\n"
                + "Termination reason: Time limit\n"
                + "Termination reason: Refutation\n";
        Assert.assertEquals(ReasonerStatus.PROOF, ReasonerOutputClassifier.classify(Reasoner.VAMPIRE, output));
    }

    @Test
    public void testVampireKeywords() {
        Assert.assertEquals(ReasonerStatus.UNKNOWN,
                ReasonerOutputClassifier.classify(Reasoner.VAMPIRE, "Termination reason: Refutation not found"));
        Assert.assertEquals(ReasonerStatus.INCONSISTENT,
                ReasonerOutputClassifier.classify(Reasoner.VAMPIRE, "Termination reason: Unsatisfiable"));
        Assert.assertEquals(ReasonerStatus.COUNTEREXAMPLE,
                ReasonerOutputClassifier.classify(Reasoner.VAMPIRE, "Termination reason: CounterSatisfiable"));
        Assert.assertEquals(ReasonerStatus.CONSISTENT,
                ReasonerOutputClassifier.classify(Reasoner.VAMPIRE, "Termination reason: Satisfiable"));
        Assert.assertEquals(ReasonerStatus.UNKNOWN,
                ReasonerOutputClassifier.classify(Reasoner.VAMPIRE, "nessuna terminazione"));
    }

    @Test
    public void testVampireParserException() {
        Assert.assertEquals(ReasonerStatus.ERROR, ReasonerOutputClassifier.classify(Reasoner.VAMPIRE,
                "Parser exception: unexpected token\nTermination reason: Unknown"));
        Assert.assertEquals(ReasonerStatus.UNKNOWN, ReasonerOutputClassifier.classify(Reasoner.VAMPIRE,
                "Parser exception: unexpected token"));
    }

    @Test
    public void testParadox() {
        Assert.assertEquals(ReasonerStatus.PROOF,
                ReasonerOutputClassifier.classify(Reasoner.PARADOX, "+++ RESULT: Theorem"));
        Assert.assertEquals(ReasonerStatus.COUNTEREXAMPLE,
                ReasonerOutputClassifier.classify(Reasoner.PARADOX, "+++ RESULT: CounterSatisfiable"));
        Assert.assertEquals(ReasonerStatus.CONSISTENT,
                ReasonerOutputClassifier.classify(Reasoner.PARADOX, "+++ RESULT: Satisfiable"));
        Assert.assertEquals(ReasonerStatus.ERROR,
                ReasonerOutputClassifier.classify(Reasoner.PARADOX, "*** Unexpected: parse error"));
        Assert.assertEquals(ReasonerStatus.UNKNOWN,
                ReasonerOutputClassifier.classify(Reasoner.PARADOX, "+++ RESULT: Satisfiable\n+++ RESULT: Theorem"));
    }

    @Test
    public void testMace4() throws IOException {
        final Path output = folder.newFile("mace4.out").toPath();
        Files.writeString(output, "interpretation( 2 ).\nExiting with 1 model.\n", StandardCharsets.UTF_8);

        Assert.assertEquals(ReasonerStatus.CONSISTENT, ReasonerOutputClassifier.classify(Reasoner.MACE4, output));
        Assert.assertEquals(ReasonerStatus.UNKNOWN,
                ReasonerOutputClassifier.classify(Reasoner.MACE4, "Exiting with failure."));
    }

    @Test
    public void testSuccessfulStatuses() {
        Assert.assertTrue(ReasonerStatus.PROOF.isSuccessful());
        Assert.assertTrue(ReasonerStatus.CONSISTENT.isSuccessful());
        Assert.assertFalse(ReasonerStatus.UNKNOWN.isSuccessful());
        Assert.assertFalse(ReasonerStatus.ERROR.isSuccessful());
    }

    @Test
    public void testReasonerFromName() {
        Assert.assertEquals(Reasoner.VAMPIRE, Reasoner.fromName(" Vampire "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedReasoner() {
        Reasoner.fromName("eprover");
    }
}
