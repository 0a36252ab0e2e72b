package org.clif.parsing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.clif.support.Ontology;

public class ClifReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static Ontology read(final String text) {
        return ClifReader.parse(text, "test").orElseThrow();
    }

    @Test
    public void testClTextWithImportsAndComments() {
        final Ontology ontology = read("(cl-text http://example.org/onto\n"
                + "  (cl-imports http://example.org/other.clif)\n"
                + "  (cl-comment 'regola di base')\n"
                + "  (forall (x) (if (A x) (B x)))\n"
                + ")");

        Assert.assertEquals("http://example.org/onto", ontology.getName());
        Assert.assertEquals(1, ontology.getAxioms().size());
        Assert.assertEquals("∀(x)[(~A(x) | B(x))]", ontology.getAxioms().get(0).toString());
        Assert.assertEquals("http://example.org/other.clif", ontology.getImports().get(0));
        Assert.assertTrue(ontology.getDiagnostics().isEmpty());
    }

    @Test
    public void testBareStatementsKeepOrder() {
        final Ontology ontology = read("/* intestazione\n su due righe */\n"
                + "(P a)\n(exists (x y) (R x y))\n(not (Q b))");

        Assert.assertEquals("test", ontology.getName());
        Assert.assertEquals(3, ontology.getAxioms().size());
        Assert.assertEquals("P(a)", ontology.getAxioms().get(0).toString());
        Assert.assertEquals("∃(x,y)[R(x,y)]", ontology.getAxioms().get(1).toString());
        Assert.assertEquals("~Q(b)", ontology.getAxioms().get(2).toString());
    }

    @Test
    public void testBiconditionalDesugaring() {
        final Ontology ontology = read("(iff (A x) (B x))");
        Assert.assertEquals("((~A(x) | B(x)) & (~B(x) | A(x)))", ontology.getAxioms().get(0).toString());
    }

    @Test
    public void testNestedFunctionArguments() {
        final Ontology ontology = read("(and (R x (f (g y))) (= x y))");
        Assert.assertEquals("(R(x,f(g(y))) & =(x,y))", ontology.getAxioms().get(0).toString());
    }

    @Test
    public void testKeywordPriority() {
        final Ontology ontology = read("(forall (x) (forallx x))");
        Assert.assertEquals("∀(x)[forallx(x)]", ontology.getAxioms().get(0).toString());
    }

    @Test
    public void testKeywordCannotBeAName() {
        try {
            read("(forall (x) (forall x))");
            Assert.fail("atteso errore di sintassi");
        } catch (final GrammarException e) {
            Assert.assertEquals(1, e.getLine());
        }
    }

    @Test
    public void testBlankInputProducesNothing() {
        Assert.assertEquals(Optional.empty(), ClifReader.parse(""));
        Assert.assertEquals(Optional.empty(), ClifReader.parse("  \n\t "));
        Assert.assertEquals(Optional.empty(), ClifReader.parse(null));
    }

    @Test
    public void testUnterminatedAxiom() {
        try {
            read("(forall (x) (and (A x) (B x))");
            Assert.fail("atteso errore di sintassi");
        } catch (final GrammarException e) {
            Assert.assertEquals(1, e.getLine());
            Assert.assertEquals("<EOF>", e.getOffendingToken());
            Assert.assertTrue(e.getMessage(), e.getMessage().startsWith("Errore alla riga 1!"));
        }
    }

    @Test
    public void testBrokenAxiomIsReconstructed() {
        try {
            read("(P a)\n(and (B x) ())\n(Q b)");
            Assert.fail("atteso errore di sintassi");
        } catch (final GrammarException e) {
            Assert.assertEquals(2, e.getLine());
            Assert.assertEquals(")", e.getOffendingToken());
            Assert.assertEquals("(and (B x) (" + BrokenAxiomLocator.underline(")") + ")", e.getContext());
        }
    }

    @Test
    public void testDuplicateQuantifiedVariable() {
        try {
            read("(P a)\n(forall (x x) (P x))");
            Assert.fail("attesa variabile duplicata");
        } catch (final GrammarException e) {
            Assert.assertEquals(2, e.getLine());
            Assert.assertEquals("x", e.getOffendingToken());
        }
    }

    @Test
    public void testReaderRecoversAfterError() {
        try {
            read("(P a");
            Assert.fail("atteso errore di sintassi");
        } catch (final GrammarException e) {
            // atteso
        }
        Assert.assertEquals(1, read("(P a)").getAxioms().size());
    }

    @Test
    public void testUnknownCharactersAreSkipped() {
        final Ontology ontology = read("(P a)\n(Q b#)\n(R c) $");

        Assert.assertEquals(3, ontology.getAxioms().size());
        Assert.assertEquals("Q(b)", ontology.getAxioms().get(1).toString());
        Assert.assertEquals(2, ontology.getDiagnostics().size());

        final LexicalDiagnostic first = ontology.getDiagnostics().get(0);
        Assert.assertEquals(2, first.line());
        Assert.assertEquals(5, first.column());
        Assert.assertEquals("#", first.symbol());
        Assert.assertEquals("$", ontology.getDiagnostics().get(1).symbol());
    }

    @Test
    public void testParseFileUsesBaseName() throws IOException {
        final Path file = folder.newFile("mereologia.clif").toPath();
        Files.writeString(file, "(forall (x) (P x x))", StandardCharsets.UTF_8);

        final Ontology ontology = ClifReader.parseFile(file).orElseThrow();
        Assert.assertEquals("mereologia", ontology.getName());
        Assert.assertEquals(1, ontology.getAxioms().size());
    }
}
