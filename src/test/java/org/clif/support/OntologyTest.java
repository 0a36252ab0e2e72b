package org.clif.support;

import org.junit.Assert;
import org.junit.Test;

import org.clif.cnf.Axiom;
import org.clif.parsing.ClifReader;

public class OntologyTest {

    private static final String SOURCE = "(cl-text http://example.org/parti\n"
            + "(cl-imports http://example.org/base)\n"
            + "(forall (x) (P x x))\n"
            + "(forall (x y) (if (and (P x y) (P y x)) (= x y)))\n"
            + ")";

    @Test
    public void testFfPcnfKeepsNameAndImports() {
        final Ontology ontology = ClifReader.parse(SOURCE).orElseThrow();
        final Ontology converted = ontology.toFfPcnf();

        Assert.assertEquals(ontology.getName(), converted.getName());
        Assert.assertEquals(ontology.getImports(), converted.getImports());
        Assert.assertEquals(2, converted.getAxioms().size());
        for (final Axiom axiom : converted.getAxioms()) {
            Assert.assertTrue(axiom.toString(), axiom.isFfPcnf());
        }
    }

    @Test
    public void testIdsFollowSharedContext() {
        final Ontology converted = ClifReader.parse(SOURCE).orElseThrow().toFfPcnf();
        final String[] lines = converted.toTptp().split("\n");

        Assert.assertEquals(2, lines.length);
        Assert.assertTrue(lines[0], lines[0].startsWith("fof(axiom70, axiom, "));
        Assert.assertTrue(lines[1], lines[1].startsWith("fof(axiom120, axiom, "));
    }

    @Test
    public void testLadrOneLinePerAxiom() {
        final Ontology ontology = ClifReader.parse(SOURCE).orElseThrow();
        final String[] lines = ontology.toLadr().split("\n");

        Assert.assertEquals(2, lines.length);
        Assert.assertEquals("(all x P(x,x)).", lines[0]);
    }

    @Test
    public void testIndependentContexts() {
        final Ontology first = ClifReader.parse(SOURCE).orElseThrow();
        final Ontology second = ClifReader.parse(SOURCE).orElseThrow();
        Assert.assertEquals(first.toFfPcnf().toTptp(), second.toFfPcnf().toTptp());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankNameRejected() {
        new Ontology(" ");
    }
}
