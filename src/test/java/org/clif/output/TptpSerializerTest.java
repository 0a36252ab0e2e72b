package org.clif.output;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import org.clif.cnf.Axiom;
import org.clif.logical.Function;
import org.clif.logical.Negation;
import org.clif.logical.Predicate;
import org.clif.logical.Universal;
import org.clif.logical.Variable;
import org.clif.parsing.ClifReader;
import org.clif.support.ConversionContext;

public class TptpSerializerTest {

    private static Axiom axiom(final String clif) {
        return ClifReader.parse(clif).orElseThrow().getAxioms().get(0);
    }

    @Test
    public void testNormalFormLine() {
        final Axiom result = axiom("(forall (x y z) (or (A x) (and (B y) (C z))))").ffPcnf();
        Assert.assertEquals("fof(axiom60, axiom, (! [Z,Y,X] : (((a(Z) | b(Y)) & (a(Z) | c(X)))))).",
                result.toTptp());
    }

    @Test
    public void testNegatedAtomIsParenthesized() {
        Assert.assertEquals("fof(axiom10, axiom, ~(p(a))).", axiom("(not (P a))").toTptp());
    }

    @Test
    public void testNegatedFormulaIsNotParenthesized() {
        Assert.assertEquals("fof(axiom10, axiom, ~(p(a) & q(b))).", axiom("(not (and (P a) (Q b)))").toTptp());
    }

    @Test
    public void testDoubleNegationCollapsed() {
        final Axiom axiom = new Axiom(new Universal(List.of("x"),
                new Negation(new Negation(new Predicate("P", List.of(new Variable("x")))))),
                new ConversionContext());
        Assert.assertEquals("fof(axiom10, axiom, (! [X] : (p(X)))).", axiom.toTptp());
    }

    @Test
    public void testEqualityAndConstants() {
        Assert.assertEquals("fof(axiom10, axiom, (? [X] : (X=socrate))).",
                axiom("(exists (x) (= x Socrate))").toTptp());
    }

    @Test
    public void testFunctionArguments() {
        Assert.assertEquals("fof(axiom10, axiom, (! [X] : (r(X,f(X,c))))).",
                axiom("(forall (x) (R x (F x c)))").toTptp());
    }

    @Test(expected = SerializationException.class)
    public void testFunctionInFormulaPositionRejected() {
        final Axiom axiom = new Axiom(new Negation(new Function("f", List.of(new Variable("x")))),
                new ConversionContext());
        axiom.toTptp();
    }

    @Test
    public void testConstantsDifferingOnlyInCaseRejected() {
        try {
            axiom("(R A a)").toTptp();
            Assert.fail("Attesa SerializationException");
        } catch (final SerializationException ex) {
            Assert.assertTrue(ex.getMessage().contains("'A'"));
        }
    }

    @Test
    public void testRepeatedConstantAccepted() {
        Assert.assertEquals("fof(axiom10, axiom, r(a,a)).", axiom("(R A A)").toTptp());
    }
}
