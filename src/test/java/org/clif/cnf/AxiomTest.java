package org.clif.cnf;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Quantifier;
import org.clif.parsing.ClifReader;
import org.clif.support.ConversionContext;

public class AxiomTest {

    private static Axiom axiom(final String clif) {
        return ClifReader.parse(clif).orElseThrow().getAxioms().get(0);
    }

    @Test
    public void testDistributionScenario() {
        final Axiom result = axiom("(forall (x y z) (or (A x) (and (B y) (C z))))").ffPcnf();
        Assert.assertEquals("∀(z,y,x)[((A(z) | B(y)) & (A(z) | C(x)))]", result.toString());
    }

    @Test
    public void testAlreadyNormalScenario() {
        final Axiom result = axiom("(forall (x y z) (and (or (A x) (B y)) (C z)))").ffPcnf();
        Assert.assertEquals("∀(z,y,x)[(C(x) & (A(z) | B(y)))]", result.toString());
    }

    @Test
    public void testNestedFunctionScenario() {
        final Axiom result = axiom("(forall (x y z) (or (A x) (and (B y) (C z (F z)))))").ffPcnf();
        Assert.assertEquals("∀(z,y,x,w,v)[((A(z) | ~C(w,v) | F(w,v)) & (A(z) | B(y)))]", result.toString());
        Assert.assertTrue(result.isFfPcnf());
    }

    @Test
    public void testIdsAdvanceAtEveryStage() {
        final Axiom original = axiom("(forall (x) (P x))");
        Assert.assertEquals(1, original.getId());
        Assert.assertEquals(6, original.ffPcnf().getId());
        Assert.assertEquals(7, original.pushNegation().getId());
    }

    @Test
    public void testStagesDoNotTouchInput() {
        final Axiom original = axiom("(not (forall (x) (and (P (f x)) (Q x))))");
        final String before = original.toString();
        original.ffPcnf();
        Assert.assertEquals(before, original.toString());
    }

    @Test
    public void testSubstituteSeveralFunctionArguments() {
        final Axiom result = axiom("(forall (x y z) (A (f x) (t y) (p z)))").substituteFunctions();
        Assert.assertEquals(
                "∀(x,y,z)[∀(f1,t2,p3)[(~A(f1,t2,p3) | (f(x,f1) & t(y,t2) & p(z,p3)))]]",
                result.toString());
    }

    @Test
    public void testSubstituteNestedFunctions() {
        final Axiom result = axiom("(C (f (g (h x))))").substituteFunctions();
        Assert.assertEquals("∀(f1,g2,h3)[(~C(f1) | (h(x,h3) & g(h3,g2) & f(g2,f1)))]", result.toString());
    }

    @Test
    public void testFreshNamesAreNeverReused() {
        final ConversionContext context = new ConversionContext();
        final Logical sentence = axiom("(P (f x))").getSentence();

        final Axiom first = new Axiom(sentence, context).substituteFunctions();
        final Axiom second = new Axiom(sentence, context).substituteFunctions();
        Assert.assertEquals("∀(f1)[(~P(f1) | f(x,f1))]", first.toString());
        Assert.assertEquals("∀(f2)[(~P(f2) | f(x,f2))]", second.toString());
    }

    @Test
    public void testFreshNameSkipsExistingConstant() {
        final Axiom result = axiom("(P f1 (f x))").substituteFunctions();
        Assert.assertEquals("∀(f2)[(~P(f1,f2) | f(x,f2))]", result.toString());
        Assert.assertTrue(result.analyze().constants().contains("f1"));
    }

    @Test
    public void testFreshNameSkipsBoundVariable() {
        final Axiom result = axiom("(forall (f1) (P f1 (f f1)))").substituteFunctions();
        Assert.assertEquals("∀(f1)[∀(f1,f2)[(~P(f1,f2) | f(f1,f2))]]", result.toString());
    }

    @Test
    public void testConstantSurvivesPipelineWhenNameCollides() {
        final Axiom result = axiom("(P f1 (f x))").ffPcnf();
        Assert.assertEquals(List.of("f1", "x"), result.analyze().constants());
        Assert.assertTrue(result.isFfPcnf());
    }

    @Test
    public void testStandardizeUsesReverseAlphabet() {
        final Axiom result = axiom("(forall (a) (exists (b) (R a b c)))").standardizeVariables();
        Assert.assertEquals("∀(z)[∃(y)[R(z,y,c)]]", result.toString());
    }

    @Test
    public void testStandardizeSkipsConstants() {
        final Axiom result = axiom("(and (P z) (forall (x) (Q x z)))").standardizeVariables();
        Assert.assertEquals("(P(z) & ∀(y)[Q(y,z)])", result.toString());
    }

    @Test
    public void testStandardizeRespectsShadowing() {
        final Axiom result = axiom("(forall (x) (and (P x) (forall (x) (Q x))))").standardizeVariables();
        Assert.assertEquals("∀(z)[(P(z) & ∀(y)[Q(y)])]", result.toString());
    }

    @Test
    public void testStandardizeProducesDistinctNames() {
        final Axiom result = axiom("(and (forall (x y) (P x y)) (exists (x) (Q x)) (forall (y) (R y)))")
                .standardizeVariables().standardizeVariables();
        final List<String> bound = boundNames(result.getSentence());
        Assert.assertEquals(new HashSet<>(bound).size(), bound.size());
    }

    @Test
    public void testPushNegationDualizesQuantifiers() {
        final Axiom result = axiom("(not (forall (x) (and (P x) (not (Q x)))))").pushNegation();
        Assert.assertEquals("∃(x)[(~P(x) | Q(x))]", result.toString());
    }

    @Test
    public void testPushNegationLeavesNegatedAtomsOnly() {
        final Axiom result = axiom("(not (or (exists (x) (not (not (P x)))) (iff (A y) (B y))))").pushNegation();
        assertNegationsOnAtoms(result.getSentence());
    }

    @Test
    public void testPrenexMovesQuantifiersOutward() {
        final Axiom result = axiom("(and (P a) (forall (x) (exists (y) (R x y))))")
                .standardizeVariables().createPrenex();
        Assert.assertEquals("∀(z)[∃(y)[(R(z,y) & P(a))]]", result.toString());
    }

    @Test
    public void testPrenexKeepsLeftToRightQuantifierOrder() {
        final Axiom result = axiom("(and (or (P a) (forall (x) (Q x))) (exists (y) (R y)))")
                .standardizeVariables().createPrenex();
        Assert.assertEquals("∀(z)[∃(y)[(R(y) & (Q(z) | P(a)))]]", result.toString());
    }

    @Test
    public void testFfPcnfClosure() {
        final String[] sources = {
                "(if (forall (x) (P (f x))) (exists (y) (Q y (g (h y)))))",
                "(iff (A x) (forall (y) (or (B y) (not (C (k y))))))",
                "(not (and (exists (x) (P x)) (forall (y) (if (Q y) (R y (s y))))))",
                "(forall (x) (= x x))" };

        for (final String source : sources) {
            final Axiom result = axiom(source).ffPcnf();
            Assert.assertTrue(source + " -> " + result, result.isFfPcnf());
        }
    }

    @Test
    public void testAnalyze() {
        final AxiomAnalysis analysis = axiom("(forall (x) (or (P x) (not (R x c)) (T x x x)))").analyze();
        Assert.assertEquals(List.of("x"), analysis.universalVariables());
        Assert.assertTrue(analysis.existentialQuantifiers().isEmpty());
        Assert.assertEquals("P(x)", analysis.unaryPredicates().get(0).toString());
        Assert.assertEquals("R(x,c)", analysis.binaryPredicates().get(0).toString());
        Assert.assertEquals(1, analysis.naryPredicates().size());
        Assert.assertEquals("R(x,c)", analysis.negatedPredicates().get(0).toString());
        Assert.assertEquals(2, analysis.positivePredicates().size());
        Assert.assertEquals(List.of("c"), analysis.constants());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullSentenceRejected() {
        new Axiom(null, new ConversionContext());
    }

    private static List<String> boundNames(final Logical node) {
        final List<String> names = new ArrayList<>();
        if (node instanceof Quantifier quantifier) {
            names.addAll(quantifier.variables());
        }
        for (final Logical child : node.terms()) {
            names.addAll(boundNames(child));
        }
        return names;
    }

    private static void assertNegationsOnAtoms(final Logical node) {
        if (node instanceof Negation negation) {
            Assert.assertEquals(Logical.Type.PREDICATE, negation.term().type());
        }
        for (final Logical child : node.terms()) {
            assertNegationsOnAtoms(child);
        }
    }
}
