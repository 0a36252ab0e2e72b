package org.clif.logical;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class LogicalTest {

    @Test
    public void testCanonicalRendering() {
        final Logical sentence = new Universal(List.of("x", "y"), new Disjunction(List.of(
                new Negation(new Predicate("P", List.of(new Variable("x")))),
                new Predicate("R", List.of(new Variable("x"),
                        new Function("f", List.of(new Variable("y"))))))));
        Assert.assertEquals("∀(x,y)[(~P(x) | R(x,f(y)))]", sentence.toString());
    }

    @Test
    public void testCopyIsStructurallyEqualButDistinct() {
        final Conjunction original = new Conjunction(List.of(
                new Predicate("P", List.of(new Variable("x"))),
                new Existential(List.of("y"), new Predicate("Q", List.of(new Variable("y"))))));

        final Conjunction copy = original.copy();
        Assert.assertEquals(original, copy);
        Assert.assertNotSame(original.terms().get(1), copy.terms().get(1));
    }

    @Test
    public void testWithTermsReplacesChildren() {
        final Negation negation = new Negation(new Predicate("P", List.of(new Variable("x"))));
        final Negation replaced = negation.withTerms(List.of(new Predicate("Q", List.of(new Variable("x")))));
        Assert.assertEquals("~Q(x)", replaced.toString());
    }

    @Test
    public void testEquality() {
        final Predicate equality = new Predicate(Predicate.EQUALITY, List.of(new Variable("x"), new Variable("y")));
        Assert.assertTrue(equality.isEquality());
        Assert.assertFalse(new Predicate("=", List.of(new Variable("x"))).isEquality());
    }

    @Test
    public void testAtomsHaveNoFormulaChildren() {
        final Predicate atom = new Predicate("P", List.of(new Function("f", List.of(new Variable("x")))));
        Assert.assertTrue(atom.terms().isEmpty());
        Assert.assertTrue(atom.hasFunctions());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPredicateRequiresArguments() {
        new Predicate("P", List.of());
    }
}
