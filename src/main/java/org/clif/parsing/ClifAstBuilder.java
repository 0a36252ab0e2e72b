package org.clif.parsing;

import org.antlr.v4.runtime.tree.TerminalNode;
import org.clif.antlr.ClifBaseVisitor;
import org.clif.antlr.ClifParser;
import org.clif.logical.Conjunction;
import org.clif.logical.Disjunction;
import org.clif.logical.Existential;
import org.clif.logical.Function;
import org.clif.logical.Logical;
import org.clif.logical.Negation;
import org.clif.logical.Predicate;
import org.clif.logical.Term;
import org.clif.logical.Universal;
import org.clif.logical.Variable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * COSTRUTTORE DELL'ALBERO LOGICO - Visitor dall'albero sintattico ANTLR ai nodi {@link Logical}
 *
 * Ogni regola della grammatica diventa il nodo corrispondente, costruito dalle foglie
 * verso la radice. Condizionali e bicondizionali vengono eliminati qui:
 *
 *   (if A B)   ->  (~A | B)
 *   (iff A B)  ->  ((~A | B) & (~B | A))
 *
 * Gli argomenti di predicati e funzioni diventano {@link Variable} o {@link Function}.
 */
public class ClifAstBuilder extends ClifBaseVisitor<Logical> {

    @Override
    public Logical visitAxiom(ClifParser.AxiomContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Logical visitNegation(ClifParser.NegationContext ctx) {
        return new Negation(visit(ctx.axiom()));
    }

    @Override
    public Logical visitConjunction(ClifParser.ConjunctionContext ctx) {
        return new Conjunction(visitAll(ctx.axiom()));
    }

    @Override
    public Logical visitDisjunction(ClifParser.DisjunctionContext ctx) {
        return new Disjunction(visitAll(ctx.axiom()));
    }

    /**
     * (if A B) -> (~A | B)
     */
    @Override
    public Logical visitConditional(ClifParser.ConditionalContext ctx) {
        Logical antecedent = visit(ctx.axiom(0));
        Logical consequent = visit(ctx.axiom(1));
        return new Disjunction(List.of(new Negation(antecedent), consequent));
    }

    /**
     * (iff A B) -> ((~A | B) & (~B | A)), con copie distinte dei due operandi.
     */
    @Override
    public Logical visitBiconditional(ClifParser.BiconditionalContext ctx) {
        Logical left = visit(ctx.axiom(0));
        Logical right = visit(ctx.axiom(1));

        Logical leftToRight = new Disjunction(List.of(new Negation(left), right));
        Logical rightToLeft = new Disjunction(List.of(new Negation(right.copy()), left.copy()));

        return new Conjunction(List.of(leftToRight, rightToLeft));
    }

    @Override
    public Logical visitUniversal(ClifParser.UniversalContext ctx) {
        return new Universal(variables(ctx.variableList()), visit(ctx.axiom()));
    }

    @Override
    public Logical visitExistential(ClifParser.ExistentialContext ctx) {
        return new Existential(variables(ctx.variableList()), visit(ctx.axiom()));
    }

    @Override
    public Logical visitPredicate(ClifParser.PredicateContext ctx) {
        return new Predicate(ctx.NONLOGICAL().getText(), parameters(ctx.parameter()));
    }

    @Override
    public Logical visitFunction(ClifParser.FunctionContext ctx) {
        return function(ctx);
    }

    //region SUPPORTO

    private List<Logical> visitAll(List<ClifParser.AxiomContext> axioms) {
        List<Logical> operands = new ArrayList<>();
        for (ClifParser.AxiomContext axiom : axioms) {
            operands.add(visit(axiom));
        }
        return operands;
    }

    /**
     * @throws GrammarException se la lista dichiara due volte la stessa variabile
     */
    private List<String> variables(ClifParser.VariableListContext ctx) {
        List<String> names = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (TerminalNode node : ctx.NONLOGICAL()) {
            String name = node.getText();
            if (!seen.add(name)) {
                throw new GrammarException(node.getSymbol().getLine(), name,
                        "variabile quantificata duplicata in (" + ctx.getText() + ")");
            }
            names.add(name);
        }
        return names;
    }

    private List<Term> parameters(List<ClifParser.ParameterContext> parameters) {
        List<Term> terms = new ArrayList<>();
        for (ClifParser.ParameterContext parameter : parameters) {
            if (parameter.function() != null) {
                terms.add(function(parameter.function()));
            } else {
                terms.add(new Variable(parameter.NONLOGICAL().getText()));
            }
        }
        return terms;
    }

    private Function function(ClifParser.FunctionContext ctx) {
        return new Function(ctx.NONLOGICAL().getText(), parameters(ctx.parameter()));
    }

    //endregion
}
