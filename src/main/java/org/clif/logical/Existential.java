package org.clif.logical;

import java.util.List;

/**
 * Quantificatore esistenziale ∃(x,y)[A].
 *
 * @param variables variabili legate, distinte
 * @param term corpo quantificato
 */
public record Existential(List<String> variables, Logical term) implements Quantifier {

    public Existential {
        variables = Quantifier.checkVariables(variables);
        if (term == null) {
            throw new IllegalArgumentException("Corpo del quantificatore non può essere null");
        }
    }

    @Override
    public Type type() {
        return Type.EXISTENTIAL;
    }

    @Override
    public Existential with(List<String> variables, Logical term) {
        return new Existential(variables, term);
    }

    @Override
    public Universal dual(Logical term) {
        return new Universal(variables, term);
    }

    @Override
    public Existential copy() {
        return new Existential(variables, term.copy());
    }

    @Override
    public String toString() {
        return "∃(" + String.join(",", variables) + ")[" + term + "]";
    }
}
