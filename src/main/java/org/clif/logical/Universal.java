package org.clif.logical;

import java.util.List;

/**
 * Quantificatore universale ∀(x,y)[A].
 *
 * @param variables variabili legate, distinte
 * @param term corpo quantificato
 */
public record Universal(List<String> variables, Logical term) implements Quantifier {

    public Universal {
        variables = Quantifier.checkVariables(variables);
        if (term == null) {
            throw new IllegalArgumentException("Corpo del quantificatore non può essere null");
        }
    }

    @Override
    public Type type() {
        return Type.UNIVERSAL;
    }

    @Override
    public Universal with(List<String> variables, Logical term) {
        return new Universal(variables, term);
    }

    @Override
    public Existential dual(Logical term) {
        return new Existential(variables, term);
    }

    @Override
    public Universal copy() {
        return new Universal(variables, term.copy());
    }

    @Override
    public String toString() {
        return "∀(" + String.join(",", variables) + ")[" + term + "]";
    }
}
