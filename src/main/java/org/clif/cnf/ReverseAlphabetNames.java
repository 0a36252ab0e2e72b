package org.clif.cnf;

import java.util.Iterator;
import java.util.Set;

/**
 * Sequenza deterministica di nomi di variabile in ordine alfabetico inverso:
 * z, y, ..., a, poi z1, y1, ..., a1, z2, ...
 * I nomi riservati (costanti dell'assioma) vengono saltati.
 */
final class ReverseAlphabetNames implements Iterator<String> {

    private static final int ALPHABET = 26;

    private final Set<String> reserved;
    private int index = 0;

    ReverseAlphabetNames(Set<String> reserved) {
        this.reserved = reserved;
    }

    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public String next() {
        String candidate;
        do {
            candidate = candidate(index++);
        } while (reserved.contains(candidate));
        return candidate;
    }

    private static String candidate(int position) {
        char letter = (char) ('z' - position % ALPHABET);
        int round = position / ALPHABET;
        return round == 0 ? String.valueOf(letter) : letter + String.valueOf(round);
    }
}
