package org.clif.cnf;

import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

public class ReverseAlphabetNamesTest {

    @Test
    public void testSequenceWrapsWithSuffix() {
        final ReverseAlphabetNames names = new ReverseAlphabetNames(Set.of());
        Assert.assertEquals("z", names.next());
        Assert.assertEquals("y", names.next());
        for (int i = 2; i < 25; i++) {
            names.next();
        }
        Assert.assertEquals("a", names.next());
        Assert.assertEquals("z1", names.next());
        Assert.assertEquals("y1", names.next());
    }

    @Test
    public void testReservedNamesAreSkipped() {
        final ReverseAlphabetNames names = new ReverseAlphabetNames(Set.of("z", "x"));
        Assert.assertEquals("y", names.next());
        Assert.assertEquals("w", names.next());
    }
}
