/*
 * TeX-Table-Lint - LaTeX document tree normalization and table linting
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.tex.tablelint.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CanonicalTreesTest {

    @Test
    void rendersArgumentsBeforeChildren() {
        CanonicalNode env =
                new CanonicalNode.Environment(
                        "table",
                        List.of(Optional.of(new CanonicalNode.Chars("H"))),
                        CanonicalNode.slots(new CanonicalNode.Comment(" note")));

        assertEquals(
                "env:table\n--H\n--% note\n",
                CanonicalTrees.toIndentedTreeString(CanonicalNode.slots(env)));
    }

    @Test
    void rendersAbsentArguments() {
        CanonicalNode caption =
                new CanonicalNode.Macro(
                        "caption",
                        Arrays.asList(Optional.empty(), Optional.of(new CanonicalNode.Chars("x"))));

        assertEquals(
                "\\caption\n--<absent>\n--x\n",
                CanonicalTrees.toIndentedTreeString(CanonicalNode.slots(caption)));
    }

    @Test
    void labelsEveryVariant() {
        assertEquals("(<, >)", CanonicalTrees.label(group("<", ">")));
        assertEquals("specials:&", CanonicalTrees.label(new CanonicalNode.Specials("&", null)));
        assertEquals("math", CanonicalTrees.label(new CanonicalNode.Math(List.of())));
        assertEquals("unknown:Foo", CanonicalTrees.label(new CanonicalNode.Unknown("Foo")));
    }

    @Test
    void leavesHaveNoArgumentsOrChildren() {
        CanonicalNode chars = new CanonicalNode.Chars("x");

        assertTrue(CanonicalTrees.argsOf(chars).isEmpty());
        assertTrue(CanonicalTrees.childrenOf(chars).isEmpty());
    }

    @Test
    void rendersDeepTreesWithoutRecursion() {
        CanonicalNode node = new CanonicalNode.Chars("leaf");
        for (int i = 0; i < 3_000; i++) {
            node = new CanonicalNode.Math(CanonicalNode.slots(node));
        }

        String tree = CanonicalTrees.toIndentedTreeString(CanonicalNode.slots(node));

        assertTrue(tree.endsWith("--".repeat(3_000) + "leaf\n"));
    }

    @Test
    void nullArgumentSlotsBecomeAbsent() {
        CanonicalNode macro = new CanonicalNode.Macro("x", Arrays.asList(null, null));

        assertEquals(List.of(Optional.empty(), Optional.empty()), CanonicalTrees.argsOf(macro));
    }

    @Test
    void nullChildSlotsBecomeAbsent() {
        CanonicalNode math =
                new CanonicalNode.Math(
                        Arrays.asList(Optional.of(new CanonicalNode.Chars("a")), null));

        assertEquals(
                List.of(Optional.of(new CanonicalNode.Chars("a")), Optional.empty()),
                CanonicalTrees.childrenOf(math));
    }

    @Test
    void rendersAbsentChildrenAndRoots() {
        CanonicalNode math =
                new CanonicalNode.Math(
                        Arrays.asList(Optional.empty(), Optional.of(new CanonicalNode.Chars("y"))));

        assertEquals(
                "math\n--<absent>\n--y\n<absent>\n",
                CanonicalTrees.toIndentedTreeString(
                        Arrays.asList(Optional.of(math), Optional.empty())));
    }

    @Test
    void slotListsCannotBeModified() {
        CanonicalNode.Math math =
                new CanonicalNode.Math(CanonicalNode.slots(new CanonicalNode.Chars("a")));

        assertThrows(
                UnsupportedOperationException.class, () -> math.children().add(Optional.empty()));
    }

    @Test
    void delimitersRequireExactlyTwoEntries() {
        assertEquals(group("a", "b").delimiters(), Delimiters.fromList(List.of("a", "b")));
        assertThrows(IllegalArgumentException.class, () -> Delimiters.fromList(List.of("a")));
    }

    private static CanonicalNode.Group group(String open, String close) {
        return new CanonicalNode.Group(Delimiters.of(open, close), List.of());
    }
}
