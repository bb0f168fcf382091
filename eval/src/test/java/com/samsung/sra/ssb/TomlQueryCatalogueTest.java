/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package com.samsung.sra.ssb;

import com.moandjiezana.toml.Toml;
import com.samsung.sra.querybench.QuerySet;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.endsWith;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TomlQueryCatalogueTest {
    private static final QueryCatalogue SSB = TomlQueryCatalogue.bundled();

    @Test
    public void bundledCatalogueHasEveryFamily() {
        Set<String> expected = new HashSet<>(Arrays.asList(
                "1.1", "1.2", "1.3", "1.1b", "1.2b", "1.3b", "1.1c", "1.2c", "1.3c",
                "2.1", "2.1r", "2.2", "2.3",
                "3.1", "3.1r", "3.2", "3.2r", "3.3", "3.4",
                "4.1", "4.1r", "4.1rb", "4.2", "4.2r", "4.3", "4.3r"));
        assertEquals(expected, SSB.getNames());
    }

    @Test
    public void sizes() {
        assertEquals(1, SSB.get("1.1").size());
        assertEquals(40 * 7, SSB.get("2.1").size());
        assertEquals(8 * 7, SSB.get("2.2").size());
        assertEquals(5 * 5 * 6, SSB.get("3.1").size());
        assertEquals(10 * 10 * 6, SSB.get("3.2").size());
        assertEquals(4, SSB.get("3.4").size());
        assertEquals(10 * 5 * 2, SSB.get("4.2").size());
        assertEquals(40 * 10 * 2, SSB.get("4.3").size());
    }

    @Test
    public void rendersFirstQuery() {
        QuerySet q21 = SSB.get("2.1");
        assertArrayEquals(new int[]{40, 1992}, q21.inputsAt(0));
        String first = q21.queryAt(0);
        assertThat(first, containsString("Bitmap(frame=\"p_brand1\", rowID=40)"));
        assertThat(first, containsString("Bitmap(frame=\"lo_year\", rowID=1992)"));
        assertThat(first, endsWith(")\n"));
        assertTrue(first.startsWith("Sum("));
    }

    @Test
    public void argumentOrderFollowsSlots() {
        // 4.3r fills the year before the city
        QuerySet q = SSB.get("4.3r");
        assertArrayEquals(new int[]{40, 2, 10}, q.getCardinalities());
        String last = q.queryAt(q.size() - 1);
        assertThat(last, containsString("Bitmap(frame=\"lo_year\", rowID=1998)"));
        assertThat(last, containsString("Bitmap(frame=\"s_city\", rowID=39)"));
    }

    @Test
    public void registerQueryHasSetupAndTeardown() {
        QuerySet q = SSB.get("4.1rb");
        assertThat(q.getSetup(), containsString("Store("));
        assertEquals("Purge(id=41)", q.getTeardown());
        assertThat(q.queryAt(0), containsString("Load(id=41)"));
        assertThat(SSB.get("4.1").getSetup(), nullValue());
    }

    @Test
    public void unknownNameRunsNothing() {
        QuerySet q = SSB.get("9.9");
        assertEquals("9.9", q.getName());
        assertEquals(0, q.size());
    }

    @Test
    public void customCatalogue() {
        QueryCatalogue catalogue = new TomlQueryCatalogue(new Toml().read(""
                + "[[query]]\n"
                + "name = \"pair\"\n"
                + "template = \"Count(Intersect(Bitmap(frame=a, rowID=%d), Bitmap(frame=b, rowID=%d)))\"\n"
                + "args = [\"1,2\", \"arange(0,3)\"]\n"));
        QuerySet q = catalogue.get("pair");
        assertEquals(6, q.size());
        assertEquals("Count(Intersect(Bitmap(frame=a, rowID=2), Bitmap(frame=b, rowID=0)))\n", q.queryAt(1));
    }

    @Test
    public void slotMismatchNamesTheQuery() {
        try {
            new TomlQueryCatalogue(new Toml().read(""
                    + "[[query]]\n"
                    + "name = \"broken\"\n"
                    + "template = \"Count(Bitmap(frame=a, rowID=%d))\"\n"
                    + "args = [\"1,2\", \"3\"]\n"));
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("broken"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateNames() {
        new TomlQueryCatalogue(new Toml().read(""
                + "[[query]]\nname = \"a\"\ntemplate = \"X(%d)\"\nargs = [\"1\"]\n"
                + "[[query]]\nname = \"a\"\ntemplate = \"Y(%d)\"\nargs = [\"1\"]\n"));
    }
}
