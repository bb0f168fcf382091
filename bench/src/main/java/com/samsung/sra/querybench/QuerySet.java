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
package com.samsung.sra.querybench;

import java.util.Arrays;
import java.util.Locale;

/**
 * A family of structurally identical queries: a template with one %d slot per dimension, and for each dimension the
 * list of values to substitute. The family is the Cartesian product of those lists; the Nth member can be rendered
 * without materializing the others (see {@link Enumerator}).
 *
 * Optional setup/teardown statements are run once before/after the whole family, e.g. to Store a bitmap that all
 * queries Load and to Purge it afterwards.
 *
 * Immutable.
 */
public class QuerySet {
    private final String name;
    private final String template;
    private final int[][] argSets;
    private final String setup, teardown;

    private final int[] lengths;
    private final long iterations;

    public QuerySet(String name, String template, int[][] argSets) {
        this(name, template, null, null, argSets);
    }

    /**
     * @param setup    statement run once before any query, or null
     * @param teardown statement run once after the last query, or null
     */
    public QuerySet(String name, String template, String setup, String teardown, int[][] argSets) {
        if (name == null || template == null || argSets == null) {
            throw new IllegalArgumentException("name, template and argument sets are required");
        }
        int slots = countSlots(template);
        if (slots != argSets.length) {
            throw new IllegalArgumentException(String.format(
                    "query set %s: template has %d slots but %d argument sets were given", name, slots, argSets.length));
        }
        this.name = name;
        this.template = template;
        this.setup = setup == null || setup.isEmpty() ? null : setup;
        this.teardown = teardown == null || teardown.isEmpty() ? null : teardown;
        this.argSets = new int[argSets.length][];
        this.lengths = new int[argSets.length];
        for (int k = 0; k < argSets.length; ++k) {
            this.argSets[k] = argSets[k].clone();
            this.lengths[k] = argSets[k].length;
        }
        this.iterations = Enumerator.size(lengths);
    }

    /** No-op set with no members. Stands in for an unknown query name */
    public static QuerySet empty(String name) {
        return new QuerySet(name, "%d", new int[][]{{}});
    }

    /** Number of %d slots; %% is a literal percent, any other conversion is rejected */
    private static int countSlots(String template) {
        int slots = 0;
        for (int i = 0; i < template.length(); ++i) {
            if (template.charAt(i) != '%') continue;
            char conversion = i + 1 < template.length() ? template.charAt(i + 1) : 0;
            if (conversion == 'd') {
                ++slots;
            } else if (conversion != '%') {
                throw new IllegalArgumentException("unsupported template conversion at offset " + i + ": " + template);
            }
            ++i;
        }
        return slots;
    }

    public String getName() {
        return name;
    }

    public String getTemplate() {
        return template;
    }

    public String getSetup() {
        return setup;
    }

    public String getTeardown() {
        return teardown;
    }

    public int getDimension() {
        return lengths.length;
    }

    public int[] getCardinalities() {
        return lengths.clone();
    }

    /** Total number of queries in the set */
    public long size() {
        return iterations;
    }

    /** Values substituted for member n, in dimension order */
    public int[] inputsAt(long n) {
        if (n < 0 || n >= iterations) {
            throw new IndexOutOfBoundsException("query " + n + " out of range [0, " + iterations + ")");
        }
        int[] idx = Enumerator.unravel(n, lengths);
        int[] inputs = new int[idx.length];
        for (int k = 0; k < idx.length; ++k) {
            inputs[k] = argSets[k][idx[k]];
        }
        return inputs;
    }

    /** Member n as raw query text, newline-terminated so that queries can be concatenated */
    public String queryAt(long n) {
        return render(inputsAt(n));
    }

    /** Member n together with its inputs */
    public QueryRecord recordAt(long n) {
        int[] inputs = inputsAt(n);
        return new QueryRecord(n, inputs, render(inputs));
    }

    private String render(int[] inputs) {
        Object[] args = new Object[inputs.length];
        for (int k = 0; k < inputs.length; ++k) {
            args[k] = inputs[k];
        }
        return String.format(Locale.ROOT, template, args) + "\n";
    }

    @Override
    public String toString() {
        return String.format("%s: %d queries over dimensions %s of form:\n%s",
                name, iterations, Arrays.toString(lengths), template);
    }
}
