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

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the argument grids written in query catalogues. Two forms are accepted:
 * <ul>
 *     <li>{@code arange(start,stop)} or {@code arange(start,stop,step)}: start, start + step, ... up to but
 *     excluding stop</li>
 *     <li>a comma separated list of integers, e.g. {@code 181,185}</li>
 * </ul>
 */
public class ArgumentSets {
    private static final Pattern ARANGE = Pattern.compile("arange\\(([^)]*)\\)");

    private ArgumentSets() {}

    public static int[] parse(String spec) {
        if (StringUtils.isBlank(spec)) {
            throw new IllegalArgumentException("empty argument list");
        }
        String trimmed = StringUtils.deleteWhitespace(spec);
        Matcher matcher = ARANGE.matcher(trimmed);
        if (matcher.matches()) {
            int[] params = parseInts(matcher.group(1), spec);
            if (params.length < 2 || params.length > 3) {
                throw new IllegalArgumentException("arange takes (start, stop[, step]): " + spec);
            }
            return arange(params[0], params[1], params.length == 3 ? params[2] : 1);
        }
        return parseInts(trimmed, spec);
    }

    public static int[][] parseAll(Iterable<String> specs) {
        int[][] ret = new int[0][];
        for (String spec : specs) {
            ret = Arrays.copyOf(ret, ret.length + 1);
            ret[ret.length - 1] = parse(spec);
        }
        return ret;
    }

    public static int[] arange(int start, int stop, int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("arange step must be positive, got " + step);
        }
        if (stop <= start) {
            throw new IllegalArgumentException(String.format("empty range arange(%d,%d,%d)", start, stop, step));
        }
        int[] ret = new int[(int) (((long) stop - start + step - 1) / step)];
        for (int i = 0; i < ret.length; ++i) {
            ret[i] = start + i * step;
        }
        return ret;
    }

    private static int[] parseInts(String csv, String spec) {
        String[] tokens = StringUtils.split(csv, ',');
        if (tokens.length == 0) {
            throw new IllegalArgumentException("empty argument list: " + spec);
        }
        int[] ret = new int[tokens.length];
        for (int i = 0; i < tokens.length; ++i) {
            try {
                ret[i] = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not an integer '" + tokens[i] + "' in " + spec, e);
            }
        }
        return ret;
    }
}
