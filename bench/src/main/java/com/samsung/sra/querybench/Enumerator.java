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

/**
 * Maps a flat iteration counter onto a tuple of per-dimension offsets, and back. Stateless replacement for an
 * arbitrarily deep nest of for-loops, similar to numpy's unravel_index.
 *
 * idx[0] cycles the fastest, idx[D-1] the slowest. For dims = (5, 4, 3) there are 60 elements and index n maps to
 * (n % 5, (n / 5) % 4, (n / 20) % 3).
 */
public class Enumerator {
    private Enumerator() {}

    /** Caller must ensure 0 <= index < size(dims) */
    public static int[] unravel(long index, int[] dims) {
        int[] idx = new int[dims.length];
        long stride = 1;
        for (int k = 0; k < dims.length; ++k) {
            idx[k] = (int) ((index / stride) % dims[k]);
            stride *= dims[k];
        }
        return idx;
    }

    /** Inverse of {@link #unravel} */
    public static long ravel(int[] idx, int[] dims) {
        if (idx.length != dims.length) {
            throw new IllegalArgumentException("expected " + dims.length + " offsets, got " + idx.length);
        }
        long index = 0, stride = 1;
        for (int k = 0; k < dims.length; ++k) {
            index += idx[k] * stride;
            stride *= dims[k];
        }
        return index;
    }

    /** Number of elements in the product space. Raises IllegalArgumentException if it does not fit in a long */
    public static long size(int[] dims) {
        long size = 1;
        for (int dim : dims) {
            if (dim < 0) {
                throw new IllegalArgumentException("negative cardinality " + dim);
            }
            try {
                size = Math.multiplyExact(size, dim);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("iteration space overflows a long", e);
            }
        }
        return size;
    }
}
