/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.codec;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Property-based tests of the dense/sparse vector conversions.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
class SparseVectorCodecPropertiesTest {

    @Property(tries = 200)
    @Label("Decoding an encoded vector gives it back")
    void decodeEncodeRoundTrip(@ForAll @Size(max = 50) List<@DoubleRange(min = -1e9, max = 1e9) Double> values) {
        double[] dense = values.stream().mapToDouble(Double::doubleValue).toArray();
        List<SparseEntry> sparse = SparseVectorCodec.encode(dense);
        assertThat(sparse).allMatch(entry -> Double.compare(entry.value(), 0.0) != 0);

        double[] decoded = SparseVectorCodec.decode(dense.length, 0.0, sparse);
        assertThat(decoded).hasSize(dense.length);
        for (int i = 0; i < dense.length; i++) {
            assertEquals(Double.doubleToRawLongBits(dense[i]), Double.doubleToRawLongBits(decoded[i]), "component " + i);
        }
    }

    @Property(tries = 50)
    @Label("Signed zeros are decoded with their sign")
    void signedZerosRoundTrip(@ForAll @Size(max = 20) List<@From("signedZeros") Double> values) {
        double[] dense = values.stream().mapToDouble(Double::doubleValue).toArray();
        double[] decoded = SparseVectorCodec.decode(dense.length, 0.0, SparseVectorCodec.encode(dense));
        for (int i = 0; i < dense.length; i++) {
            assertEquals(Double.doubleToRawLongBits(dense[i]), Double.doubleToRawLongBits(decoded[i]), "component " + i);
        }
    }

    @Provide
    Arbitrary<Double> signedZeros() {
        return Arbitraries.of(0.0, -0.0, 1.0);
    }

    @Property(tries = 200)
    @Label("Repeated indices are summed whatever their order")
    void duplicatesAreSummed(@ForAll @IntRange(min = 1, max = 10) int n,
                             @ForAll @Size(min = 1, max = 30) List<@IntRange(min = -1000, max = 1000) Integer> repeated,
                             @ForAll @DoubleRange(min = -10, max = 10) double defaultValue,
                             @ForAll Random random) {
        int idx = random.nextInt(n);
        List<SparseEntry> entries = new ArrayList<>();
        for (int value : repeated) {
            entries.add(new SparseEntry(idx, value));
        }
        List<SparseEntry> shuffled = new ArrayList<>(entries);
        Collections.shuffle(shuffled, random);

        double expected = repeated.stream().mapToInt(Integer::intValue).sum();
        double[] decoded = SparseVectorCodec.decode(n, defaultValue, entries);
        double[] decodedShuffled = SparseVectorCodec.decode(n, defaultValue, shuffled);
        assertThat(decoded[idx]).isEqualTo(expected);
        assertThat(decodedShuffled[idx]).isEqualTo(expected);
        for (int i = 0; i < n; i++) {
            if (i != idx) {
                assertThat(decoded[i]).isEqualTo(defaultValue);
            }
        }
    }
}
