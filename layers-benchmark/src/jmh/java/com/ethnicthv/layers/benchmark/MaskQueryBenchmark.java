package com.ethnicthv.layers.benchmark;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.Mask;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.BitSet;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks comparing layer membership checks:
 * - Mask.contains(int) / contains().any(..) vs hand-written int bit tests.
 * - Mask.contains(Mask) vs BitSet subset check.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms512M", "-Xmx512M"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class MaskQueryBenchmark {

    @State(Scope.Thread)
    public static class QueryState {
        @Param({"3", "16"})
        public int layerCount;

        public Mask mask;
        public Mask query;
        public int rawMask;
        public int rawQuery;
        public BitSet bitSet;
        public BitSet querySet;
        public int[] probes;

        @Setup(Level.Trial)
        public void setup() {
            SplittableRandom random = new SplittableRandom(42);
            Mask.Builder builder = Mask.builder();
            bitSet = new BitSet(Layer.COUNT);
            for (int i = 0; i < layerCount; i++) {
                int layer = random.nextInt(Layer.COUNT);
                builder.with(layer);
                bitSet.set(layer);
            }
            mask = builder.build();
            rawMask = mask.bits();

            int[] queryLayers = mask.layerIndices();
            query = Mask.of(queryLayers[0], queryLayers[queryLayers.length - 1]);
            rawQuery = query.bits();
            querySet = BitSet.valueOf(new long[]{query.unsignedBits()});

            probes = new int[64];
            for (int i = 0; i < probes.length; i++) {
                probes[i] = random.nextInt(Layer.COUNT);
            }
        }
    }

    @Benchmark
    public void maskContainsLayer(QueryState s, Blackhole bh) {
        for (int probe : s.probes) {
            bh.consume(s.mask.contains(probe));
        }
    }

    @Benchmark
    public void rawContainsLayer(QueryState s, Blackhole bh) {
        for (int probe : s.probes) {
            bh.consume((s.rawMask & (1 << probe)) != 0);
        }
    }

    @Benchmark
    public boolean maskContainsAnyLayer(QueryState s) {
        return s.mask.contains().any(s.probes);
    }

    @Benchmark
    public boolean maskContainsMask(QueryState s) {
        return s.mask.contains(s.query);
    }

    @Benchmark
    public boolean rawContainsMask(QueryState s) {
        return (s.rawMask & s.rawQuery) == s.rawQuery;
    }

    @Benchmark
    public boolean bitSetContainsMask(QueryState s) {
        BitSet diff = (BitSet) s.querySet.clone();
        diff.andNot(s.bitSet);
        return diff.isEmpty();
    }

    @Benchmark
    public Mask maskUnionMinus(QueryState s) {
        return s.mask.or(s.query).minus(Layer.UI);
    }
}
