package io.github.hongjungwan.responsemask.core.benchmark;

import io.github.hongjungwan.responsemask.api.ResponseMasker;
import io.github.hongjungwan.responsemask.api.ResponseMaskerFactory;
import io.github.hongjungwan.responsemask.api.config.MaskConfig;
import io.github.hongjungwan.responsemask.fixture.Category;
import io.github.hongjungwan.responsemask.fixture.Note;
import io.github.hongjungwan.responsemask.fixture.PartnerEndpoint;
import io.github.hongjungwan.responsemask.fixture.TestData;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmark for response masking
 *
 * Run with: main() from the test classpath
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class ResponseMaskerBenchmark {

    private ResponseMasker masker;
    private PartnerEndpoint endpoint;
    private Category smallTree;
    private Category wideTree;
    private List<Note> notes;

    @Setup(Level.Trial)
    public void setup() {
        masker = ResponseMaskerFactory.create(MaskConfig.defaultConfig());
        endpoint = new PartnerEndpoint();
        smallTree = TestData.categoryTree();
        notes = TestData.notes();

        // 100 x 10 category tree
        wideTree = new Category("root");
        for (int i = 0; i < 100; i++) {
            Category branch = new Category("branch-" + i);
            for (int j = 0; j < 10; j++) {
                branch.addChild(new Category("leaf-" + i + "-" + j));
            }
            wideTree.addChild(branch);
        }
    }

    @Benchmark
    public void maskSmallTree(Blackhole bh) {
        bh.consume(masker.mask(smallTree, "public"));
    }

    @Benchmark
    public void maskWideTree(Blackhole bh) {
        bh.consume(masker.mask(wideTree, "public"));
    }

    @Benchmark
    public void maskNotesForEndpoint(Blackhole bh) {
        bh.consume(masker.mask(notes, endpoint, "summary"));
    }

    @Benchmark
    public void maskWithoutMatchingRules(Blackhole bh) {
        bh.consume(masker.mask(new ArrayList<>(notes), "none"));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(ResponseMaskerBenchmark.class.getSimpleName())
                .warmupIterations(3)
                .measurementIterations(5)
                .forks(1)
                .build();

        new Runner(opt).run();
    }
}
