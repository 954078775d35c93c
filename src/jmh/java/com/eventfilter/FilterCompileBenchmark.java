package com.eventfilter;

import com.eventfilter.action.Action;
import com.eventfilter.action.ActionStep;
import com.eventfilter.action.MatchingMode;
import com.eventfilter.ast.Expr;
import com.eventfilter.filter.FilterCompiler;
import com.eventfilter.filter.FilterSpec;
import com.eventfilter.filter.PropertyOperator;
import com.eventfilter.filter.TeamContext;
import com.eventfilter.registry.InMemoryCohortStore;
import com.eventfilter.registry.InMemoryPropertyTypeRegistry;
import com.eventfilter.registry.PropertyType;
import com.eventfilter.splice.FilterPayload;
import com.eventfilter.splice.FilterSplicer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 过滤编译性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class FilterCompileBenchmark {

    @State(Scope.Benchmark)
    public static class CompileState {
        FilterCompiler compiler;
        FilterSplicer splicer;
        TeamContext team;
        FilterSpec wideSpec;
        Action action;
        FilterPayload payload;

        @Setup
        public void setup() {
            InMemoryPropertyTypeRegistry.Builder registry = InMemoryPropertyTypeRegistry.builder();
            // 200 个属性，一半登记为布尔
            List<FilterSpec> members = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String key = "prop_" + i;
                if (i % 2 == 0) {
                    registry.eventProperty(1L, key, PropertyType.BOOLEAN);
                }
                members.add(FilterSpec.Property.event(key, PropertyOperator.EXACT, i % 4 == 0 ? "true" : "v" + i));
            }
            members.add(FilterSpec.Property.person("email", PropertyOperator.ICONTAINS, "@example.com"));
            members.add(FilterSpec.Property.element("tag_name", null, "button"));
            members.add(FilterSpec.Property.cohort(7));

            compiler = new FilterCompiler(registry.build(), InMemoryCohortStore.builder().cohort(1L, 7L).build());
            splicer = new FilterSplicer(compiler);
            team = TeamContext.of(1L, "UTC");
            wideSpec = FilterSpec.allOf(members);
            action = new Action(1L, "signup click", List.of(
                ActionStep.builder()
                    .event("$autocapture")
                    .selector("div > form button.primary[data-attr=\"signup\"]")
                    .text("Sign up", MatchingMode.CONTAINS)
                    .url("/signup", null)
                    .build(),
                ActionStep.ofEvent("$pageview")
            ));
            payload = new FilterPayload(FilterSpec.allOf(members.subList(0, 20)), "-30d", null);
        }
    }

    @Benchmark
    public Expr compileWideGroup(CompileState state) {
        return state.compiler.compile(state.wideSpec, state.team);
    }

    @Benchmark
    public Expr compileAction(CompileState state) {
        return state.compiler.actions().compile(state.action, state.team);
    }

    @Benchmark
    public Expr spliceTemplate(CompileState state) {
        return state.splicer.splice("SELECT count() FROM events WHERE {filters}", state.payload, state.team);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(FilterCompileBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
