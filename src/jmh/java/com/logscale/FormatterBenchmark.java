package com.logscale;

import com.logscale.format.QueryFormatter;
import com.logscale.query.QueryParser;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 解析与格式化性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class FormatterBenchmark {

    @State(Scope.Thread)
    public static class QueryState {
        String shortQuery;
        String longQuery;
        QueryFormatter formatter;

        @Setup
        public void setup() {
            shortQuery = "#type=accesslog status>=500 | groupBy(url, function=count()) | sort(_count, limit=10)";

            // 200 个步骤的长管道，覆盖 case、match 与子查询
            StringBuilder builder = new StringBuilder("#repo=weblogs");
            for (int i = 0; i < 200; i++) {
                switch (i % 4) {
                    case 0 -> builder.append(" | field").append(i).append(" := a * ").append(i).append(" + b");
                    case 1 -> builder.append(" | case { status=").append(i).append(" | level := \"warn\"; * }");
                    case 2 -> builder.append(" | method match { \"GET\" => x := ").append(i).append("; * => x := 0 }");
                    default -> builder.append(" | join(query: { error | count() }, field=id").append(i).append(")");
                }
            }
            longQuery = builder.toString();
            formatter = new QueryFormatter();
        }
    }

    @Benchmark
    public Object parseShort(QueryState state) {
        return new QueryParser().parse(state.shortQuery);
    }

    @Benchmark
    public Object parseLong(QueryState state) {
        return new QueryParser().parse(state.longQuery);
    }

    @Benchmark
    public String formatShort(QueryState state) {
        return state.formatter.format(state.shortQuery);
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public String formatLong(QueryState state) {
        return state.formatter.format(state.longQuery);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(FormatterBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
