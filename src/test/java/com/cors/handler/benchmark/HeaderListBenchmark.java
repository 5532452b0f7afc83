package com.cors.handler.benchmark;

import com.cors.handler.CorsHandler;
import com.cors.handler.http.BufferedCorsResponse;
import com.cors.handler.http.CorsRequest;
import com.cors.handler.http.MapCorsRequest;
import com.cors.handler.policy.CorsOptions;
import com.cors.handler.util.HeaderLists;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for header-list parsing and full preflight negotiation.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class HeaderListBenchmark {

    private CorsHandler handler;
    private CorsRequest preflight;

    @Setup(Level.Trial)
    public void setUp() {
        handler = CorsHandler.create(CorsOptions.builder()
                .allowedOrigins("http://foobar.com", "http://*.bar.com")
                .allowedMethods("GET", "PUT")
                .allowedHeaders("Header", "Second-Header", "Third-Header")
                .build());
        preflight = MapCorsRequest.of("OPTIONS",
                "Origin", "http://foo.bar.com",
                "Access-Control-Request-Method", "PUT",
                "Access-Control-Request-Headers", "header, second-header, THIRD-HEADER");
    }

    @Benchmark
    public void parseHeaderList(Blackhole bh) {
        bh.consume(HeaderLists.parseHeaderList("header, second-header, THIRD-HEADER"));
    }

    @Benchmark
    public void preflight(Blackhole bh) {
        BufferedCorsResponse response = new BufferedCorsResponse();
        handler.apply(preflight, response);
        bh.consume(response);
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(HeaderListBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
