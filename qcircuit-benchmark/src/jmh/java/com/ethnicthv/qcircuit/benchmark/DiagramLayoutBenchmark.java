package com.ethnicthv.qcircuit.benchmark;

import com.ethnicthv.qcircuit.Quantikz;
import com.ethnicthv.qcircuit.core.circuit.Circuit;
import com.ethnicthv.qcircuit.core.gate.GateOperation;
import com.ethnicthv.qcircuit.core.layout.ColumnAssignment;
import com.ethnicthv.qcircuit.core.layout.ColumnScheduler;
import com.ethnicthv.qcircuit.core.layout.LayoutMode;
import org.openjdk.jmh.annotations.*;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks for diagram layout:
 * - Column scheduling alone, serial vs packed.
 * - Full quantikz rendering, serial vs packed.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class DiagramLayoutBenchmark {

    @State(Scope.Thread)
    public static class CircuitState {
        @Param({"8", "32"})
        public int wireCount;

        @Param({"100", "1000"})
        public int gateCount;

        public Circuit circuit;
        public Quantikz serial;
        public Quantikz packed;

        @Setup(Level.Trial)
        public void setup() {
            Random random = new Random(1234L);
            Circuit.Builder builder = Circuit.builder(wireCount);
            for (int i = 0; i < gateCount; i++) {
                int a = 1 + random.nextInt(wireCount);
                int b = 1 + (a + random.nextInt(wireCount - 1)) % wireCount;
                switch (random.nextInt(3)) {
                    case 0 -> builder.addGate(GateOperation.single(a, "H"));
                    case 1 -> builder.addGate(GateOperation.controlled(a, b, "CNOT"));
                    default -> builder.addGate(GateOperation.parametricSingle(a, "Rz", random.nextDouble()));
                }
            }
            circuit = builder.build();
            serial = Quantikz.builder().layout(LayoutMode.SERIAL).build();
            packed = Quantikz.builder().layout(LayoutMode.PACKED).build();
        }
    }

    @Benchmark
    public ColumnAssignment scheduleSerial(CircuitState state) {
        return ColumnScheduler.schedule(state.circuit, LayoutMode.SERIAL);
    }

    @Benchmark
    public ColumnAssignment schedulePacked(CircuitState state) {
        return ColumnScheduler.schedule(state.circuit, LayoutMode.PACKED);
    }

    @Benchmark
    public String renderSerial(CircuitState state) {
        return state.serial.toQuantikz(state.circuit);
    }

    @Benchmark
    public String renderPacked(CircuitState state) {
        return state.packed.toQuantikz(state.circuit);
    }
}
