/*
 *  Copyright 2023 The original authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package dev.morling.sensorstats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SummaryWriterTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    @Test
    void formatsRowWithTwoDecimals() {
        Aggregate aggregate = new Aggregate(1.0);
        aggregate.add(2.0);
        aggregate.add(3.0);

        assertThat(SummaryWriter.formatRow(new AggregateKey("A", 2024, 3, 0), aggregate))
                .isEqualTo("A;2024-03;temperatura;3.00;2.00;1.00");
    }

    @Test
    void padsYearAndMonth() {
        assertThat(SummaryWriter.formatRow(new AggregateKey("dev", 999, 1, Sensor.ETVOC.index()), new Aggregate(-0.5)))
                .isEqualTo("dev;0999-01;etvoc;-0.50;-0.50;-0.50");
    }

    @Test
    void writesFileAndMirrorsToConsole() throws IOException {
        Path output = tempDir.resolve("resumo.csv");

        writer(false).write(sample(), output);

        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).containsExactly(
                SummaryWriter.HEADER,
                "B;2024-04;umidade;55.00;55.00;55.00",
                "A;2024-03;temperatura;20.00;20.00;20.00");
        assertThat(console.toString(StandardCharsets.UTF_8).lines()).containsExactly(
                "Resultado:",
                SummaryWriter.HEADER,
                "B;2024-04;umidade;55.00;55.00;55.00",
                "A;2024-03;temperatura;20.00;20.00;20.00",
                "resumo.csv gerado com sucesso.");
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(output);
        }
    }

    @Test
    void newOutputIsWorldReadable() throws IOException {
        assumeTrue(Files.getFileAttributeView(tempDir, PosixFileAttributeView.class) != null);
        Path output = tempDir.resolve("resumo.csv");

        writer(false).write(sample(), output);

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(output))).isEqualTo("rw-r--r--");
    }

    @Test
    void replacedOutputKeepsItsPermissions() throws IOException {
        assumeTrue(Files.getFileAttributeView(tempDir, PosixFileAttributeView.class) != null);
        Path output = tempDir.resolve("resumo.csv");
        Files.createFile(output);
        Files.setPosixFilePermissions(output, PosixFilePermissions.fromString("rw-rw----"));

        writer(false).write(sample(), output);

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(output))).isEqualTo("rw-rw----");
        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).hasSize(3);
    }

    @Test
    void sortsRowsWhenRequested() {
        assertThat(writer(true).rows(sample())).containsExactly(
                "A;2024-03;temperatura;20.00;20.00;20.00",
                "B;2024-04;umidade;55.00;55.00;55.00");
    }

    @Test
    void unwritableOutputIsFatal() {
        Path output = tempDir.resolve("missing-dir").resolve("resumo.csv");

        assertThatThrownBy(() -> writer(false).write(sample(), output))
                .isInstanceOf(SensorStatsException.class)
                .hasMessageContaining("resumo.csv");
        assertThat(Files.exists(output)).isFalse();
        assertThat(console.size()).isZero();
    }

    private SummaryWriter writer(boolean sorted) {
        return new SummaryWriter(new PrintStream(console, true, StandardCharsets.UTF_8), sorted);
    }

    private static KeyedAggregateMap sample() {
        KeyedAggregateMap map = new KeyedAggregateMap();
        map.upsert(new AggregateKey("B", 2024, 4, Sensor.UMIDADE.index()), 55.0);
        map.upsert(new AggregateKey("A", 2024, 3, Sensor.TEMPERATURA.index()), 20.0);
        return map;
    }
}
