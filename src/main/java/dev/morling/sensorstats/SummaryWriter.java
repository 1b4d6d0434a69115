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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the merged statistics as a {@code ;}-separated table, one row per key, and mirrors
 * it to the console. The file only appears once it has been written completely.
 */
public class SummaryWriter {
    private static final Logger LOG = LoggerFactory.getLogger(SummaryWriter.class);

    static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    public static final String HEADER = "device;ano-mes;sensor;valor_maximo;valor_medio;valor_minimo";

    private final PrintStream console;
    private final boolean sorted;

    public SummaryWriter(PrintStream console, boolean sorted) {
        this.console = console;
        this.sorted = sorted;
    }

    public static String formatRow(AggregateKey key, Aggregate aggregate) {
        return String.format(Locale.ROOT, "%s;%04d-%02d;%s;%.2f;%.2f;%.2f",
                key.device(),
                key.year(),
                key.month(),
                key.sensor().label(),
                aggregate.max(),
                aggregate.mean(),
                aggregate.min());
    }

    public List<String> rows(KeyedAggregateMap map) {
        List<Map.Entry<AggregateKey, Aggregate>> entries = new ArrayList<>(map.entries().entrySet());
        if (sorted) {
            entries.sort(Map.Entry.comparingByKey());
        }
        List<String> rows = new ArrayList<>(entries.size());
        for (Map.Entry<AggregateKey, Aggregate> entry : entries) {
            rows.add(formatRow(entry.getKey(), entry.getValue()));
        }
        return rows;
    }

    public void write(KeyedAggregateMap map, Path output) {
        List<String> rows = rows(map);
        Path target = output.toAbsolutePath();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                writer.write(HEADER);
                writer.write('\n');
                for (String row : rows) {
                    writer.write(row);
                    writer.write('\n');
                }
            }
            applyPermissions(tmp, target);
            moveIntoPlace(tmp, target);
        }
        catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new SensorStatsException("Could not write " + output + ": " + e.getMessage(), e);
        }

        console.println("Resultado:");
        console.println(HEADER);
        for (String row : rows) {
            console.println(row);
        }
        console.println(output.getFileName() + " gerado com sucesso.");
        LOG.debug("Wrote {} rows to {}", rows.size(), target);
    }

    /**
     * Temp files are created owner-only; give the summary the permissions of the file it replaces,
     * or {@code rw-r--r--} for a new one.
     */
    private static void applyPermissions(Path tmp, Path target) throws IOException {
        if (Files.getFileAttributeView(tmp, PosixFileAttributeView.class) == null) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target) ? Files.getPosixFilePermissions(target) : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(tmp, permissions);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp, IOException failure) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        }
        catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
