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

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class CompareSummaries {
    public static void main(String[] args) throws IOException {
        if (args.length != 2 && args.length != 3) {
            System.err.println("""
                    Usage: java CompareSummaries <expected> <actual> [<tolerance>]

                    Examples:
                        java CompareSummaries expected.csv resumo.csv
                        java CompareSummaries expected.csv resumo.csv 0.01""");
            System.exit(1);
        }
        BigDecimal tolerance = args.length == 3 ? new BigDecimal(args[2]) : BigDecimal.ZERO;

        List<String> errors = compare(
                Files.readAllLines(Paths.get(args[0]), StandardCharsets.UTF_8),
                Files.readAllLines(Paths.get(args[1]), StandardCharsets.UTF_8),
                tolerance);
        errors.forEach(System.err::println);
        if (!errors.isEmpty()) {
            System.exit(1);
        }
    }

    public static List<String> compare(List<String> expectedLines, List<String> actualLines, BigDecimal tolerance) {
        if (tolerance.signum() < 0) {
            throw new IllegalArgumentException("tolerance must be positive or zero");
        }
        List<String> errors = new ArrayList<>();
        Map<String, Row> expected = parse(expectedLines, "expected", errors);
        Map<String, Row> actual = parse(actualLines, "actual", errors);

        for (Map.Entry<String, Row> entry : expected.entrySet()) {
            Row actualRow = actual.get(entry.getKey());
            if (actualRow == null) {
                errors.add("missing " + entry.getValue().line);
                continue;
            }
            Row expectedRow = entry.getValue();
            checkTolerance(expectedRow.max, actualRow.max, tolerance, "max", expectedRow, actualRow, errors);
            checkTolerance(expectedRow.mean, actualRow.mean, tolerance, "mean", expectedRow, actualRow, errors);
            checkTolerance(expectedRow.min, actualRow.min, tolerance, "min", expectedRow, actualRow, errors);
        }
        for (Map.Entry<String, Row> entry : actual.entrySet()) {
            if (!expected.containsKey(entry.getKey())) {
                errors.add("unexpected " + entry.getValue().line);
            }
        }
        return errors;
    }

    private static Map<String, Row> parse(List<String> lines, String name, List<String> errors) {
        Map<String, Row> rows = new TreeMap<>();
        if (lines.isEmpty() || !lines.get(0).equals(SummaryWriter.HEADER)) {
            errors.add(name + " does not start with header " + SummaryWriter.HEADER);
            return rows;
        }
        for (String line : lines.subList(1, lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.split(";");
            if (fields.length != 6) {
                errors.add(name + " has wrong format: " + line);
                continue;
            }
            try {
                Row row = new Row(line, new BigDecimal(fields[3]), new BigDecimal(fields[4]), new BigDecimal(fields[5]));
                if (rows.put(fields[0] + ";" + fields[1] + ";" + fields[2], row) != null) {
                    errors.add(name + " has duplicate row " + line);
                }
            }
            catch (NumberFormatException e) {
                errors.add(name + " has wrong format: " + line);
            }
        }
        return rows;
    }

    private static void checkTolerance(BigDecimal expected, BigDecimal actual, BigDecimal tolerance, String column,
                                       Row expectedRow, Row actualRow, List<String> errors) {
        if (expected.subtract(actual).abs().compareTo(tolerance) > 0) {
            errors.add(expectedRow.line + " != " + actualRow.line + " (" + column + ")");
        }
    }

    record Row(String line, BigDecimal max, BigDecimal mean, BigDecimal min) {
    }
}
