package com.ryuqq.tracker.adapter.tsv;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal tab-separated table reader and append-only writer.
 *
 * <p><strong>Reading:</strong> a file has a header when the first field of its first line
 * equals the first column of the expected header. Otherwise every line is data and the
 * expected header is applied by position (legacy headerless files). Blank lines are skipped.
 * Short rows leave the trailing columns absent, so callers can detect missing values.</p>
 *
 * <p><strong>Writing:</strong> rows are appended in a single write call, projected onto
 * the header already present in the file. Fragments are written to a temporary file and
 * moved into place, so a reader never observes a half-written fragment.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TsvTable {

    private static final String SEPARATOR = "\t";

    private final List<String> header;
    private final List<Map<String, String>> rows;

    private TsvTable(List<String> header, List<Map<String, String>> rows) {
        this.header = header;
        this.rows = rows;
    }

    /**
     * Reads a table.
     *
     * @param path the file to read
     * @param expectedHeader header applied when the file has none
     * @return the table (empty if the file is empty)
     * @throws UncheckedIOException if the file cannot be read
     */
    public static TsvTable read(Path path, List<String> expectedHeader) {
        List<String> lines;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }

        if (lines.isEmpty()) {
            return new TsvTable(expectedHeader, List.of());
        }

        List<String> first = split(lines.get(0));
        boolean hasHeader = !first.isEmpty() && first.get(0).trim().equals(expectedHeader.get(0));
        List<String> header = hasHeader ? trimAll(first) : expectedHeader;

        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = hasHeader ? 1 : 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = split(line);
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size() && c < fields.size(); c++) {
                row.put(header.get(c), fields.get(c).trim());
            }
            rows.add(row);
        }
        return new TsvTable(header, Collections.unmodifiableList(rows));
    }

    /**
     * Creates the file with the given header if it does not exist.
     *
     * @param path the file
     * @param header header columns
     * @return true if the file was created
     * @throws UncheckedIOException if the file cannot be created
     */
    public static boolean ensureHeader(Path path, List<String> header) {
        if (Files.exists(path)) {
            return false;
        }
        try {
            createParent(path);
            Files.writeString(path, join(header) + "\n", StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + path, e);
        }
    }

    /**
     * Appends rows, projected onto the file's own header.
     *
     * <p>Columns the file does not have are dropped; columns the row does not have are
     * written empty. A file created empty receives {@code defaultHeader} first.</p>
     *
     * @param path the file (created with {@code defaultHeader} if absent)
     * @param defaultHeader header used when the file has none yet
     * @param rows rows keyed by column name
     * @throws UncheckedIOException if the file cannot be written
     */
    public static void append(Path path, List<String> defaultHeader, List<Map<String, String>> rows) {
        if (rows.isEmpty()) {
            return;
        }
        ensureHeader(path, defaultHeader);

        List<String> fileHeader = readHeader(path, defaultHeader);
        StringBuilder text = new StringBuilder();
        if (isEmpty(path)) {
            text.append(join(defaultHeader)).append('\n');
            fileHeader = defaultHeader;
        } else if (!endsWithNewline(path)) {
            text.append('\n');
        }
        for (Map<String, String> row : rows) {
            List<String> values = new ArrayList<>(fileHeader.size());
            for (String column : fileHeader) {
                values.add(row.getOrDefault(column, ""));
            }
            text.append(join(values)).append('\n');
        }

        try {
            Files.writeString(path, text.toString(), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + path, e);
        }
    }

    /**
     * Writes a single-row table atomically (temporary file, then move).
     *
     * @param path the target file, replaced if present
     * @param header header columns
     * @param row the data row keyed by column name
     * @throws UncheckedIOException if the file cannot be written
     */
    public static void writeSingleRow(Path path, List<String> header, Map<String, String> row) {
        List<String> values = new ArrayList<>(header.size());
        for (String column : header) {
            values.add(row.getOrDefault(column, ""));
        }
        String text = join(header) + "\n" + join(values) + "\n";

        Path temp = path.resolveSibling("." + path.getFileName() + ".tmp");
        try {
            createParent(path);
            Files.writeString(temp, text, StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (java.nio.file.AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    /**
     * Column names of this table.
     *
     * @return header columns
     */
    public List<String> header() {
        return header;
    }

    /**
     * Data rows, keyed by column name.
     *
     * @return rows (unmodifiable)
     */
    public List<Map<String, String>> rows() {
        return rows;
    }

    /**
     * Checks whether the table declares a column.
     *
     * @param column column name
     * @return true if present in the header
     */
    public boolean hasColumn(String column) {
        return header.contains(column);
    }

    private static List<String> readHeader(Path path, List<String> defaultHeader) {
        TsvTable table = read(path, defaultHeader);
        return table.header();
    }

    private static boolean isEmpty(Path path) {
        try {
            return Files.size(path) == 0;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + path, e);
        }
    }

    private static boolean endsWithNewline(Path path) {
        try (SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return true;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            channel.read(last);
            return last.get(0) == '\n';
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static List<String> split(String line) {
        return Arrays.asList(line.split(SEPARATOR, -1));
    }

    private static List<String> trimAll(List<String> fields) {
        List<String> trimmed = new ArrayList<>(fields.size());
        for (String field : fields) {
            trimmed.add(field.trim());
        }
        return trimmed;
    }

    private static String join(List<String> values) {
        return String.join(SEPARATOR, values);
    }
}
