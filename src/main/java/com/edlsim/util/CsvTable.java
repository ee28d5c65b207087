package com.edlsim.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Small delimited-text reader for numeric tables.
 *
 * Delimiter is detected from the first non-empty line (comma, semicolon or tab;
 * quotes supported). Column names match case/spacing/punctuation-insensitively.
 * A first line that parses as all numbers is treated as data and the columns
 * are addressed by position.
 */
public final class CsvTable {

    private final String[] headers;        // empty when the file has no header line
    private final Map<String, Integer> index;
    private final List<String[]> rows;
    private final String source;

    private CsvTable(String[] headers, List<String[]> rows, String source) {
        this.headers = headers;
        this.rows = rows;
        this.source = source;
        this.index = new HashMap<>();
        for (int i = 0; i < headers.length; i++) index.put(clean(headers[i]), i);
    }

    public static CsvTable read(Path csvPath) throws IOException {
        Objects.requireNonNull(csvPath, "CSV path must not be null");
        try (BufferedReader br = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            return read(br, csvPath.toString());
        }
    }

    public static CsvTable read(BufferedReader br, String source) throws IOException {
        final String first = readNonEmptyLine(br);
        if (first == null) throw new IllegalArgumentException("CSV is empty: " + source);

        final char delim = detectDelimiter(first);
        final String[] firstToks = splitFlexible(first, delim);
        final List<String[]> rows = new ArrayList<>();
        final String[] headers;
        if (allNumeric(firstToks)) {
            headers = new String[0];
            rows.add(firstToks);
        } else {
            headers = firstToks;
        }
        for (String line; (line = br.readLine()) != null; ) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            rows.add(splitFlexible(line, delim));
        }
        return new CsvTable(headers, rows, source);
    }

    public boolean hasHeader()      { return headers.length > 0; }
    public List<String> headers()   { return List.of(headers); }
    public int rowCount()           { return rows.size(); }
    public String source()          { return source; }

    /**
     * Column index for the first alias that matches a header exactly, then by
     * substring. Without a header, returns {@code positional}.
     *
     * @throws IllegalArgumentException if a header exists and no alias matches
     */
    public int column(List<String> aliases, int positional) {
        if (!hasHeader()) return positional;
        for (String n : aliases) {
            final Integer idx = index.get(clean(n));
            if (idx != null) return idx;
        }
        for (String n : aliases) {
            for (int i = 0; i < headers.length; i++) {
                if (clean(headers[i]).contains(clean(n))) return i;
            }
        }
        throw new IllegalArgumentException("CSV missing column. Need one of: " + aliases
                + " | headers=" + Arrays.toString(headers) + " in " + source);
    }

    /** Parsed cell, or NaN when missing, blank or not a number. */
    public double number(int row, int col) {
        final String[] toks = rows.get(row);
        final String s = (col >= 0 && col < toks.length) ? toks[col] : null;
        if (s == null || s.isBlank()) return Double.NaN;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    // internals

    private static String readNonEmptyLine(BufferedReader br) throws IOException {
        String s;
        while ((s = br.readLine()) != null) {
            s = s.trim();
            if (!s.isEmpty() && !s.startsWith("#")) return s;
        }
        return null;
    }

    private static boolean allNumeric(String[] toks) {
        for (String t : toks) {
            try {
                Double.parseDouble(t.trim());
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return toks.length > 0;
    }

    private static char detectDelimiter(String h) {
        final int c = count(h, ','), s = count(h, ';'), t = count(h, '\t');
        return (c >= s && c >= t) ? ',' : (s >= c && s >= t) ? ';' : '\t';
    }

    private static int count(String s, char ch) {
        int k = 0;
        for (int i = 0; i < s.length(); i++) if (s.charAt(i) == ch) k++;
        return k;
    }

    private static String[] splitFlexible(String line, char delim) {
        final ArrayList<String> out = new ArrayList<>();
        final StringBuilder sb = new StringBuilder(64);
        boolean inQ = false;
        for (int i = 0; i < line.length(); i++) {
            final char ch = line.charAt(i);
            if (ch == '"') inQ = !inQ;
            else if (ch == delim && !inQ) { out.add(sb.toString()); sb.setLength(0); }
            else sb.append(ch);
        }
        out.add(sb.toString());
        return out.toArray(new String[0]);
    }

    static String clean(String s) {
        return s.toLowerCase(Locale.ROOT).trim()
                .replace("%", "").replace("_", "").replace("-", "").replace(" ", "")
                .replace("(", "").replace(")", "").replace("[", "").replace("]", "");
    }
}
