package org.ensembl.compara.testdb.core.seedregion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.ensembl.compara.testdb.core.domain.SeedRegion;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes seed-region files.
 *
 * <p>
 * The format is a JSON array of {@code [name, start, end]} triples. Names
 * may be given as strings or as plain numbers ({@code [22, 100, 200]}),
 * numbers are read back as their decimal text. Output always quotes names
 * and places one record per line. Anything after the closing bracket other
 * than whitespace is rejected:
 *
 * <pre>
 * [
 * ["22",16000000,16500000],
 * ["X",100,200]
 * ]
 * </pre>
 */
public final class SeedRegionFile {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private SeedRegionFile() {
    }

    /**
     * @throws SeedRegionFormatException if the content is not a list of valid triples
     * @throws IOException               if the file cannot be read
     */
    public static List<SeedRegion> read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    /**
     * Parses seed regions from text. {@code source} only labels error messages.
     */
    public static List<SeedRegion> parse(String content, String source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new SeedRegionFormatException(source + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray())
            throw new SeedRegionFormatException(source + ": expected a JSON array of [name, start, end] records");

        List<SeedRegion> regions = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            regions.add(toRegion(root.get(i), source, i));
        }
        return regions;
    }

    private static SeedRegion toRegion(JsonNode record, String source, int index) {
        String where = source + " record #" + index;
        if (!record.isArray() || record.size() != 3)
            throw new SeedRegionFormatException(where + ": expected [name, start, end], got " + record);

        JsonNode name = record.get(0);
        if (!name.isTextual() && !name.isIntegralNumber())
            throw new SeedRegionFormatException(where + ": name must be a string or integer, got " + name);

        long start = bound(record.get(1), where, "start");
        long end = bound(record.get(2), where, "end");
        try {
            return new SeedRegion(name.asText(), start, end);
        } catch (IllegalArgumentException e) {
            throw new SeedRegionFormatException(where + ": " + e.getMessage(), e);
        }
    }

    private static long bound(JsonNode node, String where, String label) {
        if (!node.isIntegralNumber() || !node.canConvertToLong())
            throw new SeedRegionFormatException(where + ": " + label + " must be an integer, got " + node);
        return node.asLong();
    }

    /**
     * Writes the regions to {@code path}, replacing any existing file. An empty
     * list produces an empty JSON array.
     */
    public static void write(Path path, List<SeedRegion> regions) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write(format(regions));
        }
    }

    /** Renders the regions exactly as {@link #write} would. */
    public static String format(List<SeedRegion> regions) {
        StringBuilder sb = new StringBuilder("[\n");
        for (int i = 0; i < regions.size(); i++) {
            SeedRegion r = regions.get(i);
            sb.append('[');
            try {
                sb.append(MAPPER.writeValueAsString(r.name()));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot encode region name " + r.name(), e);
            }
            sb.append(',').append(r.start()).append(',').append(r.end()).append(']');
            if (i < regions.size() - 1)
                sb.append(',');
            sb.append('\n');
        }
        return sb.append("]\n").toString();
    }
}
