package org.ysim.cli.population;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.model.Actor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an initial follow graph from a CSV edge list.
 * <p>
 * Each line holds {@code u,v}: user {@code u} follows user {@code v}, where both are 0-based
 * positions in the generated user list. Blank lines and lines starting with {@code #} are
 * ignored. Edges referring to positions outside the list, and self-loops, are dropped with a
 * warning.
 */
public final class EdgeListLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EdgeListLoader.class);

    private EdgeListLoader() {
    }

    /**
     * @param file  the edge list
     * @param users users in generation order
     * @return follower/followee id pairs in file order
     * @throws IOException if the file cannot be read or a line is not a pair of integers
     */
    public static List<long[]> load(Path file, List<Actor> users) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<long[]> edges = new ArrayList<>();
        int dropped = 0;
        for (int lineNumber = 1; lineNumber <= lines.size(); lineNumber++) {
            String line = lines.get(lineNumber - 1).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split(",");
            if (parts.length != 2) {
                throw new IOException(file + ":" + lineNumber + ": expected 'u,v', got '" + line + "'");
            }
            int u;
            int v;
            try {
                u = Integer.parseInt(parts[0].trim());
                v = Integer.parseInt(parts[1].trim());
            } catch (NumberFormatException e) {
                throw new IOException(file + ":" + lineNumber + ": expected integer positions, got '" + line + "'", e);
            }
            if (u < 0 || v < 0 || u >= users.size() || v >= users.size() || u == v) {
                dropped++;
                continue;
            }
            edges.add(new long[]{users.get(u).getId(), users.get(v).getId()});
        }
        if (dropped > 0) {
            LOG.warn("Dropped {} edges of {} outside the {} generated users or looping", dropped, file, users.size());
        }
        return edges;
    }
}
