package org.ysim.cli.population;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorKind;
import org.ysim.runtime.model.ActorProfile;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON snapshot of the live population and the follow edges among it.
 * <p>
 * Written after day boundaries and at the end of a run, and read back by {@code --population}
 * to continue with the same actors. The file is replaced atomically so a crash never leaves a
 * truncated snapshot behind.
 */
public final class PopulationSnapshot {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /** Serialized form of one actor. */
    static final class ActorEntry {
        long id;
        String name;
        String kind;
        int roundActions;
        double activityScale;
        int joinedDay;
        ActorProfile profile;
        List<String> interests;
    }

    /** Serialized form of the whole file. */
    static final class Document {
        int day;
        List<ActorEntry> actors = new ArrayList<>();
        List<long[]> edges = new ArrayList<>();
    }

    /**
     * Actors and edges read from a snapshot.
     */
    public record Loaded(int day, List<Actor> actors, List<long[]> edges) {

        /**
         * Adds the actors to the population and the edges among them to the graph.
         */
        public void applyTo(Population population, FollowGraph graph) {
            for (Actor actor : actors) {
                population.add(actor);
            }
            for (long[] edge : edges) {
                if (population.isLive(edge[0]) && population.isLive(edge[1]) && edge[0] != edge[1]) {
                    graph.addEdge(edge[0], edge[1]);
                }
            }
        }
    }

    private PopulationSnapshot() {
    }

    /**
     * Writes the live population and its follow edges.
     *
     * @param file target file, parent directories are created
     * @param day  last completed day
     * @throws IOException if the file cannot be written
     */
    public static void save(Path file, int day, Population population, FollowGraph graph) throws IOException {
        Document document = new Document();
        document.day = day;
        for (Actor actor : population.snapshotLive()) {
            ActorEntry entry = new ActorEntry();
            entry.id = actor.getId();
            entry.name = actor.getName();
            entry.kind = actor.getKind().name();
            entry.roundActions = actor.getRoundActions();
            entry.activityScale = actor.getActivityScale();
            entry.joinedDay = actor.getJoinedDay();
            entry.profile = actor.getProfile();
            entry.interests = actor.getInterests();
            document.actors.add(entry);
            for (long followee : graph.followeesOf(actor.getId())) {
                document.edges.add(new long[]{actor.getId(), followee});
            }
        }

        Path absolute = file.toAbsolutePath();
        if (absolute.getParent() != null) {
            Files.createDirectories(absolute.getParent());
        }
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            GSON.toJson(document, writer);
        }
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Reads a snapshot.
     *
     * @throws IOException if the file cannot be read or is not a valid snapshot
     */
    public static Loaded load(Path file) throws IOException {
        Document document;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            document = GSON.fromJson(reader, Document.class);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new IOException("Malformed population snapshot " + file + ": " + e.getMessage(), e);
        }
        if (document == null || document.actors == null) {
            throw new IOException("Population snapshot " + file + " contains no actors");
        }

        List<Actor> actors = new ArrayList<>(document.actors.size());
        for (ActorEntry entry : document.actors) {
            try {
                Actor actor = new Actor(entry.id, entry.name, ActorKind.valueOf(entry.kind), entry.profile,
                        entry.roundActions, entry.activityScale, null, entry.joinedDay);
                if (entry.interests != null) {
                    actor.setInterests(entry.interests);
                }
                actors.add(actor);
            } catch (RuntimeException e) {
                throw new IOException("Invalid actor " + entry.id + " in " + file + ": " + e.getMessage(), e);
            }
        }
        List<long[]> edges = document.edges == null ? List.of() : document.edges;
        return new Loaded(document.day, actors, edges);
    }
}
