package org.ysim.cli.population;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.ysim.runtime.SimulationFixtures;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorKind;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;

@Tag("unit")
class PopulationSnapshotTest {

    @TempDir
    Path tempDir;

    @Test
    void liveActorsAndEdgesSurviveSaveAndLoad() throws IOException {
        Population population = new Population();
        FollowGraph graph = new FollowGraph();
        Actor user = SimulationFixtures.user(1);
        user.setInterests(List.of("economy"));
        population.add(user);
        population.add(SimulationFixtures.user(2));
        population.add(SimulationFixtures.user(3));
        population.add(SimulationFixtures.page(4));
        graph.addEdge(1, 2);
        graph.addEdge(2, 4);
        graph.addEdge(3, 1);
        population.churn(3);
        graph.removeActor(3);
        Path file = tempDir.resolve("nested/population.json");

        PopulationSnapshot.save(file, 5, population, graph);
        PopulationSnapshot.Loaded loaded = PopulationSnapshot.load(file);

        assertThat(loaded.day()).isEqualTo(5);
        assertThat(loaded.actors()).extracting(Actor::getId).containsExactlyInAnyOrder(1L, 2L, 4L);
        Actor restored = loaded.actors().stream().filter(a -> a.getId() == 1L).findFirst().orElseThrow();
        assertThat(restored.getProfile()).isEqualTo(user.getProfile());
        assertThat(restored.getInterests()).containsExactly("economy");
        assertThat(loaded.actors()).filteredOn(Actor::isPage).singleElement()
                .satisfies(page -> assertThat(page.getKind()).isEqualTo(ActorKind.PAGE));
        assertThat(Files.exists(tempDir.resolve("nested/population.json.tmp"))).isFalse();

        Population target = new Population();
        FollowGraph targetGraph = new FollowGraph();
        loaded.applyTo(target, targetGraph);
        assertThat(target.liveCount()).isEqualTo(3);
        assertThat(targetGraph.contains(1, 2)).isTrue();
        assertThat(targetGraph.contains(2, 4)).isTrue();
        assertThat(targetGraph.edgeCount()).isEqualTo(2);
    }

    @Test
    void edgesToUnknownActorsAreNotApplied() {
        PopulationSnapshot.Loaded loaded = new PopulationSnapshot.Loaded(0,
                List.of(SimulationFixtures.user(1), SimulationFixtures.user(2)),
                List.of(new long[]{1, 2}, new long[]{1, 9}, new long[]{2, 2}));
        Population population = new Population();
        FollowGraph graph = new FollowGraph();

        loaded.applyTo(population, graph);

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.contains(1, 2)).isTrue();
    }

    @Test
    void malformedFileIsAnIoFailure() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"actors\": [ {\"id\": ");

        assertThatThrownBy(() -> PopulationSnapshot.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Malformed population snapshot");
    }

    @Test
    void unknownActorKindIsAnIoFailure() throws IOException {
        Path file = tempDir.resolve("kind.json");
        Files.writeString(file, "{\"day\": 0, \"actors\": [{\"id\": 1, \"name\": \"x\", \"kind\": \"ROBOT\"}]}");

        assertThatThrownBy(() -> PopulationSnapshot.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid actor 1");
    }
}
