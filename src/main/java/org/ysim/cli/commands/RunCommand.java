package org.ysim.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.cli.CommandLineInterface;
import org.ysim.cli.population.EdgeListLoader;
import org.ysim.cli.population.PopulationSnapshot;
import org.ysim.client.HttpJsonClient;
import org.ysim.client.OfflineLanguageBackend;
import org.ysim.client.OpenAiChatBackend;
import org.ysim.client.ProfileGenerator;
import org.ysim.client.RemoteRecommenderGateway;
import org.ysim.client.ServerTimeSync;
import org.ysim.client.YServerClient;
import org.ysim.runtime.RunSummary;
import org.ysim.runtime.Simulation;
import org.ysim.runtime.SimulationFactory;
import org.ysim.runtime.actions.ActionTable;
import org.ysim.runtime.config.ConfigurationException;
import org.ysim.runtime.config.SimulationSettings;
import org.ysim.runtime.internal.services.SeededRandomProvider;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorKind;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IContentService;
import org.ysim.runtime.spi.ILanguageBackend;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs a simulation against the configured content service and language backend.
 * <p>
 * Exit codes: 0 success, 1 invalid configuration or input files, 2 the content service failed
 * during setup, 130 interrupted.
 */
@Command(
    name = "run",
    description = "Run a simulation"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--population"}, description = "Load the initial population from a JSON snapshot")
    private File populationFile;

    @Option(names = {"--graph"}, description = "CSV edge list (u,v user positions) of initial follows")
    private File graphFile;

    @Option(names = {"--reset"}, description = "Clear the content service before the run")
    private boolean reset;

    @Option(names = {"--content-recsys"}, description = "Content recommender, e.g. ReverseChrono")
    private String contentRecommender;

    @Option(names = {"--follow-recsys"}, description = "Follow recommender, e.g. PreferentialAttachment")
    private String followRecommender;

    @Option(names = {"--seed"}, description = "Seed of all random decisions")
    private Long seed;

    @Option(names = {"--sequential"}, description = "Execute actions inline instead of in worker pools")
    private boolean sequential;

    @Option(names = {"--offline"}, description = "Answer prompts with scripted choices instead of a language model")
    private boolean offline;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        SimulationSettings settings;
        RemoteRecommenderGateway recommender;
        try {
            Config config = parent.loadConfig(overrides());
            settings = SimulationSettings.from(config);
            recommender = RemoteRecommenderGateway.fromSettings(
                    new HttpJsonClient(settings.servers().contentApi(), settings.dispatch().actionTimeout()),
                    settings.recommenders());
        } catch (ConfigurationException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            return 1;
        }

        IContentService content = new YServerClient(
                new HttpJsonClient(settings.servers().contentApi(), settings.dispatch().actionTimeout()));
        SimulationFactory.Collaborators collaborators = new SimulationFactory.Collaborators(
                content,
                recommender,
                languageBackend(settings),
                new ProfileGenerator(settings.agents(), settings.pages()));
        SeededRandomProvider random = new SeededRandomProvider(settings.seed());
        Population population = new Population();
        FollowGraph graph = new FollowGraph();

        try {
            if (reset) {
                content.reset();
            }
            initialize(settings, collaborators, population, graph, random);
        } catch (IOException e) {
            LOG.error("Cannot read initial population: {}", e.getMessage());
            return 1;
        } catch (GatewayException e) {
            LOG.error("Content service failed during setup: {}", e.getMessage());
            return 2;
        }

        Simulation simulation = SimulationFactory.create(settings, collaborators, population, graph,
                ActionTable.standard(), random);
        simulation.addSlotPlugin(new ServerTimeSync(content));
        Path snapshotFile = snapshotFile(settings);
        if (snapshotFile != null && (!settings.population().churn().isDisabled()
                || !settings.population().recruitment().isDisabled())) {
            simulation.addDayListener(report -> saveSnapshot(snapshotFile, report.day(), population, graph));
        }

        LOG.info("Starting '{}': {} days of {} slots, {} live actors, seed {}", settings.name(), settings.days(),
                settings.slotsPerDay(), population.liveCount(), settings.seed());
        RunSummary summary;
        try {
            summary = simulation.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Simulation interrupted at {}", simulation.getClock().isTerminal()
                    ? "the end" : simulation.getCurrentTime());
            return 130;
        } finally {
            simulation.shutdown();
        }

        if (snapshotFile != null) {
            saveSnapshot(snapshotFile, settings.days() - 1, population, graph);
        }
        out.println(summary.render());
        out.flush();
        return 0;
    }

    private Map<String, Object> overrides() {
        Map<String, Object> overrides = new LinkedHashMap<>();
        if (seed != null) {
            overrides.put("simulation.seed", seed);
        }
        if (sequential) {
            overrides.put("dispatch.mode", "sequential");
        }
        if (offline) {
            overrides.put("servers.llm.backend", "offline");
        }
        if (contentRecommender != null) {
            overrides.put("recommenders.content", contentRecommender);
        }
        if (followRecommender != null) {
            overrides.put("recommenders.follow", followRecommender);
        }
        return overrides;
    }

    private void initialize(SimulationSettings settings, SimulationFactory.Collaborators collaborators,
                            Population population, FollowGraph graph, SeededRandomProvider random)
            throws IOException, GatewayException {
        IContentService content = collaborators.content();
        SlotTime start = SlotTime.of(0, settings.slotsPerDay());
        if (populationFile != null) {
            PopulationSnapshot.Loaded loaded = PopulationSnapshot.load(populationFile.toPath());
            for (Actor actor : loaded.actors()) {
                content.register(actor, actor.getJoinedDay());
            }
            loaded.applyTo(population, graph);
            if (reset) {
                for (long[] edge : loaded.edges()) {
                    if (graph.contains(edge[0], edge[1])) {
                        content.follow(edge[0], edge[1], start);
                    }
                }
            }
            LOG.info("Loaded {} actors and {} follow edges from {}", loaded.actors().size(), graph.edgeCount(),
                    populationFile);
        } else {
            SimulationFactory.populate(settings, population, collaborators.actorFactory(), content, random);
        }

        if (graphFile != null) {
            List<long[]> edges = EdgeListLoader.load(graphFile.toPath(), population.snapshotLive(ActorKind.USER));
            int added = 0;
            for (long[] edge : edges) {
                if (graph.addEdge(edge[0], edge[1])) {
                    content.follow(edge[0], edge[1], start);
                    added++;
                }
            }
            LOG.info("Added {} initial follow edges from {}", added, graphFile);
        }
    }

    private static ILanguageBackend languageBackend(SimulationSettings settings) {
        if (settings.servers().llmBackend() == SimulationSettings.ServerSettings.LlmBackend.OFFLINE) {
            LOG.info("Language backend: offline, prompts get scripted answers");
            return new OfflineLanguageBackend(settings.seed());
        }
        LOG.info("Language backend: model {} at {}", settings.servers().llmModel(), settings.servers().llmUrl());
        return OpenAiChatBackend.fromSettings(settings.servers(), settings.dispatch().actionTimeout());
    }

    private static Path snapshotFile(SimulationSettings settings) {
        String output = settings.populationOutput();
        return output == null || output.isBlank() ? null : Path.of(output);
    }

    private static void saveSnapshot(Path file, int day, Population population, FollowGraph graph) {
        try {
            PopulationSnapshot.save(file, day, population, graph);
            LOG.debug("Saved {} live actors to {}", population.liveCount(), file);
        } catch (IOException e) {
            LOG.warn("Failed to save population snapshot to {}: {}", file, e.getMessage());
        }
    }
}
