package org.ysim.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.actions.ActionEnvironment;
import org.ysim.runtime.actions.ActionTable;
import org.ysim.runtime.actions.PromptBuilder;
import org.ysim.runtime.config.SimulationSettings;
import org.ysim.runtime.dispatch.ActionInvoker;
import org.ysim.runtime.dispatch.Dispatcher;
import org.ysim.runtime.dispatch.TelemetryRecorder;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IActorFactory;
import org.ysim.runtime.spi.IContentService;
import org.ysim.runtime.spi.ILanguageBackend;
import org.ysim.runtime.spi.IRandomProvider;
import org.ysim.runtime.spi.IRecommenderGateway;

/**
 * Wires a {@link Simulation} from validated settings and the external collaborators.
 */
public final class SimulationFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationFactory.class);

    /**
     * External systems a run talks to.
     */
    public record Collaborators(IContentService content, IRecommenderGateway recommender,
                                ILanguageBackend language, IActorFactory actorFactory) {
    }

    private SimulationFactory() {
    }

    /**
     * Creates the simulation. The population and graph are used as given; see
     * {@link #populate} to fill an empty population.
     *
     * @param settings     validated settings
     * @param collaborators external systems
     * @param population   initial live population
     * @param graph        initial follow graph
     * @param table        action bindings
     * @param random       run-level random provider
     * @return a simulation positioned at slot 0
     */
    public static Simulation create(SimulationSettings settings, Collaborators collaborators,
                                    Population population, FollowGraph graph, ActionTable table,
                                    IRandomProvider random) {
        SimulationSettings.AgentSettings agents = settings.agents();
        ActionEnvironment environment = ActionEnvironment.builder()
                .content(collaborators.content())
                .recommender(collaborators.recommender())
                .language(collaborators.language())
                .graph(graph)
                .population(population)
                .prompts(new PromptBuilder(settings.prompts()))
                .annotateEmotions(agents.annotateEmotions(), agents.emotions())
                .maxThreadLength(agents.maxThreadLength())
                .attentionWindow(agents.attentionWindow())
                .secondaryFollowProbability(agents.secondaryFollow())
                .build();
        ActionInvoker invoker = new ActionInvoker(table, environment, random,
                settings.dispatch().lightRetries(), new TelemetryRecorder(settings.telemetryEnabled()));
        Dispatcher dispatcher = Dispatcher.create(settings.dispatch(), invoker, population);

        SimulationClock clock = new SimulationClock(settings.slotsPerDay(), settings.days());
        ActivitySampler sampler = new ActivitySampler(settings.hourlyActivity(),
                settings.pages().hourlyActivity(), random);
        ActionSelector selector = new ActionSelector(settings.userActions(), settings.pages().actions(), random);
        PopulationManager manager = new PopulationManager(settings.population(), population, graph,
                dispatcher, collaborators.content(), collaborators.actorFactory(), random);
        return new Simulation(clock, population, graph, sampler, selector, dispatcher, manager, random);
    }

    /**
     * Generates the starting users and the configured pages and registers them with the content
     * service. Pages take the lowest ids.
     *
     * @throws GatewayException if the content service rejects a registration
     */
    public static void populate(SimulationSettings settings, Population population, IActorFactory factory,
                                IContentService content, IRandomProvider random) throws GatewayException {
        for (int i = 0; i < settings.pages().sites().size(); i++) {
            long id = population.nextActorId();
            Actor page = factory.createPage(id, i, random.deriveFor("page", id));
            content.register(page, 0);
            population.add(page);
        }
        for (int i = 0; i < settings.startingAgents(); i++) {
            long id = population.nextActorId();
            Actor user = factory.createUser(id, 0, random.deriveFor("user", id));
            content.register(user, 0);
            population.add(user);
        }
        LOG.info("Generated {} pages and {} users", settings.pages().sites().size(), settings.startingAgents());
    }
}
