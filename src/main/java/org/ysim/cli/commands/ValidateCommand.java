package org.ysim.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.cli.CommandLineInterface;
import org.ysim.client.ContentStrategy;
import org.ysim.client.FollowStrategy;
import org.ysim.runtime.config.ConfigurationException;
import org.ysim.runtime.config.SimulationSettings;
import org.ysim.runtime.dispatch.Dispatcher;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Checks a configuration without contacting any external service and prints the effective run shape.
 */
@Command(
    name = "validate",
    description = "Validate the configuration and print the effective settings"
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        SimulationSettings settings;
        ContentStrategy content;
        FollowStrategy follow;
        try {
            settings = SimulationSettings.from(parent.loadConfig(java.util.Map.of()));
            content = ContentStrategy.fromName(settings.recommenders().contentStrategy());
            follow = FollowStrategy.fromName(settings.recommenders().followStrategy());
        } catch (ConfigurationException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            return 1;
        }

        SimulationSettings.DispatchSettings dispatch = settings.dispatch();
        out.printf("Simulation:   %s, %d days x %d slots, seed %d%n", settings.name(), settings.days(),
                settings.slotsPerDay(), settings.seed());
        out.printf("Population:   %d users, %d pages, churn %s, recruitment %s (%s)%n", settings.startingAgents(),
                settings.pages().sites().size(), settings.population().churn(), settings.population().recruitment(),
                settings.population().recruitmentBasis());
        out.printf("Dispatch:     %s, %d light workers, %d heavy slots + %d queued, timeout %d ms%n",
                dispatch.mode(), Dispatcher.resolveWorkers(dispatch.lightWorkers()), dispatch.heavySlots(),
                dispatch.queueDepth(), dispatch.actionTimeout().toMillis());
        out.printf("Recommenders: content %s, follow %s%n", content.getDisplayName(), follow.getDisplayName());
        SimulationSettings.ServerSettings servers = settings.servers();
        if (servers.llmBackend() == SimulationSettings.ServerSettings.LlmBackend.OFFLINE) {
            out.println("Language:     offline (scripted answers)");
        } else {
            out.printf("Language:     %s at %s%n", servers.llmModel(), servers.llmUrl());
        }
        List<Integer> missing = settings.hourlyActivity().missingHours();
        if (!missing.isEmpty()) {
            out.printf("Hours without activity entry (treated as 0): %s%n", missing);
        }
        out.println("Configuration is valid.");
        out.flush();
        return 0;
    }
}
