package org.ysim.client;

import org.ysim.runtime.config.SimulationSettings.AgentSettings;
import org.ysim.runtime.config.SimulationSettings.PageSettings;
import org.ysim.runtime.config.SimulationSettings.PageSite;
import org.ysim.runtime.config.SimulationSettings.ProfilePools;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorKind;
import org.ysim.runtime.model.ActorProfile;
import org.ysim.runtime.spi.IActorFactory;
import org.ysim.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Draws synthetic user profiles from the configured attribute pools and builds page actors from
 * the configured news sites.
 * <p>
 * All draws come from the provider passed per call, so a profile depends only on the seed of the
 * run and the actor id. Names carry the id as suffix and are therefore unique.
 */
public final class ProfileGenerator implements IActorFactory {

    private static final String[] SYLLABLES = {
            "al", "be", "ca", "da", "el", "fi", "go", "ha", "is", "jo", "ka", "li", "ma", "no",
            "or", "pe", "ra", "si", "ta", "ul", "va", "wen", "xi", "yo", "za"
    };

    private final AgentSettings agents;
    private final PageSettings pages;

    public ProfileGenerator(AgentSettings agents, PageSettings pages) {
        this.agents = Objects.requireNonNull(agents, "agents");
        this.pages = Objects.requireNonNull(pages, "pages");
    }

    @Override
    public Actor createUser(long id, int joinedDay, IRandomProvider random) {
        ProfilePools pools = agents.profiles();
        String name = name(random) + "_" + id;
        ActorProfile profile = new ActorProfile(
                name.toLowerCase(Locale.ROOT) + "@ysim.invalid",
                pools.minAge() + random.nextInt(pools.maxAge() - pools.minAge() + 1),
                pick(pools.genders(), random),
                pick(pools.nationalities(), random),
                pick(pools.languages(), random),
                pick(pools.leanings(), random),
                pick(pools.education(), random),
                pick(pools.toxicity(), random),
                pick(pools.openness(), random),
                pick(pools.conscientiousness(), random),
                pick(pools.extraversion(), random),
                pick(pools.agreeableness(), random),
                pick(pools.neuroticism(), random),
                sample(agents.interests(), agents.interestsPerAgent(), random),
                null);
        return new Actor(id, name, ActorKind.USER, profile, roundActions(random), activityScale(random),
                null, joinedDay);
    }

    @Override
    public Actor createPage(long id, int index, IRandomProvider random) {
        if (index < 0 || index >= pages.sites().size()) {
            throw new IllegalArgumentException("No page site at index " + index + ", "
                    + pages.sites().size() + " configured");
        }
        PageSite site = pages.sites().get(index);
        ProfilePools pools = agents.profiles();
        ActorProfile profile = new ActorProfile(
                site.name().replaceAll("\\s+", ".").toLowerCase(Locale.ROOT) + "@ysim.invalid",
                0,
                null,
                null,
                pools.languages().isEmpty() ? "English" : pools.languages().get(0),
                site.leaning(),
                null,
                "no",
                null,
                null,
                null,
                null,
                null,
                site.topics(),
                site.feedUrl());
        return new Actor(id, site.name(), ActorKind.PAGE, profile, 0, 1.0, null, 0);
    }

    private int roundActions(IRandomProvider random) {
        int min = agents.roundActionsMin();
        int max = agents.roundActionsMax();
        if (max <= 0) {
            return 0;
        }
        return min + random.nextInt(max - min + 1);
    }

    private double activityScale(IRandomProvider random) {
        double variance = agents.activityVariance();
        if (variance <= 0.0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 + (2.0 * random.nextDouble() - 1.0) * variance);
    }

    private static String name(IRandomProvider random) {
        int syllables = 2 + random.nextInt(2);
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < syllables; i++) {
            name.append(SYLLABLES[random.nextInt(SYLLABLES.length)]);
        }
        name.setCharAt(0, Character.toUpperCase(name.charAt(0)));
        return name.toString();
    }

    private static String pick(List<String> pool, IRandomProvider random) {
        return pool.isEmpty() ? null : pool.get(random.nextInt(pool.size()));
    }

    /**
     * Draws up to {@code count} distinct elements, keeping the pool order.
     */
    static List<String> sample(List<String> pool, int count, IRandomProvider random) {
        List<String> remaining = new ArrayList<>(pool);
        List<Integer> chosen = new ArrayList<>();
        int n = Math.min(count, remaining.size());
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < remaining.size(); i++) {
            indices.add(i);
        }
        for (int i = 0; i < n; i++) {
            chosen.add(indices.remove(random.nextInt(indices.size())));
        }
        chosen.sort(null);
        List<String> result = new ArrayList<>(n);
        for (int index : chosen) {
            result.add(remaining.get(index));
        }
        return result;
    }
}
