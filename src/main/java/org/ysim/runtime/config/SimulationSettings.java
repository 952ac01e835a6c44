package org.ysim.runtime.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.ysim.runtime.dispatch.FractionalResourcePool;
import org.ysim.runtime.model.ActionKind;
import org.ysim.runtime.model.ActionLikelihood;
import org.ysim.runtime.model.ActorKind;
import org.ysim.runtime.model.HourlyActivityTable;
import org.ysim.runtime.model.RateSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed, validated view of the run configuration.
 * <p>
 * {@link #from(Config)} expects a resolved configuration that already contains the defaults of
 * {@code reference.conf}. Every problem is reported as a {@link ConfigurationException} before
 * any component is built, so an invalid configuration never starts a run.
 *
 * @param name             run name, used in log lines and the summary
 * @param days             number of simulated days
 * @param slotsPerDay      hours per day
 * @param startingAgents   users created at initialization (ignored when a snapshot is loaded)
 * @param seed             seed of the run-level random provider
 * @param populationOutput file the live population is saved to, empty to disable
 * @param hourlyActivity   user activity per hour
 * @param userActions      action distribution of users
 * @param pages            page configuration
 * @param agents           user behaviour and profile pools
 * @param population       churn, recruitment and daily follow evaluation
 * @param dispatch         worker pools and resource budget
 * @param servers          external endpoints
 * @param recommenders     recommender strategy names and limits
 * @param prompts          prompt templates by key
 * @param telemetryEnabled whether per-action telemetry is written
 */
public record SimulationSettings(
        String name,
        int days,
        int slotsPerDay,
        int startingAgents,
        long seed,
        String populationOutput,
        HourlyActivityTable hourlyActivity,
        ActionLikelihood userActions,
        PageSettings pages,
        AgentSettings agents,
        PopulationSettings population,
        DispatchSettings dispatch,
        ServerSettings servers,
        RecommenderSettings recommenders,
        Map<String, String> prompts,
        boolean telemetryEnabled) {

    /**
     * One news site run by a page actor.
     */
    public record PageSite(String name, String feedUrl, String leaning, List<String> topics) {
    }

    /**
     * @param sites          configured news sites, one page actor each
     * @param actions        action distribution of pages
     * @param hourlyActivity publishing probability per hour, or {@code null} to publish in every slot
     */
    public record PageSettings(List<PageSite> sites, ActionLikelihood actions, HourlyActivityTable hourlyActivity) {
    }

    /**
     * Pools user profiles are drawn from.
     */
    public record ProfilePools(
            int minAge,
            int maxAge,
            List<String> genders,
            List<String> nationalities,
            List<String> languages,
            List<String> leanings,
            List<String> education,
            List<String> toxicity,
            List<String> openness,
            List<String> conscientiousness,
            List<String> extraversion,
            List<String> agreeableness,
            List<String> neuroticism) {
    }

    /**
     * @param roundActionsMin   lower bound of the per-day active-slot budget, 0 = unbounded
     * @param roundActionsMax   upper bound of the per-day active-slot budget
     * @param activityVariance  half-width of the uniform personal activity multiplier around 1
     * @param annotateEmotions  extract emotions from generated content
     * @param emotions          emotion vocabulary
     * @param interests         interest pool
     * @param interestsPerAgent interests drawn per new user
     * @param attentionWindow   slots of history the service considers for interests
     * @param maxThreadLength   posts of a conversation shown when commenting
     * @param secondaryFollow   chance of asking, after a comment or reaction, whether to follow or
     *                          unfollow the author of the post; 0 disables the question
     * @param profiles          profile attribute pools
     */
    public record AgentSettings(
            int roundActionsMin,
            int roundActionsMax,
            double activityVariance,
            boolean annotateEmotions,
            List<String> emotions,
            List<String> interests,
            int interestsPerAgent,
            int attentionWindow,
            int maxThreadLength,
            double secondaryFollow,
            ProfilePools profiles) {
    }

    /**
     * @param churn                  users removed per day
     * @param recruitment            users added per day
     * @param recruitmentBasis       base population of a percentage recruitment
     * @param dailyFollowProbability chance of a user being selected for follow evaluation each day
     * @param followActiveOnly       restrict follow evaluation to users active that day
     */
    public record PopulationSettings(
            RateSpec churn,
            RateSpec recruitment,
            RecruitmentBasis recruitmentBasis,
            double dailyFollowProbability,
            boolean followActiveOnly) {
    }

    public enum RecruitmentBasis {
        /** Live user count after churn. */
        POPULATION,
        /** Number of distinct users active during the day. */
        DAILY_ACTIVE
    }

    /**
     * @param mode          parallel pools or inline execution
     * @param lightWorkers  CPU pool size, 0 = available processors
     * @param lightRetries  extra attempts for idempotent actions after transient failures
     * @param heavyCapacity logical accelerator capacity
     * @param heavyUnit     capacity share of one heavy task
     * @param queueDepth    heavy intents that may wait beyond the running ones
     * @param actionTimeout bound of every external call
     */
    public record DispatchSettings(
            Mode mode,
            int lightWorkers,
            int lightRetries,
            double heavyCapacity,
            double heavyUnit,
            int queueDepth,
            Duration actionTimeout) {

        public enum Mode {
            PARALLEL,
            SEQUENTIAL
        }

        /**
         * @return the number of heavy tasks allowed to run at the same time
         */
        public int heavySlots() {
            return FractionalResourcePool.slotsFor(heavyCapacity, heavyUnit);
        }
    }

    /**
     * @param llmBackend which language backend answers prompts; {@code OFFLINE} needs none of the
     *                   other llm settings
     */
    public record ServerSettings(
            String contentApi,
            String llmUrl,
            String llmModel,
            String llmApiKey,
            double temperature,
            int maxTokens,
            LlmBackend llmBackend) {

        public enum LlmBackend {
            /** OpenAI-compatible chat completions endpoint at {@code llm.url}. */
            OPENAI,
            /** Scripted answers without any model, for dry runs. */
            OFFLINE
        }
    }

    /**
     * @param contentStrategy name of the content recommender
     * @param followStrategy  name of the follow recommender
     * @param postLimit       posts requested per feed
     * @param followLimit     candidates requested per follow evaluation
     * @param leaningBias     weight of same-leaning candidates in follow recommendation
     * @param visibilitySlots slots a post stays eligible for content recommendation
     */
    public record RecommenderSettings(
            String contentStrategy,
            String followStrategy,
            int postLimit,
            int followLimit,
            double leaningBias,
            int visibilitySlots) {
    }

    /**
     * Builds and validates the settings.
     *
     * @param config resolved configuration including reference defaults
     * @return the settings
     * @throws ConfigurationException if any value is missing, malformed or out of range
     */
    public static SimulationSettings from(Config config) {
        try {
            return parse(config);
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static SimulationSettings parse(Config root) {
        Config sim = root.getConfig("simulation");
        int days = positive(sim, "days");
        int slotsPerDay = positive(sim, "slots-per-day");
        int startingAgents = nonNegative(sim, "starting-agents");
        if (!sim.hasPath("hourly-activity")) {
            throw new ConfigurationException("simulation.hourly-activity is missing: "
                    + "every run needs an hourly activity table");
        }
        HourlyActivityTable hourly = hourlyTable(sim.getObject("hourly-activity"), slotsPerDay,
                "simulation.hourly-activity");
        ActionLikelihood userActions = likelihood(sim, "actions-likelihood", ActorKind.USER,
                "simulation.actions-likelihood");

        SimulationSettings settings = new SimulationSettings(
                sim.getString("name"),
                days,
                slotsPerDay,
                startingAgents,
                sim.getLong("seed"),
                sim.getString("population-output"),
                hourly,
                userActions,
                pages(root.getConfig("pages"), slotsPerDay),
                agents(root.getConfig("agents")),
                population(root.getConfig("population")),
                dispatch(root.getConfig("dispatch")),
                servers(root.getConfig("servers")),
                recommenders(root.getConfig("recommenders")),
                prompts(root.getConfig("prompts")),
                root.getBoolean("telemetry.enabled"));
        return settings;
    }

    static HourlyActivityTable hourlyTable(ConfigObject table, int slotsPerDay, String path) {
        Map<Integer, Double> fractions = new HashMap<>();
        for (Map.Entry<String, ConfigValue> entry : table.entrySet()) {
            int hour;
            try {
                hour = Integer.parseInt(entry.getKey().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(path + ": hour key '" + entry.getKey() + "' is not a number", e);
            }
            if (hour < 0 || hour >= slotsPerDay) {
                throw new ConfigurationException(path + ": hour " + hour + " is outside 0.." + (slotsPerDay - 1));
            }
            double fraction = number(entry.getValue(), path + "." + entry.getKey());
            if (fraction < 0.0 || fraction > 1.0) {
                throw new ConfigurationException(path + ": fraction for hour " + hour
                        + " must be within [0, 1], got " + fraction);
            }
            fractions.put(hour, fraction);
        }
        return new HourlyActivityTable(slotsPerDay, fractions);
    }

    static ActionLikelihood likelihood(Config section, String key, ActorKind actorKind, String path) {
        if (!section.hasPath(key)) {
            return new ActionLikelihood(Map.of(), 0.0);
        }
        Map<ActionKind, Double> weights = new EnumMap<>(ActionKind.class);
        double none = 0.0;
        for (Map.Entry<String, ConfigValue> entry : section.getObject(key).entrySet()) {
            String name = entry.getKey();
            double weight = number(entry.getValue(), path + "." + name);
            if (weight < 0.0) {
                throw new ConfigurationException(path + "." + name + " must be >= 0, got " + weight);
            }
            if (ActionLikelihood.NONE_KEY.equalsIgnoreCase(name.trim())) {
                none = weight;
                continue;
            }
            ActionKind kind = ActionKind.fromConfigKey(name).orElseThrow(() ->
                    new ConfigurationException(path + ": unknown action '" + name + "'"));
            if (weight > 0.0 && !kind.isAllowedFor(actorKind)) {
                throw new ConfigurationException(path + ": action '" + name + "' is not available to "
                        + actorKind.name().toLowerCase(Locale.ROOT) + "s");
            }
            weights.put(kind, weight);
        }
        return new ActionLikelihood(weights, none);
    }

    private static PageSettings pages(Config pages, int slotsPerDay) {
        List<PageSite> sites = new ArrayList<>();
        for (Config site : pages.getConfigList("sites")) {
            sites.add(new PageSite(
                    site.getString("name"),
                    site.hasPath("feed") ? site.getString("feed") : null,
                    site.hasPath("leaning") ? site.getString("leaning") : "",
                    site.hasPath("topics") ? site.getStringList("topics") : List.of()));
        }
        HourlyActivityTable hourly = pages.hasPath("hourly-activity")
                ? hourlyTable(pages.getObject("hourly-activity"), slotsPerDay, "pages.hourly-activity")
                : null;
        return new PageSettings(List.copyOf(sites),
                likelihood(pages, "actions-likelihood", ActorKind.PAGE, "pages.actions-likelihood"), hourly);
    }

    private static AgentSettings agents(Config agents) {
        int min = nonNegative(agents, "round-actions.min");
        int max = nonNegative(agents, "round-actions.max");
        if (max < min) {
            throw new ConfigurationException("agents.round-actions.max (" + max
                    + ") must not be below agents.round-actions.min (" + min + ")");
        }
        double variance = agents.getDouble("activity-variance");
        if (variance < 0.0 || variance > 1.0) {
            throw new ConfigurationException("agents.activity-variance must be within [0, 1], got " + variance);
        }
        List<String> emotions = new ArrayList<>();
        for (String e : agents.getStringList("emotions")) {
            emotions.add(e.trim().toLowerCase(Locale.ROOT));
        }
        double secondaryFollow = agents.getDouble("probability-of-secondary-follow");
        if (secondaryFollow < 0.0 || secondaryFollow > 1.0) {
            throw new ConfigurationException("agents.probability-of-secondary-follow must be within [0, 1], got "
                    + secondaryFollow);
        }
        Config p = agents.getConfig("profiles");
        int minAge = nonNegative(p, "age.min");
        int maxAge = nonNegative(p, "age.max");
        if (maxAge < minAge) {
            throw new ConfigurationException("agents.profiles.age.max must not be below age.min");
        }
        ProfilePools pools = new ProfilePools(minAge, maxAge,
                nonEmpty(p, "genders"), nonEmpty(p, "nationalities"), nonEmpty(p, "languages"),
                nonEmpty(p, "leanings"), nonEmpty(p, "education"), nonEmpty(p, "toxicity"),
                nonEmpty(p, "big-five.openness"), nonEmpty(p, "big-five.conscientiousness"),
                nonEmpty(p, "big-five.extraversion"), nonEmpty(p, "big-five.agreeableness"),
                nonEmpty(p, "big-five.neuroticism"));
        return new AgentSettings(min, max, variance,
                agents.getBoolean("annotate-emotions"),
                List.copyOf(emotions),
                agents.getStringList("interests"),
                nonNegative(agents, "interests-per-agent"),
                positive(agents, "attention-window"),
                positive(agents, "max-thread-length"),
                secondaryFollow,
                pools);
    }

    private static PopulationSettings population(Config population) {
        RateSpec churn = rate(population.getConfig("churn"), "population.churn");
        Config recruitmentConfig = population.getConfig("recruitment");
        RateSpec recruitment = rate(recruitmentConfig, "population.recruitment");
        RecruitmentBasis basis;
        String basisName = recruitmentConfig.getString("basis").trim().toLowerCase(Locale.ROOT);
        switch (basisName) {
            case "population" -> basis = RecruitmentBasis.POPULATION;
            case "daily-active" -> basis = RecruitmentBasis.DAILY_ACTIVE;
            default -> throw new ConfigurationException("population.recruitment.basis must be population or "
                    + "daily-active, got '" + basisName + "'");
        }
        if (basis == RecruitmentBasis.DAILY_ACTIVE && recruitment.mode() == RateSpec.Mode.FIXED
                && !recruitment.isDisabled()) {
            throw new ConfigurationException("population.recruitment.basis = daily-active requires "
                    + "mode = percentage: a fixed count has no basis");
        }
        double follow = population.getDouble("follow.probability");
        if (follow < 0.0 || follow > 1.0) {
            throw new ConfigurationException("population.follow.probability must be within [0, 1], got " + follow);
        }
        return new PopulationSettings(churn, recruitment, basis, follow, population.getBoolean("follow.active-only"));
    }

    private static RateSpec rate(Config rate, String path) {
        RateSpec.Mode mode;
        try {
            mode = RateSpec.Mode.parse(rate.getString("mode"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(path + ".mode: " + e.getMessage(), e);
        }
        double value = rate.getDouble("value");
        try {
            return new RateSpec(mode, value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(path + ": " + e.getMessage(), e);
        }
    }

    private static DispatchSettings dispatch(Config dispatch) {
        DispatchSettings.Mode mode;
        String modeName = dispatch.getString("mode").trim().toUpperCase(Locale.ROOT);
        try {
            mode = DispatchSettings.Mode.valueOf(modeName);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("dispatch.mode must be parallel or sequential, got '"
                    + dispatch.getString("mode") + "'", e);
        }
        double capacity = dispatch.getDouble("heavy.capacity");
        double unit = dispatch.getDouble("heavy.unit");
        if (!(capacity > 0.0)) {
            throw new ConfigurationException("dispatch.heavy.capacity must be > 0, got " + capacity);
        }
        if (!(unit > 0.0) || unit > capacity) {
            throw new ConfigurationException("dispatch.heavy.unit must lie in (0, " + capacity + "], got " + unit);
        }
        Duration timeout = dispatch.getDuration("action-timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("dispatch.action-timeout must be positive, got " + timeout);
        }
        return new DispatchSettings(mode,
                nonNegative(dispatch, "light.workers"),
                nonNegative(dispatch, "light.retries"),
                capacity, unit,
                nonNegative(dispatch, "heavy.queue-depth"),
                timeout);
    }

    private static ServerSettings servers(Config servers) {
        ServerSettings.LlmBackend backend;
        String backendName = servers.getString("llm.backend").trim().toUpperCase(Locale.ROOT);
        try {
            backend = ServerSettings.LlmBackend.valueOf(backendName);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("servers.llm.backend must be openai or offline, got '"
                    + servers.getString("llm.backend") + "'", e);
        }
        return new ServerSettings(
                servers.getString("content.api"),
                servers.getString("llm.url"),
                servers.getString("llm.model"),
                servers.getString("llm.api-key"),
                servers.getDouble("llm.temperature"),
                servers.getInt("llm.max-tokens"),
                backend);
    }

    private static RecommenderSettings recommenders(Config recommenders) {
        return new RecommenderSettings(
                recommenders.getString("content"),
                recommenders.getString("follow"),
                positive(recommenders, "posts"),
                positive(recommenders, "follow-candidates"),
                recommenders.getDouble("leaning-bias"),
                positive(recommenders, "visibility-slots"));
    }

    private static Map<String, String> prompts(Config prompts) {
        Map<String, String> result = new HashMap<>();
        for (Map.Entry<String, ConfigValue> entry : prompts.root().entrySet()) {
            if (entry.getValue().valueType() != ConfigValueType.STRING) {
                throw new ConfigurationException("prompts." + entry.getKey() + " must be a string");
            }
            result.put(entry.getKey(), (String) entry.getValue().unwrapped());
        }
        return Map.copyOf(result);
    }

    private static double number(ConfigValue value, String path) {
        if (value.valueType() != ConfigValueType.NUMBER) {
            throw new ConfigurationException(path + " must be a number, got " + value.render());
        }
        return ((Number) value.unwrapped()).doubleValue();
    }

    private static int positive(Config config, String path) {
        int value = config.getInt(path);
        if (value <= 0) {
            throw new ConfigurationException(path + " must be > 0, got " + value);
        }
        return value;
    }

    private static int nonNegative(Config config, String path) {
        int value = config.getInt(path);
        if (value < 0) {
            throw new ConfigurationException(path + " must be >= 0, got " + value);
        }
        return value;
    }

    private static List<String> nonEmpty(Config config, String path) {
        List<String> values = config.getStringList(path);
        if (values.isEmpty()) {
            throw new ConfigurationException(path + " must not be empty");
        }
        return List.copyOf(values);
    }

    /**
     * @return the total number of slots of the run
     */
    public long totalSlots() {
        return (long) days * slotsPerDay;
    }
}
