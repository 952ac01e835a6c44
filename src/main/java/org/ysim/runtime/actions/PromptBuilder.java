package org.ysim.runtime.actions;

import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorProfile;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the configured prompt templates for an actor.
 * <p>
 * Templates use {@code {placeholder}} markers. The actor placeholders are {@code name},
 * {@code age}, {@code gender}, {@code nationality}, {@code language}, {@code leaning},
 * {@code education}, {@code toxicity}, {@code personality} and {@code interests}; handlers add
 * their own (for example {@code post_text}). Unknown placeholders are left untouched.
 */
public final class PromptBuilder {

    public static final String ROLEPLAY = "agent-roleplay";
    public static final String POST = "handler-post";
    public static final String COMMENT = "handler-comment";
    public static final String SHARE = "handler-share";
    public static final String REACTION = "handler-reactions";
    public static final String CAST = "handler-cast";
    public static final String FOLLOW = "handler-follow";
    public static final String NEWS = "handler-news";
    public static final String ANNOTATOR = "annotator";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private static final Map<String, String> DEFAULTS = Map.of(
            ROLEPLAY, "You are {name}, a {age} year old {gender} from {nationality} who writes in {language}. "
                    + "Political leaning: {leaning}. Education: {education}. Personality: {personality}. "
                    + "Toxicity: {toxicity}. Interests: {interests}.",
            POST, "Write a short social media post about one of your interests. Use at most two hashtags.",
            COMMENT, "Write a short comment to the following conversation, in character:\n{thread}",
            SHARE, "Write a short sentence to accompany sharing this post:\n{post_text}",
            REACTION, "Do you like this post? Answer only YES or NO.\n{post_text}",
            CAST, "Which side does this post make you lean towards? Answer only RIGHT, LEFT or NONE.\n{post_text}",
            FOLLOW, "After reading this post, do you want to {action} its author? Answer only YES or NO.\n{post_text}",
            NEWS, "Write a short post presenting the latest news about {topic} from {page}.",
            ANNOTATOR, "List the emotions expressed in this text, choosing only from: {emotions}.\n{text}");

    private final Map<String, String> templates;

    public PromptBuilder(Map<String, String> templates) {
        Map<String, String> merged = new HashMap<>(DEFAULTS);
        merged.putAll(templates);
        this.templates = Map.copyOf(merged);
    }

    /**
     * @return a builder with the built-in templates only
     */
    public static PromptBuilder defaults() {
        return new PromptBuilder(Map.of());
    }

    /**
     * Renders the system prompt describing the actor's persona.
     */
    public String persona(Actor actor) {
        return render(ROLEPLAY, actor, Map.of());
    }

    /**
     * Renders a template for an actor.
     *
     * @param key    template key, e.g. {@link #POST}
     * @param actor  the actor whose profile fills the actor placeholders
     * @param extras additional placeholder values
     * @return the rendered prompt
     * @throws IllegalArgumentException if no template has this key
     */
    public String render(String key, Actor actor, Map<String, String> extras) {
        String template = templates.get(key);
        if (template == null) {
            throw new IllegalArgumentException("No prompt template named '" + key + "'");
        }
        Map<String, String> values = actorValues(actor);
        values.putAll(extras);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Map<String, String> actorValues(Actor actor) {
        ActorProfile p = actor.getProfile();
        Map<String, String> values = new HashMap<>();
        values.put("name", actor.getName());
        values.put("age", Integer.toString(p.age()));
        values.put("gender", String.valueOf(p.gender()));
        values.put("nationality", String.valueOf(p.nationality()));
        values.put("language", String.valueOf(p.language()));
        values.put("leaning", String.valueOf(p.leaning()));
        values.put("education", String.valueOf(p.education()));
        values.put("toxicity", String.valueOf(p.toxicity()));
        values.put("personality", p.personality());
        values.put("interests", String.join(", ", actor.getInterests()));
        return values;
    }
}
