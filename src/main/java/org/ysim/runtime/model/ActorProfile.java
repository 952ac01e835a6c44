package org.ysim.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * Static profile attributes of an actor, sent to the content service on registration and
 * used to build language-model prompts.
 * <p>
 * The five personality fields hold the textual Big Five descriptors (for example
 * {@code "open to experience"}). Pages carry a {@code feedUrl}; users leave it {@code null}.
 *
 * @param email          contact address registered with the content service
 * @param age            age in years
 * @param gender         free-form gender label
 * @param nationality    nationality label
 * @param language       language the actor writes in
 * @param leaning        political leaning
 * @param education      education level
 * @param toxicity       toxicity level label (for example {@code "no"}, {@code "low"})
 * @param openness       Big Five openness descriptor
 * @param conscientiousness Big Five conscientiousness descriptor
 * @param extraversion   Big Five extraversion descriptor
 * @param agreeableness  Big Five agreeableness descriptor
 * @param neuroticism    Big Five neuroticism descriptor
 * @param interests      initial interests
 * @param feedUrl        news feed of a page, or {@code null}
 */
public record ActorProfile(
        String email,
        int age,
        String gender,
        String nationality,
        String language,
        String leaning,
        String education,
        String toxicity,
        String openness,
        String conscientiousness,
        String extraversion,
        String agreeableness,
        String neuroticism,
        List<String> interests,
        String feedUrl) {

    public ActorProfile {
        Objects.requireNonNull(email, "email");
        if (age < 0) {
            throw new IllegalArgumentException("age must be >= 0, got " + age);
        }
        interests = interests == null ? List.of() : List.copyOf(interests);
    }

    /**
     * Renders the personality as a single descriptive line for prompts.
     */
    public String personality() {
        return String.join(", ", openness, conscientiousness, extraversion, agreeableness, neuroticism);
    }
}
