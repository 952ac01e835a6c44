package org.ysim.client;

import org.ysim.runtime.actions.TextTools;
import org.ysim.runtime.internal.services.SeededRandomProvider;
import org.ysim.runtime.spi.ILanguageBackend;
import org.ysim.runtime.spi.IRandomProvider;

import java.util.List;

/**
 * {@link ILanguageBackend} that answers without a model, for dry runs of the simulation loop
 * against a content service.
 * <p>
 * Prompts that offer RIGHT, LEFT or NONE, or YES or NO, get one of those options; every other
 * prompt gets a fixed text. The choice is drawn from a stream derived from the seed and the
 * prompts, so the same prompt always gets the same answer and concurrent calls need no locking.
 */
public final class OfflineLanguageBackend implements ILanguageBackend {

    static final String TEXT = "Just sharing a few thoughts on today's news.";

    private static final List<String> SIDES = List.of("RIGHT", "LEFT", "NONE");
    private static final List<String> DECISIONS = List.of("YES", "NO");

    private final SeededRandomProvider random;

    public OfflineLanguageBackend(long seed) {
        this.random = new SeededRandomProvider(seed);
    }

    @Override
    public String chat(String systemPrompt, String userPrompt) {
        List<String> options = optionsOf(userPrompt);
        if (options.isEmpty()) {
            return TEXT;
        }
        long key = 31L * systemPrompt.hashCode() + userPrompt.hashCode();
        IRandomProvider rng = random.deriveFor("prompt", key);
        return options.get(rng.nextInt(options.size()));
    }

    private static List<String> optionsOf(String prompt) {
        if (offersAll(prompt, SIDES)) {
            return SIDES;
        }
        if (offersAll(prompt, DECISIONS)) {
            return DECISIONS;
        }
        return List.of();
    }

    private static boolean offersAll(String prompt, List<String> options) {
        for (String option : options) {
            if (!TextTools.containsWord(prompt, option)) {
                return false;
            }
        }
        return true;
    }
}
