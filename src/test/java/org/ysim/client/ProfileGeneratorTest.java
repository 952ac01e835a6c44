package org.ysim.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ysim.runtime.SimulationFixtures;
import org.ysim.runtime.config.SimulationSettings;
import org.ysim.runtime.internal.services.SeededRandomProvider;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorKind;

@Tag("unit")
class ProfileGeneratorTest {

    private final SimulationSettings settings = SimulationFixtures.settings("""
            agents.round-actions { min = 1, max = 3 }
            agents.activity-variance = 0.5
            pages.sites = [{ name = "Daily Post", feed = "https://daily.example.org/rss", leaning = "Republican",
                             topics = ["economy", "crime"] }]
            """);
    private final ProfileGenerator generator = new ProfileGenerator(settings.agents(), settings.pages());

    @Test
    void userIsDrawnFromPools() {
        Actor user = generator.createUser(12, 3, new SeededRandomProvider(1));

        assertThat(user.getKind()).isEqualTo(ActorKind.USER);
        assertThat(user.getName()).endsWith("_12");
        assertThat(user.getJoinedDay()).isEqualTo(3);
        assertThat(user.getRoundActions()).isBetween(1, 3);
        assertThat(user.getActivityScale()).isBetween(0.5, 1.5);
        assertThat(user.getProfile().age()).isBetween(18, 70);
        assertThat(user.getProfile().leaning()).isIn("Democrat", "Republican");
        assertThat(user.getProfile().interests()).hasSize(3).doesNotHaveDuplicates()
                .isSubsetOf(settings.agents().interests());
        assertThat(user.getProfile().feedUrl()).isNull();
    }

    @Test
    void sameDrawsGiveSameProfile() {
        Actor first = generator.createUser(4, 0, new SeededRandomProvider(99).deriveFor("recruit", 4));
        Actor second = generator.createUser(4, 0, new SeededRandomProvider(99).deriveFor("recruit", 4));

        assertThat(second.getName()).isEqualTo(first.getName());
        assertThat(second.getProfile()).isEqualTo(first.getProfile());
    }

    @Test
    void pageComesFromConfiguredSite() {
        Actor page = generator.createPage(1, 0, new SeededRandomProvider(1));

        assertThat(page.isPage()).isTrue();
        assertThat(page.getName()).isEqualTo("Daily Post");
        assertThat(page.getProfile().email()).isEqualTo("daily.post@ysim.invalid");
        assertThat(page.getProfile().feedUrl()).isEqualTo("https://daily.example.org/rss");
        assertThat(page.getProfile().interests()).containsExactly("economy", "crime");
    }

    @Test
    void pageIndexOutsideSitesIsRejected() {
        assertThatThrownBy(() -> generator.createPage(2, 1, new SeededRandomProvider(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    void sampleKeepsPoolOrder() {
        List<String> pool = List.of("a", "b", "c", "d", "e");

        List<String> drawn = ProfileGenerator.sample(pool, 3, new SeededRandomProvider(5));

        assertThat(drawn).hasSize(3).isSubsetOf(pool).isSortedAccordingTo(String::compareTo);
        assertThat(ProfileGenerator.sample(pool, 9, new SeededRandomProvider(5))).isEqualTo(pool);
    }
}
