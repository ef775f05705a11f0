package sbhackathon.koala.goldenPath.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class OnboardingEventPublisherTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-10-17T09:00:00Z"), ZoneOffset.UTC);
    private final OnboardingEventPublisher publisher = new OnboardingEventPublisher(clock);

    @Test
    void publish_deliversEventToListeners() {
        List<OnboardingEvent> received = new ArrayList<>();
        publisher.subscribe(received::add);

        publisher.publish(OnboardingState.PROVISIONING, OnboardingEvent.Outcome.SUCCEEDED, "inventory-api", "ok");

        assertThat(received).singleElement().satisfies(event -> {
            assertThat(event.stage()).isEqualTo(OnboardingState.PROVISIONING);
            assertThat(event.outcome()).isEqualTo(OnboardingEvent.Outcome.SUCCEEDED);
            assertThat(event.appName()).isEqualTo("inventory-api");
            assertThat(event.timestamp()).isEqualTo(Instant.parse("2026-10-17T09:00:00Z"));
        });
    }

    @Test
    void publish_failingListenerDoesNotStopOthers() {
        List<OnboardingEvent> received = new ArrayList<>();
        publisher.subscribe(event -> {
            throw new IllegalStateException("listener down");
        });
        publisher.subscribe(received::add);

        publisher.publish(OnboardingState.EXTRACTING, OnboardingEvent.Outcome.STARTED, null, "Stage started");

        assertThat(received).hasSize(1);
    }

    @Test
    void unsubscribe_stopsDelivery() {
        List<OnboardingEvent> received = new ArrayList<>();
        Consumer<OnboardingEvent> listener = received::add;
        publisher.subscribe(listener);
        publisher.unsubscribe(listener);

        publisher.publish(OnboardingState.EXTRACTING, OnboardingEvent.Outcome.STARTED, null, "Stage started");

        assertThat(received).isEmpty();
    }

    @Test
    void format_isKeyValueLine() {
        OnboardingEvent event = new OnboardingEvent(OnboardingState.REGISTERING, OnboardingEvent.Outcome.FAILED,
                "inventory-api", Instant.parse("2026-10-17T09:00:00Z"), "kubectl said \"no\"\nbye");

        assertThat(OnboardingEventPublisher.format(event)).isEqualTo(
                "onboarding-event stage=REGISTERING outcome=FAILED app=inventory-api "
                        + "timestamp=2026-10-17T09:00:00Z message=\"kubectl said \\\"no\\\" bye\"");
    }

    @Test
    void format_marksMissingAppName() {
        OnboardingEvent event = new OnboardingEvent(OnboardingState.START, OnboardingEvent.Outcome.FAILED,
                null, Instant.parse("2026-10-17T09:00:00Z"), "Preconditions not met");

        assertThat(OnboardingEventPublisher.format(event)).contains(" app=- ");
    }
}
