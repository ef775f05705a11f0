package sbhackathon.koala.goldenPath.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Emits one structured log line per stage event and hands the event to in-process listeners.
 */
@Slf4j
@Component
public class OnboardingEventPublisher {

    private final List<Consumer<OnboardingEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public OnboardingEventPublisher() {
        this(Clock.systemUTC());
    }

    OnboardingEventPublisher(Clock clock) {
        this.clock = clock;
    }

    public void subscribe(Consumer<OnboardingEvent> listener) {
        listeners.add(listener);
    }

    public void unsubscribe(Consumer<OnboardingEvent> listener) {
        listeners.remove(listener);
    }

    public OnboardingEvent publish(OnboardingState stage, OnboardingEvent.Outcome outcome,
                                   String appName, String message) {
        OnboardingEvent event = new OnboardingEvent(stage, outcome, appName, clock.instant(), message);

        String line = format(event);
        if (outcome == OnboardingEvent.Outcome.FAILED) {
            log.error(line);
        } else {
            log.info(line);
        }

        for (Consumer<OnboardingEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Onboarding event listener failed: {}", e.getMessage());
            }
        }
        return event;
    }

    static String format(OnboardingEvent event) {
        return "onboarding-event"
                + " stage=" + event.stage()
                + " outcome=" + event.outcome()
                + " app=" + (event.appName() != null ? event.appName() : "-")
                + " timestamp=" + event.timestamp()
                + " message=\"" + escape(event.message()) + "\"";
    }

    private static String escape(String message) {
        if (message == null) {
            return "";
        }
        return message.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", " ");
    }
}
