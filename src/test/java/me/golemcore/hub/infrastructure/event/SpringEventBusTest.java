package me.golemcore.hub.infrastructure.event;

import me.golemcore.hub.domain.model.LoopState;
import me.golemcore.hub.domain.model.LoopTransition;
import me.golemcore.hub.domain.model.TaskTransitionEvent;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringEventBusTest {

    private final ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
    private final SpringEventBus eventBus = new SpringEventBus(publisher);

    @Test
    void shouldForwardEventToPublisher() {
        TaskTransitionEvent event = event();

        eventBus.publish(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void shouldNotPropagateListenerFailure() {
        doThrow(new IllegalStateException("disk full")).when(publisher).publishEvent(any(Object.class));

        assertDoesNotThrow(() -> eventBus.publish(event()));
    }

    private static TaskTransitionEvent event() {
        LoopTransition transition = LoopTransition.builder()
                .from(LoopState.IDLE)
                .to(LoopState.PLANNING)
                .reason("task started")
                .build();
        return new TaskTransitionEvent("s1", "t1", transition);
    }
}
