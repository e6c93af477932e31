package com.patternscope.simulator.service;

import com.patternscope.simulator.model.TrafficEventEntity;
import com.patternscope.simulator.repository.TrafficEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

class TrafficSeedServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-08T00:00:00Z");

    @Mock
    private TrafficEventRepository trafficEventRepository;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    @SuppressWarnings("unchecked")
    void savesOrderedBatchWithinWindow() {
        TrafficSeedService service = new TrafficSeedService(trafficEventRepository, clock, 300, 7, 42L, 0.05);

        int saved = service.seed();

        assertThat(saved).isEqualTo(300);
        ArgumentCaptor<List<TrafficEventEntity>> captor = ArgumentCaptor.forClass(List.class);
        verify(trafficEventRepository).saveAll(captor.capture());
        List<TrafficEventEntity> events = captor.getValue();
        assertThat(events).hasSize(300)
                .isSortedAccordingTo(Comparator.comparing(TrafficEventEntity::getTimestamp))
                .allSatisfy(event -> assertThat(event.getTimestamp())
                        .isBetween(NOW.minusSeconds(7 * 86_400), NOW));
    }

    @Test
    void rejectsEmptyWindow() {
        assertThatThrownBy(() -> new TrafficSeedService(trafficEventRepository, clock, 10, 0, 42L, 0.05))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
