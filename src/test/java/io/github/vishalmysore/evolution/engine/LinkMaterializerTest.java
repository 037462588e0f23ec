package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.EventType;
import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.domain.ScoringMethod;
import io.github.vishalmysore.evolution.scoring.PairScore;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static io.github.vishalmysore.evolution.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class LinkMaterializerTest {

    private final Event from = event("evt_1", "2008-09-12", EventType.LIQUIDITY_WARNING);
    private final Event to = event("evt_2", "2008-09-15", EventType.BANKRUPTCY);

    private PairScore pair(double composite) {
        return new PairScore(from, to, Map.of(ScoringMethod.TEMPORAL, composite), composite, true, "why");
    }

    @Test
    void emitsLinkAtOrAboveThreshold() {
        LinkMaterializer materializer = new LinkMaterializer(0.5, 365);
        Optional<EvolutionLink> link = materializer.materialize(pair(0.5));
        assertTrue(link.isPresent());
        assertEquals("evt_1", link.get().getFromEventId());
        assertEquals("evt_2", link.get().getToEventId());
        assertEquals(3, link.get().getDayGap());
        assertEquals(EventType.BANKRUPTCY, link.get().getToType());
        assertTrue(link.get().isDegraded());
        assertEquals("why", link.get().getExplanation());
        assertEquals(0.5, link.get().getComponentScore(ScoringMethod.TEMPORAL), 1e-9);
    }

    @Test
    void dropsLinksBelowThresholdOrOutsideWindow() {
        assertTrue(new LinkMaterializer(0.5, 365).materialize(pair(0.4999)).isEmpty());
        assertTrue(new LinkMaterializer(0.1, 2).materialize(pair(0.9)).isEmpty());
    }
}
