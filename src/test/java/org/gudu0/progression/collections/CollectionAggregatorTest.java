package org.gudu0.progression.collections;

import org.gudu0.progression.counters.CounterStore;
import org.gudu0.progression.events.AnalyticsSink;
import org.gudu0.progression.events.CollectionCompleted;
import org.gudu0.progression.events.EventDispatcher;
import org.gudu0.progression.events.ItemCollected;
import org.gudu0.progression.events.NotificationService;
import org.gudu0.progression.persistence.SaveData;
import org.gudu0.progression.persistence.StatePersister;
import org.gudu0.progression.rewards.RewardGrant;
import org.gudu0.progression.rewards.RewardGrantException;
import org.gudu0.progression.rewards.RewardGrantService;
import org.gudu0.progression.rewards.RewardKind;
import org.gudu0.progression.rewards.RewardManifest;
import org.gudu0.progression.rewards.RewardSource;
import org.gudu0.progression.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.gudu0.progression.testutil.Defs.coinsAndGems;
import static org.gudu0.progression.testutil.Defs.collection;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class CollectionAggregatorTest {

    @Mock
    private NotificationService notifications;

    @Mock
    private AnalyticsSink analytics;

    @Mock
    private RewardGrantService rewards;

    @Mock
    private StatePersister persister;

    private CounterStore counters;
    private CollectionAggregator collections;

    @BeforeEach
    void setUp() {
        counters = new CounterStore();
        collections = new CollectionAggregator(
                List.of(
                        collection("gems_collection", coinsAndGems(5000, 200), "red_gem", "blue_gem", "diamond"),
                        collection("trophies", RewardManifest.none(), "bronze", "silver")
                ),
                counters,
                new EventDispatcher(notifications, analytics),
                rewards, persister, new MutableClock(10_000L));
    }

    @Test
    void testCollectBumpsItemsCollectedCounter() {
        assertTrue(collections.collect("gems_collection", "red_gem"));
        assertTrue(collections.collect("trophies", "bronze"));

        assertEquals(2, counters.get(CollectionAggregator.ITEMS_COLLECTED));
        assertTrue(collections.isCollected("gems_collection", "red_gem"));
        verify(notifications, times(2)).notify(any(ItemCollected.class));
    }

    @Test
    void testDuplicateCollectIsNoop() {
        collections.collect("gems_collection", "red_gem");
        clearInvocations(notifications, analytics, persister);

        assertFalse(collections.collect("gems_collection", "red_gem"));

        assertEquals(1, counters.get(CollectionAggregator.ITEMS_COLLECTED));
        verifyNoInteractions(notifications, analytics, persister);
    }

    @Test
    void testUnknownIdsAreIgnored() {
        assertFalse(collections.collect("missing", "red_gem"));
        assertFalse(collections.collect("gems_collection", "emerald"));
        assertFalse(collections.collect(null, null));

        assertEquals(0, counters.get(CollectionAggregator.ITEMS_COLLECTED));
        verifyNoInteractions(notifications, analytics, persister);
    }

    @Test
    void testCompletionFiresOnceAndGrantsOnce() throws Exception {
        collections.collect("gems_collection", "red_gem");
        collections.collect("gems_collection", "blue_gem");
        assertFalse(collections.isCompleted("gems_collection"));

        collections.collect("gems_collection", "diamond");
        assertTrue(collections.isCompleted("gems_collection"));
        assertEquals(0, collections.evaluate());

        verify(notifications, times(1)).notify(any(CollectionCompleted.class));

        ArgumentCaptor<RewardGrant> captor = ArgumentCaptor.forClass(RewardGrant.class);
        verify(rewards, times(1)).grant(captor.capture());
        assertEquals(RewardSource.COLLECTION, captor.getValue().source());
        assertEquals("gems_collection", captor.getValue().sourceId());
        assertEquals(5000, captor.getValue().manifest().total(RewardKind.CURRENCY));
        assertEquals(200, captor.getValue().manifest().total(RewardKind.PREMIUM_CURRENCY));
    }

    @Test
    void testCompletionWithoutRewardsStillEmits() throws Exception {
        collections.collect("trophies", "bronze");
        collections.collect("trophies", "silver");

        assertTrue(collections.isCompleted("trophies"));
        assertFalse(collections.isGrantPending("trophies"));
        verify(notifications, times(1)).notify(new CollectionCompleted("trophies"));
        verifyNoInteractions(rewards);
    }

    @Test
    void testFailedCompletionGrantIsRetried() throws Exception {
        doThrow(new RewardGrantException("inventory down"))
                .doNothing()
                .when(rewards).grant(any());

        collections.collect("trophies", "bronze");
        collections.collect("gems_collection", "red_gem");
        collections.collect("gems_collection", "blue_gem");
        collections.collect("gems_collection", "diamond");

        assertTrue(collections.isCompleted("gems_collection"));
        assertTrue(collections.isGrantPending("gems_collection"));

        assertEquals(1, collections.retryPendingGrants());
        assertFalse(collections.isGrantPending("gems_collection"));
        verify(rewards, times(2)).grant(any());
    }

    @Test
    void testCompletionPercentage() {
        assertEquals(0, CollectionAggregator.completionPercentage(0, 6));
        assertEquals(16, CollectionAggregator.completionPercentage(1, 6));
        assertEquals(66, CollectionAggregator.completionPercentage(4, 6));
        assertEquals(99, CollectionAggregator.completionPercentage(199, 200));
        assertEquals(100, CollectionAggregator.completionPercentage(6, 6));
        assertEquals(0, CollectionAggregator.completionPercentage(0, 0));

        collections.collect("trophies", "bronze");
        CollectionView trophies = collections.views().get(1);
        assertEquals("trophies", trophies.id());
        assertEquals(50, trophies.completionPercentage());
        assertTrue(trophies.items().get(0).collected());
        assertEquals(10_000L, trophies.items().get(0).collectedAtMillis());
        assertFalse(trophies.items().get(1).collected());
    }

    @Test
    void testRestoreDoesNotRegrantCompletedCollection() throws Exception {
        collections.restore(Map.of("trophies", new SaveData.CollectionRecord(true, true, false, Map.of(
                "bronze", new SaveData.ItemRecord(true, 5L),
                "silver", new SaveData.ItemRecord(true, 6L),
                "platinum", new SaveData.ItemRecord(true, 7L)))));

        assertTrue(collections.isCompleted("trophies"));
        assertEquals(0, collections.evaluate());
        verifyNoInteractions(rewards, notifications);
    }

    @Test
    void testGrownCollectionIsIncompleteButNotRegranted() throws Exception {
        // saved when the collection only had two items and was finished
        collections.restore(Map.of("gems_collection", new SaveData.CollectionRecord(true, true, false, Map.of(
                "red_gem", new SaveData.ItemRecord(true, 1L),
                "blue_gem", new SaveData.ItemRecord(true, 2L)))));

        assertFalse(collections.isCompleted("gems_collection"));

        collections.collect("gems_collection", "diamond");

        assertTrue(collections.isCompleted("gems_collection"));
        verify(rewards, never()).grant(any());
        verify(notifications, never()).notify(any(CollectionCompleted.class));
    }
}
