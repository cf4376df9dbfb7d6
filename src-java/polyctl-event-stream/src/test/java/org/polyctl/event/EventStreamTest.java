/* Copyright 2026 Telstra Open Source
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package org.polyctl.event;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.polyctl.config.provider.PropertiesBasedConfigurationProvider;
import org.polyctl.event.config.EventStreamConfig;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

public class EventStreamTest {
    private EventStream stream;

    private static EventStreamConfig config(int queueSize, int historySize, boolean autoDeactivate) {
        Properties properties = new Properties();
        properties.setProperty("event-stream.max-queue-size", String.valueOf(queueSize));
        properties.setProperty("event-stream.max-history-size", String.valueOf(historySize));
        properties.setProperty("event-stream.poll-timeout-ms", "50");
        properties.setProperty("event-stream.auto-deactivate-failed-subscribers", String.valueOf(autoDeactivate));
        return new PropertiesBasedConfigurationProvider(properties).getConfiguration(EventStreamConfig.class);
    }

    @AfterEach
    public void tearDown() {
        if (stream != null) {
            stream.stop();
        }
    }

    private int drain() throws InterruptedException {
        int count = 0;
        while (stream.processNext(0)) {
            count++;
        }
        return count;
    }

    private Event publish(String type, String controller, int priority) {
        return stream.publish(type, controller, "openflow", ImmutableMap.of("controller_id", controller), priority);
    }

    @Test
    public void defaultsAreApplied() {
        EventStreamConfig config = new PropertiesBasedConfigurationProvider(new Properties())
                .getConfiguration(EventStreamConfig.class);

        assertEquals(10000, config.getMaxQueueSize());
        assertEquals(1000, config.getMaxHistorySize());
        assertEquals(1000, config.getPollTimeoutMs());
        assertTrue(config.isAutoDeactivateFailedSubscribers());
        assertEquals(300, config.getCleanupIntervalSeconds());
        assertEquals(5000, config.getShutdownTimeoutMs());
    }

    @Test
    public void oldestEventsAreDroppedOnOverflow() throws Exception {
        stream = new EventStream(config(5, 10, true));

        List<Long> published = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            published.add(publish("tick", "c1", 1).getSequenceNumber());
        }

        EventStreamStats stats = stream.stats();
        assertEquals(3, stats.getDroppedEvents());
        assertEquals(5, stats.getQueueSize());

        assertEquals(5, drain());
        List<Long> recent = stream.recent(5).stream()
                .map(Event::getSequenceNumber)
                .collect(Collectors.toList());
        assertEquals(published.subList(3, 8), recent);
        assertEquals(5, stream.stats().getTotalEvents());
    }

    @Test
    public void sequenceNumbersGrow() {
        stream = new EventStream(config(10, 10, true));

        Event first = publish("tick", "c1", 1);
        Event second = publish("tick", "c1", 1);

        assertTrue(second.getSequenceNumber() > first.getSequenceNumber());
    }

    @Test
    public void historyKeepsNewestEvents() throws Exception {
        stream = new EventStream(config(100, 3, true));

        List<Long> published = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            published.add(publish("tick", "c1", 1).getSequenceNumber());
        }
        drain();

        List<Long> all = stream.recent(0).stream().map(Event::getSequenceNumber).collect(Collectors.toList());
        assertEquals(published.subList(3, 6), all);
        assertEquals(1, stream.recent(1).size());
        assertEquals(published.get(5).longValue(), stream.recent(1).get(0).getSequenceNumber());
    }

    @Test
    public void recentAppliesFilter() throws Exception {
        stream = new EventStream(config(100, 100, true));
        publish("a", "c1", 1);
        Event wanted = publish("b", "c1", 3);
        publish("a", "c2", 3);
        drain();

        EventFilter filter = EventFilter.builder().eventType("b").build();

        assertThat(stream.recent(10, filter), contains(wanted));
        assertEquals(3, stream.recent(-1, null).size());
        assertThat(stream.recent(10, EventFilter.builder().controllerId("c9").build()), empty());
    }

    @Test
    public void deliveryRespectsFilters() throws Exception {
        stream = new EventStream(config(100, 100, true));
        List<Event> all = new ArrayList<>();
        List<Event> highOnly = new ArrayList<>();
        List<Event> c2Only = new ArrayList<>();
        assertTrue(stream.subscribe("all", all::add));
        assertTrue(stream.subscribe("high", highOnly::add, EventFilter.builder().minPriority(3).build()));
        assertTrue(stream.subscribe("c2", c2Only::add, EventFilter.builder()
                .controllerId("c2")
                .customFilter(event -> event.getData().containsKey("controller_id"))
                .build()));

        Event low = publish("tick", "c1", 1);
        Event high = publish("failover", "c1", 3);
        Event fromC2 = publish("tick", "c2", 2);
        drain();

        assertEquals(List.of(low, high, fromC2), all);
        assertEquals(List.of(high), highOnly);
        assertEquals(List.of(fromC2), c2Only);
        assertEquals(3, stream.getSubscriber("all").get().getEventCount());
        assertEquals(fromC2, stream.getSubscriber("all").get().getLastEvent());
    }

    @Test
    public void failingSubscriberIsIsolatedAndSwept() throws Exception {
        stream = new EventStream(config(100, 100, true));
        List<Event> received = new ArrayList<>();
        stream.subscribe("broken", event -> {
            throw new IllegalStateException("boom");
        });
        stream.subscribe("healthy", received::add);

        publish("tick", "c1", 1);
        publish("tick", "c1", 1);
        drain();

        assertEquals(2, received.size());
        assertFalse(stream.getSubscriber("broken").get().isActive());
        assertEquals(2, stream.stats().getSubscriberCount());

        assertEquals(1, stream.sweep());
        assertFalse(stream.getSubscriber("broken").isPresent());
        assertEquals(1, stream.stats().getSubscriberCount());
    }

    @Test
    public void failingSubscriberStaysActiveWhenDeactivationDisabled() throws Exception {
        stream = new EventStream(config(100, 100, false));
        List<Event> attempts = new ArrayList<>();
        stream.subscribe("flaky", event -> {
            attempts.add(event);
            throw new IllegalStateException("boom");
        });

        publish("tick", "c1", 1);
        publish("tick", "c1", 1);
        drain();

        assertEquals(2, attempts.size());
        assertTrue(stream.getSubscriber("flaky").get().isActive());
        assertEquals(0, stream.sweep());
    }

    @Test
    public void duplicateAndMissingSubscribers() {
        stream = new EventStream(config(10, 10, true));

        assertTrue(stream.subscribe("s1", event -> { }));
        assertFalse(stream.subscribe("s1", event -> { }));
        assertTrue(stream.unsubscribe("s1"));
        assertFalse(stream.unsubscribe("s1"));
    }

    @Test
    public void invalidPriorityIsRejected() {
        stream = new EventStream(config(10, 10, true));

        assertThrows(IllegalArgumentException.class, () -> publish("tick", "c1", 4));
        assertThrows(IllegalArgumentException.class, () -> publish("tick", "c1", 0));
    }

    @Test
    public void statsCountByTypeControllerAndSource() throws Exception {
        stream = new EventStream(config(100, 100, true));
        publish("a", "c1", 1);
        publish("a", "c2", 1);
        stream.publish("b", "c1", "p4runtime", Collections.emptyMap());
        drain();

        EventStreamStats stats = stream.stats();

        assertEquals(3, stats.getTotalEvents());
        assertEquals(2L, stats.getEventsByType().get("a"));
        assertEquals(1L, stats.getEventsByType().get("b"));
        assertEquals(2L, stats.getEventsByController().get("c1"));
        assertEquals(2L, stats.getEventsBySourceType().get("openflow"));
        assertEquals(1L, stats.getEventsBySourceType().get("p4runtime"));
        assertEquals(3, stats.getHistorySize());
        assertFalse(stats.isRunning());
    }

    @Test
    public void backgroundConsumerDeliversInOrder() throws Exception {
        stream = new EventStream(config(1000, 1000, true));
        CountDownLatch latch = new CountDownLatch(50);
        List<Long> received = new CopyOnWriteArrayList<>();
        stream.subscribe("collector", event -> {
            received.add(event.getSequenceNumber());
            latch.countDown();
        });

        stream.start();
        stream.start();
        assertTrue(stream.isRunning());
        for (int i = 0; i < 50; i++) {
            publish("tick", "c1", 1);
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        List<Long> sorted = new ArrayList<>(received);
        Collections.sort(sorted);
        assertEquals(sorted, received);

        stream.stop();
        assertFalse(stream.isRunning());
        assertFalse(stream.stats().isRunning());
    }

    private static Event queued(long sequenceNumber) {
        return Event.builder()
                .eventType(EventTypes.PACKET_IN)
                .timestamp(Instant.EPOCH)
                .sequenceNumber(sequenceNumber)
                .priority(Event.PRIORITY_LOW)
                .build();
    }

    @Test
    public void slotFreedByConsumerIsReusedWithoutDropping() {
        LinkedBlockingDeque<Event> queue = new LinkedBlockingDeque<Event>(2) {
            private boolean consumerRaced;

            @Override
            public boolean offerLast(Event event) {
                boolean accepted = super.offerLast(event);
                if (!accepted && !consumerRaced) {
                    consumerRaced = true;
                    pollFirst();
                }
                return accepted;
            }
        };
        queue.add(queued(1));
        queue.add(queued(2));

        int dropped = EventStream.enqueueDroppingOldest(queue, queued(3));

        assertEquals(0, dropped);
        assertEquals(Arrays.asList(2L, 3L),
                queue.stream().map(Event::getSequenceNumber).collect(Collectors.toList()));
    }

    @Test
    public void fullQueueDropsExactlyOneOldest() {
        LinkedBlockingDeque<Event> queue = new LinkedBlockingDeque<>(2);
        queue.add(queued(1));
        queue.add(queued(2));

        int dropped = EventStream.enqueueDroppingOldest(queue, queued(3));

        assertEquals(1, dropped);
        assertEquals(Arrays.asList(2L, 3L),
                queue.stream().map(Event::getSequenceNumber).collect(Collectors.toList()));
    }
}
