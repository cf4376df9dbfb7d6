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

import org.polyctl.event.config.EventStreamConfig;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Centralized event bus. Producers publish into a bounded queue without ever blocking, a single consumer
 * thread records each event into the history and hands it to every matching subscriber.
 *
 * <p>When the queue is full the oldest queued event is discarded to make room for the new one.
 */
@Slf4j
public class EventStream {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final EventStreamConfig config;
    private final Clock clock;
    private final Instant startTime;

    private final LinkedBlockingDeque<Event> queue;
    private final Object publishLock = new Object();

    private final EvictingQueue<Event> history;
    private final Object historyLock = new Object();

    private final Map<String, EventSubscriber> subscribers = new LinkedHashMap<>();
    private final Object subscribersLock = new Object();

    private final AtomicLong totalEvents = new AtomicLong();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final Multiset<String> eventsByType = ConcurrentHashMultiset.create();
    private final Multiset<String> eventsByController = ConcurrentHashMultiset.create();
    private final Multiset<String> eventsBySourceType = ConcurrentHashMultiset.create();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService consumer;
    private ScheduledExecutorService sweeper;

    public EventStream(EventStreamConfig config) {
        this(config, Clock.systemUTC());
    }

    public EventStream(@NonNull EventStreamConfig config, @NonNull Clock clock) {
        this.config = config;
        this.clock = clock;
        this.startTime = clock.instant();
        this.queue = new LinkedBlockingDeque<>(config.getMaxQueueSize());
        this.history = EvictingQueue.create(config.getMaxHistorySize());
    }

    /**
     * Starts the consumer and the inactive subscribers sweeper. Calling it on a running stream has no effect.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Event stream is already running");
            return;
        }

        log.info("Starting event stream (queue size {}, history size {})",
                config.getMaxQueueSize(), config.getMaxHistorySize());
        consumer = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("event-stream-consumer-%d").setDaemon(true).build());
        consumer.execute(this::consume);

        long interval = config.getCleanupIntervalSeconds();
        sweeper = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("event-stream-sweeper-%d").setDaemon(true).build());
        sweeper.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.SECONDS);
    }

    /**
     * Stops the background threads and waits for them to finish. Events still queued stay in the queue.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        log.info("Stopping event stream");
        long timeout = config.getShutdownTimeoutMs();
        sweeper.shutdownNow();
        consumer.shutdown();
        try {
            if (!consumer.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
                log.warn("Event stream consumer did not stop in {} ms, interrupting it", timeout);
                consumer.shutdownNow();
            }
            if (!sweeper.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
                log.warn("Event stream sweeper did not stop in {} ms", timeout);
            }
        } catch (InterruptedException e) {
            consumer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Event stream stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public Event publish(String eventType, String sourceController, String sourceType, Map<String, Object> data) {
        return publish(eventType, sourceController, sourceType, data, Event.PRIORITY_LOW, Collections.emptyMap());
    }

    public Event publish(String eventType, String sourceController, String sourceType, Map<String, Object> data,
                         int priority) {
        return publish(eventType, sourceController, sourceType, data, priority, Collections.emptyMap());
    }

    /**
     * Puts an event into the stream. Never waits for the consumer, if the queue is full the oldest queued
     * event is dropped.
     *
     * @return the published event with its sequence number assigned
     */
    public Event publish(String eventType, String sourceController, String sourceType, Map<String, Object> data,
                         int priority, Map<String, Object> metadata) {
        Preconditions.checkArgument(priority >= Event.PRIORITY_LOW && priority <= Event.PRIORITY_HIGH,
                "Invalid event priority %s", priority);

        Event event;
        synchronized (publishLock) {
            event = Event.builder()
                    .eventType(eventType)
                    .sourceController(sourceController)
                    .sourceType(sourceType)
                    .data(data)
                    .timestamp(clock.instant())
                    .sequenceNumber(SEQUENCE.incrementAndGet())
                    .priority(priority)
                    .metadata(metadata)
                    .build();

            droppedEvents.addAndGet(enqueueDroppingOldest(queue, event));
        }
        return event;
    }

    /**
     * Appends the event, discarding the oldest queued events only while the queue has no free slot. The
     * consumer may free a slot between a rejected offer and the discard, so the free capacity is rechecked
     * before every discard.
     *
     * @return number of discarded events
     */
    @VisibleForTesting
    static int enqueueDroppingOldest(BlockingDeque<Event> queue, Event event) {
        int dropped = 0;
        while (!queue.offerLast(event)) {
            if (queue.remainingCapacity() > 0) {
                continue;
            }
            Event oldest = queue.pollFirst();
            if (oldest != null) {
                dropped++;
                log.debug("Event queue is full, dropped event #{} ({})",
                        oldest.getSequenceNumber(), oldest.getEventType());
            }
        }
        return dropped;
    }

    /**
     * Adds a subscriber.
     *
     * @return {@code false} if a subscriber with the same id is already registered
     */
    public boolean subscribe(String subscriberId, EventListener listener) {
        return subscribe(subscriberId, listener, EventFilter.any());
    }

    public boolean subscribe(String subscriberId, EventListener listener, EventFilter filter) {
        EventSubscriber subscriber = new EventSubscriber(subscriberId, listener, filter, clock.instant());
        synchronized (subscribersLock) {
            if (subscribers.containsKey(subscriberId)) {
                log.warn("Subscriber {} already exists", subscriberId);
                return false;
            }
            subscribers.put(subscriberId, subscriber);
        }
        log.info("Added event stream subscriber {}", subscriberId);
        return true;
    }

    /**
     * Removes a subscriber.
     *
     * @return {@code false} if there was no such subscriber
     */
    public boolean unsubscribe(String subscriberId) {
        EventSubscriber removed;
        synchronized (subscribersLock) {
            removed = subscribers.remove(subscriberId);
        }
        if (removed == null) {
            log.warn("Subscriber {} not found", subscriberId);
            return false;
        }
        log.info("Removed event stream subscriber {}", subscriberId);
        return true;
    }

    public Optional<EventSubscriber> getSubscriber(String subscriberId) {
        synchronized (subscribersLock) {
            return Optional.ofNullable(subscribers.get(subscriberId));
        }
    }

    public List<Event> recent(int count) {
        return recent(count, null);
    }

    /**
     * Returns up to {@code count} most recent processed events in sequence order. A non positive count
     * returns the whole history. The queue is not touched.
     */
    public List<Event> recent(int count, EventFilter filter) {
        List<Event> events;
        synchronized (historyLock) {
            events = new ArrayList<>(history);
        }
        if (filter != null) {
            events = events.stream().filter(filter::matches).collect(Collectors.toList());
        }
        if (count > 0 && events.size() > count) {
            events = events.subList(events.size() - count, events.size());
        }
        return ImmutableList.copyOf(events);
    }

    public EventStreamStats stats() {
        double uptime = Duration.between(startTime, clock.instant()).toMillis() / 1000.0;
        int historySize;
        synchronized (historyLock) {
            historySize = history.size();
        }
        int subscriberCount;
        synchronized (subscribersLock) {
            subscriberCount = subscribers.size();
        }
        long total = totalEvents.get();

        return EventStreamStats.builder()
                .running(running.get())
                .uptimeSeconds(uptime)
                .queueSize(queue.size())
                .historySize(historySize)
                .totalEvents(total)
                .eventsByType(toCounts(eventsByType))
                .eventsByController(toCounts(eventsByController))
                .eventsBySourceType(toCounts(eventsBySourceType))
                .droppedEvents(droppedEvents.get())
                .subscriberCount(subscriberCount)
                .eventsPerSecond(total / Math.max(uptime, 1.0))
                .build();
    }

    private void consume() {
        log.debug("Event stream consumer started");
        long pollTimeout = config.getPollTimeoutMs();
        while (running.get()) {
            try {
                processNext(pollTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Error processing event: {}", e.getMessage(), e);
            }
        }
        log.debug("Event stream consumer finished");
    }

    /**
     * Takes one event from the queue, waiting up to {@code timeoutMs}, and dispatches it.
     *
     * @return {@code true} if an event was processed
     */
    @VisibleForTesting
    boolean processNext(long timeoutMs) throws InterruptedException {
        Event event = queue.pollFirst(timeoutMs, TimeUnit.MILLISECONDS);
        if (event == null) {
            return false;
        }

        totalEvents.incrementAndGet();
        eventsByType.add(event.getEventType());
        eventsByController.add(String.valueOf(event.getSourceController()));
        eventsBySourceType.add(String.valueOf(event.getSourceType()));
        synchronized (historyLock) {
            history.add(event);
        }
        distribute(event);
        return true;
    }

    private void distribute(Event event) {
        List<EventSubscriber> targets;
        synchronized (subscribersLock) {
            targets = new ArrayList<>(subscribers.values());
        }

        for (EventSubscriber subscriber : targets) {
            if (!subscriber.isActive()) {
                continue;
            }
            try {
                if (subscriber.getFilter().matches(event)) {
                    subscriber.getListener().onEvent(event);
                    subscriber.delivered(event);
                }
            } catch (RuntimeException e) {
                log.error("Subscriber {} has failed on event #{} ({})",
                        subscriber.getSubscriberId(), event.getSequenceNumber(), event.getEventType(), e);
                if (config.isAutoDeactivateFailedSubscribers()) {
                    log.warn("Deactivating subscriber {}", subscriber.getSubscriberId());
                    subscriber.deactivate();
                }
            }
        }
    }

    /**
     * Removes inactive subscribers.
     *
     * @return number of removed subscribers
     */
    @VisibleForTesting
    int sweep() {
        List<String> removed = new ArrayList<>();
        synchronized (subscribersLock) {
            Iterator<EventSubscriber> iterator = subscribers.values().iterator();
            while (iterator.hasNext()) {
                EventSubscriber subscriber = iterator.next();
                if (!subscriber.isActive()) {
                    iterator.remove();
                    removed.add(subscriber.getSubscriberId());
                }
            }
        }
        for (String subscriberId : removed) {
            log.info("Removed inactive subscriber {}", subscriberId);
        }
        return removed.size();
    }

    private static Map<String, Long> toCounts(Multiset<String> source) {
        ImmutableMap.Builder<String, Long> result = ImmutableMap.builder();
        for (Multiset.Entry<String> entry : source.entrySet()) {
            result.put(entry.getElement(), (long) entry.getCount());
        }
        return result.build();
    }
}
