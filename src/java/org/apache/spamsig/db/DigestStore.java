/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.spamsig.db;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.function.BiFunction;

import com.codahale.metrics.Timer;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Striped;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.spamsig.exceptions.RecordDecodeException;
import org.apache.spamsig.exceptions.StoreException;
import org.apache.spamsig.metrics.DigestStoreMetrics;

/**
 * Maps digests to their {@link Record}s on top of a pluggable {@link IDigestBackend}.
 *
 * Reports and whitelists are read-modify-write sequences. They run under a lock
 * striped by digest, so concurrent reports of the same digest are all counted.
 * Plain {@link #set(String, Record)} and {@link #delete(String)} take no lock and
 * the last writer wins.
 *
 * Records which have not been updated for a configurable time are removed by a
 * background sweep, started with {@link #startReorganizing(Long)}. The sweep holds
 * the digest's lock between reading a record and deleting it, so a report racing
 * with the sweep either lands before the check (and the record survives) or after
 * the delete (and recreates it). Nothing is scheduled until asked for, and
 * {@link #shutdown()} stops all background work and closes the backend.
 */
public class DigestStore implements Closeable
{
    private static final Logger logger = LoggerFactory.getLogger(DigestStore.class);

    public static final long DEFAULT_REORGANIZE_PERIOD_SECONDS = TimeUnit.DAYS.toSeconds(1);

    private static final int LOCK_STRIPES = Integer.getInteger("spamsig.digest_store_lock_stripes", 128);

    private final String name;
    private final IDigestBackend backend;
    private final Clock clock;
    private final long reorganizePeriodSeconds;
    private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);
    private final AtomicBoolean sweepInFlight = new AtomicBoolean(false);
    private final ScheduledExecutorService executor;
    private final DigestStoreMetrics metrics;

    private volatile ScheduledFuture<?> sweepTask;
    private volatile ScheduledFuture<?> syncTask;

    public DigestStore(String name, IDigestBackend backend)
    {
        this(name, backend, DEFAULT_REORGANIZE_PERIOD_SECONDS);
    }

    public DigestStore(String name, IDigestBackend backend, long reorganizePeriodSeconds)
    {
        this(name, backend, reorganizePeriodSeconds, Clock.systemUTC());
    }

    @VisibleForTesting
    DigestStore(String name, IDigestBackend backend, long reorganizePeriodSeconds, Clock clock)
    {
        Preconditions.checkArgument(reorganizePeriodSeconds > 0, "Reorganize period must be positive");
        this.name = name;
        this.backend = backend;
        this.clock = clock;
        this.reorganizePeriodSeconds = reorganizePeriodSeconds;
        this.metrics = new DigestStoreMetrics(name);

        ScheduledThreadPoolExecutor scheduler =
            new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder().setNameFormat("DigestStore-" + name + "-%d")
                                                                        .setDaemon(true)
                                                                        .build());
        scheduler.setRemoveOnCancelPolicy(true);
        this.executor = scheduler;
    }

    public String getName()
    {
        return name;
    }

    /**
     * @return the record for the digest, or empty if there is none or the stored
     * value cannot be decoded
     */
    public Optional<Record> get(String digest)
    {
        checkDigest(digest);
        try (Timer.Context ignored = metrics.readLatency.time())
        {
            return Optional.ofNullable(read(digest));
        }
        catch (IOException e)
        {
            throw storeError("read", digest, e);
        }
    }

    public void set(String digest, Record record)
    {
        checkDigest(digest);
        Preconditions.checkNotNull(record);
        try (Timer.Context ignored = metrics.writeLatency.time())
        {
            backend.put(digest, RecordCodec.encode(record));
        }
        catch (IOException e)
        {
            throw storeError("write", digest, e);
        }
    }

    public void delete(String digest)
    {
        checkDigest(digest);
        try
        {
            backend.remove(digest);
        }
        catch (IOException e)
        {
            throw storeError("delete", digest, e);
        }
    }

    public Iterable<String> keys()
    {
        try
        {
            return backend.keys();
        }
        catch (IOException e)
        {
            throw storeError("list", "all digests", e);
        }
    }

    /**
     * Count a spam report of the digest, creating its record if necessary.
     * @return the record as stored
     */
    public Record reportDigest(String digest)
    {
        metrics.reports.mark();
        return update(digest, (record, now) -> record == null ? Record.newReport(now) : record.withReport(now));
    }

    /**
     * Count a whitelisting of the digest, creating its record if necessary.
     * @return the record as stored
     */
    public Record whitelistDigest(String digest)
    {
        metrics.whitelists.mark();
        return update(digest, (record, now) -> record == null ? Record.newWhitelist(now) : record.withWhitelist(now));
    }

    private Record update(String digest, BiFunction<Record, Instant, Record> mutation)
    {
        checkDigest(digest);
        Lock lock = locks.get(digest);
        lock.lock();
        try (Timer.Context ignored = metrics.writeLatency.time())
        {
            // an undecodable value is replaced, as if the digest had not been seen before
            Record updated = mutation.apply(read(digest), clock.instant());
            backend.put(digest, RecordCodec.encode(updated));
            return updated;
        }
        catch (IOException e)
        {
            throw storeError("update", digest, e);
        }
        finally
        {
            lock.unlock();
        }
    }

    private Record read(String digest) throws IOException
    {
        byte[] value = backend.get(digest);
        if (value == null)
            return null;

        try
        {
            return RecordCodec.decode(value);
        }
        catch (RecordDecodeException e)
        {
            metrics.decodeFailures.mark();
            logger.warn("Ignoring undecodable record for digest {} in {}: {}", digest, name, e.getMessage());
            return null;
        }
    }

    /**
     * Schedule a recurring sweep which removes every record not updated within the
     * last maxAgeSeconds, starting immediately. A schedule already in place is
     * replaced.
     *
     * @param maxAgeSeconds the age after which records expire; null or a value
     *                      which is not positive disables expiry
     * @return whether a sweep was scheduled
     */
    public synchronized boolean startReorganizing(Long maxAgeSeconds)
    {
        if (maxAgeSeconds == null || maxAgeSeconds <= 0)
        {
            logger.info("Record expiry is disabled for {}", name);
            return false;
        }

        stopReorganizing();
        final long maxAge = maxAgeSeconds;
        logger.info("Expiring records older than {}s from {} every {}s", maxAge, name, reorganizePeriodSeconds);
        sweepTask = executor.scheduleWithFixedDelay(() -> runSweep(maxAge), 0, reorganizePeriodSeconds, TimeUnit.SECONDS);
        return true;
    }

    public synchronized void stopReorganizing()
    {
        if (sweepTask != null)
        {
            sweepTask.cancel(false);
            sweepTask = null;
        }
    }

    public boolean isReorganizing()
    {
        ScheduledFuture<?> task = sweepTask;
        return task != null && !task.isDone();
    }

    /**
     * Schedule a recurring flush of the backend.
     *
     * @param periodSeconds interval between flushes; a value which is not positive
     *                      disables periodic flushing
     */
    public synchronized boolean startSyncing(long periodSeconds)
    {
        if (periodSeconds <= 0)
            return false;

        if (syncTask != null)
            syncTask.cancel(false);
        syncTask = executor.scheduleWithFixedDelay(this::runFlush, periodSeconds, periodSeconds, TimeUnit.SECONDS);
        return true;
    }

    public void flush()
    {
        try
        {
            backend.flush();
        }
        catch (IOException e)
        {
            throw storeError("flush", name, e);
        }
    }

    // runs on the scheduler, where an escaping exception would cancel future runs
    private void runSweep(long maxAgeSeconds)
    {
        try
        {
            sweep(maxAgeSeconds);
        }
        catch (Throwable t)
        {
            logger.error("Unexpected error sweeping expired records from {}", name, t);
        }
    }

    private void runFlush()
    {
        try
        {
            backend.flush();
        }
        catch (Throwable t)
        {
            metrics.flushErrors.mark();
            logger.warn("Failed to flush {}", name, t);
        }
    }

    /**
     * Remove every record whose most recent update is more than maxAgeSeconds ago,
     * then ask the backend to reclaim space. A record which cannot be read or
     * removed is logged and left in place; it does not stop the sweep. If a sweep
     * is already running this returns immediately.
     *
     * @return the number of records removed
     */
    public int sweep(long maxAgeSeconds)
    {
        if (!sweepInFlight.compareAndSet(false, true))
        {
            logger.debug("A sweep of {} is already in progress, not starting another", name);
            metrics.sweepsSkipped.mark();
            return 0;
        }

        try (Timer.Context ignored = metrics.sweepLatency.time())
        {
            Instant now = clock.instant();
            Iterable<String> digests;
            try
            {
                digests = backend.keys();
            }
            catch (IOException e)
            {
                logger.warn("Unable to list the digests in {}, skipping this sweep", name, e);
                return 0;
            }

            int examined = 0;
            int evicted = 0;
            for (String digest : digests)
            {
                examined++;
                if (sweepOne(digest, now, maxAgeSeconds))
                    evicted++;
            }

            try
            {
                backend.compact();
            }
            catch (IOException e)
            {
                logger.warn("Compaction of {} failed after sweep", name, e);
            }

            metrics.sweepEvictions.inc(evicted);
            logger.info("Removed {} of {} records older than {}s from {}", evicted, examined, maxAgeSeconds, name);
            return evicted;
        }
        finally
        {
            sweepInFlight.set(false);
        }
    }

    private boolean sweepOne(String digest, Instant now, long maxAgeSeconds)
    {
        Lock lock = locks.get(digest);
        lock.lock();
        try
        {
            byte[] value = backend.get(digest);
            if (value == null)
                return false;

            Record record = RecordCodec.decode(value);
            Instant lastUpdated = record.lastUpdated();
            if (lastUpdated != null && !lastUpdated.plusSeconds(maxAgeSeconds).isBefore(now))
                return false;

            logger.trace("Expiring {} last updated at {}", digest, lastUpdated);
            backend.remove(digest);
            return true;
        }
        catch (RecordDecodeException | IOException e)
        {
            metrics.sweepItemErrors.mark();
            logger.warn("Skipping digest {} while sweeping {}: {}", digest, name, e.getMessage());
            return false;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Stop all background work and close the backend.
     */
    public void shutdown() throws IOException
    {
        synchronized (this)
        {
            stopReorganizing();
            if (syncTask != null)
            {
                syncTask.cancel(false);
                syncTask = null;
            }
        }
        executor.shutdown();
        try
        {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES))
                logger.warn("Background tasks of {} did not finish within a minute", name);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        try
        {
            backend.flush();
        }
        finally
        {
            backend.close();
        }
    }

    public void close() throws IOException
    {
        shutdown();
    }

    private StoreException storeError(String operation, String digest, IOException cause)
    {
        metrics.backendErrors.mark();
        return new StoreException(String.format("Failed to %s %s in %s", operation, digest, name), cause);
    }

    private static void checkDigest(String digest)
    {
        Preconditions.checkArgument(digest != null && !digest.isEmpty(), "Digest must not be empty");
    }
}
