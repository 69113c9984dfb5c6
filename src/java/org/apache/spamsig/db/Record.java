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

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Counters kept for one digest: how often it was reported as spam and how often
 * it was whitelisted, each with the time of the first and the most recent such
 * operation.
 *
 * A pair of timestamps is null until the corresponding operation happens for the
 * first time, in which case its count is 0. Timestamps are kept to microsecond
 * precision, which is what the storage encoding preserves.
 */
public final class Record
{
    /** Earliest timestamp a record may hold; the storage encoding has a four digit, unsigned year. */
    public static final Instant MIN_TIMESTAMP = Instant.parse("0001-01-01T00:00:00Z");
    /** Latest timestamp a record may hold. */
    public static final Instant MAX_TIMESTAMP = Instant.parse("9999-12-31T23:59:59.999999Z");

    private final long reportCount;
    private final Instant reportEntered;
    private final Instant reportUpdated;
    private final long whitelistCount;
    private final Instant whitelistEntered;
    private final Instant whitelistUpdated;

    public Record(long reportCount,
                  Instant reportEntered,
                  Instant reportUpdated,
                  long whitelistCount,
                  Instant whitelistEntered,
                  Instant whitelistUpdated)
    {
        Preconditions.checkArgument(reportCount >= 0, "Negative report count %s", reportCount);
        Preconditions.checkArgument(whitelistCount >= 0, "Negative whitelist count %s", whitelistCount);
        checkPair("report", reportEntered, reportUpdated);
        checkPair("whitelist", whitelistEntered, whitelistUpdated);

        this.reportCount = reportCount;
        this.reportEntered = truncate(reportEntered);
        this.reportUpdated = truncate(reportUpdated);
        this.whitelistCount = whitelistCount;
        this.whitelistEntered = truncate(whitelistEntered);
        this.whitelistUpdated = truncate(whitelistUpdated);
    }

    public static Record newReport(Instant now)
    {
        return new Record(1, now, now, 0, null, null);
    }

    public static Record newWhitelist(Instant now)
    {
        return new Record(0, null, null, 1, now, now);
    }

    public Record withReport(Instant now)
    {
        Instant entered = reportEntered == null ? now : reportEntered;
        return new Record(reportCount + 1, entered, latest(entered, now), whitelistCount, whitelistEntered, whitelistUpdated);
    }

    public Record withWhitelist(Instant now)
    {
        Instant entered = whitelistEntered == null ? now : whitelistEntered;
        return new Record(reportCount, reportEntered, reportUpdated, whitelistCount + 1, entered, latest(entered, now));
    }

    /**
     * @return the more recent of the two updated timestamps, or null if neither is set
     */
    public Instant lastUpdated()
    {
        if (reportUpdated == null)
            return whitelistUpdated;
        if (whitelistUpdated == null)
            return reportUpdated;
        return latest(reportUpdated, whitelistUpdated);
    }

    public long getReportCount()
    {
        return reportCount;
    }

    public Instant getReportEntered()
    {
        return reportEntered;
    }

    public Instant getReportUpdated()
    {
        return reportUpdated;
    }

    public long getWhitelistCount()
    {
        return whitelistCount;
    }

    public Instant getWhitelistEntered()
    {
        return whitelistEntered;
    }

    public Instant getWhitelistUpdated()
    {
        return whitelistUpdated;
    }

    private static void checkPair(String kind, Instant entered, Instant updated)
    {
        Preconditions.checkArgument((entered == null) == (updated == null),
                                    "Only one of the %s timestamps is set", kind);
        if (entered == null)
            return;

        Preconditions.checkArgument(!updated.isBefore(entered),
                                    "%s updated (%s) is before %s entered (%s)", kind, updated, kind, entered);
        checkRange(kind, truncate(entered));
        checkRange(kind, truncate(updated));
    }

    private static void checkRange(String kind, Instant instant)
    {
        Preconditions.checkArgument(!instant.isBefore(MIN_TIMESTAMP) && !instant.isAfter(MAX_TIMESTAMP),
                                    "%s timestamp %s is outside %s to %s", kind, instant, MIN_TIMESTAMP, MAX_TIMESTAMP);
    }

    // a clock stepping backwards must not produce an updated time before the entered time
    private static Instant latest(Instant a, Instant b)
    {
        return a.isAfter(b) ? a : b;
    }

    private static Instant truncate(Instant instant)
    {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MICROS);
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof Record))
            return false;

        Record r = (Record) o;
        return reportCount == r.reportCount
               && whitelistCount == r.whitelistCount
               && Objects.equal(reportEntered, r.reportEntered)
               && Objects.equal(reportUpdated, r.reportUpdated)
               && Objects.equal(whitelistEntered, r.whitelistEntered)
               && Objects.equal(whitelistUpdated, r.whitelistUpdated);
    }

    public int hashCode()
    {
        return Objects.hashCode(reportCount, reportEntered, reportUpdated, whitelistCount, whitelistEntered, whitelistUpdated);
    }

    public String toString()
    {
        return String.format("Record(reports: %d [%s, %s], whitelists: %d [%s, %s])",
                             reportCount, reportEntered, reportUpdated,
                             whitelistCount, whitelistEntered, whitelistUpdated);
    }
}
