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

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class RecordTest
{
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00.123456Z");
    private static final Instant T1 = Instant.parse("2024-03-02T11:30:00Z");
    private static final Instant T2 = Instant.parse("2024-03-05T08:15:00.5Z");

    @Test
    public void newReportSetsOnlyTheReportPair()
    {
        Record record = Record.newReport(T0);
        assertEquals(1, record.getReportCount());
        assertEquals(T0, record.getReportEntered());
        assertEquals(T0, record.getReportUpdated());
        assertEquals(0, record.getWhitelistCount());
        assertNull(record.getWhitelistEntered());
        assertNull(record.getWhitelistUpdated());
    }

    @Test
    public void withReportKeepsEnteredAndRefreshesUpdated()
    {
        Record record = Record.newReport(T0).withReport(T1).withReport(T2);
        assertEquals(3, record.getReportCount());
        assertEquals(T0, record.getReportEntered());
        assertEquals(T2, record.getReportUpdated());
    }

    @Test
    public void whitelistAfterReportLeavesReportAlone()
    {
        Record record = Record.newReport(T0).withWhitelist(T1);
        assertEquals(1, record.getReportCount());
        assertEquals(T0, record.getReportUpdated());
        assertEquals(1, record.getWhitelistCount());
        assertEquals(T1, record.getWhitelistEntered());
        assertEquals(T1, record.getWhitelistUpdated());
    }

    @Test
    public void updatedNeverMovesBackwards()
    {
        Record record = Record.newReport(T1).withReport(T0);
        assertEquals(T1, record.getReportEntered());
        assertEquals(T1, record.getReportUpdated());
    }

    @Test
    public void lastUpdatedIsTheLaterPair()
    {
        assertEquals(T2, Record.newReport(T0).withWhitelist(T2).lastUpdated());
        assertEquals(T2, Record.newWhitelist(T0).withReport(T2).lastUpdated());
        assertNull(new Record(0, null, null, 0, null, null).lastUpdated());
    }

    @Test
    public void timestampsAreTruncatedToMicros()
    {
        Record record = Record.newReport(Instant.parse("2024-03-01T10:00:00.123456789Z"));
        assertEquals(Instant.parse("2024-03-01T10:00:00.123456Z"), record.getReportEntered());
    }

    @Test
    public void rejectsInvalidRecords()
    {
        assertThatThrownBy(() -> new Record(-1, T0, T0, 0, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Record(0, null, null, -1, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Record(1, T0, null, 0, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Record(1, T1, T0, 0, null, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void rejectsTimestampsOutsideYearsOneTo9999()
    {
        Instant yearZero = Instant.parse("0000-06-01T00:00:00Z");
        Instant year10000 = Instant.parse("+10000-06-01T00:00:00Z");
        assertThatThrownBy(() -> new Record(1, yearZero, yearZero, 0, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Record(0, null, null, 1, T0, year10000))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Record.newReport(Record.MIN_TIMESTAMP.minusNanos(1000)))
            .isInstanceOf(IllegalArgumentException.class);

        // sub-microsecond digits are dropped before the range is checked
        assertEquals(Record.MAX_TIMESTAMP, Record.newReport(Record.MAX_TIMESTAMP.plusNanos(999)).getReportUpdated());
    }
}
