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

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

import com.google.common.base.Splitter;

import org.apache.spamsig.exceptions.RecordDecodeException;

/**
 * Storage encoding of a {@link Record}, used as the value stored under a digest:
 * <pre>
 *     1,&lt;reportCount&gt;,&lt;reportEntered&gt;,&lt;reportUpdated&gt;,&lt;whitelistCount&gt;,&lt;whitelistEntered&gt;,&lt;whitelistUpdated&gt;
 * </pre>
 * The leading 1 is the format version. Counts are decimal and timestamps are UTC
 * {@code yyyy-MM-dd HH:mm:ss.SSSSSS}, so they sort lexically; {@link Record} keeps
 * them within years 1 to 9999. A timestamp which is not set is written as an empty
 * field. Older servers wrote {@code None} instead, which is read as unset too.
 */
public final class RecordCodec
{
    public static final String VERSION = "1";

    private static final int FIELD_COUNT = 7;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS");
    // written by servers which dropped the fraction when it was zero
    private static final DateTimeFormatter TIMESTAMP_SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

    private static final String LEGACY_UNSET = "None";

    private static final Splitter COMMA = Splitter.on(',');

    private RecordCodec()
    {
    }

    public static byte[] encode(Record record)
    {
        String encoded = String.join(",",
                                     VERSION,
                                     Long.toString(record.getReportCount()),
                                     formatTimestamp(record.getReportEntered()),
                                     formatTimestamp(record.getReportUpdated()),
                                     Long.toString(record.getWhitelistCount()),
                                     formatTimestamp(record.getWhitelistEntered()),
                                     formatTimestamp(record.getWhitelistUpdated()));
        return encoded.getBytes(StandardCharsets.UTF_8);
    }

    public static Record decode(byte[] bytes) throws RecordDecodeException
    {
        String value = new String(bytes, StandardCharsets.UTF_8);
        List<String> fields = COMMA.splitToList(value);
        if (!VERSION.equals(fields.get(0)))
            throw new RecordDecodeException(String.format("Unknown record format version '%s'", fields.get(0)));
        if (fields.size() != FIELD_COUNT)
            throw new RecordDecodeException(String.format("Expected %d fields but found %d in '%s'",
                                                          FIELD_COUNT, fields.size(), value));

        try
        {
            return new Record(parseCount(fields.get(1)),
                              parseTimestamp(fields.get(2)),
                              parseTimestamp(fields.get(3)),
                              parseCount(fields.get(4)),
                              parseTimestamp(fields.get(5)),
                              parseTimestamp(fields.get(6)));
        }
        catch (DateTimeParseException | IllegalArgumentException e)
        {
            throw new RecordDecodeException(String.format("Invalid record '%s': %s", value, e.getMessage()), e);
        }
    }

    static String formatTimestamp(Instant instant)
    {
        return instant == null ? "" : TIMESTAMP.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    static Instant parseTimestamp(String field)
    {
        if (field.isEmpty() || LEGACY_UNSET.equals(field))
            return null;

        DateTimeFormatter format = field.indexOf('.') >= 0 ? TIMESTAMP : TIMESTAMP_SECONDS;
        return LocalDateTime.parse(field, format).toInstant(ZoneOffset.UTC);
    }

    // NumberFormatException is an IllegalArgumentException
    private static long parseCount(String field)
    {
        return Long.parseLong(field);
    }
}
