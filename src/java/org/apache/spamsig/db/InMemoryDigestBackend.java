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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.ImmutableList;

/**
 * Backend holding all records on the heap. Nothing survives a restart, which
 * makes it suitable for tests and for servers which only need short lived counts.
 */
public class InMemoryDigestBackend implements IDigestBackend
{
    private final ConcurrentMap<String, byte[]> values = new ConcurrentHashMap<>();

    public InMemoryDigestBackend()
    {
    }

    public byte[] get(String key)
    {
        byte[] value = values.get(key);
        return value == null ? null : value.clone();
    }

    public void put(String key, byte[] value)
    {
        values.put(key, value.clone());
    }

    public void remove(String key)
    {
        values.remove(key);
    }

    public Iterable<String> keys()
    {
        return ImmutableList.copyOf(values.keySet());
    }

    public void flush()
    {
        // nothing to make durable
    }

    public void compact()
    {
        // removed entries are reclaimed by the garbage collector
    }

    public int size()
    {
        return values.size();
    }

    public void close()
    {
        values.clear();
    }
}
