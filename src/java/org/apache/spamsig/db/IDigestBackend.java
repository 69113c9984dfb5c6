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

/**
 * The key-value engine a {@link DigestStore} keeps its encoded records in.
 *
 * Implementations must make each individual put and remove atomic; a reader must
 * never see a partially written value. They need not provide anything stronger,
 * the store serializes read-modify-write sequences itself.
 *
 * Implementations configured by class name must have a public no-argument
 * constructor.
 */
public interface IDigestBackend extends Closeable
{
    /**
     * @return the value stored under the key, or null if there is none
     */
    byte[] get(String key) throws IOException;

    void put(String key, byte[] value) throws IOException;

    /**
     * Removing a key which is not present is not an error.
     */
    void remove(String key) throws IOException;

    /**
     * All keys present when the iteration starts. Keys added or removed while
     * iterating may or may not be included.
     */
    Iterable<String> keys() throws IOException;

    /**
     * Make previous writes durable.
     */
    void flush() throws IOException;

    /**
     * Reclaim space left behind by removed keys. Called after each expiry sweep.
     */
    void compact() throws IOException;
}
