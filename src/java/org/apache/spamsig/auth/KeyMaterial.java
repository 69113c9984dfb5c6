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
package org.apache.spamsig.auth;

import java.util.List;
import java.util.Locale;

import com.google.common.base.Splitter;
import com.google.common.io.BaseEncoding;

/**
 * The key column of the client accounts file: {@code <salt>,<key>} with both
 * halves hex encoded. Either half may be empty, but not both.
 */
public final class KeyMaterial
{
    private static final Splitter COMMA = Splitter.on(',').trimResults();
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final byte[] salt;
    private final byte[] key;

    private KeyMaterial(byte[] salt, byte[] key)
    {
        this.salt = salt;
        this.key = key;
    }

    /**
     * @throws IllegalArgumentException if there is no salt divider or either half is
     * not valid hex
     */
    public static KeyMaterial fromHex(String material)
    {
        List<String> parts = COMMA.splitToList(material);
        if (parts.size() != 2)
            throw new IllegalArgumentException("Invalid number of parts for key; perhaps the comma " +
                                               "dividing the salt from the key is missing?");

        return new KeyMaterial(decode(parts.get(0)), decode(parts.get(1)));
    }

    private static byte[] decode(String hex)
    {
        if (hex.isEmpty())
            return null;

        String normalized = hex.toLowerCase(Locale.US);
        // the value is numeric, so an odd number of digits has an implied leading zero
        if (normalized.length() % 2 != 0)
            normalized = '0' + normalized;
        return HEX.decode(normalized);
    }

    public boolean isEmpty()
    {
        return salt == null && key == null;
    }

    /**
     * @return the decoded salt, or null if none was given
     */
    public byte[] getSalt()
    {
        return salt == null ? null : salt.clone();
    }

    /**
     * @return the decoded key, or null if none was given
     */
    public byte[] getKey()
    {
        return key == null ? null : key.clone();
    }
}
