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

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class KeyMaterialTest
{
    @Test
    public void decodesSaltAndKey()
    {
        KeyMaterial material = KeyMaterial.fromHex("0aff,DEADbeef");
        assertArrayEquals(new byte[]{ 0x0a, (byte) 0xff }, material.getSalt());
        assertArrayEquals(new byte[]{ (byte) 0xde, (byte) 0xad, (byte) 0xbe, (byte) 0xef }, material.getKey());
        assertFalse(material.isEmpty());
    }

    @Test
    public void eitherSideMayBeEmpty()
    {
        KeyMaterial noSalt = KeyMaterial.fromHex(",abcd");
        assertNull(noSalt.getSalt());
        assertArrayEquals(new byte[]{ (byte) 0xab, (byte) 0xcd }, noSalt.getKey());

        KeyMaterial noKey = KeyMaterial.fromHex("abcd,");
        assertNull(noKey.getKey());
        assertFalse(noKey.isEmpty());
    }

    @Test
    public void bothEmptyIsEmpty()
    {
        assertTrue(KeyMaterial.fromHex(",").isEmpty());
    }

    @Test
    public void oddLengthHasImpliedLeadingZero()
    {
        assertArrayEquals(new byte[]{ 0x0a, (byte) 0xbc }, KeyMaterial.fromHex(",abc").getKey());
        assertArrayEquals(new byte[]{ 0x01 }, KeyMaterial.fromHex("1,").getSalt());
    }

    @Test
    public void missingCommaIsRejected()
    {
        assertThatThrownBy(() -> KeyMaterial.fromHex("abcdef"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("comma");
    }

    @Test
    public void tooManyPartsAreRejected()
    {
        assertThatThrownBy(() -> KeyMaterial.fromHex("ab,cd,ef"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void invalidHexIsRejected()
    {
        assertThatThrownBy(() -> KeyMaterial.fromHex("zz,abcd"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void returnedBytesAreCopies()
    {
        KeyMaterial material = KeyMaterial.fromHex(",abcd");
        material.getKey()[0] = 0;
        assertArrayEquals(new byte[]{ (byte) 0xab, (byte) 0xcd }, material.getKey());
    }
}
