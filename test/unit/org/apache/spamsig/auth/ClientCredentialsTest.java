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

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.apache.spamsig.exceptions.InvalidLineException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ClientCredentialsTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void loadsAccounts() throws Exception
    {
        Path file = write("# host : port : username : salt,key",
                          "digests.example.org : 24441 : alice : ab,cdef",
                          "",
                          "127.0.0.1 : 24441 : bob : ,01");
        ImmutableMap<ServerEndpoint, Account> accounts = ClientCredentials.loadClientAccounts(file);

        assertEquals(2, accounts.size());
        Account alice = accounts.get(new ServerEndpoint("digests.example.org", 24441));
        assertEquals("alice", alice.getUsername());
        assertArrayEquals(new byte[]{ (byte) 0xab }, alice.getSalt());
        assertArrayEquals(new byte[]{ (byte) 0xcd, (byte) 0xef }, alice.getKey());

        Account bob = accounts.get(new ServerEndpoint("127.0.0.1", 24441));
        assertNull(bob.getSalt());
        assertArrayEquals(new byte[]{ 0x01 }, bob.getKey());
    }

    @Test
    public void invalidLinesAreSkipped() throws Exception
    {
        Path file = write("host : 24441 : alice",
                          "host : port : alice : ab,cd",
                          "host : 24441 : alice : ,",
                          "host : 24441 : alice : abcd",
                          "host : 24441 : alice : ab,",
                          "host : 24441 :  : ab,cd",
                          "host : 70000 : alice : ab,cd",
                          "host : 24442 : carol : ab,cd");
        ImmutableMap<ServerEndpoint, Account> accounts = ClientCredentials.loadClientAccounts(file);

        assertEquals(1, accounts.size());
        assertEquals("carol", accounts.get(new ServerEndpoint("host", 24442)).getUsername());
    }

    @Test
    public void laterDuplicateServerWins() throws Exception
    {
        Path file = write("host : 24441 : alice : ,ab",
                          "host : 24441 : bob : ,cd");
        ImmutableMap<ServerEndpoint, Account> accounts = ClientCredentials.loadClientAccounts(file);

        assertEquals(1, accounts.size());
        assertEquals("bob", accounts.get(new ServerEndpoint("host", 24441)).getUsername());
    }

    @Test
    public void missingFileGivesNoAccounts() throws Exception
    {
        Path missing = folder.getRoot().toPath().resolve("accounts");
        assertTrue(ClientCredentials.loadClientAccounts(missing).isEmpty());
    }

    @Test
    public void unknownServerUsesAnonymous() throws Exception
    {
        ClientCredentials credentials = ClientCredentials.load(write("host : 24441 : alice : ,ab"));

        assertEquals("alice", credentials.accountFor("host", 24441).getUsername());
        Account other = credentials.accountFor("host", 24442);
        assertSame(Account.ANONYMOUS, other);
        assertTrue(other.isAnonymous());
        assertEquals(0, other.getKey().length);
        assertNull(other.getSalt());
    }

    @Test
    public void parseLineReasons()
    {
        assertThatThrownBy(() -> ClientCredentials.parseLine("a : b : c"))
            .isInstanceOf(InvalidLineException.class)
            .hasMessageContaining("wrong number of parts");
        assertThatThrownBy(() -> ClientCredentials.parseLine("host : x : alice : ab,cd"))
            .isInstanceOf(InvalidLineException.class)
            .hasMessageContaining("invalid port");
        assertThatThrownBy(() -> ClientCredentials.parseLine("host : 1 : alice : ,"))
            .isInstanceOf(InvalidLineException.class)
            .hasMessageContaining("keystuff can't be all empty");
    }

    @Test
    public void parseLineReturnsEndpointAndAccount() throws Exception
    {
        Map.Entry<ServerEndpoint, Account> entry = ClientCredentials.parseLine("host : 24441 : alice : 1,2");
        assertEquals(new ServerEndpoint("host", 24441), entry.getKey());
        assertArrayEquals(new byte[]{ 0x02 }, entry.getValue().getKey());
    }

    private Path write(String... lines) throws Exception
    {
        File file = folder.newFile();
        Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return file.toPath();
    }
}
